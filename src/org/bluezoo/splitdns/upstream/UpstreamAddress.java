/*
 * UpstreamAddress.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of splitdns, a split-horizon DNS dispatcher.
 *
 * splitdns is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * splitdns is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with splitdns.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.splitdns.upstream;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.text.MessageFormat;
import java.util.Locale;

/**
 * Parsed form of an upstream address as written in the configuration.
 *
 * <p>The syntax is
 * <code>[scheme://]host[:port][?socks5=host:port&amp;netaddr=ip]</code>.
 * The scheme is {@code udp} (the default) or {@code tcp}, and the port
 * defaults to 53. IPv6 hosts are written in brackets. The {@code socks5}
 * parameter names a SOCKS5 proxy to connect through and is only allowed
 * with {@code tcp}; {@code netaddr} is the local address to send from.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class UpstreamAddress {

    public static final String SCHEME_UDP = "udp";
    public static final String SCHEME_TCP = "tcp";
    public static final int DEFAULT_PORT = 53;
    public static final int DEFAULT_SOCKS5_PORT = 1080;

    private final String spec;
    private final String scheme;
    private final String host;
    private final int port;
    private final String socks5Host;
    private final int socks5Port;
    private final InetAddress netAddress;

    private UpstreamAddress(String spec, String scheme, String host, int port,
                            String socks5Host, int socks5Port, InetAddress netAddress) {
        this.spec = spec;
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.socks5Host = socks5Host;
        this.socks5Port = socks5Port;
        this.netAddress = netAddress;
    }

    /**
     * Parses an upstream address.
     *
     * @param spec the address as configured
     * @return the parsed address
     * @throws IllegalArgumentException if the address is malformed
     */
    public static UpstreamAddress parse(String spec) {
        String s = spec.trim();
        if (!s.contains("://")) {
            s = SCHEME_UDP + "://" + s;
        }
        URI uri;
        try {
            uri = new URI(s);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(message("err.bad_upstream", spec, e.getMessage()), e);
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!SCHEME_UDP.equals(scheme) && !SCHEME_TCP.equals(scheme)) {
            throw new IllegalArgumentException(message("err.unsupported_scheme", spec, scheme));
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException(message("err.missing_host", spec));
        }
        host = unbracket(host);
        int port = uri.getPort() < 0 ? DEFAULT_PORT : uri.getPort();
        String path = uri.getRawPath();
        if (path != null && !path.isEmpty() && !"/".equals(path)) {
            throw new IllegalArgumentException(message("err.bad_upstream", spec, path));
        }

        String socks5Host = null;
        int socks5Port = DEFAULT_SOCKS5_PORT;
        InetAddress netAddress = null;
        String query = uri.getQuery();
        if (query != null && !query.isEmpty()) {
            for (String param : query.split("&")) {
                if (param.isEmpty()) {
                    continue;
                }
                int eq = param.indexOf('=');
                String name = (eq < 0) ? param : param.substring(0, eq);
                String value = (eq < 0) ? "" : param.substring(eq + 1);
                if ("socks5".equals(name)) {
                    String[] hostPort = splitHostPort(spec, value);
                    socks5Host = hostPort[0];
                    if (hostPort[1] != null) {
                        socks5Port = parsePort(spec, hostPort[1]);
                    }
                } else if ("netaddr".equals(name)) {
                    netAddress = parseLiteral(spec, value);
                } else {
                    throw new IllegalArgumentException(message("err.unknown_parameter", spec, name));
                }
            }
        }
        if (socks5Host != null && !SCHEME_TCP.equals(scheme)) {
            throw new IllegalArgumentException(message("err.socks5_requires_tcp", spec));
        }
        return new UpstreamAddress(spec, scheme, host, port, socks5Host, socks5Port, netAddress);
    }

    public String getScheme() {
        return scheme;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    /**
     * Returns the SOCKS5 proxy host.
     *
     * @return the proxy host, or null if no proxy is used
     */
    public String getSocks5Host() {
        return socks5Host;
    }

    public int getSocks5Port() {
        return socks5Port;
    }

    /**
     * Returns the local address to send from.
     *
     * @return the local address, or null for the wildcard address
     */
    public InetAddress getNetAddress() {
        return netAddress;
    }

    /**
     * Creates a transport for this address. The server host is resolved
     * here unless a proxy is used, in which case the proxy resolves it.
     *
     * @param timeout the exchange timeout in milliseconds
     * @return a new transport
     * @throws UnknownHostException if a host cannot be resolved
     */
    public UpstreamTransport createTransport(int timeout) throws UnknownHostException {
        if (socks5Host != null) {
            InetSocketAddress proxy = new InetSocketAddress(InetAddress.getByName(socks5Host), socks5Port);
            InetSocketAddress server = isLiteral(host)
                    ? new InetSocketAddress(InetAddress.getByName(host), port)
                    : InetSocketAddress.createUnresolved(host, port);
            return new TCPUpstreamTransport(server, netAddress, proxy, timeout);
        }
        InetSocketAddress server = new InetSocketAddress(InetAddress.getByName(host), port);
        if (SCHEME_TCP.equals(scheme)) {
            return new TCPUpstreamTransport(server, netAddress, null, timeout);
        }
        return new UDPUpstreamTransport(server, netAddress, timeout);
    }

    @Override
    public String toString() {
        return spec;
    }

    private static String unbracket(String host) {
        if (host.startsWith("[") && host.endsWith("]")) {
            return host.substring(1, host.length() - 1);
        }
        return host;
    }

    private static boolean isLiteral(String host) {
        if (host.indexOf(':') >= 0) {
            return true;
        }
        for (int i = 0; i < host.length(); i++) {
            char c = host.charAt(i);
            if (c != '.' && (c < '0' || c > '9')) {
                return false;
            }
        }
        return true;
    }

    private static String[] splitHostPort(String spec, String value) {
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 2) {
                throw new IllegalArgumentException(message("err.bad_socks5", spec, value));
            }
            String h = value.substring(1, close);
            if (close + 1 == value.length()) {
                return new String[] { h, null };
            }
            if (value.charAt(close + 1) != ':') {
                throw new IllegalArgumentException(message("err.bad_socks5", spec, value));
            }
            return new String[] { h, value.substring(close + 2) };
        }
        int colon = value.indexOf(':');
        if (colon == 0 || value.isEmpty()) {
            throw new IllegalArgumentException(message("err.bad_socks5", spec, value));
        }
        if (colon < 0 || colon != value.lastIndexOf(':')) {
            // no port, or a bare IPv6 literal
            return new String[] { value, null };
        }
        return new String[] { value.substring(0, colon), value.substring(colon + 1) };
    }

    private static int parsePort(String spec, String value) {
        try {
            int port = Integer.parseInt(value);
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException(message("err.bad_port", spec, value));
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(message("err.bad_port", spec, value), e);
        }
    }

    private static InetAddress parseLiteral(String spec, String value) {
        if (value.isEmpty() || !isLiteral(value)) {
            throw new IllegalArgumentException(message("err.bad_netaddr", spec, value));
        }
        try {
            return InetAddress.getByName(value);
        } catch (UnknownHostException e) {
            throw new IllegalArgumentException(message("err.bad_netaddr", spec, value), e);
        }
    }

    private static String message(String key, Object... args) {
        return MessageFormat.format(Upstream.L10N.getString(key), args);
    }

}
