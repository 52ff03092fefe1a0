/*
 * DispatcherConfiguration.java
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

package org.bluezoo.splitdns;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Settings for a splitdns instance, as read from the configuration file.
 *
 * <p>Each setting has a property name used in the configuration file:
 * <table>
 * <tr><th>Property</th><th>Meaning</th></tr>
 * <tr><td>{@code server}</td><td>address to listen on (required)</td></tr>
 * <tr><td>{@code cache}</td><td>answer cache size, 0 to disable</td></tr>
 * <tr><td>{@code local-upstream}</td><td>local upstream addresses (required, repeatable)</td></tr>
 * <tr><td>{@code local-ip}</td><td>trusted IP range list files (required, repeatable)</td></tr>
 * <tr><td>{@code local-domain}</td><td>domain list files forced local (repeatable)</td></tr>
 * <tr><td>{@code local-latency}</td><td>grace window in milliseconds, default 50</td></tr>
 * <tr><td>{@code remote-upstream}</td><td>remote upstream addresses (required, repeatable)</td></tr>
 * <tr><td>{@code remote-domain}</td><td>domain list files forced remote (repeatable)</td></tr>
 * <tr><td>{@code upstream-timeout}</td><td>upstream exchange timeout in milliseconds, default 5000</td></tr>
 * <tr><td>{@code debug}</td><td>verbose logging</td></tr>
 * </table>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DispatcherConfiguration {

    public static final int DEFAULT_LOCAL_LATENCY = 50;
    public static final int DEFAULT_UPSTREAM_TIMEOUT = 5000;
    public static final int DEFAULT_PORT = 53;

    private String server;
    private int cacheSize;
    private final List<String> localUpstreams = new ArrayList<>();
    private final List<String> localIPFiles = new ArrayList<>();
    private final List<String> localDomainFiles = new ArrayList<>();
    private int localLatency = DEFAULT_LOCAL_LATENCY;
    private final List<String> remoteUpstreams = new ArrayList<>();
    private final List<String> remoteDomainFiles = new ArrayList<>();
    private int upstreamTimeout = DEFAULT_UPSTREAM_TIMEOUT;
    private boolean debug;

    /**
     * Applies a property from the configuration file. List-valued
     * properties accumulate; others replace any earlier value.
     *
     * @param name the property name
     * @param value the property value
     * @throws IllegalArgumentException if the name is unknown or the value invalid
     */
    public void setProperty(String name, String value) {
        String v = value.trim();
        switch (name) {
            case "server":
                server = v;
                break;
            case "cache":
                cacheSize = parseInt(name, v, 0);
                break;
            case "local-upstream":
                localUpstreams.add(v);
                break;
            case "local-ip":
                localIPFiles.add(v);
                break;
            case "local-domain":
                localDomainFiles.add(v);
                break;
            case "local-latency":
                localLatency = parseInt(name, v, 0);
                break;
            case "remote-upstream":
                remoteUpstreams.add(v);
                break;
            case "remote-domain":
                remoteDomainFiles.add(v);
                break;
            case "upstream-timeout":
                upstreamTimeout = parseInt(name, v, 1);
                break;
            case "debug":
                debug = parseBoolean(name, v);
                break;
            default:
                String msg = MessageFormat.format(SplitDNS.L10N.getString("err.unknown_property"), name);
                throw new IllegalArgumentException(msg);
        }
    }

    /**
     * Checks that every required property has been set.
     *
     * @throws IllegalArgumentException naming the first missing property
     */
    public void validate() {
        String missing = null;
        if (server == null || server.isEmpty()) {
            missing = "server";
        } else if (localUpstreams.isEmpty()) {
            missing = "local-upstream";
        } else if (localIPFiles.isEmpty()) {
            missing = "local-ip";
        } else if (remoteUpstreams.isEmpty()) {
            missing = "remote-upstream";
        }
        if (missing != null) {
            String msg = MessageFormat.format(SplitDNS.L10N.getString("err.missing_property"), missing);
            throw new IllegalArgumentException(msg);
        }
    }

    public String getServer() {
        return server;
    }

    /**
     * Returns the listen address. The server property is written as
     * {@code host:port}, {@code [ipv6]:port}, {@code :port} for all
     * interfaces, or a bare host for port 53.
     *
     * @return the socket address to bind
     * @throws UnknownHostException if the host cannot be resolved
     * @throws IllegalArgumentException if the address is malformed
     */
    public InetSocketAddress getServerAddress() throws UnknownHostException {
        String host = server;
        int port = DEFAULT_PORT;
        if (server.startsWith("[")) {
            int close = server.indexOf(']');
            if (close < 0) {
                throw badServer();
            }
            host = server.substring(1, close);
            if (close + 1 < server.length()) {
                if (server.charAt(close + 1) != ':') {
                    throw badServer();
                }
                port = parsePort(server.substring(close + 2));
            }
        } else {
            int colon = server.lastIndexOf(':');
            if (colon >= 0 && server.indexOf(':') == colon) {
                host = server.substring(0, colon);
                port = parsePort(server.substring(colon + 1));
            }
        }
        if (host.isEmpty()) {
            return new InetSocketAddress(port);
        }
        return new InetSocketAddress(InetAddress.getByName(host), port);
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public List<String> getLocalUpstreams() {
        return Collections.unmodifiableList(localUpstreams);
    }

    public List<String> getLocalIPFiles() {
        return Collections.unmodifiableList(localIPFiles);
    }

    public List<String> getLocalDomainFiles() {
        return Collections.unmodifiableList(localDomainFiles);
    }

    public int getLocalLatency() {
        return localLatency;
    }

    public List<String> getRemoteUpstreams() {
        return Collections.unmodifiableList(remoteUpstreams);
    }

    public List<String> getRemoteDomainFiles() {
        return Collections.unmodifiableList(remoteDomainFiles);
    }

    public int getUpstreamTimeout() {
        return upstreamTimeout;
    }

    public boolean isDebug() {
        return debug;
    }

    private IllegalArgumentException badServer() {
        return badServer(null);
    }

    private IllegalArgumentException badServer(Throwable cause) {
        String msg = MessageFormat.format(SplitDNS.L10N.getString("err.bad_server_address"), server);
        return new IllegalArgumentException(msg, cause);
    }

    private int parsePort(String value) {
        try {
            int port = Integer.parseInt(value);
            if (port < 0 || port > 65535) {
                throw badServer();
            }
            return port;
        } catch (NumberFormatException e) {
            throw badServer(e);
        }
    }

    private static int parseInt(String name, String value, int min) {
        String msg = MessageFormat.format(SplitDNS.L10N.getString("err.bad_integer"), name, value);
        int i;
        try {
            i = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(msg, e);
        }
        if (i < min) {
            throw new IllegalArgumentException(msg);
        }
        return i;
    }

    private static boolean parseBoolean(String name, String value) {
        String v = value.toLowerCase(Locale.ROOT);
        if ("true".equals(v) || "yes".equals(v) || "on".equals(v) || "1".equals(v)) {
            return true;
        }
        if ("false".equals(v) || "no".equals(v) || "off".equals(v) || "0".equals(v)) {
            return false;
        }
        String msg = MessageFormat.format(SplitDNS.L10N.getString("err.bad_boolean"), name, value);
        throw new IllegalArgumentException(msg);
    }

}
