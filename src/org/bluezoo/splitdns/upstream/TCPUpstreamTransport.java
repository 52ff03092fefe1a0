/*
 * TCPUpstreamTransport.java
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

import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.dns.DNSFormatException;
import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * DNS over TCP to a single server, optionally through a SOCKS5 proxy.
 *
 * <p>Each exchange opens its own connection, writes the query with a
 * two-byte length prefix (RFC 1035 section 4.2.2), reads one response
 * and closes the connection.
 *
 * <p>When a proxy is configured the connection is made to the proxy and
 * a SOCKS5 CONNECT (RFC 1928) to the server is negotiated first, using
 * the no-authentication method. An unresolved server address is passed
 * to the proxy by name.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TCPUpstreamTransport implements UpstreamTransport {

    private static final Logger LOGGER = Logger.getLogger(TCPUpstreamTransport.class.getName());

    static final int SOCKS_VERSION = 5;
    static final int SOCKS_NO_AUTH = 0;
    static final int SOCKS_NO_ACCEPTABLE_METHODS = 0xFF;
    static final int SOCKS_CMD_CONNECT = 1;
    static final int SOCKS_ATYP_IPV4 = 1;
    static final int SOCKS_ATYP_DOMAIN = 3;
    static final int SOCKS_ATYP_IPV6 = 4;
    static final int SOCKS_SUCCEEDED = 0;

    private final InetSocketAddress server;
    private final InetAddress localAddress;
    private final InetSocketAddress proxy;
    private final int timeout;

    /**
     * Creates a TCP transport.
     *
     * @param server the server address, unresolved only when a proxy is used
     * @param localAddress the local address to connect from, or null for any
     * @param proxy the SOCKS5 proxy address, or null to connect directly
     * @param timeout the connect and read timeout in milliseconds
     */
    public TCPUpstreamTransport(InetSocketAddress server, InetAddress localAddress,
                                InetSocketAddress proxy, int timeout) {
        this.server = server;
        this.localAddress = localAddress;
        this.proxy = proxy;
        this.timeout = timeout;
    }

    @Override
    public DNSMessage exchange(DNSMessage query) throws IOException, DNSFormatException {
        byte[] queryData = query.toByteArray();
        try (SocketChannel channel = SocketChannel.open()) {
            Socket socket = channel.socket();
            if (localAddress != null) {
                socket.bind(new InetSocketAddress(localAddress, 0));
            }
            socket.connect(proxy != null ? proxy : server, timeout);
            socket.setSoTimeout(timeout);
            DataInputStream in = new DataInputStream(socket.getInputStream());
            DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
            if (proxy != null) {
                socksConnect(in, out);
            }
            out.writeShort(queryData.length);
            out.write(queryData);
            out.flush();
            if (LOGGER.isLoggable(Level.FINEST)) {
                String msg = MessageFormat.format(Upstream.L10N.getString("debug.sent"), query, this);
                LOGGER.finest(msg);
            }
            int length = in.readUnsignedShort();
            byte[] responseData = new byte[length];
            in.readFully(responseData);
            DNSMessage response = DNSMessage.parse(responseData, 0, length);
            if (response.getId() != query.getId()) {
                String msg = MessageFormat.format(Upstream.L10N.getString("err.id_mismatch"),
                        response.getId(), query.getId(), this);
                throw new DNSFormatException(msg);
            }
            return response;
        }
    }

    /**
     * Negotiates a SOCKS5 CONNECT to the server over an open connection
     * to the proxy.
     */
    void socksConnect(DataInputStream in, DataOutputStream out) throws IOException {
        // Method selection: one method, no authentication
        out.writeByte(SOCKS_VERSION);
        out.writeByte(1);
        out.writeByte(SOCKS_NO_AUTH);
        out.flush();
        int version = in.readUnsignedByte();
        int method = in.readUnsignedByte();
        if (version != SOCKS_VERSION || method != SOCKS_NO_AUTH) {
            String msg = MessageFormat.format(Upstream.L10N.getString("err.socks_method"), proxy, method);
            throw new IOException(msg);
        }

        out.writeByte(SOCKS_VERSION);
        out.writeByte(SOCKS_CMD_CONNECT);
        out.writeByte(0); // reserved
        InetAddress address = server.getAddress();
        if (address == null) {
            byte[] host = server.getHostString().getBytes(StandardCharsets.US_ASCII);
            out.writeByte(SOCKS_ATYP_DOMAIN);
            out.writeByte(host.length);
            out.write(host);
        } else {
            byte[] addr = address.getAddress();
            out.writeByte(addr.length == 4 ? SOCKS_ATYP_IPV4 : SOCKS_ATYP_IPV6);
            out.write(addr);
        }
        out.writeShort(server.getPort());
        out.flush();

        version = in.readUnsignedByte();
        int reply = in.readUnsignedByte();
        in.readUnsignedByte(); // reserved
        if (version != SOCKS_VERSION || reply != SOCKS_SUCCEEDED) {
            String msg = MessageFormat.format(Upstream.L10N.getString("err.socks_reply"), proxy, reply, server);
            throw new IOException(msg);
        }
        // Skip the bound address and port
        int atyp = in.readUnsignedByte();
        int skip;
        switch (atyp) {
            case SOCKS_ATYP_IPV4:
                skip = 4;
                break;
            case SOCKS_ATYP_IPV6:
                skip = 16;
                break;
            case SOCKS_ATYP_DOMAIN:
                skip = in.readUnsignedByte();
                break;
            default:
                String msg = MessageFormat.format(Upstream.L10N.getString("err.socks_address_type"), proxy, atyp);
                throw new IOException(msg);
        }
        in.readFully(new byte[skip + 2]);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("tcp://");
        sb.append(server.getHostString());
        sb.append(':');
        sb.append(server.getPort());
        if (proxy != null) {
            sb.append("?socks5=");
            sb.append(proxy.getHostString());
            sb.append(':');
            sb.append(proxy.getPort());
        }
        return sb.toString();
    }

}
