/*
 * UDPUpstreamTransport.java
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

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.nio.channels.DatagramChannel;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.dns.DNSFormatException;
import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * DNS over UDP to a single server.
 *
 * <p>Each exchange uses its own datagram channel, so concurrent exchanges
 * never see each other's responses. Datagrams that cannot be parsed, or
 * that do not carry the query's ID and question, are ignored until the
 * exchange times out. A truncated response is retried once over TCP
 * to the same server.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UDPUpstreamTransport implements UpstreamTransport {

    private static final Logger LOGGER = Logger.getLogger(UDPUpstreamTransport.class.getName());

    static final int MAX_DNS_MESSAGE_SIZE = 65535;

    private final InetSocketAddress server;
    private final InetAddress localAddress;
    private final int timeout;
    private final UpstreamTransport tcpFallback;

    /**
     * Creates a UDP transport.
     *
     * @param server the server address
     * @param localAddress the local address to send from, or null for any
     * @param timeout the exchange timeout in milliseconds
     */
    public UDPUpstreamTransport(InetSocketAddress server, InetAddress localAddress, int timeout) {
        this(server, localAddress, timeout,
                new TCPUpstreamTransport(server, localAddress, null, timeout));
    }

    UDPUpstreamTransport(InetSocketAddress server, InetAddress localAddress, int timeout,
                         UpstreamTransport tcpFallback) {
        this.server = server;
        this.localAddress = localAddress;
        this.timeout = timeout;
        this.tcpFallback = tcpFallback;
    }

    @Override
    public DNSMessage exchange(DNSMessage query) throws IOException, DNSFormatException {
        DNSMessage response = exchangeUDP(query);
        if (response.isTruncated() && tcpFallback != null) {
            if (LOGGER.isLoggable(Level.FINEST)) {
                String msg = MessageFormat.format(Upstream.L10N.getString("debug.tcp_retry"), server);
                LOGGER.finest(msg);
            }
            return tcpFallback.exchange(query);
        }
        return response;
    }

    private DNSMessage exchangeUDP(DNSMessage query) throws IOException {
        byte[] queryData = query.toByteArray();
        long deadline = System.currentTimeMillis() + timeout;
        try (DatagramChannel channel = DatagramChannel.open()) {
            DatagramSocket socket = channel.socket();
            socket.bind(new InetSocketAddress(localAddress, 0));
            socket.connect(server);
            socket.send(new DatagramPacket(queryData, queryData.length, server));
            if (LOGGER.isLoggable(Level.FINEST)) {
                String msg = MessageFormat.format(Upstream.L10N.getString("debug.sent"), query, server);
                LOGGER.finest(msg);
            }
            byte[] buf = new byte[MAX_DNS_MESSAGE_SIZE];
            while (true) {
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0L) {
                    String msg = MessageFormat.format(Upstream.L10N.getString("err.timeout"), server);
                    throw new SocketTimeoutException(msg);
                }
                socket.setSoTimeout((int) remaining);
                DatagramPacket packet = new DatagramPacket(buf, buf.length);
                socket.receive(packet);
                DNSMessage response;
                try {
                    response = DNSMessage.parse(buf, 0, packet.getLength());
                } catch (DNSFormatException e) {
                    if (LOGGER.isLoggable(Level.FINEST)) {
                        String msg = MessageFormat.format(Upstream.L10N.getString("debug.malformed"),
                                server, e.getMessage());
                        LOGGER.finest(msg);
                    }
                    continue;
                }
                if (response.getId() != query.getId() || !response.isResponse()) {
                    if (LOGGER.isLoggable(Level.FINEST)) {
                        String msg = MessageFormat.format(Upstream.L10N.getString("debug.mismatched_id"),
                                response.getId(), server);
                        LOGGER.finest(msg);
                    }
                    continue;
                }
                if (!response.getQuestions().equals(query.getQuestions())) {
                    if (LOGGER.isLoggable(Level.FINEST)) {
                        String msg = MessageFormat.format(Upstream.L10N.getString("debug.mismatched_question"),
                                response.getQuestions(), server);
                        LOGGER.finest(msg);
                    }
                    continue;
                }
                return response;
            }
        }
    }

    @Override
    public String toString() {
        return "udp://" + server;
    }

}
