/*
 * UDPListener.java
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

package org.bluezoo.splitdns.server;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.dns.DNSFormatException;
import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Receives DNS queries as UDP datagrams.
 *
 * <p>A single thread receives datagrams; each one is processed on the
 * worker executor and its response sent back to the sender.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class UDPListener {

    private static final Logger LOGGER = Logger.getLogger(UDPListener.class.getName());

    private static final int MAX_DNS_MESSAGE_SIZE = 65535;

    private final InetSocketAddress address;
    private final QueryProcessor processor;
    private final Executor workers;

    private DatagramSocket socket;
    private Thread receiver;
    private volatile boolean closed;

    /**
     * Creates a listener.
     *
     * @param address the address to bind
     * @param processor the query processor
     * @param workers the executor processing queries
     */
    public UDPListener(InetSocketAddress address, QueryProcessor processor, Executor workers) {
        this.address = address;
        this.processor = processor;
        this.workers = workers;
    }

    /**
     * Binds the socket and starts receiving.
     *
     * @throws IOException if the socket cannot be bound
     */
    public synchronized void start() throws IOException {
        socket = new DatagramSocket(address);
        receiver = new Thread(new Runnable() {
            @Override
            public void run() {
                receive();
            }
        }, "splitdns-udp-" + socket.getLocalPort());
        receiver.setDaemon(true);
        receiver.start();
        String msg = MessageFormat.format(QueryProcessor.L10N.getString("info.listening"),
                "udp", socket.getLocalSocketAddress());
        LOGGER.info(msg);
    }

    /**
     * Returns the bound address.
     *
     * @return the local socket address, or null if not started
     */
    public synchronized InetSocketAddress getLocalAddress() {
        return (socket == null) ? null : (InetSocketAddress) socket.getLocalSocketAddress();
    }

    /**
     * Closes the socket and stops receiving.
     */
    public synchronized void close() {
        closed = true;
        if (socket != null) {
            socket.close();
        }
    }

    private void receive() {
        byte[] buf = new byte[MAX_DNS_MESSAGE_SIZE];
        while (!closed) {
            DatagramPacket packet = new DatagramPacket(buf, buf.length);
            try {
                socket.receive(packet);
            } catch (SocketException e) {
                if (!closed) {
                    String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.receive"), address);
                    LOGGER.log(Level.SEVERE, msg, e);
                }
                return;
            } catch (IOException e) {
                String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.receive"), address);
                LOGGER.log(Level.WARNING, msg, e);
                continue;
            }
            byte[] data = Arrays.copyOf(packet.getData(), packet.getLength());
            InetSocketAddress source = (InetSocketAddress) packet.getSocketAddress();
            try {
                workers.execute(new DatagramTask(data, source));
            } catch (RejectedExecutionException e) {
                if (!closed) {
                    String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.rejected"), source);
                    LOGGER.log(Level.WARNING, msg, e);
                }
            }
        }
    }

    /**
     * Processes one datagram and sends the response.
     */
    private class DatagramTask implements Runnable {

        private final byte[] data;
        private final InetSocketAddress source;

        DatagramTask(byte[] data, InetSocketAddress source) {
            this.data = data;
            this.source = source;
        }

        @Override
        public void run() {
            DNSMessage query = null;
            DNSMessage response;
            try {
                query = DNSMessage.parse(data, 0, data.length);
                response = processor.process(query, source);
            } catch (DNSFormatException e) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.malformed_query"), source);
                    LOGGER.log(Level.FINE, msg, e);
                }
                response = QueryProcessor.formatError(data, 0, data.length);
            }
            if (response == null) {
                return;
            }
            ByteBuffer out = QueryProcessor.encodeForUDP(response, query);
            try {
                socket.send(new DatagramPacket(out.array(), out.arrayOffset() + out.position(),
                        out.remaining(), source));
            } catch (IOException e) {
                if (!closed) {
                    String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.send"), source);
                    LOGGER.log(Level.WARNING, msg, e);
                }
            }
        }
    }

}
