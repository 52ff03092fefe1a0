/*
 * TCPListener.java
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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.text.MessageFormat;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Receives DNS queries over TCP.
 *
 * <p>Each accepted connection is served on the worker executor. Queries
 * are read one at a time with their two-byte length prefix and answered
 * in order until the client closes the connection or stays idle for
 * longer than the idle timeout.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class TCPListener {

    private static final Logger LOGGER = Logger.getLogger(TCPListener.class.getName());

    /** Default idle timeout for client connections, in milliseconds. */
    public static final int DEFAULT_IDLE_TIMEOUT = 10000;

    private final InetSocketAddress address;
    private final QueryProcessor processor;
    private final Executor workers;
    private final Set<Socket> connections = ConcurrentHashMap.newKeySet();

    private int idleTimeout = DEFAULT_IDLE_TIMEOUT;
    private ServerSocket serverSocket;
    private Thread acceptor;
    private volatile boolean closed;

    /**
     * Creates a listener.
     *
     * @param address the address to bind
     * @param processor the query processor
     * @param workers the executor serving connections
     */
    public TCPListener(InetSocketAddress address, QueryProcessor processor, Executor workers) {
        this.address = address;
        this.processor = processor;
        this.workers = workers;
    }

    /**
     * Sets how long a connection may stay idle between queries.
     *
     * @param idleTimeout the timeout in milliseconds
     */
    public void setIdleTimeout(int idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    /**
     * Binds the server socket and starts accepting connections.
     *
     * @throws IOException if the socket cannot be bound
     */
    public synchronized void start() throws IOException {
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(address);
        acceptor = new Thread(new Runnable() {
            @Override
            public void run() {
                accept();
            }
        }, "splitdns-tcp-" + serverSocket.getLocalPort());
        acceptor.setDaemon(true);
        acceptor.start();
        String msg = MessageFormat.format(QueryProcessor.L10N.getString("info.listening"),
                "tcp", serverSocket.getLocalSocketAddress());
        LOGGER.info(msg);
    }

    /**
     * Returns the bound address.
     *
     * @return the local socket address, or null if not started
     */
    public synchronized InetSocketAddress getLocalAddress() {
        return (serverSocket == null) ? null : (InetSocketAddress) serverSocket.getLocalSocketAddress();
    }

    /**
     * Closes the server socket and every open connection.
     */
    public synchronized void close() {
        closed = true;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.log(Level.FINE, e.getMessage(), e);
            }
        }
        for (Socket connection : connections) {
            closeQuietly(connection);
        }
    }

    private void accept() {
        while (!closed) {
            final Socket connection;
            try {
                connection = serverSocket.accept();
            } catch (IOException e) {
                if (!closed) {
                    String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.accept"), address);
                    LOGGER.log(Level.SEVERE, msg, e);
                }
                return;
            }
            connections.add(connection);
            try {
                workers.execute(new Runnable() {
                    @Override
                    public void run() {
                        serve(connection);
                    }
                });
            } catch (RejectedExecutionException e) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.rejected"),
                            connection.getRemoteSocketAddress());
                    LOGGER.fine(msg);
                }
                connections.remove(connection);
                closeQuietly(connection);
            }
        }
    }

    void serve(Socket connection) {
        InetSocketAddress source = (InetSocketAddress) connection.getRemoteSocketAddress();
        try {
            connection.setSoTimeout(idleTimeout);
            DataInputStream in = new DataInputStream(new BufferedInputStream(connection.getInputStream()));
            DataOutputStream out = new DataOutputStream(new BufferedOutputStream(connection.getOutputStream()));
            while (!closed) {
                int length;
                try {
                    length = in.readUnsignedShort();
                } catch (EOFException e) {
                    break;
                }
                byte[] data = new byte[length];
                in.readFully(data);
                DNSMessage response = processor.process(data, 0, length, source);
                if (response == null) {
                    break;
                }
                byte[] responseData = response.toByteArray();
                out.writeShort(responseData.length);
                out.write(responseData);
                out.flush();
            }
        } catch (SocketTimeoutException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(QueryProcessor.L10N.getString("debug.idle_timeout"), source);
                LOGGER.fine(msg);
            }
        } catch (SocketException | EOFException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(QueryProcessor.L10N.getString("debug.connection_closed"), source);
                LOGGER.log(Level.FINE, msg, e);
            }
        } catch (IOException e) {
            String msg = MessageFormat.format(QueryProcessor.L10N.getString("err.connection"), source);
            LOGGER.log(Level.WARNING, msg, e);
        } finally {
            connections.remove(connection);
            closeQuietly(connection);
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, e.getMessage(), e);
        }
    }

}
