/*
 * DNSServer.java
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
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.bluezoo.splitdns.dispatch.QueryHandler;

/**
 * UDP and TCP listeners on the same address, sharing one query
 * processor and one worker pool.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DNSServer {

    private final InetSocketAddress address;
    private final QueryProcessor processor;

    private ExecutorService workers;
    private UDPListener udpListener;
    private TCPListener tcpListener;

    /**
     * Creates a server.
     *
     * @param address the address to listen on
     * @param handler the handler resolving queries
     */
    public DNSServer(InetSocketAddress address, QueryHandler handler) {
        this.address = address;
        this.processor = new QueryProcessor(handler);
    }

    /**
     * Starts both listeners. If the UDP listener binds an ephemeral port,
     * the TCP listener binds the same port.
     *
     * @throws IOException if either listener cannot be bound
     */
    public synchronized void start() throws IOException {
        workers = Executors.newCachedThreadPool(new WorkerThreadFactory());
        udpListener = new UDPListener(address, processor, workers);
        udpListener.start();
        InetSocketAddress bound = new InetSocketAddress(address.getAddress(),
                udpListener.getLocalAddress().getPort());
        tcpListener = new TCPListener(bound, processor, workers);
        try {
            tcpListener.start();
        } catch (IOException e) {
            udpListener.close();
            workers.shutdownNow();
            throw e;
        }
    }

    /**
     * Returns the UDP listener's bound address.
     *
     * @return the address, or null if not started
     */
    public synchronized InetSocketAddress getUDPAddress() {
        return (udpListener == null) ? null : udpListener.getLocalAddress();
    }

    /**
     * Returns the TCP listener's bound address.
     *
     * @return the address, or null if not started
     */
    public synchronized InetSocketAddress getTCPAddress() {
        return (tcpListener == null) ? null : tcpListener.getLocalAddress();
    }

    /**
     * Stops both listeners and the worker pool.
     */
    public synchronized void close() {
        if (udpListener != null) {
            udpListener.close();
        }
        if (tcpListener != null) {
            tcpListener.close();
        }
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(1, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "splitdns-worker-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

}
