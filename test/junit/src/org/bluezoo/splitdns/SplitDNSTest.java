/*
 * SplitDNSTest.java
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

import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSResourceRecord;
import org.bluezoo.splitdns.dns.DNSType;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Starts a complete dispatcher against loopback upstream servers.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SplitDNSTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private FixedAnswerServer localUpstream;
    private FixedAnswerServer remoteUpstream;
    private SplitDNS splitdns;

    @Before
    public void setUp() throws Exception {
        localUpstream = new FixedAnswerServer("10.9.8.7");
        remoteUpstream = new FixedAnswerServer("5.6.7.8");
        localUpstream.start();
        remoteUpstream.start();

        File ipList = folder.newFile("local-ip.txt");
        Files.write(ipList.toPath(), "10.0.0.0/8\n".getBytes(StandardCharsets.UTF_8));
        File remoteList = folder.newFile("remote-domain.txt");
        Files.write(remoteList.toPath(), "# proxied\nblocked.example\n".getBytes(StandardCharsets.UTF_8));

        DispatcherConfiguration config = new DispatcherConfiguration();
        config.setProperty("server", "127.0.0.1:0");
        config.setProperty("cache", "64");
        config.setProperty("local-upstream", "udp://127.0.0.1:" + localUpstream.getPort());
        config.setProperty("local-ip", ipList.getPath());
        config.setProperty("remote-upstream", "udp://127.0.0.1:" + remoteUpstream.getPort());
        config.setProperty("remote-domain", remoteList.getPath());
        config.setProperty("upstream-timeout", "2000");
        config.validate();

        splitdns = new SplitDNS(config);
        splitdns.start();
    }

    @After
    public void tearDown() {
        splitdns.stop();
        localUpstream.close();
        remoteUpstream.close();
    }

    private DNSMessage exchange(int id, String name) throws Exception {
        InetSocketAddress address = splitdns.getServer().getUDPAddress();
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.setSoTimeout(5000);
            byte[] data = DNSMessage.createQuery(id, name, DNSType.A).toByteArray();
            socket.send(new DatagramPacket(data, data.length, address));
            byte[] buf = new byte[4096];
            DatagramPacket packet = new DatagramPacket(buf, buf.length);
            socket.receive(packet);
            return DNSMessage.parse(buf, 0, packet.getLength());
        }
    }

    @Test
    public void testRacedQueryUsesLocalAnswer() throws Exception {
        DNSMessage response = exchange(500, "www.example.com");

        assertEquals(500, response.getId());
        assertEquals(InetAddress.getByName("10.9.8.7"), response.getAnswers().get(0).getAddress());
    }

    @Test
    public void testForcedRemoteDomain() throws Exception {
        DNSMessage response = exchange(501, "www.blocked.example");

        assertEquals(InetAddress.getByName("5.6.7.8"), response.getAnswers().get(0).getAddress());
        assertEquals(0, localUpstream.getQueries());
    }

    @Test
    public void testRepeatedQueryServedFromCache() throws Exception {
        exchange(502, "cached.example");
        int queries = localUpstream.getQueries();

        DNSMessage response = exchange(503, "cached.example");

        assertEquals(503, response.getId());
        assertEquals(queries, localUpstream.getQueries());
    }

    @Test
    public void testLocateConfiguration() throws Exception {
        File file = folder.newFile("splitdns.xml");
        assertEquals(file, SplitDNS.locateConfiguration(new String[] { file.getPath() }));
    }

    /**
     * UDP server answering every A query with one fixed address.
     */
    static class FixedAnswerServer implements Runnable {

        private final InetAddress answer;
        private final DatagramSocket socket;
        private volatile int queries;

        FixedAnswerServer(String answer) throws IOException {
            this.answer = InetAddress.getByName(answer);
            this.socket = new DatagramSocket(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0));
        }

        void start() {
            Thread thread = new Thread(this, "fixed-answer-" + socket.getLocalPort());
            thread.setDaemon(true);
            thread.start();
        }

        int getPort() {
            return socket.getLocalPort();
        }

        int getQueries() {
            return queries;
        }

        void close() {
            socket.close();
        }

        @Override
        public void run() {
            byte[] buf = new byte[512];
            while (!socket.isClosed()) {
                try {
                    DatagramPacket packet = new DatagramPacket(buf, buf.length);
                    socket.receive(packet);
                    queries++;
                    DNSMessage query = DNSMessage.parse(buf, 0, packet.getLength());
                    DNSMessage response = query.createResponse(Collections.singletonList(
                            DNSResourceRecord.a(query.getQuestions().get(0).getName(), 300, answer)));
                    byte[] data = response.toByteArray();
                    socket.send(new DatagramPacket(data, data.length, packet.getSocketAddress()));
                } catch (Exception e) {
                    if (!socket.isClosed()) {
                        e.printStackTrace();
                    }
                }
            }
        }
    }

}
