/*
 * DispatchEngineTest.java
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

package org.bluezoo.splitdns.dispatch;

import org.bluezoo.splitdns.cache.MemoryCache;
import org.bluezoo.splitdns.cache.QueryKey;
import org.bluezoo.splitdns.cache.ShardedAnswerCache;
import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSQuestion;
import org.bluezoo.splitdns.dns.DNSResourceRecord;
import org.bluezoo.splitdns.dns.DNSType;
import org.bluezoo.splitdns.matcher.DomainSet;
import org.bluezoo.splitdns.matcher.IPMatcher;
import org.bluezoo.splitdns.matcher.NetList;
import org.bluezoo.splitdns.upstream.ScriptedTransport;
import org.bluezoo.splitdns.upstream.Upstream;
import org.bluezoo.splitdns.upstream.UpstreamGroup;
import org.bluezoo.splitdns.upstream.UpstreamRole;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link DispatchEngine} using scripted upstreams with
 * fixed latencies.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DispatchEngineTest {

    private ExecutorService executor;
    private NetList localRange;
    private AtomicInteger validations;
    private ResponseValidator validator;
    private final long[] now = { 0L };
    private MemoryCache<QueryKey, DNSMessage> store;
    private ShardedAnswerCache cache;

    @Before
    public void setUp() {
        executor = Executors.newCachedThreadPool();
        localRange = new NetList();
        localRange.add("10.0.0.0/8");
        localRange.sort();
        validations = new AtomicInteger();
        validator = new ResponseValidator(new IPMatcher() {
            @Override
            public boolean contains(InetAddress address) {
                validations.incrementAndGet();
                return localRange.contains(address);
            }
        });
        store = new MemoryCache<QueryKey, DNSMessage>(8, 16) {
            @Override
            protected long currentTimeMillis() {
                return now[0];
            }
        };
        cache = new ShardedAnswerCache(store);
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    private static Upstream upstream(String name, ScriptedTransport transport, boolean trusted) {
        return new Upstream(name, transport, trusted);
    }

    private static UpstreamGroup local(Upstream... upstreams) {
        return new UpstreamGroup(UpstreamRole.LOCAL, Arrays.asList(upstreams));
    }

    private static UpstreamGroup remote(Upstream... upstreams) {
        return new UpstreamGroup(UpstreamRole.REMOTE, Arrays.asList(upstreams));
    }

    private DispatchEngine engine(UpstreamGroup local, UpstreamGroup remote,
                                  RoutingClassifier classifier, long grace) {
        return new DispatchEngine(local, remote, classifier, validator, cache, grace, executor);
    }

    private DispatchEngine engine(UpstreamGroup local, UpstreamGroup remote, long grace) {
        return engine(local, remote, new RoutingClassifier(null, null), grace);
    }

    private static DNSMessage query(int id, String name) {
        return DNSMessage.createQuery(id, name, DNSType.A);
    }

    private static String firstAddress(DNSMessage response) {
        return response.getAnswers().get(0).getAddress().getHostAddress();
    }

    @Test
    public void testTrustedLocalAnswerWins() throws Exception {
        ScriptedTransport localTransport = ScriptedTransport.answering(10, 300, "1.2.3.4");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(3000, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", localTransport, true)),
                remote(upstream("remote", remoteTransport, true)), 50);

        long start = System.currentTimeMillis();
        DNSMessage response = engine.handle(query(11, "example.com"));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(11, response.getId());
        assertEquals("1.2.3.4", firstAddress(response));
        assertTrue("took " + elapsed + "ms", elapsed < 2000);
        assertTrue(remoteTransport.awaitInterrupted(2000));
    }

    @Test
    public void testRemoteAnswerAfterGraceWindow() throws Exception {
        ScriptedTransport outOfRange = ScriptedTransport.answering(10, 300, "1.2.3.4");
        ScriptedTransport slowLocal = ScriptedTransport.answering(5000, 300, "10.0.0.1");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(30, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local-a", outOfRange, false), upstream("local-b", slowLocal, false)),
                remote(upstream("remote", remoteTransport, true)), 100);

        long start = System.currentTimeMillis();
        DNSMessage response = engine.handle(query(12, "example.com"));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals("5.6.7.8", firstAddress(response));
        assertTrue("took " + elapsed + "ms", elapsed >= 130);
        assertTrue("took " + elapsed + "ms", elapsed < 1500);
        assertTrue(slowLocal.awaitInterrupted(2000));
    }

    @Test
    public void testRemoteAnswerWaitsForGraceWhenLocalAnswered() throws Exception {
        ScriptedTransport outOfRange = ScriptedTransport.answering(10, 300, "1.2.3.4");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(30, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", outOfRange, false)),
                remote(upstream("remote", remoteTransport, true)), 20);

        long start = System.currentTimeMillis();
        DNSMessage response = engine.handle(query(29, "example.com"));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals("5.6.7.8", firstAddress(response));
        assertTrue("took " + elapsed + "ms", elapsed >= 50);
        assertTrue("took " + elapsed + "ms", elapsed < 1000);
    }

    @Test
    public void testLocalServerFailureDoesNotPreemptRemote() throws Exception {
        ScriptedTransport servfail = ScriptedTransport.responding(10, DNSMessage.RCODE_SERVFAIL);
        ScriptedTransport remoteTransport = ScriptedTransport.answering(30, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", servfail, false)),
                remote(upstream("remote", remoteTransport, true)), 50);

        DNSMessage response = engine.handle(query(30, "example.com"));

        assertTrue(response.isSuccess());
        assertEquals("5.6.7.8", firstAddress(response));
    }

    @Test
    public void testLocalServerFailureUsedWhenRemoteFails() throws Exception {
        ScriptedTransport refused = ScriptedTransport.responding(10, DNSMessage.RCODE_REFUSED);
        DispatchEngine engine = engine(
                local(upstream("local", refused, false)),
                remote(upstream("remote", ScriptedTransport.failing(30), true)), 50);

        DNSMessage response = engine.handle(query(31, "example.com"));

        assertEquals(DNSMessage.RCODE_REFUSED, response.getRcode());
        assertEquals(31, response.getId());
        assertEquals(0, store.size());
    }

    @Test
    public void testLocalNameErrorAccepted() throws Exception {
        ScriptedTransport nxdomain = ScriptedTransport.responding(10, DNSMessage.RCODE_NXDOMAIN);
        ScriptedTransport remoteTransport = ScriptedTransport.answering(3000, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", nxdomain, false)),
                remote(upstream("remote", remoteTransport, true)), 50);

        long start = System.currentTimeMillis();
        DNSMessage response = engine.handle(query(32, "missing.example"));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(DNSMessage.RCODE_NXDOMAIN, response.getRcode());
        assertTrue("took " + elapsed + "ms", elapsed < 2000);
        assertTrue(remoteTransport.awaitInterrupted(2000));
    }

    @Test
    public void testUpstreamQueriesUseOwnId() throws Exception {
        ScriptedTransport localTransport = ScriptedTransport.answering(10, 300, "1.2.3.4");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(20, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", localTransport, false)),
                remote(upstream("remote", remoteTransport, true)), 20);

        DNSMessage response = engine.handle(query(4242, "example.com"));

        assertEquals(4242, response.getId());
        int localId = localTransport.getLastQueryId();
        assertTrue(localId >= 0 && localId <= 0xFFFF);
        assertNotEquals(4242, localId);
        assertEquals(localId, remoteTransport.getLastQueryId());
    }

    @Test
    public void testInRangeLocalAnswerWithinGraceWindow() throws Exception {
        ScriptedTransport outOfRange = ScriptedTransport.answering(10, 300, "1.2.3.4");
        ScriptedTransport inRange = ScriptedTransport.answering(80, 300, "10.1.1.1");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(20, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local-a", outOfRange, false), upstream("local-b", inRange, false)),
                remote(upstream("remote", remoteTransport, true)), 2000);

        DNSMessage response = engine.handle(query(13, "example.com"));

        assertEquals("10.1.1.1", firstAddress(response));
    }

    @Test
    public void testLocalAnswerWithoutAddressesAccepted() throws Exception {
        ScriptedTransport empty = ScriptedTransport.answering(10, 300);
        ScriptedTransport remoteTransport = ScriptedTransport.answering(3000, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", empty, false)),
                remote(upstream("remote", remoteTransport, true)), 50);

        DNSMessage response = engine.handle(query(14, "example.com"));

        assertTrue(response.isSuccess());
        assertTrue(response.getAnswers().isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    public void testLocalFailureAcceptsRemoteAtOnce() throws Exception {
        ScriptedTransport failing = ScriptedTransport.failing(5);
        ScriptedTransport remoteTransport = ScriptedTransport.answering(20, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", failing, true)),
                remote(upstream("remote", remoteTransport, true)), 5000);

        long start = System.currentTimeMillis();
        DNSMessage response = engine.handle(query(15, "example.com"));
        long elapsed = System.currentTimeMillis() - start;

        assertEquals("5.6.7.8", firstAddress(response));
        assertTrue("took " + elapsed + "ms", elapsed < 4000);
    }

    @Test
    public void testRemoteFailureFallsBackToLocal() throws Exception {
        ScriptedTransport outOfRange = ScriptedTransport.answering(30, 300, "1.2.3.4");
        ScriptedTransport failing = ScriptedTransport.failing(5);
        DispatchEngine engine = engine(
                local(upstream("local", outOfRange, false)),
                remote(upstream("remote", failing, true)), 50);

        DNSMessage response = engine.handle(query(16, "example.com"));

        assertEquals("1.2.3.4", firstAddress(response));
    }

    @Test
    public void testAllUpstreamsFail() throws Exception {
        DispatchEngine engine = engine(
                local(upstream("local-a", ScriptedTransport.failing(5), true),
                        upstream("local-b", ScriptedTransport.failing(10), false)),
                remote(upstream("remote", ScriptedTransport.failing(15), true)), 50);

        try {
            engine.handle(query(17, "example.com"));
            fail("Expected ResolutionException");
        } catch (ResolutionException e) {
            assertEquals(0, store.size());
        }
    }

    @Test
    public void testForcedLocalSkipsValidation() throws Exception {
        DomainSet localDomains = new DomainSet();
        localDomains.add("corp.example");
        ScriptedTransport localTransport = ScriptedTransport.answering(10, 300, "1.2.3.4");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(10, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", localTransport, false)),
                remote(upstream("remote", remoteTransport, true)),
                new RoutingClassifier(localDomains, null), 50);

        DNSMessage response = engine.handle(query(18, "www.corp.example"));

        assertEquals("1.2.3.4", firstAddress(response));
        assertEquals(1, localTransport.getCalls());
        assertEquals(0, remoteTransport.getCalls());
        assertEquals(0, validations.get());
    }

    @Test
    public void testForcedRemote() throws Exception {
        DomainSet remoteDomains = new DomainSet();
        remoteDomains.add("full:blocked.example");
        ScriptedTransport localTransport = ScriptedTransport.answering(10, 300, "10.0.0.1");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(10, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", localTransport, true)),
                remote(upstream("remote", remoteTransport, true)),
                new RoutingClassifier(null, remoteDomains), 50);

        DNSMessage response = engine.handle(query(19, "blocked.example"));

        assertEquals("5.6.7.8", firstAddress(response));
        assertEquals(0, localTransport.getCalls());
        assertEquals(1, remoteTransport.getCalls());
    }

    @Test
    public void testForcedPrefersDefiniteAnswer() throws Exception {
        DomainSet localDomains = new DomainSet();
        localDomains.add("corp.example");
        DispatchEngine engine = engine(
                local(upstream("local-a", ScriptedTransport.responding(5, DNSMessage.RCODE_SERVFAIL), false),
                        upstream("local-b", ScriptedTransport.answering(40, 300, "10.0.0.2"), false)),
                remote(upstream("remote", ScriptedTransport.failing(5), true)),
                new RoutingClassifier(localDomains, null), 50);

        DNSMessage response = engine.handle(query(33, "www.corp.example"));

        assertEquals("10.0.0.2", firstAddress(response));
    }

    @Test
    public void testForcedGroupFailure() throws Exception {
        DomainSet localDomains = new DomainSet();
        localDomains.add("corp.example");
        DispatchEngine engine = engine(
                local(upstream("local", ScriptedTransport.failing(5), true)),
                remote(upstream("remote", ScriptedTransport.answering(5, 300, "5.6.7.8"), true)),
                new RoutingClassifier(localDomains, null), 50);

        try {
            engine.handle(query(20, "corp.example"));
            fail("Expected ResolutionException");
        } catch (ResolutionException e) {
            assertNotNull(e.getMessage());
        }
    }

    @Test
    public void testCacheHit() throws Exception {
        ScriptedTransport localTransport = ScriptedTransport.answering(5, 300, "10.0.0.1");
        ScriptedTransport remoteTransport = ScriptedTransport.answering(50, 300, "5.6.7.8");
        DispatchEngine engine = engine(
                local(upstream("local", localTransport, true)),
                remote(upstream("remote", remoteTransport, true)), 50);

        DNSMessage first = engine.handle(query(21, "example.com"));
        int localCalls = localTransport.getCalls();
        int remoteCalls = remoteTransport.getCalls();
        DNSMessage second = engine.handle(query(22, "EXAMPLE.com"));

        assertEquals(22, second.getId());
        assertEquals(localCalls, localTransport.getCalls());
        assertEquals(remoteCalls, remoteTransport.getCalls());
        assertArrayEquals(first.withId(22).toByteArray(), second.toByteArray());
    }

    @Test
    public void testCacheExpiry() throws Exception {
        ScriptedTransport localTransport = ScriptedTransport.answering(5, 30, "10.0.0.1");
        DispatchEngine engine = engine(
                local(upstream("local", localTransport, true)),
                remote(upstream("remote", ScriptedTransport.failing(5), true)), 50);

        engine.handle(query(23, "example.com"));
        now[0] = 29999L;
        engine.handle(query(24, "example.com"));
        assertEquals(1, localTransport.getCalls());

        now[0] = 30000L;
        engine.handle(query(25, "example.com"));
        assertEquals(2, localTransport.getCalls());
    }

    @Test
    public void testZeroTTLNotCached() throws Exception {
        ScriptedTransport localTransport = ScriptedTransport.answering(5, 0, "10.0.0.1");
        DispatchEngine engine = engine(
                local(upstream("local", localTransport, true)),
                remote(upstream("remote", ScriptedTransport.failing(5), true)), 50);

        engine.handle(query(26, "example.com"));
        engine.handle(query(27, "example.com"));

        assertEquals(0, store.size());
        assertEquals(2, localTransport.getCalls());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMultipleQuestionsRejected() throws Exception {
        DispatchEngine engine = engine(
                local(upstream("local", ScriptedTransport.failing(5), true)),
                remote(upstream("remote", ScriptedTransport.failing(5), true)), 50);
        List<DNSQuestion> questions = new ArrayList<>();
        questions.add(new DNSQuestion("a.example", DNSType.A));
        questions.add(new DNSQuestion("b.example", DNSType.A));
        List<DNSResourceRecord> none = Collections.emptyList();

        engine.handle(new DNSMessage(28, DNSMessage.FLAG_RD, questions, none, none, none));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testGroupRolesChecked() {
        UpstreamGroup group = local(upstream("local", ScriptedTransport.failing(5), true));
        new DispatchEngine(group, group, new RoutingClassifier(null, null), validator, cache, 50, executor);
    }

}
