/*
 * QueryProcessorTest.java
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

import org.bluezoo.splitdns.dispatch.QueryHandler;
import org.bluezoo.splitdns.dispatch.ResolutionException;
import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSQuestion;
import org.bluezoo.splitdns.dns.DNSResourceRecord;
import org.bluezoo.splitdns.dns.DNSType;
import org.junit.Before;
import org.junit.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link QueryProcessor}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class QueryProcessorTest {

    private final SocketAddress client = new InetSocketAddress(InetAddress.getLoopbackAddress(), 40000);
    private int handled;
    private QueryProcessor processor;

    @Before
    public void setUp() {
        processor = new QueryProcessor(new QueryHandler() {
            @Override
            public DNSMessage handle(DNSMessage query) throws ResolutionException {
                handled++;
                String name = query.getQuestions().get(0).getName();
                if (name.startsWith("fail.")) {
                    throw new ResolutionException("no answer for " + name);
                }
                if (name.startsWith("bug.")) {
                    throw new IllegalStateException("handler bug");
                }
                try {
                    return query.createResponse(Collections.singletonList(
                            DNSResourceRecord.a(name, 60, InetAddress.getByName("192.0.2.1"))));
                } catch (UnknownHostException e) {
                    throw new ResolutionException(e.getMessage(), e);
                }
            }
        });
    }

    private static DNSMessage message(int id, int flags, DNSQuestion... questions) {
        List<DNSQuestion> list = new ArrayList<>();
        Collections.addAll(list, questions);
        List<DNSResourceRecord> none = Collections.emptyList();
        return new DNSMessage(id, flags, list, none, none, none);
    }

    @Test
    public void testQueryAnswered() {
        byte[] data = DNSMessage.createQuery(100, "example.com", DNSType.A).toByteArray();

        DNSMessage response = processor.process(data, 0, data.length, client);

        assertEquals(100, response.getId());
        assertTrue(response.isResponse());
        assertEquals(1, response.getAnswers().size());
        assertEquals(1, handled);
    }

    @Test
    public void testResolutionFailureGivesServfail() {
        DNSMessage response = processor.process(DNSMessage.createQuery(101, "fail.example", DNSType.A), client);

        assertEquals(DNSMessage.RCODE_SERVFAIL, response.getRcode());
        assertEquals(101, response.getId());
    }

    @Test
    public void testHandlerBugGivesServfail() {
        DNSMessage response = processor.process(DNSMessage.createQuery(102, "bug.example", DNSType.A), client);

        assertEquals(DNSMessage.RCODE_SERVFAIL, response.getRcode());
    }

    @Test
    public void testUnsupportedOpcode() {
        int status = 2 << 11;
        DNSMessage query = message(103, status | DNSMessage.FLAG_RD, new DNSQuestion("example.com", DNSType.A));

        DNSMessage response = processor.process(query, client);

        assertEquals(DNSMessage.RCODE_NOTIMP, response.getRcode());
        assertEquals(0, handled);
    }

    @Test
    public void testQuestionCount() {
        DNSMessage none = message(104, DNSMessage.FLAG_RD);
        DNSMessage two = message(105, DNSMessage.FLAG_RD,
                new DNSQuestion("a.example", DNSType.A), new DNSQuestion("b.example", DNSType.A));

        assertEquals(DNSMessage.RCODE_FORMERR, processor.process(none, client).getRcode());
        assertEquals(DNSMessage.RCODE_FORMERR, processor.process(two, client).getRcode());
        assertEquals(0, handled);
    }

    @Test
    public void testResponsesDropped() {
        DNSMessage response = DNSMessage.createQuery(106, "example.com", DNSType.A)
                .createErrorResponse(DNSMessage.RCODE_NOERROR);
        byte[] data = response.toByteArray();

        assertNull(processor.process(response, client));
        assertNull(processor.process(data, 0, data.length, client));
        assertEquals(0, handled);
    }

    @Test
    public void testMalformedQueryGivesFormerr() {
        byte[] data = DNSMessage.createQuery(107, "example.com", DNSType.A).toByteArray();
        byte[] cut = new byte[data.length - 3];
        System.arraycopy(data, 0, cut, 0, cut.length);

        DNSMessage response = processor.process(cut, 0, cut.length, client);

        assertNotNull(response);
        assertEquals(107, response.getId());
        assertEquals(DNSMessage.RCODE_FORMERR, response.getRcode());
        assertTrue(response.isResponse());
        assertTrue(response.getQuestions().isEmpty());
    }

    @Test
    public void testShortMessageIgnored() {
        byte[] data = new byte[] { 0, 1, 0, 0, 0 };
        assertNull(processor.process(data, 0, data.length, client));
    }

    @Test
    public void testEncodeForUDPTruncates() throws Exception {
        DNSMessage query = DNSMessage.createQuery(108, "big.example", DNSType.A);
        List<DNSResourceRecord> answers = new ArrayList<>();
        for (int i = 1; i <= 60; i++) {
            answers.add(DNSResourceRecord.a("big.example", 60, InetAddress.getByName("192.0.2." + i)));
        }
        DNSMessage response = query.createResponse(answers);

        ByteBuffer plain = QueryProcessor.encodeForUDP(response, query);
        DNSMessage truncated = DNSMessage.parse(plain);
        assertTrue(truncated.isTruncated());
        assertTrue(truncated.getAnswers().isEmpty());
        assertEquals(108, truncated.getId());

        List<DNSResourceRecord> none = Collections.emptyList();
        DNSMessage ednsQuery = new DNSMessage(109, DNSMessage.FLAG_RD, query.getQuestions(), none, none,
                Collections.singletonList(DNSResourceRecord.opt(4096)));
        DNSMessage full = DNSMessage.parse(QueryProcessor.encodeForUDP(response, ednsQuery));
        assertFalse(full.isTruncated());
        assertEquals(60, full.getAnswers().size());
    }

}
