/*
 * ShardedAnswerCacheTest.java
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

package org.bluezoo.splitdns.cache;

import org.bluezoo.splitdns.dns.DNSClass;
import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSQuestion;
import org.bluezoo.splitdns.dns.DNSResourceRecord;
import org.bluezoo.splitdns.dns.DNSType;
import org.junit.Test;

import java.net.InetAddress;
import java.util.Collections;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ShardedAnswerCache}, {@link DisabledAnswerCache}
 * and {@link QueryKey}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ShardedAnswerCacheTest {

    private static DNSMessage response(String name, int ttl) throws Exception {
        DNSMessage query = DNSMessage.createQuery(1, name, DNSType.A);
        DNSResourceRecord answer = DNSResourceRecord.a(name, ttl, InetAddress.getByName("192.0.2.1"));
        return query.createResponse(Collections.singletonList(answer));
    }

    @Test
    public void testSmallSizeDisablesCache() throws Exception {
        assertSame(DisabledAnswerCache.INSTANCE, ShardedAnswerCache.create(0));
        assertSame(DisabledAnswerCache.INSTANCE, ShardedAnswerCache.create(8));

        AnswerCache cache = ShardedAnswerCache.create(8);
        QueryKey key = new QueryKey("example.com", 1, 1);
        cache.put(key, response("example.com", 300), 300);
        assertNull(cache.get(key));
    }

    @Test
    public void testShardLayout() {
        AnswerCache cache = ShardedAnswerCache.create(1024);
        try {
            assertTrue(cache instanceof ShardedAnswerCache);
            MemoryCache<QueryKey, DNSMessage> store = ((ShardedAnswerCache) cache).getStore();
            assertEquals(8, store.getShardCount());
            assertEquals(128, store.getShardCapacity());
        } finally {
            cache.close();
        }
    }

    @Test
    public void testPutAndGet() throws Exception {
        ShardedAnswerCache cache = new ShardedAnswerCache(new MemoryCache<QueryKey, DNSMessage>(8, 16));
        DNSMessage response = response("example.com", 300);
        QueryKey key = QueryKey.of(response.getQuestions().get(0));

        cache.put(key, response, 300);

        assertSame(response, cache.get(key));
        assertSame(response, cache.get(new QueryKey("EXAMPLE.com.", 1, 1)));
        assertNull(cache.get(new QueryKey("example.com", 28, 1)));
    }

    @Test
    public void testTTLInSeconds() throws Exception {
        final long[] now = { 0L };
        MemoryCache<QueryKey, DNSMessage> store = new MemoryCache<QueryKey, DNSMessage>(1, 16) {
            @Override
            protected long currentTimeMillis() {
                return now[0];
            }
        };
        ShardedAnswerCache cache = new ShardedAnswerCache(store);
        QueryKey key = new QueryKey("example.com", 1, 1);
        cache.put(key, response("example.com", 2), 2);

        now[0] = 1999L;
        assertNotNull(cache.get(key));
        now[0] = 2000L;
        assertNull(cache.get(key));
    }

    @Test
    public void testQueryKeyNormalization() {
        QueryKey a = new QueryKey("WWW.Example.COM.", 1, 1);
        QueryKey b = QueryKey.of(new DNSQuestion("www.example.com", DNSType.A, DNSClass.IN));

        assertEquals("www.example.com", a.getName());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(1, a.getType());
        assertEquals(1, a.getDNSClass());
    }

    @Test
    public void testQueryKeyDistinguishesTypeAndClass() {
        QueryKey a = new QueryKey("example.com", 1, 1);
        assertFalse(a.equals(new QueryKey("example.com", 28, 1)));
        assertFalse(a.equals(new QueryKey("example.com", 1, 3)));
        assertFalse(a.equals(new QueryKey("example.org", 1, 1)));
    }

}
