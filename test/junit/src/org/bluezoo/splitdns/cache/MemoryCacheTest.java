/*
 * MemoryCacheTest.java
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

import org.junit.Test;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link MemoryCache}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MemoryCacheTest {

    @Test
    public void testPutAndGet() {
        MemoryCache<String, String> cache = new MemoryCache<>(4, 16);

        cache.put("a", "alpha", 1000L, 0L);
        cache.put("b", "beta", 1000L, 0L);

        assertEquals("alpha", cache.get("a", 500L));
        assertEquals("beta", cache.get("b", 500L));
        assertNull(cache.get("c", 500L));
        assertEquals(2, cache.size());
    }

    @Test
    public void testExpiry() {
        MemoryCache<String, String> cache = new MemoryCache<>(1, 16);
        cache.put("a", "alpha", 1000L, 0L);

        assertEquals("alpha", cache.get("a", 999L));
        assertNull(cache.get("a", 1000L));
        assertEquals(0, cache.size());
    }

    @Test
    public void testNonPositiveTTLStoresNothing() {
        MemoryCache<String, String> cache = new MemoryCache<>(1, 16);

        cache.put("a", "alpha", 0L, 0L);
        cache.put("b", "beta", -5L, 0L);

        assertEquals(0, cache.size());
        assertNull(cache.get("a", 0L));
    }

    @Test
    public void testReplaceValue() {
        MemoryCache<String, String> cache = new MemoryCache<>(1, 16);
        cache.put("a", "old", 100L, 0L);
        cache.put("a", "new", 1000L, 0L);

        assertEquals("new", cache.get("a", 500L));
        assertEquals(1, cache.size());
    }

    @Test
    public void testLeastRecentlyUsedEvicted() {
        MemoryCache<String, String> cache = new MemoryCache<>(1, 2);
        cache.put("a", "alpha", 1000L, 0L);
        cache.put("b", "beta", 1000L, 0L);

        // touch a so that b is the eldest
        assertEquals("alpha", cache.get("a", 1L));
        cache.put("c", "gamma", 1000L, 2L);

        assertEquals(2, cache.size());
        assertEquals("alpha", cache.get("a", 3L));
        assertNull(cache.get("b", 3L));
        assertEquals("gamma", cache.get("c", 3L));
    }

    @Test
    public void testRemove() {
        MemoryCache<String, String> cache = new MemoryCache<>(2, 4);
        cache.put("a", "alpha", 1000L, 0L);

        cache.remove("a");

        assertNull(cache.get("a", 0L));
        assertEquals(0, cache.size());
    }

    @Test
    public void testRemoveExpired() {
        MemoryCache<String, String> cache = new MemoryCache<>(4, 16);
        cache.put("short1", "x", 100L, 0L);
        cache.put("short2", "y", 100L, 0L);
        cache.put("long", "z", 10000L, 0L);

        assertEquals(2, cache.removeExpired(5000L));
        assertEquals(1, cache.size());
        assertEquals("z", cache.get("long", 5000L));
    }

    @Test
    public void testOverriddenClock() {
        final long[] now = { 1000L };
        MemoryCache<String, String> cache = new MemoryCache<String, String>(1, 4) {
            @Override
            protected long currentTimeMillis() {
                return now[0];
            }
        };
        cache.put("a", "alpha", 2000L);

        now[0] = 2999L;
        assertEquals("alpha", cache.get("a"));
        now[0] = 3000L;
        assertNull(cache.get("a"));
    }

    @Test
    public void testDimensions() {
        MemoryCache<String, String> cache = new MemoryCache<>(8, 128);
        assertEquals(8, cache.getShardCount());
        assertEquals(128, cache.getShardCapacity());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadShardCount() {
        new MemoryCache<String, String>(0, 16);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadShardCapacity() {
        new MemoryCache<String, String>(8, 0);
    }

    @Test
    public void testCleanupStartAndClose() throws Exception {
        MemoryCache<String, String> cache = new MemoryCache<>(1, 4);
        cache.put("a", "alpha", 10L);
        cache.startCleanup(20L);
        try {
            long deadline = System.currentTimeMillis() + 5000L;
            while (cache.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10L);
            }
            assertEquals(0, cache.size());
        } finally {
            cache.close();
        }
    }

}
