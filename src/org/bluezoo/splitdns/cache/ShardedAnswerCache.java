/*
 * ShardedAnswerCache.java
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

import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Answer cache backed by a sharded {@link MemoryCache}.
 *
 * <p>A configured size is divided evenly over {@link #SHARD_COUNT}
 * shards. Sizes at or below {@link #MINIMUM_SIZE} disable caching; see
 * {@link #create(int)}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ShardedAnswerCache implements AnswerCache {

    private static final Logger LOGGER = Logger.getLogger(ShardedAnswerCache.class.getName());

    /** Number of shards a configured size is divided over. */
    public static final int SHARD_COUNT = 8;

    /** Largest configured size that disables caching. */
    public static final int MINIMUM_SIZE = 8;

    /** Interval between sweeps of expired entries, in milliseconds. */
    public static final long CLEANUP_INTERVAL = 60000L;

    private final MemoryCache<QueryKey, DNSMessage> store;

    /**
     * Creates a cache over an existing store.
     *
     * @param store the backing store
     */
    public ShardedAnswerCache(MemoryCache<QueryKey, DNSMessage> store) {
        this.store = store;
    }

    /**
     * Creates the answer cache for a configured size: a disabled cache
     * when the size is at or below {@link #MINIMUM_SIZE}, otherwise a
     * sharded cache with periodic cleanup of expired entries.
     *
     * @param size the configured total number of entries
     * @return the answer cache
     */
    public static AnswerCache create(int size) {
        if (size <= MINIMUM_SIZE) {
            return DisabledAnswerCache.INSTANCE;
        }
        MemoryCache<QueryKey, DNSMessage> store =
                new MemoryCache<>(SHARD_COUNT, size / SHARD_COUNT);
        store.startCleanup(CLEANUP_INTERVAL);
        return new ShardedAnswerCache(store);
    }

    @Override
    public DNSMessage get(QueryKey key) {
        DNSMessage response = store.get(key);
        if (response != null && LOGGER.isLoggable(Level.FINEST)) {
            String msg = MessageFormat.format(MemoryCache.L10N.getString("debug.hit"), key);
            LOGGER.finest(msg);
        }
        return response;
    }

    @Override
    public void put(QueryKey key, DNSMessage response, int ttl) {
        store.put(key, response, ttl * 1000L);
    }

    @Override
    public void close() {
        store.close();
    }

    /**
     * Returns the backing store.
     *
     * @return the store
     */
    public MemoryCache<QueryKey, DNSMessage> getStore() {
        return store;
    }

}
