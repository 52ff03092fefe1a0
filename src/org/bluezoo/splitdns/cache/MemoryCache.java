/*
 * MemoryCache.java
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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded in-memory key/value store with per-entry expiry.
 *
 * <p>Entries are spread over a fixed number of shards, each holding at
 * most a fixed number of entries. Each shard is guarded by its own lock
 * and evicts its least recently used entry when a put would exceed its
 * capacity. An entry is never returned after its expiry time, and a
 * background task may be scheduled to remove expired entries that are
 * no longer being looked up.
 *
 * @param <K> the key type
 * @param <V> the value type
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class MemoryCache<K, V> {

    private static final Logger LOGGER = Logger.getLogger(MemoryCache.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.splitdns.cache.L10N");

    private final Shard<K, V>[] shards;
    private final int shardCapacity;

    private ScheduledExecutorService cleanupExecutor;
    private ScheduledFuture<?> cleanupFuture;

    /**
     * Creates a new cache with no background cleanup.
     *
     * @param shardCount the number of shards (at least 1)
     * @param shardCapacity the maximum number of entries per shard (at least 1)
     */
    @SuppressWarnings("unchecked")
    public MemoryCache(int shardCount, int shardCapacity) {
        if (shardCount < 1) {
            String msg = MessageFormat.format(L10N.getString("err.bad_shard_count"), shardCount);
            throw new IllegalArgumentException(msg);
        }
        if (shardCapacity < 1) {
            String msg = MessageFormat.format(L10N.getString("err.bad_shard_capacity"), shardCapacity);
            throw new IllegalArgumentException(msg);
        }
        this.shardCapacity = shardCapacity;
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++) {
            shards[i] = new Shard<>(shardCapacity);
        }
    }

    /**
     * Returns the number of shards.
     *
     * @return the shard count
     */
    public int getShardCount() {
        return shards.length;
    }

    /**
     * Returns the maximum number of entries held by each shard.
     *
     * @return the per-shard capacity
     */
    public int getShardCapacity() {
        return shardCapacity;
    }

    /**
     * Starts a background task removing expired entries at a fixed
     * interval. Has no effect if cleanup is already running.
     *
     * @param interval the interval between sweeps in milliseconds
     */
    public synchronized void startCleanup(long interval) {
        if (cleanupFuture != null) {
            return;
        }
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(
                new DaemonThreadFactory("MemoryCache-Cleanup"));
        cleanupFuture = cleanupExecutor.scheduleAtFixedRate(new CleanupTask(),
                interval, interval, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the background cleanup task, if running.
     */
    public synchronized void close() {
        if (cleanupFuture != null) {
            cleanupFuture.cancel(false);
            cleanupFuture = null;
        }
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
            cleanupExecutor = null;
        }
    }

    /**
     * Returns the live value for a key.
     *
     * @param key the key
     * @return the value, or null if absent or expired
     */
    public V get(K key) {
        return get(key, currentTimeMillis());
    }

    V get(K key, long now) {
        return shardFor(key).get(key, now);
    }

    /**
     * Stores a value that expires after the given time to live. A
     * non-positive time to live stores nothing.
     *
     * @param key the key
     * @param value the value
     * @param ttl the time to live in milliseconds
     */
    public void put(K key, V value, long ttl) {
        put(key, value, ttl, currentTimeMillis());
    }

    void put(K key, V value, long ttl, long now) {
        if (ttl <= 0L) {
            return;
        }
        shardFor(key).put(key, value, now + ttl);
    }

    /**
     * Removes the entry for a key.
     *
     * @param key the key
     */
    public void remove(K key) {
        shardFor(key).remove(key);
    }

    /**
     * Returns the number of entries held, including any that have expired
     * but not yet been removed.
     *
     * @return the entry count
     */
    public int size() {
        int size = 0;
        for (Shard<K, V> shard : shards) {
            size += shard.size();
        }
        return size;
    }

    /**
     * Removes all expired entries.
     *
     * @return the number of entries removed
     */
    public int removeExpired() {
        return removeExpired(currentTimeMillis());
    }

    int removeExpired(long now) {
        int removed = 0;
        for (Shard<K, V> shard : shards) {
            removed += shard.removeExpired(now);
        }
        return removed;
    }

    /**
     * Returns the current time used to compute and check expiry.
     *
     * @return the current time in milliseconds
     */
    protected long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    private Shard<K, V> shardFor(K key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return shards[Math.floorMod(h, shards.length)];
    }

    /**
     * Access-ordered map guarded by a lock.
     */
    private static final class Shard<K, V> {

        private final ReentrantLock lock = new ReentrantLock();
        private final LinkedHashMap<K, Entry<V>> map;

        Shard(final int capacity) {
            map = new LinkedHashMap<K, Entry<V>>(16, 0.75f, true) {
                private static final long serialVersionUID = 1L;

                @Override
                protected boolean removeEldestEntry(Map.Entry<K, Entry<V>> eldest) {
                    return size() > capacity;
                }
            };
        }

        V get(K key, long now) {
            lock.lock();
            try {
                Entry<V> entry = map.get(key);
                if (entry == null) {
                    return null;
                }
                if (now >= entry.expiry) {
                    map.remove(key);
                    return null;
                }
                return entry.value;
            } finally {
                lock.unlock();
            }
        }

        void put(K key, V value, long expiry) {
            lock.lock();
            try {
                map.put(key, new Entry<>(value, expiry));
            } finally {
                lock.unlock();
            }
        }

        void remove(K key) {
            lock.lock();
            try {
                map.remove(key);
            } finally {
                lock.unlock();
            }
        }

        int size() {
            lock.lock();
            try {
                return map.size();
            } finally {
                lock.unlock();
            }
        }

        int removeExpired(long now) {
            int removed = 0;
            lock.lock();
            try {
                Iterator<Entry<V>> it = map.values().iterator();
                while (it.hasNext()) {
                    if (now >= it.next().expiry) {
                        it.remove();
                        removed++;
                    }
                }
            } finally {
                lock.unlock();
            }
            return removed;
        }
    }

    private static final class Entry<V> {
        final V value;
        final long expiry;

        Entry(V value, long expiry) {
            this.value = value;
            this.expiry = expiry;
        }
    }

    private class CleanupTask implements Runnable {
        @Override
        public void run() {
            try {
                int removed = removeExpired();
                if (removed > 0 && LOGGER.isLoggable(Level.FINEST)) {
                    String msg = MessageFormat.format(L10N.getString("debug.removed_expired"), removed);
                    LOGGER.finest(msg);
                }
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, L10N.getString("err.cleanup_failed"), e);
            }
        }
    }

    private static class DaemonThreadFactory implements ThreadFactory {
        private final String name;

        DaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }

}
