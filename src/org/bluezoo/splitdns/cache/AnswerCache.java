/*
 * AnswerCache.java
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

import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Store of resolved answers keyed by query identity.
 *
 * <p>Implementations must be safe for concurrent use and must never
 * return an answer past its expiry.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface AnswerCache {

    /**
     * Returns the live cached answer for a query.
     *
     * @param key the query identity
     * @return the cached response, or null on a miss
     */
    DNSMessage get(QueryKey key);

    /**
     * Stores an answer.
     *
     * @param key the query identity
     * @param response the response to store
     * @param ttl the time to live in seconds
     */
    void put(QueryKey key, DNSMessage response, int ttl);

    /**
     * Releases any background resources held by the cache.
     */
    void close();

}
