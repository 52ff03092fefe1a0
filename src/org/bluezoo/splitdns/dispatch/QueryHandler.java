/*
 * QueryHandler.java
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

import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Resolves a DNS query on behalf of a listener.
 *
 * <p>Implementations are invoked once per inbound query, possibly from
 * many threads at once, and know nothing of the transport the query
 * arrived on.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface QueryHandler {

    /**
     * Resolves a query.
     *
     * @param query a query with exactly one question
     * @return the response, carrying the query's ID
     * @throws ResolutionException if no upstream produced an answer
     */
    DNSMessage handle(DNSMessage query) throws ResolutionException;

}
