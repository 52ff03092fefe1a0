/*
 * UpstreamTransport.java
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

package org.bluezoo.splitdns.upstream;

import java.io.IOException;

import org.bluezoo.splitdns.dns.DNSFormatException;
import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Performs a single DNS exchange with an upstream resolver.
 *
 * <p>Exchanges block the calling thread. Implementations must respond to
 * interruption of that thread by abandoning the exchange and releasing
 * any socket it holds, typically by throwing
 * {@link java.nio.channels.ClosedByInterruptException}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public interface UpstreamTransport {

    /**
     * Sends a query and waits for the matching response.
     *
     * @param query the query
     * @return the response
     * @throws IOException if the exchange fails, times out or is interrupted
     * @throws DNSFormatException if the response cannot be decoded
     */
    DNSMessage exchange(DNSMessage query) throws IOException, DNSFormatException;

}
