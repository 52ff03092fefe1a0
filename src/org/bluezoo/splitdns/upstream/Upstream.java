/*
 * Upstream.java
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
import java.util.ResourceBundle;

import org.bluezoo.splitdns.dns.DNSFormatException;
import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * A configured upstream resolver.
 *
 * <p>An upstream pairs a transport with a name for logging and a trusted
 * flag. Answers from a trusted upstream are not subject to address range
 * validation. Instances are immutable and shared by all concurrent
 * queries.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Upstream {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.splitdns.upstream.L10N");

    private final String name;
    private final UpstreamTransport transport;
    private final boolean trusted;

    /**
     * Creates an upstream.
     *
     * @param name the name used in log messages
     * @param transport the transport
     * @param trusted whether answers bypass range validation
     */
    public Upstream(String name, UpstreamTransport transport, boolean trusted) {
        this.name = name;
        this.transport = transport;
        this.trusted = trusted;
    }

    public String getName() {
        return name;
    }

    public UpstreamTransport getTransport() {
        return transport;
    }

    public boolean isTrusted() {
        return trusted;
    }

    /**
     * Queries this upstream. Interrupting the calling thread cancels the
     * query.
     *
     * @param query the query
     * @return the response
     * @throws IOException if the exchange fails or is cancelled
     * @throws DNSFormatException if the response is malformed
     */
    public DNSMessage query(DNSMessage query) throws IOException, DNSFormatException {
        return transport.exchange(query);
    }

    @Override
    public String toString() {
        return trusted ? name + " (trusted)" : name;
    }

}
