/*
 * UpstreamGroup.java
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

import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;

import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * An ordered set of upstreams that are queried together.
 *
 * <p>The group does not interpret the trusted flag of its members; that
 * is left to whoever consumes the race.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class UpstreamGroup {

    private final UpstreamRole role;
    private final List<Upstream> upstreams;

    /**
     * Creates a group.
     *
     * @param role the role of the group
     * @param upstreams the upstreams, in configuration order
     */
    public UpstreamGroup(UpstreamRole role, List<Upstream> upstreams) {
        this.role = role;
        this.upstreams = Collections.unmodifiableList(new ArrayList<>(upstreams));
    }

    /**
     * Creates a group from configured addresses. The first upstream is
     * trusted.
     *
     * @param role the role of the group
     * @param addresses the upstream addresses, in configuration order
     * @param timeout the exchange timeout in milliseconds
     * @return the group
     * @throws UnknownHostException if an upstream host cannot be resolved
     */
    public static UpstreamGroup create(UpstreamRole role, List<UpstreamAddress> addresses, int timeout)
            throws UnknownHostException {
        List<Upstream> upstreams = new ArrayList<>(addresses.size());
        for (int i = 0; i < addresses.size(); i++) {
            UpstreamAddress address = addresses.get(i);
            upstreams.add(new Upstream(address.toString(), address.createTransport(timeout), i == 0));
        }
        return new UpstreamGroup(role, upstreams);
    }

    public UpstreamRole getRole() {
        return role;
    }

    public List<Upstream> getUpstreams() {
        return upstreams;
    }

    public int size() {
        return upstreams.size();
    }

    /**
     * Starts a race over this group alone.
     *
     * @param query the query
     * @param executor the executor for the query tasks
     * @return the started race, which the caller must close
     */
    public Race race(DNSMessage query, ExecutorService executor) {
        Race race = new Race(executor);
        race.start(this, query);
        return race;
    }

    @Override
    public String toString() {
        return role + upstreams.toString();
    }

}
