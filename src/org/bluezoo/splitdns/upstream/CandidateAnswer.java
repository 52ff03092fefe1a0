/*
 * CandidateAnswer.java
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

import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Outcome of one upstream query within a race: either a response or the
 * exception that ended the query.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class CandidateAnswer {

    private final UpstreamRole role;
    private final Upstream upstream;
    private final DNSMessage response;
    private final Exception error;
    private final long elapsed;

    CandidateAnswer(UpstreamRole role, Upstream upstream, DNSMessage response,
                    Exception error, long elapsed) {
        this.role = role;
        this.upstream = upstream;
        this.response = response;
        this.error = error;
        this.elapsed = elapsed;
    }

    /**
     * Returns the role of the group the upstream belongs to.
     *
     * @return the role
     */
    public UpstreamRole getRole() {
        return role;
    }

    public Upstream getUpstream() {
        return upstream;
    }

    /**
     * Returns whether the answering upstream is trusted.
     *
     * @return the upstream's trusted flag
     */
    public boolean isTrusted() {
        return upstream.isTrusted();
    }

    /**
     * Returns the response.
     *
     * @return the response, or null if the query failed
     */
    public DNSMessage getResponse() {
        return response;
    }

    /**
     * Returns the failure.
     *
     * @return the exception, or null if a response was received
     */
    public Exception getError() {
        return error;
    }

    public boolean isError() {
        return response == null;
    }

    /**
     * Returns the time from the start of the race until this outcome.
     *
     * @return the elapsed time in milliseconds
     */
    public long getElapsed() {
        return elapsed;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CandidateAnswer{");
        sb.append(role);
        sb.append(", ");
        sb.append(upstream);
        sb.append(", ");
        sb.append(elapsed);
        sb.append("ms, ");
        if (response != null) {
            sb.append(response);
        } else {
            sb.append(error);
        }
        sb.append("}");
        return sb.toString();
    }

}
