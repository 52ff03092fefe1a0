/*
 * Race.java
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
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.dns.DNSFormatException;
import org.bluezoo.splitdns.dns.DNSMessage;

/**
 * Concurrent queries to one or more upstream groups on behalf of a single
 * request.
 *
 * <p>{@link #start} submits one task per upstream. Outcomes are delivered
 * by {@link #next()} and {@link #poll(long, TimeUnit)} in the order they
 * complete, each outcome exactly once. A race is driven by a single
 * consumer thread and is not restartable. {@link #close()} cancels every
 * query still in flight by interrupting its task, which makes the
 * transport close its socket; outcomes of cancelled queries are
 * discarded.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Race implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Race.class.getName());

    private final ExecutorService executor;
    private final long startTime;
    private final BlockingQueue<CandidateAnswer> arrivals = new LinkedBlockingQueue<>();
    private final List<Future<?>> tasks = new ArrayList<>();
    private final Map<UpstreamRole, Counts> counts = new EnumMap<>(UpstreamRole.class);

    private volatile boolean closed;

    /**
     * Creates a race whose queries run on the given executor.
     *
     * @param executor the executor for upstream query tasks
     */
    public Race(ExecutorService executor) {
        this.executor = executor;
        this.startTime = System.nanoTime();
        for (UpstreamRole role : UpstreamRole.values()) {
            counts.put(role, new Counts());
        }
    }

    /**
     * Starts querying every upstream of a group.
     *
     * @param group the group
     * @param query the query to send
     */
    public void start(UpstreamGroup group, DNSMessage query) {
        if (closed) {
            throw new IllegalStateException(Upstream.L10N.getString("err.race_closed"));
        }
        UpstreamRole role = group.getRole();
        for (Upstream upstream : group.getUpstreams()) {
            counts.get(role).started++;
            tasks.add(executor.submit(new QueryTask(role, upstream, query)));
        }
    }

    /**
     * Waits for the next outcome.
     *
     * @return the next outcome, or null if no query is outstanding
     * @throws InterruptedException if the calling thread is interrupted
     */
    public CandidateAnswer next() throws InterruptedException {
        if (getOutstanding() == 0) {
            return null;
        }
        return delivered(arrivals.take());
    }

    /**
     * Waits up to the given time for the next outcome.
     *
     * @param timeout the maximum time to wait
     * @param unit the unit of the timeout
     * @return the next outcome, or null if none completed in time or no
     *         query is outstanding
     * @throws InterruptedException if the calling thread is interrupted
     */
    public CandidateAnswer poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (getOutstanding() == 0) {
            return null;
        }
        return delivered(arrivals.poll(timeout, unit));
    }

    /**
     * Returns the number of queries not yet delivered.
     *
     * @return the total outstanding count
     */
    public int getOutstanding() {
        int outstanding = 0;
        for (Counts c : counts.values()) {
            outstanding += c.started - c.delivered;
        }
        return outstanding;
    }

    /**
     * Returns the number of queries to a group role not yet delivered.
     *
     * @param role the role
     * @return the outstanding count
     */
    public int getOutstanding(UpstreamRole role) {
        Counts c = counts.get(role);
        return c.started - c.delivered;
    }

    /**
     * Returns whether every query to a group role has failed. A role with
     * no queries started counts as exhausted.
     *
     * @param role the role
     * @return true if all queries of that role were delivered as errors
     */
    public boolean isExhausted(UpstreamRole role) {
        Counts c = counts.get(role);
        return c.failed == c.started;
    }

    /**
     * Returns the time since the race was created.
     *
     * @return the elapsed time in milliseconds
     */
    public long getElapsed() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
    }

    /**
     * Cancels every query still in flight.
     */
    @Override
    public void close() {
        closed = true;
        for (Future<?> task : tasks) {
            task.cancel(true);
        }
    }

    private CandidateAnswer delivered(CandidateAnswer answer) {
        if (answer != null) {
            Counts c = counts.get(answer.getRole());
            c.delivered++;
            if (answer.isError()) {
                c.failed++;
            }
        }
        return answer;
    }

    private static final class Counts {
        int started;
        int delivered;
        int failed;
    }

    private class QueryTask implements Runnable {

        private final UpstreamRole role;
        private final Upstream upstream;
        private final DNSMessage query;

        QueryTask(UpstreamRole role, Upstream upstream, DNSMessage query) {
            this.role = role;
            this.upstream = upstream;
            this.query = query;
        }

        @Override
        public void run() {
            DNSMessage response = null;
            Exception error = null;
            try {
                response = upstream.query(query);
            } catch (IOException | DNSFormatException | RuntimeException e) {
                error = e;
            }
            if (closed) {
                return;
            }
            long elapsed = getElapsed();
            if (error != null) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String msg = MessageFormat.format(Upstream.L10N.getString("debug.upstream_failed"),
                            upstream, elapsed, error.toString());
                    LOGGER.log(Level.FINE, msg, LOGGER.isLoggable(Level.FINEST) ? error : null);
                }
            } else if (LOGGER.isLoggable(Level.FINEST)) {
                String msg = MessageFormat.format(Upstream.L10N.getString("debug.upstream_response"),
                        upstream, elapsed, response);
                LOGGER.finest(msg);
            }
            arrivals.add(new CandidateAnswer(role, upstream, response, error, elapsed));
        }
    }

}
