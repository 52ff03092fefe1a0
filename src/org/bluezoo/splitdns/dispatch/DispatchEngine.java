/*
 * DispatchEngine.java
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

import java.security.SecureRandom;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.cache.AnswerCache;
import org.bluezoo.splitdns.cache.QueryKey;
import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSQuestion;
import org.bluezoo.splitdns.upstream.CandidateAnswer;
import org.bluezoo.splitdns.upstream.Race;
import org.bluezoo.splitdns.upstream.UpstreamGroup;
import org.bluezoo.splitdns.upstream.UpstreamRole;

/**
 * Split-horizon query handler.
 *
 * <p>Each query is first looked up in the answer cache. On a miss its
 * name is classified: names on the local domain list are sent to the
 * local group only, names on the remote domain list to the remote group
 * only, and the first answer from the group is used. All other names are
 * sent to both groups at once and the answers arbitrated:
 * <ol>
 * <li>An answer from the local group is accepted as soon as it arrives if
 * its upstream is trusted, if one of its addresses lies in the trusted
 * range, or if it is a NOERROR or NXDOMAIN answer with no addresses at
 * all. Other local answers are kept as a last resort.</li>
 * <li>The first answer from the remote group opens a grace window. If an
 * acceptable local answer arrives before the window closes it is used,
 * otherwise the remote answer is used when the window closes.</li>
 * <li>If every local upstream fails, the first remote answer is used
 * without waiting.</li>
 * <li>If every remote upstream fails, the first local answer is used even
 * if its addresses lie outside the trusted range.</li>
 * </ol>
 * Once an answer is accepted every other query for the request is
 * cancelled. Upstream queries carry a random message ID; the client's ID
 * is restored on the answer. Successful answers with a positive minimum TTL are cached.
 *
 * <p>Instances are safe for concurrent use. Each query runs its upstream
 * exchanges as separate tasks on the supplied executor.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DispatchEngine implements QueryHandler {

    private static final Logger LOGGER = Logger.getLogger(DispatchEngine.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.splitdns.dispatch.L10N");

    private static final SecureRandom RANDOM = new SecureRandom();

    private final UpstreamGroup localGroup;
    private final UpstreamGroup remoteGroup;
    private final RoutingClassifier classifier;
    private final ResponseValidator validator;
    private final AnswerCache cache;
    private final long graceMillis;
    private final ExecutorService executor;

    /**
     * Creates a dispatch engine.
     *
     * @param localGroup the local upstream group
     * @param remoteGroup the remote upstream group
     * @param classifier the routing classifier
     * @param validator the validator for local answers
     * @param cache the answer cache
     * @param graceMillis the grace window in milliseconds
     * @param executor the executor for upstream query tasks
     */
    public DispatchEngine(UpstreamGroup localGroup, UpstreamGroup remoteGroup,
                          RoutingClassifier classifier, ResponseValidator validator,
                          AnswerCache cache, long graceMillis, ExecutorService executor) {
        if (localGroup.getRole() != UpstreamRole.LOCAL || remoteGroup.getRole() != UpstreamRole.REMOTE) {
            throw new IllegalArgumentException(L10N.getString("err.group_roles"));
        }
        this.localGroup = localGroup;
        this.remoteGroup = remoteGroup;
        this.classifier = classifier;
        this.validator = validator;
        this.cache = cache;
        this.graceMillis = graceMillis;
        this.executor = executor;
    }

    @Override
    public DNSMessage handle(DNSMessage query) throws ResolutionException {
        List<DNSQuestion> questions = query.getQuestions();
        if (questions.size() != 1) {
            String msg = MessageFormat.format(L10N.getString("err.question_count"), questions.size());
            throw new IllegalArgumentException(msg);
        }
        QueryKey key = QueryKey.of(questions.get(0));

        DNSMessage cached = cache.get(key);
        if (cached != null) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("debug.cache_hit"), key);
                LOGGER.fine(msg);
            }
            return cached.withId(query.getId());
        }

        Routing routing = classifier.classify(key.getName());
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.routing"), key, routing);
            LOGGER.fine(msg);
        }
        DNSMessage upstreamQuery = query.withId(nextQueryId(query.getId()));
        CandidateAnswer accepted;
        try {
            switch (routing) {
                case FORCED_LOCAL:
                    accepted = first(localGroup, upstreamQuery, key);
                    break;
                case FORCED_REMOTE:
                    accepted = first(remoteGroup, upstreamQuery, key);
                    break;
                default:
                    accepted = arbitrate(upstreamQuery, key);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            String msg = MessageFormat.format(L10N.getString("err.interrupted"), key);
            throw new ResolutionException(msg, e);
        }

        DNSMessage response = accepted.getResponse();
        int ttl = response.getMinimumTTL();
        if (response.isSuccess() && ttl > 0) {
            cache.put(key, response, ttl);
        }
        return response.withId(query.getId());
    }

    /**
     * Returns a random message ID for upstream queries that differs from
     * the client's.
     */
    static int nextQueryId(int clientId) {
        int id;
        do {
            id = RANDOM.nextInt(0x10000);
        } while (id == clientId);
        return id;
    }

    /**
     * Returns whether a response is a definite answer for its name:
     * NOERROR or NXDOMAIN. Other response codes report a server problem.
     */
    static boolean isDefinite(DNSMessage response) {
        int rcode = response.getRcode();
        return rcode == DNSMessage.RCODE_NOERROR || rcode == DNSMessage.RCODE_NXDOMAIN;
    }

    /**
     * Queries a single group and returns its first definite answer, or
     * failing that its first answer of any kind.
     */
    private CandidateAnswer first(UpstreamGroup group, DNSMessage query, QueryKey key)
            throws ResolutionException, InterruptedException {
        CandidateAnswer fallback = null;
        try (Race race = group.race(query, executor)) {
            CandidateAnswer answer;
            while ((answer = race.next()) != null) {
                if (answer.isError()) {
                    continue;
                }
                if (isDefinite(answer.getResponse())) {
                    logAccepted("debug.accept_forced", key, answer);
                    return answer;
                }
                if (fallback == null) {
                    fallback = answer;
                }
            }
        }
        if (fallback != null) {
            logAccepted("debug.accept_forced", key, fallback);
            return fallback;
        }
        String msg = MessageFormat.format(L10N.getString("err.group_failed"), key, group.getRole());
        throw new ResolutionException(msg);
    }

    /**
     * Races both groups and arbitrates between their answers.
     */
    private CandidateAnswer arbitrate(DNSMessage query, QueryKey key)
            throws ResolutionException, InterruptedException {
        try (Race race = new Race(executor)) {
            race.start(localGroup, query);
            race.start(remoteGroup, query);

            CandidateAnswer firstLocal = null;
            CandidateAnswer firstRemote = null;
            long graceDeadline = 0L;
            while (true) {
                if (firstRemote != null && race.isExhausted(UpstreamRole.LOCAL)) {
                    logAccepted("debug.accept_local_failed", key, firstRemote);
                    return firstRemote;
                }
                if (firstLocal != null && race.isExhausted(UpstreamRole.REMOTE)) {
                    logAccepted("debug.accept_remote_failed", key, firstLocal);
                    return firstLocal;
                }
                if (race.isExhausted(UpstreamRole.LOCAL) && race.isExhausted(UpstreamRole.REMOTE)) {
                    String msg = MessageFormat.format(L10N.getString("err.all_failed"), key);
                    throw new ResolutionException(msg);
                }

                CandidateAnswer answer;
                if (firstRemote == null) {
                    answer = race.next();
                } else {
                    long remaining = graceDeadline - System.nanoTime();
                    if (remaining <= 0L) {
                        logAccepted("debug.accept_grace_elapsed", key, firstRemote);
                        return firstRemote;
                    }
                    if (race.getOutstanding() == 0) {
                        TimeUnit.NANOSECONDS.sleep(remaining);
                        continue;
                    }
                    answer = race.poll(remaining, TimeUnit.NANOSECONDS);
                }
                if (answer == null || answer.isError()) {
                    continue;
                }

                if (answer.getRole() == UpstreamRole.LOCAL) {
                    if (answer.isTrusted()) {
                        logAccepted("debug.accept_trusted", key, answer);
                        return answer;
                    }
                    DNSMessage response = answer.getResponse();
                    ResponseValidator.Verdict verdict = validator.validate(response);
                    if (verdict == ResponseValidator.Verdict.IN_RANGE) {
                        logAccepted("debug.accept_in_range", key, answer);
                        return answer;
                    }
                    if (verdict == ResponseValidator.Verdict.NO_ADDRESS && isDefinite(response)) {
                        logAccepted("debug.accept_no_address", key, answer);
                        return answer;
                    }
                    if (LOGGER.isLoggable(Level.FINE)) {
                        String msgKey = (verdict == ResponseValidator.Verdict.OUT_OF_RANGE)
                                ? "debug.out_of_range" : "debug.not_definite";
                        String msg = MessageFormat.format(L10N.getString(msgKey),
                                key, answer.getUpstream(), answer.getElapsed(), response.getRcode());
                        LOGGER.fine(msg);
                    }
                    if (firstLocal == null) {
                        firstLocal = answer;
                    }
                } else if (firstRemote == null) {
                    firstRemote = answer;
                    graceDeadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(graceMillis);
                }
            }
        }
    }

    private void logAccepted(String key, QueryKey query, CandidateAnswer answer) {
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString(key),
                    query, answer.getRole(), answer.getUpstream(), answer.getElapsed());
            LOGGER.fine(msg);
        }
    }

}
