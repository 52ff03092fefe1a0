/*
 * QueryProcessor.java
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

package org.bluezoo.splitdns.server;

import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.dispatch.QueryHandler;
import org.bluezoo.splitdns.dispatch.ResolutionException;
import org.bluezoo.splitdns.dns.DNSFormatException;
import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSQuestion;
import org.bluezoo.splitdns.dns.DNSResourceRecord;

/**
 * Turns inbound DNS messages into responses, independent of the
 * transport they arrived on.
 *
 * <p>Responses are dropped. Queries with an opcode other than QUERY are
 * answered with NOTIMP, and queries without exactly one question with
 * FORMERR. All other queries are passed to the {@link QueryHandler}; a
 * query it cannot resolve is answered with SERVFAIL.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class QueryProcessor {

    private static final Logger LOGGER = Logger.getLogger(QueryProcessor.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.splitdns.server.L10N");

    private static final int HEADER_SIZE = 12;
    private static final int OPCODE_MASK = 0x7800;

    private final QueryHandler handler;

    /**
     * Creates a processor.
     *
     * @param handler the handler resolving queries
     */
    public QueryProcessor(QueryHandler handler) {
        this.handler = handler;
    }

    /**
     * Processes a raw inbound message.
     *
     * @param data the buffer holding the message
     * @param offset the offset of the message in the buffer
     * @param length the length of the message
     * @param source the client address, for logging
     * @return the response, or null if the message should be dropped
     */
    public DNSMessage process(byte[] data, int offset, int length, SocketAddress source) {
        DNSMessage query;
        try {
            query = DNSMessage.parse(data, offset, length);
        } catch (DNSFormatException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("err.malformed_query"), source);
                LOGGER.log(Level.FINE, msg, e);
            }
            return formatError(data, offset, length);
        }
        return process(query, source);
    }

    /**
     * Processes a decoded inbound message.
     *
     * @param query the message
     * @param source the client address, for logging
     * @return the response, or null if the message is itself a response
     */
    public DNSMessage process(DNSMessage query, SocketAddress source) {
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.received_query"), query, source);
            LOGGER.fine(msg);
        }
        if (!query.isQuery()) {
            return null;
        }
        if (query.getOpcode() != DNSMessage.OPCODE_QUERY) {
            return query.createErrorResponse(DNSMessage.RCODE_NOTIMP);
        }
        if (query.getQuestions().size() != 1) {
            return query.createErrorResponse(DNSMessage.RCODE_FORMERR);
        }
        try {
            return handler.handle(query);
        } catch (ResolutionException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(e.getMessage());
            }
            return query.createErrorResponse(DNSMessage.RCODE_SERVFAIL);
        } catch (RuntimeException e) {
            String msg = MessageFormat.format(L10N.getString("err.query"), source);
            LOGGER.log(Level.WARNING, msg, e);
            return query.createErrorResponse(DNSMessage.RCODE_SERVFAIL);
        }
    }

    /**
     * Encodes a response for delivery over UDP, truncating it if it is
     * larger than the payload size the query advertised.
     *
     * @param response the response
     * @param query the query being answered, or null if it could not be decoded
     * @return the encoded response
     */
    public static ByteBuffer encodeForUDP(DNSMessage response, DNSMessage query) {
        int limit = (query != null) ? query.getUDPPayloadSize() : DNSMessage.DEFAULT_UDP_PAYLOAD_SIZE;
        ByteBuffer data = response.serialize();
        if (data.remaining() > limit) {
            data = response.truncate().serialize();
        }
        return data;
    }

    /**
     * Builds a FORMERR response to a message that could not be decoded,
     * echoing its ID and opcode.
     *
     * @return the response, or null if not even the header is readable
     */
    static DNSMessage formatError(byte[] data, int offset, int length) {
        if (length < HEADER_SIZE) {
            return null;
        }
        int id = ((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF);
        int flags = ((data[offset + 2] & 0xFF) << 8) | (data[offset + 3] & 0xFF);
        if ((flags & DNSMessage.FLAG_QR) != 0) {
            return null;
        }
        int responseFlags = DNSMessage.FLAG_QR | (flags & (OPCODE_MASK | DNSMessage.FLAG_RD))
                | DNSMessage.RCODE_FORMERR;
        List<DNSQuestion> noQuestions = Collections.emptyList();
        List<DNSResourceRecord> noRecords = Collections.emptyList();
        return new DNSMessage(id, responseFlags, noQuestions, noRecords, noRecords, noRecords);
    }

}
