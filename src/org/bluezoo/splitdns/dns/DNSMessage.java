/*
 * DNSMessage.java
 * Copyright (C) 2025, 2026 Chris Burdess
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

package org.bluezoo.splitdns.dns;

import java.io.ByteArrayOutputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;

/**
 * A DNS protocol message.
 *
 * <p>DNS messages are used for both queries and responses. The message
 * consists of a header followed by question, answer, authority, and
 * additional sections. Messages are immutable; the dispatcher forwards
 * the client's query to upstreams as-is and hands the chosen upstream
 * response back with only its ID rewritten.
 *
 * <p>See RFC 1035 for the DNS protocol specification.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DNSMessage {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.splitdns.dns.L10N");

    // -- Header flags --

    /** Query/Response flag: 0 = query, 1 = response */
    public static final int FLAG_QR = 0x8000;

    /** Authoritative Answer flag */
    public static final int FLAG_AA = 0x0400;

    /** Truncation flag */
    public static final int FLAG_TC = 0x0200;

    /** Recursion Desired flag */
    public static final int FLAG_RD = 0x0100;

    /** Recursion Available flag */
    public static final int FLAG_RA = 0x0080;

    // -- OPCODE values (bits 11-14) --

    /** Standard query */
    public static final int OPCODE_QUERY = 0;

    // -- RCODE values (bits 0-3 of flags) --

    /** No error */
    public static final int RCODE_NOERROR = 0;

    /** Format error */
    public static final int RCODE_FORMERR = 1;

    /** Server failure */
    public static final int RCODE_SERVFAIL = 2;

    /** Non-existent domain */
    public static final int RCODE_NXDOMAIN = 3;

    /** Not implemented */
    public static final int RCODE_NOTIMP = 4;

    /** Query refused */
    public static final int RCODE_REFUSED = 5;

    /** Largest UDP message a client accepts without EDNS0. */
    public static final int DEFAULT_UDP_PAYLOAD_SIZE = 512;

    static final int HEADER_SIZE = 12;
    private static final int COMPRESSION_MASK = 0xC0;
    private static final int COMPRESSION_POINTER = 0xC0;
    private static final int MAX_POINTERS = 16;

    private final int id;
    private final int flags;
    private final List<DNSQuestion> questions;
    private final List<DNSResourceRecord> answers;
    private final List<DNSResourceRecord> authorities;
    private final List<DNSResourceRecord> additionals;

    /**
     * Creates a new DNS message.
     *
     * @param id the message ID
     * @param flags the header flags
     * @param questions the question section
     * @param answers the answer section
     * @param authorities the authority section
     * @param additionals the additional section
     */
    public DNSMessage(int id, int flags,
                      List<DNSQuestion> questions,
                      List<DNSResourceRecord> answers,
                      List<DNSResourceRecord> authorities,
                      List<DNSResourceRecord> additionals) {
        this.id = id & 0xFFFF;
        this.flags = flags & 0xFFFF;
        this.questions = Collections.unmodifiableList(new ArrayList<>(questions));
        this.answers = Collections.unmodifiableList(new ArrayList<>(answers));
        this.authorities = Collections.unmodifiableList(new ArrayList<>(authorities));
        this.additionals = Collections.unmodifiableList(new ArrayList<>(additionals));
    }

    /**
     * Returns the message ID.
     *
     * @return the message ID (0-65535)
     */
    public int getId() {
        return id;
    }

    /**
     * Returns the header flags.
     *
     * @return the flags
     */
    public int getFlags() {
        return flags;
    }

    /**
     * Returns true if this is a response message.
     *
     * @return true if response, false if query
     */
    public boolean isResponse() {
        return (flags & FLAG_QR) != 0;
    }

    /**
     * Returns true if this is a query message.
     *
     * @return true if query, false if response
     */
    public boolean isQuery() {
        return (flags & FLAG_QR) == 0;
    }

    /**
     * Returns the OPCODE.
     *
     * @return the opcode (0-15)
     */
    public int getOpcode() {
        return (flags >> 11) & 0x0F;
    }

    /**
     * Returns true if the message was truncated.
     *
     * @return true if truncated
     */
    public boolean isTruncated() {
        return (flags & FLAG_TC) != 0;
    }

    /**
     * Returns true if Recursion Desired is set.
     *
     * @return true if recursion is desired
     */
    public boolean isRecursionDesired() {
        return (flags & FLAG_RD) != 0;
    }

    /**
     * Returns true if Recursion Available is set.
     *
     * @return true if recursion is available
     */
    public boolean isRecursionAvailable() {
        return (flags & FLAG_RA) != 0;
    }

    /**
     * Returns the RCODE (response code).
     *
     * @return the response code (0-15)
     */
    public int getRcode() {
        return flags & 0x0F;
    }

    /**
     * Returns true if the response code indicates success.
     *
     * @return true if RCODE is NOERROR
     */
    public boolean isSuccess() {
        return getRcode() == RCODE_NOERROR;
    }

    /**
     * Returns the question section.
     *
     * @return unmodifiable list of questions
     */
    public List<DNSQuestion> getQuestions() {
        return questions;
    }

    /**
     * Returns the answer section.
     *
     * @return unmodifiable list of answers
     */
    public List<DNSResourceRecord> getAnswers() {
        return answers;
    }

    /**
     * Returns the authority section.
     *
     * @return unmodifiable list of authority records
     */
    public List<DNSResourceRecord> getAuthorities() {
        return authorities;
    }

    /**
     * Returns the additional section.
     *
     * @return unmodifiable list of additional records
     */
    public List<DNSResourceRecord> getAdditionals() {
        return additionals;
    }

    /**
     * Returns the A and AAAA records of the answer section.
     *
     * @return the address records, possibly empty
     */
    public List<DNSResourceRecord> getAddressRecords() {
        List<DNSResourceRecord> addresses = new ArrayList<>();
        for (DNSResourceRecord rr : answers) {
            if (rr.isAddress()) {
                addresses.add(rr);
            }
        }
        return addresses;
    }

    /**
     * Returns the smallest TTL among the answer records, ignoring any
     * OPT pseudo-record. TTLs with the high bit set are treated as zero
     * (RFC 2181 section 8).
     *
     * @return the minimum answer TTL in seconds, or 0 if there are no answers
     */
    public int getMinimumTTL() {
        int min = -1;
        for (DNSResourceRecord rr : answers) {
            if (rr.getTypeValue() == DNSType.OPT.getValue()) {
                continue;
            }
            int ttl = Math.max(0, rr.getTTL());
            if (min < 0 || ttl < min) {
                min = ttl;
            }
        }
        return Math.max(0, min);
    }

    /**
     * Returns the UDP payload size the sender of this message accepts,
     * as advertised by an EDNS0 OPT record.
     *
     * @return the payload size, at least {@link #DEFAULT_UDP_PAYLOAD_SIZE}
     */
    public int getUDPPayloadSize() {
        for (DNSResourceRecord rr : additionals) {
            if (rr.getTypeValue() == DNSType.OPT.getValue()) {
                return Math.max(DEFAULT_UDP_PAYLOAD_SIZE, rr.getClassValue());
            }
        }
        return DEFAULT_UDP_PAYLOAD_SIZE;
    }

    // -- Parsing --

    /**
     * Parses a DNS message from a byte buffer. Parsing starts at the
     * buffer's current position, which is treated as offset zero for
     * compression pointers.
     *
     * @param data the buffer containing the DNS message
     * @return the parsed message
     * @throws DNSFormatException if the message is malformed
     */
    public static DNSMessage parse(ByteBuffer data) throws DNSFormatException {
        if (data.remaining() < HEADER_SIZE) {
            throw new DNSFormatException(L10N.getString("err.short_header"));
        }
        ByteBuffer message = data.slice();
        ByteBuffer original = message.duplicate();
        try {
            int id = message.getShort() & 0xFFFF;
            int flags = message.getShort() & 0xFFFF;
            int qdCount = message.getShort() & 0xFFFF;
            int anCount = message.getShort() & 0xFFFF;
            int nsCount = message.getShort() & 0xFFFF;
            int arCount = message.getShort() & 0xFFFF;

            List<DNSQuestion> questions = new ArrayList<>(qdCount);
            for (int i = 0; i < qdCount; i++) {
                questions.add(parseQuestion(message, original));
            }
            List<DNSResourceRecord> answers = parseSection(message, original, anCount);
            List<DNSResourceRecord> authorities = parseSection(message, original, nsCount);
            List<DNSResourceRecord> additionals = parseSection(message, original, arCount);

            data.position(data.position() + message.position());
            return new DNSMessage(id, flags, questions, answers, authorities, additionals);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new DNSFormatException(L10N.getString("err.truncated_record"), e);
        }
    }

    /**
     * Parses a DNS message from a byte array.
     *
     * @param data the message bytes
     * @param offset the start of the message
     * @param length the length of the message
     * @return the parsed message
     * @throws DNSFormatException if the message is malformed
     */
    public static DNSMessage parse(byte[] data, int offset, int length) throws DNSFormatException {
        return parse(ByteBuffer.wrap(data, offset, length));
    }

    private static List<DNSResourceRecord> parseSection(ByteBuffer data, ByteBuffer original, int count)
            throws DNSFormatException {
        List<DNSResourceRecord> records = new ArrayList<>(Math.min(count, 64));
        for (int i = 0; i < count; i++) {
            records.add(parseResourceRecord(data, original));
        }
        return records;
    }

    private static DNSQuestion parseQuestion(ByteBuffer data, ByteBuffer original) throws DNSFormatException {
        String name = decodeName(data, original);
        if (data.remaining() < 4) {
            throw new DNSFormatException(L10N.getString("err.truncated_question"));
        }
        int type = data.getShort() & 0xFFFF;
        int dnsClass = data.getShort() & 0xFFFF;
        return new DNSQuestion(name, type, dnsClass);
    }

    private static DNSResourceRecord parseResourceRecord(ByteBuffer data, ByteBuffer original)
            throws DNSFormatException {
        String name = decodeName(data, original);
        if (data.remaining() < 10) {
            throw new DNSFormatException(L10N.getString("err.truncated_record"));
        }
        int type = data.getShort() & 0xFFFF;
        int dnsClass = data.getShort() & 0xFFFF;
        int ttl = data.getInt();
        int rdLength = data.getShort() & 0xFFFF;

        if (data.remaining() < rdLength) {
            throw new DNSFormatException(L10N.getString("err.truncated_rdata"));
        }
        int rdStart = data.position();
        byte[] rdata = expandRData(type, original, rdStart, rdLength);
        data.position(rdStart + rdLength);

        return new DNSResourceRecord(name, type, dnsClass, ttl, rdata);
    }

    /**
     * Returns the RDATA of a record with any compressed domain names
     * rewritten in uncompressed form, so that the record no longer
     * refers to offsets in the message it came from.
     */
    private static byte[] expandRData(int type, ByteBuffer original, int start, int length)
            throws DNSFormatException {
        ByteBuffer rd = original.duplicate();
        rd.limit(start + length);
        rd.position(start);
        DNSType known = DNSType.fromValue(type);
        if (known == null) {
            return remaining(rd);
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(length + 16);
        switch (known) {
            case CNAME:
            case NS:
            case PTR:
                writeBytes(out, encodeName(decodeName(rd, original)));
                break;
            case MX:
                writeBytes(out, fixed(rd, 2));
                writeBytes(out, encodeName(decodeName(rd, original)));
                break;
            case SRV:
                writeBytes(out, fixed(rd, 6));
                writeBytes(out, encodeName(decodeName(rd, original)));
                break;
            case SOA:
                writeBytes(out, encodeName(decodeName(rd, original)));
                writeBytes(out, encodeName(decodeName(rd, original)));
                writeBytes(out, fixed(rd, 20));
                break;
            default:
                return remaining(rd);
        }
        return out.toByteArray();
    }

    private static byte[] fixed(ByteBuffer rd, int length) throws DNSFormatException {
        if (rd.remaining() < length) {
            throw new DNSFormatException(L10N.getString("err.truncated_rdata"));
        }
        byte[] bytes = new byte[length];
        rd.get(bytes);
        return bytes;
    }

    private static byte[] remaining(ByteBuffer rd) {
        byte[] bytes = new byte[rd.remaining()];
        rd.get(bytes);
        return bytes;
    }

    private static void writeBytes(ByteArrayOutputStream out, byte[] bytes) {
        out.write(bytes, 0, bytes.length);
    }

    /**
     * Decodes a DNS name from the buffer, following compression
     * pointers into the original message.
     *
     * @param data the current read position
     * @param original the whole message, positioned anywhere, for pointer resolution
     * @return the decoded domain name, without a trailing dot
     * @throws DNSFormatException if the name is truncated or a pointer is invalid
     */
    static String decodeName(ByteBuffer data, ByteBuffer original) throws DNSFormatException {
        StringBuilder name = new StringBuilder();
        ByteBuffer cursor = data;
        int jumps = 0;

        while (true) {
            if (!cursor.hasRemaining()) {
                throw new DNSFormatException(L10N.getString("err.truncated_name"));
            }
            int len = cursor.get() & 0xFF;
            if (len == 0) {
                break;
            }
            if ((len & COMPRESSION_MASK) == COMPRESSION_POINTER) {
                if (!cursor.hasRemaining()) {
                    throw new DNSFormatException(L10N.getString("err.truncated_name"));
                }
                int offset = ((len & 0x3F) << 8) | (cursor.get() & 0xFF);
                if (++jumps > MAX_POINTERS) {
                    throw new DNSFormatException(L10N.getString("err.pointer_loop"));
                }
                if (offset >= original.limit()) {
                    String msg = MessageFormat.format(L10N.getString("err.bad_pointer"), offset);
                    throw new DNSFormatException(msg);
                }
                ByteBuffer pointer = original.duplicate();
                pointer.position(offset);
                cursor = pointer;
                continue;
            }
            if ((len & COMPRESSION_MASK) != 0) {
                String msg = MessageFormat.format(L10N.getString("err.bad_label"), len);
                throw new DNSFormatException(msg);
            }
            if (cursor.remaining() < len) {
                throw new DNSFormatException(L10N.getString("err.truncated_name"));
            }
            byte[] label = new byte[len];
            cursor.get(label);
            if (name.length() > 0) {
                name.append('.');
            }
            name.append(new String(label, StandardCharsets.US_ASCII));
        }

        return name.toString();
    }

    /**
     * Encodes a domain name to uncompressed DNS wire format.
     *
     * @param name the domain name, with or without a trailing dot
     * @return the encoded bytes
     * @throws IllegalArgumentException if a label is longer than 63 bytes
     */
    static byte[] encodeName(String name) {
        if (name == null || name.isEmpty() || ".".equals(name)) {
            return new byte[] { 0 };
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(name.length() + 2);
        int start = 0;
        int len = name.length();
        while (start < len) {
            int dotIndex = name.indexOf('.', start);
            String label;
            if (dotIndex < 0) {
                label = name.substring(start);
                start = len;
            } else {
                label = name.substring(start, dotIndex);
                start = dotIndex + 1;
            }
            if (label.isEmpty()) {
                continue;
            }
            byte[] bytes = label.getBytes(StandardCharsets.US_ASCII);
            if (bytes.length > 63) {
                String msg = MessageFormat.format(L10N.getString("err.label_too_long"), label);
                throw new IllegalArgumentException(msg);
            }
            out.write(bytes.length);
            out.write(bytes, 0, bytes.length);
        }
        out.write(0);
        return out.toByteArray();
    }

    // -- Serialization --

    /**
     * Serializes this message to a byte buffer ready for reading.
     *
     * @return the serialized message
     */
    public ByteBuffer serialize() {
        return ByteBuffer.wrap(toByteArray());
    }

    /**
     * Serializes this message to a byte array. Names are written
     * uncompressed.
     *
     * @return the wire form of this message
     */
    public byte[] toByteArray() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(DEFAULT_UDP_PAYLOAD_SIZE);

        writeShort(out, id);
        writeShort(out, flags);
        writeShort(out, questions.size());
        writeShort(out, answers.size());
        writeShort(out, authorities.size());
        writeShort(out, additionals.size());

        for (DNSQuestion q : questions) {
            writeBytes(out, encodeName(q.getName()));
            writeShort(out, q.getTypeValue());
            writeShort(out, q.getClassValue());
        }
        for (DNSResourceRecord rr : answers) {
            writeResourceRecord(out, rr);
        }
        for (DNSResourceRecord rr : authorities) {
            writeResourceRecord(out, rr);
        }
        for (DNSResourceRecord rr : additionals) {
            writeResourceRecord(out, rr);
        }
        return out.toByteArray();
    }

    private static void writeShort(ByteArrayOutputStream out, int value) {
        out.write((value >> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write((value >> 24) & 0xFF);
        out.write((value >> 16) & 0xFF);
        out.write((value >> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    private static void writeResourceRecord(ByteArrayOutputStream out, DNSResourceRecord rr) {
        writeBytes(out, encodeName(rr.getName()));
        writeShort(out, rr.getTypeValue());
        writeShort(out, rr.getClassValue());
        writeInt(out, rr.getTTL());
        byte[] rdata = rr.rdata();
        writeShort(out, rdata.length);
        out.write(rdata, 0, rdata.length);
    }

    // -- Derived messages --

    /**
     * Returns a copy of this message carrying a different ID.
     *
     * @param newId the message ID to use
     * @return this message if the ID already matches, otherwise a copy
     */
    public DNSMessage withId(int newId) {
        if ((newId & 0xFFFF) == id) {
            return this;
        }
        return new DNSMessage(newId, flags, questions, answers, authorities, additionals);
    }

    /**
     * Returns a truncated form of this response for UDP delivery: the TC
     * flag is set and only the question section and any OPT record are
     * kept, telling the client to retry over TCP.
     *
     * @return the truncated response
     */
    public DNSMessage truncate() {
        List<DNSResourceRecord> opt = new ArrayList<>(1);
        for (DNSResourceRecord rr : additionals) {
            if (rr.getTypeValue() == DNSType.OPT.getValue()) {
                opt.add(rr);
            }
        }
        List<DNSResourceRecord> emptyList = Collections.emptyList();
        return new DNSMessage(id, flags | FLAG_TC, questions, emptyList, emptyList, opt);
    }

    /**
     * Creates a response message for this query.
     *
     * @param answers the answer records
     * @return the response message
     */
    public DNSMessage createResponse(List<DNSResourceRecord> answers) {
        List<DNSResourceRecord> emptyList = Collections.emptyList();
        int responseFlags = FLAG_QR | FLAG_RA | (flags & FLAG_RD);
        return new DNSMessage(id, responseFlags, questions, answers, emptyList, emptyList);
    }

    /**
     * Creates an error response for this query.
     *
     * @param rcode the response code (e.g., RCODE_SERVFAIL)
     * @return the error response message
     */
    public DNSMessage createErrorResponse(int rcode) {
        int responseFlags = FLAG_QR | FLAG_RA | (flags & FLAG_RD) | (rcode & 0x0F);
        List<DNSResourceRecord> emptyList = Collections.emptyList();
        return new DNSMessage(id, responseFlags, questions, emptyList, emptyList, emptyList);
    }

    /**
     * Creates a new recursive query message.
     *
     * @param id the message ID
     * @param name the domain name to query
     * @param type the record type
     * @return the query message
     */
    public static DNSMessage createQuery(int id, String name, DNSType type) {
        DNSQuestion question = new DNSQuestion(name, type, DNSClass.IN);
        List<DNSQuestion> questions = Collections.singletonList(question);
        List<DNSResourceRecord> emptyList = Collections.emptyList();
        return new DNSMessage(id, FLAG_RD, questions, emptyList, emptyList, emptyList);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("DNSMessage{id=");
        sb.append(id);
        sb.append(", ");
        sb.append(isQuery() ? "QUERY" : "RESPONSE");
        if (isResponse()) {
            sb.append(", rcode=");
            sb.append(getRcode());
        }
        if (!questions.isEmpty()) {
            sb.append(", question=");
            sb.append(questions.get(0));
        }
        if (isTruncated()) {
            sb.append(", TC");
        }
        sb.append(", answers=");
        sb.append(answers.size());
        sb.append(", authorities=");
        sb.append(authorities.size());
        sb.append(", additionals=");
        sb.append(additionals.size());
        sb.append("}");
        return sb.toString();
    }

}
