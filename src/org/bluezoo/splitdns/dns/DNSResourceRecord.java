/*
 * DNSResourceRecord.java
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

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.ResourceBundle;

/**
 * A DNS resource record.
 *
 * <p>Resource records appear in the answer, authority, and additional
 * sections of DNS responses. Type and class are held as raw wire values;
 * any domain names embedded in the RDATA of well-known types have
 * already been expanded from their compressed form by
 * {@link DNSMessage#parse}, so the record can be re-serialized on its own.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DNSResourceRecord {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.splitdns.dns.L10N");

    private final String name;
    private final int type;
    private final int dnsClass;
    private final int ttl;
    private final byte[] rdata;

    /**
     * Creates a new DNS resource record.
     *
     * @param name the owner name
     * @param type the record type value
     * @param dnsClass the record class value
     * @param ttl time to live in seconds
     * @param rdata the record data
     */
    public DNSResourceRecord(String name, int type, int dnsClass, int ttl, byte[] rdata) {
        this.name = name;
        this.type = type & 0xFFFF;
        this.dnsClass = dnsClass & 0xFFFF;
        this.ttl = ttl;
        this.rdata = rdata.clone();
    }

    /**
     * Creates a new DNS resource record.
     *
     * @param name the owner name
     * @param type the record type
     * @param dnsClass the record class
     * @param ttl time to live in seconds
     * @param rdata the record data
     */
    public DNSResourceRecord(String name, DNSType type, DNSClass dnsClass, int ttl, byte[] rdata) {
        this(name, type.getValue(), dnsClass.getValue(), ttl, rdata);
    }

    /**
     * Returns the owner name.
     *
     * @return the domain name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the record type.
     *
     * @return the record type, or null if not a known type
     */
    public DNSType getType() {
        return DNSType.fromValue(type);
    }

    /**
     * Returns the numeric record type.
     *
     * @return the type value
     */
    public int getTypeValue() {
        return type;
    }

    /**
     * Returns the record class.
     *
     * @return the record class, or null if not a known class
     */
    public DNSClass getDNSClass() {
        return DNSClass.fromValue(dnsClass);
    }

    /**
     * Returns the numeric record class. For OPT records this is the
     * advertised UDP payload size.
     *
     * @return the class value
     */
    public int getClassValue() {
        return dnsClass;
    }

    /**
     * Returns the time to live in seconds, as it appeared on the wire.
     *
     * @return the TTL
     */
    public int getTTL() {
        return ttl;
    }

    /**
     * Returns the raw record data.
     *
     * @return a copy of the record data
     */
    public byte[] getRData() {
        return rdata.clone();
    }

    int getRDataLength() {
        return rdata.length;
    }

    byte[] rdata() {
        return rdata;
    }

    /**
     * Returns true if this is an A or AAAA record whose RDATA has the
     * length of an address of that family.
     *
     * @return true if {@link #getAddress()} will succeed
     */
    public boolean isAddress() {
        return (type == DNSType.A.getValue() && rdata.length == 4)
                || (type == DNSType.AAAA.getValue() && rdata.length == 16);
    }

    // -- Convenience factory methods --

    /**
     * Creates an A record (IPv4 address).
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param address the IPv4 address
     * @return the resource record
     */
    public static DNSResourceRecord a(String name, int ttl, InetAddress address) {
        return new DNSResourceRecord(name, DNSType.A, DNSClass.IN, ttl, address.getAddress());
    }

    /**
     * Creates an AAAA record (IPv6 address).
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param address the IPv6 address
     * @return the resource record
     */
    public static DNSResourceRecord aaaa(String name, int ttl, InetAddress address) {
        return new DNSResourceRecord(name, DNSType.AAAA, DNSClass.IN, ttl, address.getAddress());
    }

    /**
     * Creates a CNAME record.
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param canonicalName the canonical name
     * @return the resource record
     */
    public static DNSResourceRecord cname(String name, int ttl, String canonicalName) {
        byte[] encoded = DNSMessage.encodeName(canonicalName);
        return new DNSResourceRecord(name, DNSType.CNAME, DNSClass.IN, ttl, encoded);
    }

    /**
     * Creates a TXT record.
     *
     * @param name the domain name
     * @param ttl time to live in seconds
     * @param text the text content
     * @return the resource record
     */
    public static DNSResourceRecord txt(String name, int ttl, String text) {
        byte[] textBytes = text.getBytes(StandardCharsets.UTF_8);
        // character-strings: length byte + up to 255 bytes each
        ByteBuffer buf = ByteBuffer.allocate(textBytes.length + (textBytes.length / 255) + 1);
        int offset = 0;
        while (offset < textBytes.length) {
            int len = Math.min(255, textBytes.length - offset);
            buf.put((byte) len);
            buf.put(textBytes, offset, len);
            offset += len;
        }
        byte[] rdataBytes = new byte[buf.position()];
        buf.flip();
        buf.get(rdataBytes);
        return new DNSResourceRecord(name, DNSType.TXT, DNSClass.IN, ttl, rdataBytes);
    }

    /**
     * Creates an EDNS0 OPT pseudo-record advertising a UDP payload size.
     *
     * @param udpPayloadSize the largest UDP response the sender accepts
     * @return the resource record
     */
    public static DNSResourceRecord opt(int udpPayloadSize) {
        return new DNSResourceRecord("", DNSType.OPT.getValue(), udpPayloadSize, 0, new byte[0]);
    }

    // -- RDATA interpretation methods --

    /**
     * Interprets the RDATA as an IP address (for A or AAAA records).
     *
     * @return the IP address
     * @throws IllegalStateException if this is not an address record
     */
    public InetAddress getAddress() {
        if (!isAddress()) {
            String msg = MessageFormat.format(L10N.getString("err.not_address_record"),
                    DNSType.toString(type));
            throw new IllegalStateException(msg);
        }
        try {
            return InetAddress.getByAddress(rdata);
        } catch (UnknownHostException e) {
            throw new IllegalStateException(L10N.getString("err.invalid_address_data"), e);
        }
    }

    /**
     * Interprets the RDATA as a domain name (for CNAME, PTR, NS records).
     *
     * @return the domain name
     * @throws IllegalStateException if this is not a name-type record
     */
    public String getTargetName() {
        if (type != DNSType.CNAME.getValue()
                && type != DNSType.PTR.getValue()
                && type != DNSType.NS.getValue()) {
            String msg = MessageFormat.format(L10N.getString("err.not_name_record"),
                    DNSType.toString(type));
            throw new IllegalStateException(msg);
        }
        ByteBuffer buf = ByteBuffer.wrap(rdata);
        try {
            return DNSMessage.decodeName(buf, buf);
        } catch (DNSFormatException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DNSResourceRecord)) {
            return false;
        }
        DNSResourceRecord that = (DNSResourceRecord) o;
        return ttl == that.ttl &&
               name.equalsIgnoreCase(that.name) &&
               type == that.type &&
               dnsClass == that.dnsClass &&
               Arrays.equals(rdata, that.rdata);
    }

    @Override
    public int hashCode() {
        int result = name.toLowerCase().hashCode();
        result = 31 * result + type;
        result = 31 * result + dnsClass;
        result = 31 * result + ttl;
        result = 31 * result + Arrays.hashCode(rdata);
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(name);
        sb.append(" ");
        sb.append(ttl);
        sb.append(" ");
        sb.append(DNSClass.toString(dnsClass));
        sb.append(" ");
        sb.append(DNSType.toString(type));
        if (isAddress()) {
            sb.append(" ");
            sb.append(getAddress().getHostAddress());
        } else if (type == DNSType.CNAME.getValue()
                || type == DNSType.PTR.getValue()
                || type == DNSType.NS.getValue()) {
            sb.append(" ");
            try {
                sb.append(getTargetName());
            } catch (IllegalStateException e) {
                sb.append("[invalid]");
            }
        } else {
            sb.append(" [");
            sb.append(rdata.length);
            sb.append(" bytes]");
        }
        return sb.toString();
    }

}
