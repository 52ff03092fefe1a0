/*
 * DNSType.java
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

/**
 * DNS resource record types known to splitdns.
 *
 * <p>Only the address types ({@link #A} and {@link #AAAA}) carry meaning
 * for dispatching; the others are listed so that log output and RDATA
 * name expansion can refer to them. Records of any other type are still
 * carried through by numeric value.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DNSType {

    /** IPv4 address record. */
    A(1),

    /** Authoritative name server. */
    NS(2),

    /** Canonical name (alias). */
    CNAME(5),

    /** Start of authority. */
    SOA(6),

    /** Domain name pointer (reverse DNS). */
    PTR(12),

    /** Mail exchange. */
    MX(15),

    /** Text record. */
    TXT(16),

    /** IPv6 address record. */
    AAAA(28),

    /** Service locator. */
    SRV(33),

    /** Option (EDNS). */
    OPT(41),

    /** Service binding. */
    SVCB(64),

    /** HTTPS service binding. */
    HTTPS(65),

    /** All records (query only). */
    ANY(255);

    private final int value;

    DNSType(int value) {
        this.value = value;
    }

    /**
     * Returns the numeric value of this type.
     *
     * @return the type value
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns true if records of this type carry an IP address.
     *
     * @return true for A and AAAA
     */
    public boolean isAddress() {
        return this == A || this == AAAA;
    }

    /**
     * Returns the DNSType for the given numeric value.
     *
     * @param value the type value
     * @return the DNSType, or null if unknown
     */
    public static DNSType fromValue(int value) {
        for (DNSType type : values()) {
            if (type.value == value) {
                return type;
            }
        }
        return null;
    }

    /**
     * Returns a printable mnemonic for a numeric type value,
     * using the RFC 3597 {@code TYPEnnn} form for unknown types.
     *
     * @param value the type value
     * @return the mnemonic
     */
    public static String toString(int value) {
        DNSType type = fromValue(value);
        return (type != null) ? type.name() : "TYPE" + value;
    }

}
