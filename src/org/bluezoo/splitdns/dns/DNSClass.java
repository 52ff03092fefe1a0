/*
 * DNSClass.java
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
 * DNS record classes.
 *
 * <p>In practice, only IN (Internet) is commonly used. Note that the
 * class field of an EDNS OPT record holds the sender's UDP payload size
 * rather than a class, which is why records keep the raw value.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DNSClass {

    /** Internet class. */
    IN(1),

    /** Chaos class (historical). */
    CH(3),

    /** Hesiod class (historical). */
    HS(4),

    /** Any class (query only). */
    ANY(255);

    private final int value;

    DNSClass(int value) {
        this.value = value;
    }

    /**
     * Returns the numeric value of this class.
     *
     * @return the class value
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the DNSClass for the given numeric value.
     *
     * @param value the class value
     * @return the DNSClass, or null if unknown
     */
    public static DNSClass fromValue(int value) {
        for (DNSClass cls : values()) {
            if (cls.value == value) {
                return cls;
            }
        }
        return null;
    }

    /**
     * Returns a printable mnemonic for a numeric class value.
     *
     * @param value the class value
     * @return the mnemonic
     */
    public static String toString(int value) {
        DNSClass cls = fromValue(value);
        return (cls != null) ? cls.name() : "CLASS" + value;
    }

}
