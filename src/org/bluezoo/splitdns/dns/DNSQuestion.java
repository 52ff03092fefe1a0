/*
 * DNSQuestion.java
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
 * A question in a DNS query.
 *
 * <p>Each question specifies a domain name, record type, and class.
 * Type and class are kept as their numeric wire values so that queries
 * for types splitdns does not know are still forwarded intact.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DNSQuestion {

    private final String name;
    private final int type;
    private final int dnsClass;

    /**
     * Creates a new DNS question.
     *
     * @param name the domain name to query
     * @param type the record type value
     * @param dnsClass the record class value
     */
    public DNSQuestion(String name, int type, int dnsClass) {
        if (name == null) {
            throw new NullPointerException("name");
        }
        this.name = name;
        this.type = type & 0xFFFF;
        this.dnsClass = dnsClass & 0xFFFF;
    }

    /**
     * Creates a new DNS question.
     *
     * @param name the domain name to query
     * @param type the record type
     * @param dnsClass the record class
     */
    public DNSQuestion(String name, DNSType type, DNSClass dnsClass) {
        this(name, type.getValue(), dnsClass.getValue());
    }

    /**
     * Creates a new DNS question with IN class.
     *
     * @param name the domain name to query
     * @param type the record type
     */
    public DNSQuestion(String name, DNSType type) {
        this(name, type, DNSClass.IN);
    }

    /**
     * Returns the domain name being queried, as it appeared on the wire.
     *
     * @return the domain name
     */
    public String getName() {
        return name;
    }

    /**
     * Returns the record type being queried.
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
     * Returns the record class being queried.
     *
     * @return the record class, or null if not a known class
     */
    public DNSClass getDNSClass() {
        return DNSClass.fromValue(dnsClass);
    }

    /**
     * Returns the numeric record class.
     *
     * @return the class value
     */
    public int getClassValue() {
        return dnsClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DNSQuestion)) {
            return false;
        }
        DNSQuestion that = (DNSQuestion) o;
        return name.equalsIgnoreCase(that.name) &&
               type == that.type &&
               dnsClass == that.dnsClass;
    }

    @Override
    public int hashCode() {
        int result = name.toLowerCase().hashCode();
        result = 31 * result + type;
        result = 31 * result + dnsClass;
        return result;
    }

    @Override
    public String toString() {
        return name + " " + DNSClass.toString(dnsClass) + " " + DNSType.toString(type);
    }

}
