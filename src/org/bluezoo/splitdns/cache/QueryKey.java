/*
 * QueryKey.java
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

package org.bluezoo.splitdns.cache;

import java.util.Locale;

import org.bluezoo.splitdns.dns.DNSClass;
import org.bluezoo.splitdns.dns.DNSQuestion;
import org.bluezoo.splitdns.dns.DNSType;

/**
 * Identity of a query for caching: the normalized name together with the
 * record type and class. Two questions differing only in letter case or
 * in a trailing dot produce equal keys.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class QueryKey {

    private final String name;
    private final int type;
    private final int dnsClass;

    /**
     * Creates a key.
     *
     * @param name the query name
     * @param type the record type value
     * @param dnsClass the record class value
     */
    public QueryKey(String name, int type, int dnsClass) {
        this.name = normalize(name);
        this.type = type;
        this.dnsClass = dnsClass;
    }

    /**
     * Returns the key for a question.
     *
     * @param question the question
     * @return the key
     */
    public static QueryKey of(DNSQuestion question) {
        return new QueryKey(question.getName(), question.getTypeValue(), question.getClassValue());
    }

    /**
     * Lower-cases a domain name and strips any trailing dot.
     *
     * @param name the name
     * @return the normalized name
     */
    public static String normalize(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        if (n.endsWith(".")) {
            n = n.substring(0, n.length() - 1);
        }
        return n;
    }

    public String getName() {
        return name;
    }

    public int getType() {
        return type;
    }

    public int getDNSClass() {
        return dnsClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryKey)) {
            return false;
        }
        QueryKey other = (QueryKey) o;
        return type == other.type && dnsClass == other.dnsClass && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        int result = name.hashCode();
        result = 31 * result + type;
        result = 31 * result + dnsClass;
        return result;
    }

    @Override
    public String toString() {
        return name + " " + DNSType.toString(type) + " " + DNSClass.toString(dnsClass);
    }

}
