/*
 * IPMatcher.java
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

package org.bluezoo.splitdns.matcher;

import java.net.InetAddress;

/**
 * Decides whether an address lies inside a configured set of address
 * ranges.
 *
 * <p>Implementations must be safe for concurrent use once populated.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see NetList
 */
public interface IPMatcher {

    /**
     * Returns true if the address lies inside one of the ranges.
     *
     * @param address an IPv4 or IPv6 address
     * @return true if contained
     */
    boolean contains(InetAddress address);

}
