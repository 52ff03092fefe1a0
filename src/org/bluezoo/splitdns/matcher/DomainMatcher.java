/*
 * DomainMatcher.java
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

/**
 * Decides whether a domain name belongs to a configured set of names.
 *
 * <p>Implementations must be safe for concurrent use once populated.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DomainSet
 */
public interface DomainMatcher {

    /**
     * Returns true if the given name matches this set.
     *
     * @param name a domain name, in any case, with or without a trailing dot
     * @return true if the name matches
     */
    boolean matches(String name);

}
