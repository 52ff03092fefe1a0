/*
 * Routing.java
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

/**
 * How a query is dispatched to the upstream groups.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum Routing {

    /** Only the local group is queried and its first answer is used as is. */
    FORCED_LOCAL,

    /** Only the remote group is queried. */
    FORCED_REMOTE,

    /** Both groups are queried and their answers arbitrated. */
    RACE;

}
