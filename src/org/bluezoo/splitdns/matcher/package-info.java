/*
 * package-info.java
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

/**
 * Domain name and IP address matchers used to classify queries and to
 * validate answers.
 *
 * <p>{@link org.bluezoo.splitdns.matcher.DomainSet} decides whether a
 * query name is forced to the local or remote resolvers;
 * {@link org.bluezoo.splitdns.matcher.NetList} decides whether the
 * addresses in a local answer lie inside the trusted range. Both are
 * filled from list files by
 * {@link org.bluezoo.splitdns.matcher.MatcherLoader} at startup.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.splitdns.matcher;
