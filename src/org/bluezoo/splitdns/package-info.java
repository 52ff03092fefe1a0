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
 * splitdns, a split-horizon DNS dispatcher.
 *
 * <p>{@link org.bluezoo.splitdns.SplitDNS} is the entry point. It reads a
 * configuration file with {@link org.bluezoo.splitdns.ConfigurationParser}
 * and wires the matchers, upstream groups, answer cache and dispatch
 * engine behind UDP and TCP listeners.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.splitdns;
