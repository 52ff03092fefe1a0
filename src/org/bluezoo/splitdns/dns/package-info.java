/*
 * package-info.java
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

/**
 * DNS message model and RFC 1035 wire codec.
 *
 * <p>The dispatcher only needs to look inside a response far enough to
 * find its address records, its response code and the smallest TTL of
 * its answers; everything else is carried through untouched. To make
 * that possible, record types and classes are kept as numeric values,
 * and compressed names inside the RDATA of well-known types are expanded
 * when a message is parsed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see org.bluezoo.splitdns.dns.DNSMessage
 */
package org.bluezoo.splitdns.dns;
