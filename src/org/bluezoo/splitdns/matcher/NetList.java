/*
 * NetList.java
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

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.ResourceBundle;

/**
 * A list of IP address ranges supporting fast containment tests.
 *
 * <p>Prefixes are added in any order with {@link #add(String)}; once all
 * are added, {@link #sort()} orders them and merges overlapping or
 * adjacent ranges so that {@link #contains(InetAddress)} is a binary
 * search over sorted, non-overlapping intervals.
 *
 * <p>IPv4 and IPv6 share one 128-bit space: an IPv4 address is stored as
 * its IPv4-mapped IPv6 form ({@code ::ffff:a.b.c.d}), each address being
 * a pair of unsigned 64-bit halves.
 *
 * <p>The list is built once at startup; after {@link #sort()} it is
 * read-only and safe for concurrent lookups.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class NetList implements IPMatcher {

    static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.splitdns.matcher.L10N");

    private static final long IPV4_MAPPED_PREFIX = 0x0000FFFF00000000L;

    private List<Range> pending = new ArrayList<>();
    private long[] startHi;
    private long[] startLo;
    private long[] endHi;
    private long[] endLo;

    /**
     * Adds an address or CIDR prefix, for example {@code 10.0.0.0/8},
     * {@code 192.168.1.1} or {@code 2001:db8::/32}.
     *
     * @param cidr the prefix in text form
     * @throws IllegalArgumentException if the text is not a valid
     *         address literal or prefix
     */
    public void add(String cidr) {
        String text = cidr.trim();
        int slash = text.indexOf('/');
        String addressPart = (slash < 0) ? text : text.substring(0, slash);
        byte[] bytes = parseAddress(addressPart);
        if (bytes == null) {
            String msg = MessageFormat.format(L10N.getString("err.bad_address"), cidr);
            throw new IllegalArgumentException(msg);
        }
        int maxPrefix = bytes.length * 8;
        int prefix = maxPrefix;
        if (slash >= 0) {
            try {
                prefix = Integer.parseInt(text.substring(slash + 1).trim());
            } catch (NumberFormatException e) {
                prefix = -1;
            }
            if (prefix < 0 || prefix > maxPrefix) {
                String msg = MessageFormat.format(L10N.getString("err.bad_prefix"), cidr);
                throw new IllegalArgumentException(msg);
            }
        }
        add(bytes, prefix);
    }

    /**
     * Adds a prefix given as an address and prefix length.
     *
     * @param address the network address
     * @param prefixLength the prefix length in bits for the address family
     */
    public void add(InetAddress address, int prefixLength) {
        add(address.getAddress(), prefixLength);
    }

    private void add(byte[] address, int prefixLength) {
        if (pending == null) {
            throw new IllegalStateException(L10N.getString("err.already_sorted"));
        }
        long hi;
        long lo;
        int prefix;
        if (address.length == 4) {
            hi = 0L;
            lo = IPV4_MAPPED_PREFIX | (toLong(address, 0, 4) & 0xFFFFFFFFL);
            prefix = 96 + prefixLength;
        } else {
            hi = toLong(address, 0, 8);
            lo = toLong(address, 8, 8);
            prefix = prefixLength;
        }
        long hiMask = (prefix >= 64) ? -1L : (prefix == 0 ? 0L : -1L << (64 - prefix));
        long loMask = (prefix <= 64) ? 0L : (prefix == 128 ? -1L : -1L << (128 - prefix));
        pending.add(new Range(hi & hiMask, lo & loMask, hi | ~hiMask, lo | ~loMask));
    }

    /**
     * Sorts and merges the added ranges. Must be called once, after the
     * last {@link #add} and before the first {@link #contains}.
     */
    public void sort() {
        if (pending == null) {
            return;
        }
        List<Range> ranges = pending;
        Collections.sort(ranges, new Comparator<Range>() {
            @Override
            public int compare(Range a, Range b) {
                return compare128(a.startHi, a.startLo, b.startHi, b.startLo);
            }
        });
        List<Range> merged = new ArrayList<>(ranges.size());
        Range current = null;
        for (Range r : ranges) {
            if (current != null && touches(current, r)) {
                if (compare128(r.endHi, r.endLo, current.endHi, current.endLo) > 0) {
                    current = new Range(current.startHi, current.startLo, r.endHi, r.endLo);
                }
            } else {
                if (current != null) {
                    merged.add(current);
                }
                current = r;
            }
        }
        if (current != null) {
            merged.add(current);
        }

        int n = merged.size();
        startHi = new long[n];
        startLo = new long[n];
        endHi = new long[n];
        endLo = new long[n];
        for (int i = 0; i < n; i++) {
            Range r = merged.get(i);
            startHi[i] = r.startHi;
            startLo[i] = r.startLo;
            endHi[i] = r.endHi;
            endLo[i] = r.endLo;
        }
        pending = null;
    }

    @Override
    public boolean contains(InetAddress address) {
        if (pending != null) {
            throw new IllegalStateException(L10N.getString("err.not_sorted"));
        }
        byte[] bytes = address.getAddress();
        long hi;
        long lo;
        if (address instanceof Inet4Address) {
            hi = 0L;
            lo = IPV4_MAPPED_PREFIX | (toLong(bytes, 0, 4) & 0xFFFFFFFFL);
        } else {
            hi = toLong(bytes, 0, 8);
            lo = toLong(bytes, 8, 8);
        }
        // last range starting at or before the address
        int low = 0;
        int high = startHi.length - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (compare128(startHi[mid], startLo[mid], hi, lo) <= 0) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found >= 0 && compare128(hi, lo, endHi[found], endLo[found]) <= 0;
    }

    /**
     * Returns the number of ranges: as added before {@link #sort()},
     * after merging once sorted.
     *
     * @return the range count
     */
    public int size() {
        return (pending != null) ? pending.size() : startHi.length;
    }

    private static boolean touches(Range current, Range next) {
        if (compare128(next.startHi, next.startLo, current.endHi, current.endLo) <= 0) {
            return true;
        }
        // adjacent: next.start == current.end + 1
        long lo = current.endLo + 1;
        long hi = (lo == 0L) ? current.endHi + 1 : current.endHi;
        return next.startHi == hi && next.startLo == lo;
    }

    static int compare128(long aHi, long aLo, long bHi, long bLo) {
        int c = Long.compareUnsigned(aHi, bHi);
        return (c != 0) ? c : Long.compareUnsigned(aLo, bLo);
    }

    private static long toLong(byte[] bytes, int offset, int length) {
        long value = 0L;
        for (int i = 0; i < length; i++) {
            value = (value << 8) | (bytes[offset + i] & 0xFFL);
        }
        return value;
    }

    /**
     * Parses an address literal without ever consulting the resolver.
     */
    static byte[] parseAddress(String addr) {
        if (addr.indexOf(':') >= 0) {
            try {
                return InetAddress.getByName(addr).getAddress();
            } catch (UnknownHostException e) {
                return null;
            }
        }
        String[] parts = addr.split("\\.", -1);
        if (parts.length != 4) {
            return null;
        }
        byte[] bytes = new byte[4];
        for (int i = 0; i < 4; i++) {
            try {
                int val = Integer.parseInt(parts[i]);
                if (val < 0 || val > 255) {
                    return null;
                }
                bytes[i] = (byte) val;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return bytes;
    }

    private static final class Range {
        final long startHi;
        final long startLo;
        final long endHi;
        final long endLo;

        Range(long startHi, long startLo, long endHi, long endLo) {
            this.startHi = startHi;
            this.startLo = startLo;
            this.endHi = endHi;
            this.endLo = endLo;
        }
    }

}
