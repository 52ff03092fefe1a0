/*
 * ResponseValidator.java
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

import java.util.List;

import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSResourceRecord;
import org.bluezoo.splitdns.matcher.IPMatcher;

/**
 * Checks the addresses in a response against the trusted IP range.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ResponseValidator {

    /**
     * Result of validating a response.
     */
    public enum Verdict {

        /** At least one address record lies in the trusted range. */
        IN_RANGE,

        /** No address record lies in the trusted range. */
        OUT_OF_RANGE,

        /** The response has no address records to validate. */
        NO_ADDRESS;

    }

    private final IPMatcher trustedRange;

    /**
     * Creates a validator.
     *
     * @param trustedRange the trusted address range
     */
    public ResponseValidator(IPMatcher trustedRange) {
        this.trustedRange = trustedRange;
    }

    /**
     * Validates the A and AAAA records in the answer section of a response.
     *
     * @param response the response
     * @return the verdict
     */
    public Verdict validate(DNSMessage response) {
        List<DNSResourceRecord> addresses = response.getAddressRecords();
        if (addresses.isEmpty()) {
            return Verdict.NO_ADDRESS;
        }
        for (DNSResourceRecord rr : addresses) {
            if (trustedRange.contains(rr.getAddress())) {
                return Verdict.IN_RANGE;
            }
        }
        return Verdict.OUT_OF_RANGE;
    }

    /**
     * Returns whether a response has an address in the trusted range.
     *
     * @param response the response
     * @return true if the verdict is {@link Verdict#IN_RANGE}
     */
    public boolean isTrustedByRange(DNSMessage response) {
        return validate(response) == Verdict.IN_RANGE;
    }

}
