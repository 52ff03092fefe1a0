/*
 * ResponseValidatorTest.java
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

import org.bluezoo.splitdns.dns.DNSMessage;
import org.bluezoo.splitdns.dns.DNSResourceRecord;
import org.bluezoo.splitdns.dns.DNSType;
import org.bluezoo.splitdns.matcher.NetList;
import org.junit.Before;
import org.junit.Test;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link ResponseValidator}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ResponseValidatorTest {

    private ResponseValidator validator;
    private DNSMessage query;

    @Before
    public void setUp() {
        NetList range = new NetList();
        range.add("10.0.0.0/8");
        range.add("2001:db8::/32");
        range.sort();
        validator = new ResponseValidator(range);
        query = DNSMessage.createQuery(1, "example.com", DNSType.A);
    }

    @Test
    public void testInRange() throws Exception {
        List<DNSResourceRecord> answers = new ArrayList<>();
        answers.add(DNSResourceRecord.a("example.com", 60, InetAddress.getByName("1.2.3.4")));
        answers.add(DNSResourceRecord.a("example.com", 60, InetAddress.getByName("10.2.3.4")));

        DNSMessage response = query.createResponse(answers);

        assertEquals(ResponseValidator.Verdict.IN_RANGE, validator.validate(response));
        assertTrue(validator.isTrustedByRange(response));
    }

    @Test
    public void testIPv6InRange() throws Exception {
        DNSMessage response = query.createResponse(Collections.singletonList(
                DNSResourceRecord.aaaa("example.com", 60, InetAddress.getByName("2001:db8::1"))));

        assertEquals(ResponseValidator.Verdict.IN_RANGE, validator.validate(response));
    }

    @Test
    public void testOutOfRange() throws Exception {
        DNSMessage response = query.createResponse(Collections.singletonList(
                DNSResourceRecord.a("example.com", 60, InetAddress.getByName("1.2.3.4"))));

        assertEquals(ResponseValidator.Verdict.OUT_OF_RANGE, validator.validate(response));
        assertFalse(validator.isTrustedByRange(response));
    }

    @Test
    public void testNoAddressRecords() {
        DNSMessage cnameOnly = query.createResponse(Collections.singletonList(
                DNSResourceRecord.cname("example.com", 60, "alias.example.net")));
        DNSMessage nxdomain = query.createErrorResponse(DNSMessage.RCODE_NXDOMAIN);

        assertEquals(ResponseValidator.Verdict.NO_ADDRESS, validator.validate(cnameOnly));
        assertEquals(ResponseValidator.Verdict.NO_ADDRESS, validator.validate(nxdomain));
        assertFalse(validator.isTrustedByRange(cnameOnly));
    }

}
