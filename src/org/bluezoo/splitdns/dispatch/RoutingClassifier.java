/*
 * RoutingClassifier.java
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

import org.bluezoo.splitdns.matcher.DomainMatcher;

/**
 * Classifies query names by the configured local and remote domain
 * lists. A name on both lists is routed locally.
 *
 * <p>Classification depends only on the name and the two matchers.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RoutingClassifier {

    private final DomainMatcher localDomains;
    private final DomainMatcher remoteDomains;

    /**
     * Creates a classifier.
     *
     * @param localDomains names forced to the local group, or null for none
     * @param remoteDomains names forced to the remote group, or null for none
     */
    public RoutingClassifier(DomainMatcher localDomains, DomainMatcher remoteDomains) {
        this.localDomains = localDomains;
        this.remoteDomains = remoteDomains;
    }

    /**
     * Classifies a query name.
     *
     * @param name the query name
     * @return the routing for the name
     */
    public Routing classify(String name) {
        if (localDomains != null && localDomains.matches(name)) {
            return Routing.FORCED_LOCAL;
        }
        if (remoteDomains != null && remoteDomains.matches(name)) {
            return Routing.FORCED_REMOTE;
        }
        return Routing.RACE;
    }

}
