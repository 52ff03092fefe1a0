/*
 * DomainSet.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.ResourceBundle;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A set of domain name rules.
 *
 * <p>Each rule is one of:
 * <ul>
 * <li>{@code domain:example.com} &ndash; matches example.com and every
 *     name below it (this is the default when no prefix is given)</li>
 * <li>{@code full:www.example.com} &ndash; matches that name only</li>
 * <li>{@code keyword:ads} &ndash; matches any name containing the text</li>
 * <li>{@code regexp:^ad[0-9]+\.} &ndash; matches any name in which the
 *     regular expression is found</li>
 * </ul>
 *
 * <p>Names are compared in lower case without a trailing dot. Suffix
 * rules are looked up by walking from the full name up through each
 * parent domain, so a lookup costs one hash probe per label.
 *
 * <p>A set is populated once at startup and only read afterwards; it is
 * not safe to add rules while other threads are matching.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DomainSet implements DomainMatcher {

    static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.splitdns.matcher.L10N");

    private static final String PREFIX_DOMAIN = "domain:";
    private static final String PREFIX_FULL = "full:";
    private static final String PREFIX_KEYWORD = "keyword:";
    private static final String PREFIX_REGEXP = "regexp:";

    private final Set<String> suffixes = new HashSet<>();
    private final Set<String> fullNames = new HashSet<>();
    private final List<String> keywords = new ArrayList<>();
    private final List<Pattern> patterns = new ArrayList<>();

    /**
     * Adds a rule to this set.
     *
     * @param rule the rule, optionally carrying a type prefix
     * @throws IllegalArgumentException if the rule is empty, has an
     *         unknown prefix, or is an invalid regular expression
     */
    public void add(String rule) {
        String value = rule.trim();
        if (value.startsWith(PREFIX_FULL)) {
            fullNames.add(normalize(requireValue(rule, value.substring(PREFIX_FULL.length()))));
        } else if (value.startsWith(PREFIX_DOMAIN)) {
            suffixes.add(normalize(requireValue(rule, value.substring(PREFIX_DOMAIN.length()))));
        } else if (value.startsWith(PREFIX_KEYWORD)) {
            String keyword = requireValue(rule, value.substring(PREFIX_KEYWORD.length()));
            keywords.add(keyword.toLowerCase(Locale.ROOT));
        } else if (value.startsWith(PREFIX_REGEXP)) {
            String regexp = requireValue(rule, value.substring(PREFIX_REGEXP.length()));
            try {
                patterns.add(Pattern.compile(regexp));
            } catch (PatternSyntaxException e) {
                String msg = MessageFormat.format(L10N.getString("err.bad_regexp"), rule);
                throw new IllegalArgumentException(msg, e);
            }
        } else if (value.indexOf(':') >= 0) {
            String msg = MessageFormat.format(L10N.getString("err.unknown_rule_type"), rule);
            throw new IllegalArgumentException(msg);
        } else {
            suffixes.add(normalize(requireValue(rule, value)));
        }
    }

    @Override
    public boolean matches(String name) {
        String normalized = normalize(name);
        if (fullNames.contains(normalized)) {
            return true;
        }
        if (!suffixes.isEmpty()) {
            String candidate = normalized;
            while (true) {
                if (suffixes.contains(candidate)) {
                    return true;
                }
                int dot = candidate.indexOf('.');
                if (dot < 0) {
                    break;
                }
                candidate = candidate.substring(dot + 1);
            }
        }
        for (String keyword : keywords) {
            if (normalized.contains(keyword)) {
                return true;
            }
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the number of rules in this set.
     *
     * @return the rule count
     */
    public int size() {
        return suffixes.size() + fullNames.size() + keywords.size() + patterns.size();
    }

    /**
     * Normalizes a domain name for comparison: lower case, no trailing dot.
     *
     * @param name the name
     * @return the normalized name
     */
    public static String normalize(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".") && lower.length() > 1) {
            return lower.substring(0, lower.length() - 1);
        }
        return lower;
    }

    private static String requireValue(String rule, String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            String msg = MessageFormat.format(L10N.getString("err.empty_rule"), rule);
            throw new IllegalArgumentException(msg);
        }
        return trimmed;
    }

}
