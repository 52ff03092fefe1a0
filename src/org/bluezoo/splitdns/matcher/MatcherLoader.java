/*
 * MatcherLoader.java
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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Populates matchers from list files.
 *
 * <p>List files hold one entry per line. Anything after a {@code #} is a
 * comment, and blank lines are ignored. Domain lists hold
 * {@link DomainSet} rules; IP lists hold addresses or CIDR prefixes for
 * a {@link NetList}. An invalid entry makes the whole file fail to load,
 * reporting the file and line.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class MatcherLoader {

    private static final Logger LOGGER = Logger.getLogger(MatcherLoader.class.getName());
    static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.splitdns.matcher.L10N");

    private MatcherLoader() {
    }

    /**
     * Loads every domain list file into a new set.
     *
     * @param files the list files
     * @return the populated set
     * @throws IOException if a file cannot be read or holds an invalid rule
     */
    public static DomainSet loadDomains(List<Path> files) throws IOException {
        DomainSet set = new DomainSet();
        for (Path file : files) {
            loadDomains(set, file);
        }
        return set;
    }

    /**
     * Loads a domain list file into a set.
     *
     * @param set the set to add rules to
     * @param file the list file
     * @return the number of rules read
     * @throws IOException if the file cannot be read or holds an invalid rule
     */
    public static int loadDomains(final DomainSet set, Path file) throws IOException {
        return read(file, new EntryConsumer() {
            @Override
            public void accept(String entry) {
                set.add(entry);
            }
        });
    }

    /**
     * Loads every IP list file into a new, sorted list.
     *
     * @param files the list files
     * @return the populated and sorted list
     * @throws IOException if a file cannot be read or holds an invalid prefix
     */
    public static NetList loadNetList(List<Path> files) throws IOException {
        NetList list = new NetList();
        for (Path file : files) {
            loadNetList(list, file);
        }
        list.sort();
        return list;
    }

    /**
     * Loads an IP list file into a list. The caller must call
     * {@link NetList#sort()} once every file is loaded.
     *
     * @param list the list to add prefixes to
     * @param file the list file
     * @return the number of prefixes read
     * @throws IOException if the file cannot be read or holds an invalid prefix
     */
    public static int loadNetList(final NetList list, Path file) throws IOException {
        return read(file, new EntryConsumer() {
            @Override
            public void accept(String entry) {
                list.add(entry);
            }
        });
    }

    private static int read(Path file, EntryConsumer consumer) throws IOException {
        int count = 0;
        int lineNumber = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                int comment = line.indexOf('#');
                if (comment >= 0) {
                    line = line.substring(0, comment);
                }
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                try {
                    consumer.accept(line);
                } catch (IllegalArgumentException e) {
                    String msg = MessageFormat.format(L10N.getString("err.bad_entry"),
                            file, lineNumber, e.getMessage());
                    throw new IOException(msg, e);
                }
                count++;
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("debug.loaded_file"), count, file);
            LOGGER.fine(msg);
        }
        return count;
    }

    private interface EntryConsumer {
        void accept(String entry);
    }

}
