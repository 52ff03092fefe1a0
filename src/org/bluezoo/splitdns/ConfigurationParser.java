/*
 * ConfigurationParser.java
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

package org.bluezoo.splitdns;

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SAX-based parser for the splitdns configuration file.
 *
 * <p>The document element is {@code splitdns}. Each setting is a
 * {@code property} element whose {@code name} attribute names the setting
 * and whose text is its value. A list-valued setting may repeat the
 * property, or give its values as {@code value} children of a
 * {@code list} element:
 * <pre>
 * &lt;splitdns&gt;
 *   &lt;property name="server"&gt;127.0.0.1:5353&lt;/property&gt;
 *   &lt;property name="local-upstream"&gt;
 *     &lt;list&gt;
 *       &lt;value&gt;223.5.5.5&lt;/value&gt;
 *       &lt;value&gt;tcp://119.29.29.29&lt;/value&gt;
 *     &lt;/list&gt;
 *   &lt;/property&gt;
 *   &lt;property name="local-ip"&gt;/etc/splitdns/china_ip_list.txt&lt;/property&gt;
 *   &lt;property name="remote-upstream"&gt;tcp://8.8.8.8?socks5=127.0.0.1:1080&lt;/property&gt;
 * &lt;/splitdns&gt;
 * </pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ConfigurationParser extends DefaultHandler {

    private static final Logger LOGGER = Logger.getLogger(ConfigurationParser.class.getName());

    private DispatcherConfiguration configuration;
    private Locator locator;
    private boolean inRoot;
    private String currentPropertyName;
    private List<String> currentValues;
    private boolean inValue;
    private StringBuilder textContent = new StringBuilder();

    /**
     * Parses a configuration file.
     *
     * @param file the configuration file
     * @return the configuration
     * @throws SAXException if the file is not a valid configuration
     * @throws IOException if the file cannot be read
     */
    public DispatcherConfiguration parse(File file) throws SAXException, IOException {
        InputStream in = new BufferedInputStream(new FileInputStream(file));
        try {
            InputSource source = new InputSource(in);
            source.setSystemId(file.toURI().toString());
            return parse(source);
        } finally {
            in.close();
        }
    }

    /**
     * Parses a configuration document.
     *
     * @param source the document source
     * @return the configuration
     * @throws SAXException if the document is not a valid configuration
     * @throws IOException if the document cannot be read
     */
    public DispatcherConfiguration parse(InputSource source) throws SAXException, IOException {
        configuration = new DispatcherConfiguration();
        inRoot = false;
        currentPropertyName = null;
        currentValues = null;
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            SAXParser parser = factory.newSAXParser();
            parser.parse(source, this);
        } catch (ParserConfigurationException e) {
            throw new SAXException(e);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(SplitDNS.L10N.getString("debug.parsed_configuration"),
                    source.getSystemId());
            LOGGER.fine(msg);
        }
        return configuration;
    }

    @Override
    public void setDocumentLocator(Locator locator) {
        this.locator = locator;
    }

    @Override
    public void startElement(String uri, String localName, String qName,
                             Attributes atts) throws SAXException {
        String name = localName != null && !localName.isEmpty() ? localName : qName;
        textContent.setLength(0);
        if (!inRoot) {
            if (!"splitdns".equals(name)) {
                throw error("err.root_element", name);
            }
            inRoot = true;
        } else if ("property".equals(name)) {
            String propertyName = atts.getValue("name");
            if (propertyName == null || propertyName.isEmpty()) {
                throw error("err.property_name");
            }
            currentPropertyName = propertyName;
            currentValues = new ArrayList<>();
        } else if ("value".equals(name) && currentPropertyName != null) {
            inValue = true;
        } else if (!"list".equals(name) || currentPropertyName == null) {
            if (LOGGER.isLoggable(Level.WARNING)) {
                String msg = MessageFormat.format(SplitDNS.L10N.getString("warn.unknown_element"),
                        name, lineNumber());
                LOGGER.warning(msg);
            }
        }
    }

    @Override
    public void characters(char[] ch, int start, int length) {
        textContent.append(ch, start, length);
    }

    @Override
    public void endElement(String uri, String localName, String qName) throws SAXException {
        String name = localName != null && !localName.isEmpty() ? localName : qName;
        if ("value".equals(name) && inValue) {
            currentValues.add(textContent.toString());
            inValue = false;
        } else if ("property".equals(name) && currentPropertyName != null) {
            if (currentValues.isEmpty()) {
                currentValues.add(textContent.toString());
            }
            for (String value : currentValues) {
                try {
                    configuration.setProperty(currentPropertyName, value);
                } catch (IllegalArgumentException e) {
                    SAXParseException spe = new SAXParseException(e.getMessage(), locator);
                    spe.initCause(e);
                    throw spe;
                }
            }
            currentPropertyName = null;
            currentValues = null;
        }
        textContent.setLength(0);
    }

    private SAXParseException error(String key, Object... args) {
        String msg = MessageFormat.format(SplitDNS.L10N.getString(key), args);
        return new SAXParseException(msg, locator);
    }

    private String lineNumber() {
        return (locator != null) ? Integer.toString(locator.getLineNumber()) : "?";
    }

}
