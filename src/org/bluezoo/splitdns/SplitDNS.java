/*
 * SplitDNS.java
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

import java.io.File;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.splitdns.cache.AnswerCache;
import org.bluezoo.splitdns.cache.ShardedAnswerCache;
import org.bluezoo.splitdns.dispatch.DispatchEngine;
import org.bluezoo.splitdns.dispatch.ResponseValidator;
import org.bluezoo.splitdns.dispatch.RoutingClassifier;
import org.bluezoo.splitdns.matcher.DomainSet;
import org.bluezoo.splitdns.matcher.MatcherLoader;
import org.bluezoo.splitdns.matcher.NetList;
import org.bluezoo.splitdns.server.DNSServer;
import org.bluezoo.splitdns.upstream.UpstreamAddress;
import org.bluezoo.splitdns.upstream.UpstreamGroup;
import org.bluezoo.splitdns.upstream.UpstreamRole;

/**
 * Split-horizon DNS dispatcher.
 *
 * <p>Loads the domain and IP lists named by the configuration, builds the
 * local and remote upstream groups, and serves DNS over UDP and TCP on
 * the configured address until the process is stopped.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SplitDNS {

    private static final Logger LOGGER = Logger.getLogger(SplitDNS.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.splitdns.L10N");

    private final DispatcherConfiguration configuration;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private ExecutorService upstreamExecutor;
    private AnswerCache cache;
    private DispatchEngine engine;
    private DNSServer server;

    /**
     * Creates an instance for a validated configuration.
     *
     * @param configuration the configuration
     */
    public SplitDNS(DispatcherConfiguration configuration) {
        this.configuration = configuration;
    }

    /**
     * Loads the matchers, creates the upstreams and starts listening.
     *
     * @throws IOException if a list file cannot be loaded or a listener
     *         cannot be bound
     * @throws IllegalArgumentException if an upstream address is invalid
     */
    public synchronized void start() throws IOException {
        DomainSet localDomains = null;
        if (!configuration.getLocalDomainFiles().isEmpty()) {
            localDomains = MatcherLoader.loadDomains(toPaths(configuration.getLocalDomainFiles()));
            String msg = MessageFormat.format(L10N.getString("info.local_domains_loaded"), localDomains.size());
            LOGGER.info(msg);
        }
        DomainSet remoteDomains = null;
        if (!configuration.getRemoteDomainFiles().isEmpty()) {
            remoteDomains = MatcherLoader.loadDomains(toPaths(configuration.getRemoteDomainFiles()));
            String msg = MessageFormat.format(L10N.getString("info.remote_domains_loaded"), remoteDomains.size());
            LOGGER.info(msg);
        }
        NetList localIP = MatcherLoader.loadNetList(toPaths(configuration.getLocalIPFiles()));
        String msg = MessageFormat.format(L10N.getString("info.local_ip_loaded"), localIP.size());
        LOGGER.info(msg);

        int timeout = configuration.getUpstreamTimeout();
        UpstreamGroup localGroup = UpstreamGroup.create(UpstreamRole.LOCAL,
                parseUpstreams(configuration.getLocalUpstreams()), timeout);
        UpstreamGroup remoteGroup = UpstreamGroup.create(UpstreamRole.REMOTE,
                parseUpstreams(configuration.getRemoteUpstreams()), timeout);

        InetSocketAddress address = configuration.getServerAddress();
        upstreamExecutor = Executors.newCachedThreadPool(new UpstreamThreadFactory());
        cache = ShardedAnswerCache.create(configuration.getCacheSize());
        engine = new DispatchEngine(localGroup, remoteGroup,
                new RoutingClassifier(localDomains, remoteDomains),
                new ResponseValidator(localIP),
                cache, configuration.getLocalLatency(), upstreamExecutor);
        server = new DNSServer(address, engine);
        try {
            server.start();
        } catch (IOException e) {
            stop();
            throw e;
        }
    }

    /**
     * Returns the dispatch engine.
     *
     * @return the engine, or null if not started
     */
    public synchronized DispatchEngine getEngine() {
        return engine;
    }

    /**
     * Returns the running server.
     *
     * @return the server, or null if not started
     */
    public synchronized DNSServer getServer() {
        return server;
    }

    /**
     * Stops listening and releases all resources.
     */
    public synchronized void stop() {
        if (server != null) {
            server.close();
        }
        if (cache != null) {
            cache.close();
        }
        if (upstreamExecutor != null) {
            upstreamExecutor.shutdownNow();
        }
        stopped.countDown();
    }

    /**
     * Blocks until {@link #stop()} has been called.
     *
     * @throws InterruptedException if the calling thread is interrupted
     */
    public void await() throws InterruptedException {
        stopped.await();
    }

    private static List<Path> toPaths(List<String> files) {
        List<Path> paths = new ArrayList<>(files.size());
        for (String file : files) {
            paths.add(Paths.get(file));
        }
        return paths;
    }

    private static List<UpstreamAddress> parseUpstreams(List<String> specs) {
        List<UpstreamAddress> addresses = new ArrayList<>(specs.size());
        for (String spec : specs) {
            addresses.add(UpstreamAddress.parse(spec));
        }
        return addresses;
    }

    /**
     * Sets the level of the splitdns loggers and of the root handlers.
     *
     * @param debug true for FINE, false for INFO
     */
    static void configureLogging(boolean debug) {
        Level level = debug ? Level.FINE : Level.INFO;
        Logger.getLogger("org.bluezoo.splitdns").setLevel(level);
        for (Handler handler : Logger.getLogger("").getHandlers()) {
            handler.setLevel(level);
        }
    }

    /**
     * Returns the configuration file to read: the first argument if
     * given, otherwise {@code ~/.splitdnsrc}, otherwise
     * {@code /etc/splitdnsrc}.
     */
    static File locateConfiguration(String[] args) {
        File file;
        if (args.length > 0) {
            file = new File(args[0]);
        } else {
            file = new File(System.getProperty("user.home") + File.separator + ".splitdnsrc");
        }
        if (!file.exists()) {
            file = new File("/etc/splitdnsrc");
        }
        return file;
    }

    private static class UpstreamThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "splitdns-upstream-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }

    private static class ShutdownHook extends Thread {
        private final SplitDNS splitdns;

        ShutdownHook(SplitDNS splitdns) {
            super("splitdns-shutdown");
            this.splitdns = splitdns;
        }

        @Override
        public void run() {
            LOGGER.info(L10N.getString("info.shutdown"));
            splitdns.stop();
        }
    }

    // -- Main entry point --

    public static void main(String[] args) {
        File configFile = locateConfiguration(args);
        if (!configFile.exists()) {
            System.out.println(L10N.getString("err.syntax"));
            System.exit(1);
        }

        DispatcherConfiguration configuration;
        try {
            configuration = new ConfigurationParser().parse(configFile);
            configuration.validate();
        } catch (Exception e) {
            String msg = MessageFormat.format(L10N.getString("err.configuration"), configFile);
            LOGGER.log(Level.SEVERE, msg, e);
            System.exit(2);
            return;
        }
        configureLogging(configuration.isDebug());

        SplitDNS splitdns = new SplitDNS(configuration);
        try {
            splitdns.start();
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, L10N.getString("err.start"), e);
            System.exit(2);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new ShutdownHook(splitdns));

        try {
            splitdns.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

}
