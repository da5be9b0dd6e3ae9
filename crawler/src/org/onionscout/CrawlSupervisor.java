package org.onionscout;

import org.jetbrains.annotations.Nullable;
import org.onionscout.analysis.ContentAnalyzer;
import org.onionscout.analysis.NetworkScope;
import org.onionscout.config.ConfigurationException;
import org.onionscout.config.ScoutConfig;
import org.onionscout.transport.ProxyTransport;
import org.onionscout.util.Address;
import org.onionscout.util.InvalidAddressException;
import org.onionscout.util.NamedThreadFactory;
import org.onionscout.webapp.Route.HttpError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one crawl run: seeds the frontier, runs the worker pool until it finishes, and writes the export.
 * <p>
 * States move forward only: IDLE, SEEDING, RUNNING, DRAINING, STOPPED. A run with nothing to crawl goes from
 * SEEDING straight to STOPPED.
 */
public class CrawlSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CrawlSupervisor.class);
    private final ScoutConfig config;
    private final Database db;
    private final NetworkScope scope;
    private final TrustScorer trustScorer;
    private final CrawlState crawlState = new CrawlState();
    private final Frontier frontier;
    private final WorkerPool pool;
    private final ProgressTracker progressTracker;
    private final Exporter exporter;
    private final ScheduledExecutorService maintenance = Executors.newSingleThreadScheduledExecutor(
            new NamedThreadFactory("maintenance"));
    private final Lock startStopLock = new ReentrantLock();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile State state = State.IDLE;
    private volatile @Nullable String stopReason;

    public enum State {
        IDLE, SEEDING, RUNNING, DRAINING, STOPPED
    }

    public CrawlSupervisor(ScoutConfig config, Database db, ProxyTransport transport) {
        this(config, db, transport, new ProgressTracker(db.progress()));
    }

    CrawlSupervisor(ScoutConfig config, Database db, ProxyTransport transport, ProgressTracker progressTracker) {
        this.config = config;
        this.db = db;
        this.scope = new NetworkScope(config.crawl().networkSuffixes(), config.crawl().ignoredExtensions());
        this.trustScorer = new TrustScorer(config.trust().halfLife());
        var courtesy = new HostCourtesy(config.crawl().courtesyInterval());
        this.frontier = new Frontier(db, trustScorer, config.crawl().retryLimit(), courtesy, crawlState);
        var analyzer = new ContentAnalyzer(scope, config.analysis());
        this.pool = new WorkerPool(frontier, transport, analyzer, config.crawl());
        this.pool.setDrainListener(this::onDrain);
        this.progressTracker = progressTracker;
        this.exporter = new Exporter(db);
    }

    /**
     * Loads or resets the persisted crawl, enqueues the configured seeds and starts the workers.
     *
     * @throws ConfigurationException if a configured seed is invalid; nothing is enqueued and the crawl is stopped
     * @throws BadStateException      if the crawl was already started
     */
    public void start() throws ConfigurationException, BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Crawl busy " + state);
        try {
            if (state != State.IDLE) throw new BadStateException("Can only start an IDLE crawl");
            state = State.SEEDING;

            List<Address> seeds;
            try {
                seeds = parseSeeds(config.seeds());
            } catch (InvalidAddressException e) {
                finish("invalid seed");
                throw new ConfigurationException("Invalid seed: " + e.getMessage(), e);
            }

            if (config.storage().reset()) {
                log.info("Resetting crawl state");
                db.reset();
            }
            frontier.load();
            int added = frontier.enqueue(seeds, 0, null);
            log.atInfo().addKeyValue("seeds", seeds.size()).addKeyValue("added", added)
                    .addKeyValue("pending", frontier.pendingCount()).log("Seeded frontier");

            if (frontier.isExhausted()) {
                log.info("Nothing to crawl");
                finish("frontier empty");
                return;
            }
            Long budget = remainingBudget();
            if (budget != null && budget <= 0) {
                log.info("Page budget already spent");
                finish("page budget reached");
                return;
            }

            progressTracker.startSession();
            long refreshMillis = config.trust().refreshInterval().toMillis();
            if (refreshMillis > 0) {
                maintenance.scheduleAtFixedRate(this::rescoreHosts, refreshMillis, refreshMillis,
                        TimeUnit.MILLISECONDS);
            }
            pool.start(budget);
            if (state == State.SEEDING) state = State.RUNNING;
            var monitor = new Thread(this::awaitPool, "supervisor");
            monitor.setDaemon(true);
            monitor.start();
        } finally {
            startStopLock.unlock();
        }
    }

    private List<Address> parseSeeds(List<String> raw) throws InvalidAddressException {
        var seeds = new ArrayList<Address>();
        for (String seed : raw) {
            seeds.add(parseSeed(seed));
        }
        return seeds;
    }

    private Address parseSeed(String raw) throws InvalidAddressException {
        Address address = Address.parse(raw);
        if (!scope.onNetwork(address)) {
            throw new InvalidAddressException(raw, "host is not on the " + String.join(", ", scope.suffixes())
                                                   + " network");
        }
        return address;
    }

    /**
     * @return pages this run may still fetch, or null if there is no budget
     */
    private @Nullable Long remainingBudget() {
        Long pageBudget = config.crawl().pageBudget();
        if (pageBudget == null) return null;
        return Math.max(0, pageBudget - crawlState.fetched());
    }

    /**
     * Adds a seed address, at startup or while the crawl runs.
     *
     * @return true if the address had never been seen before
     * @throws InvalidAddressException if the address can't be normalized or isn't on the crawled network
     * @throws BadStateException       if the crawl has stopped or has run out of work and is stopping
     */
    public boolean addSeed(String raw) throws InvalidAddressException, BadStateException {
        Address address = parseSeed(raw);
        if (state == State.STOPPED) throw new BadStateException("Crawl is stopped, seed not added: " + address);
        boolean added;
        try {
            added = frontier.enqueue(address);
        } catch (Frontier.ClosedException e) {
            throw new BadStateException("Crawl has run out of work and is stopping, seed not added: " + address);
        }
        log.atInfo().addKeyValue("url", address).addKeyValue("added", added).log("Seed submitted");
        return added;
    }

    /**
     * Stops dequeuing new work. In-flight fetches are completed and committed before the crawl reaches STOPPED.
     */
    public void stop() throws BadStateException {
        if (!startStopLock.tryLock()) throw new BadStateException("Crawl busy " + state);
        try {
            switch (state) {
                case RUNNING, DRAINING -> pool.stop("stop requested");
                case IDLE -> finish("stop requested");
                default -> throw new BadStateException("Can't stop a " + state + " crawl");
            }
        } finally {
            startStopLock.unlock();
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void awaitTermination() throws InterruptedException {
        stopped.await();
    }

    private void onDrain(String reason) {
        stopReason = reason;
        if (state == State.RUNNING || state == State.SEEDING) {
            state = State.DRAINING;
            log.info("Crawl draining: {}", reason);
        }
    }

    private void awaitPool() {
        try {
            pool.join();
        } catch (InterruptedException e) {
            log.warn("Interrupted waiting for workers");
        }
        String reason = pool.stopReason();
        finish(reason == null ? "frontier exhausted" : reason);
    }

    private void finish(String reason) {
        synchronized (stopped) {
            if (stopped.getCount() == 0) return;
            if (stopReason == null) stopReason = reason;
            maintenance.shutdownNow();
            progressTracker.stopSession();
            Path exportPath = config.storage().export();
            if (exportPath != null) {
                try {
                    exporter.export(exportPath);
                } catch (IOException | RuntimeException e) {
                    log.error("Failed to write export to " + exportPath, e);
                }
            }
            state = State.STOPPED;
            Progress progress = crawlState.snapshot();
            log.atInfo().addKeyValue("fetched", progress.fetched()).addKeyValue("succeeded", progress.succeeded())
                    .addKeyValue("failed", progress.failed()).addKeyValue("findings", progress.findings())
                    .addKeyValue("pending", progress.pending()).log("Crawl stopped: {}", stopReason);
            stopped.countDown();
        }
    }

    private void rescoreHosts() {
        try {
            int rescored = db.rescoreAll(trustScorer, Instant.now());
            log.debug("Rescored {} hosts", rescored);
        } catch (RuntimeException e) {
            log.warn("Failed to rescore hosts", e);
        }
    }

    /**
     * Stops the crawl and waits for in-flight work to finish. Doesn't close the database.
     */
    @Override
    public void close() {
        if (state == State.RUNNING || state == State.DRAINING) {
            pool.stop("shutdown");
            try {
                if (!awaitTermination(config.crawl().timeout().plusSeconds(10))) {
                    log.warn("Workers still busy at shutdown");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        } else if (state != State.STOPPED) {
            finish("shutdown");
        }
        maintenance.shutdownNow();
        progressTracker.close();
    }

    public State state() {
        return state;
    }

    public @Nullable String stopReason() {
        return stopReason;
    }

    public Progress progress() {
        return crawlState.snapshot();
    }

    public List<Worker.Info> workerInfo() {
        return pool.workerInfo();
    }

    public Frontier frontier() {
        return frontier;
    }

    public Database db() {
        return db;
    }

    public Exporter exporter() {
        return exporter;
    }

    public ScoutConfig config() {
        return config;
    }

    @HttpError(409)
    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
