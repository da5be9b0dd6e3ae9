package org.onionscout;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.jwarc.WarcDigest;
import org.onionscout.analysis.Analysis;
import org.onionscout.analysis.ContentAnalyzer;
import org.onionscout.config.CrawlConfig;
import org.onionscout.transport.FetchResponse;
import org.onionscout.transport.ProxyTransport;
import org.onionscout.transport.TransportException;
import org.onionscout.util.Address;
import org.onionscout.util.BareMediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.List;

public class Worker {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    final String id;
    private final WorkerPool pool;
    private final Frontier frontier;
    private final ProxyTransport transport;
    private final ContentAnalyzer analyzer;
    private final CrawlConfig config;
    private Thread thread;
    private volatile Info info;

    Worker(String id, WorkerPool pool, Frontier frontier, ProxyTransport transport, ContentAnalyzer analyzer,
           CrawlConfig config) {
        this.id = id;
        this.pool = pool;
        this.frontier = frontier;
        this.transport = transport;
        this.analyzer = analyzer;
        this.config = config;
        this.info = new Info(id, null, null, Instant.now());
    }

    synchronized void start() {
        log.debug("Starting worker {}", id);
        thread = new Thread(() -> {
            try {
                run();
            } catch (InterruptedException e) {
                log.info("Worker {} interrupted", id);
            } catch (RuntimeException e) {
                log.error("Worker crashed", e);
            } finally {
                updateInfo(new Info(id, null, null, Instant.now()));
                log.debug("Worker {} finished", id);
            }
        }, "Worker-" + id);
        thread.start();
    }

    void join() throws InterruptedException {
        thread.join();
    }

    boolean join(long millis) throws InterruptedException {
        thread.join(millis);
        return !thread.isAlive();
    }

    boolean isAlive() {
        return thread != null && thread.isAlive();
    }

    void run() throws InterruptedException {
        while (!pool.isStopping()) {
            if (!pool.tryReserve()) {
                pool.drain("page budget reached");
                return;
            }
            FrontierEntry entry;
            try {
                entry = frontier.dequeue();
            } catch (PersistenceException e) {
                pool.unreserve();
                log.error("Dequeue failed", e);
                pool.recordPersistenceFailure();
                frontier.awaitChange(config.idlePoll());
                continue;
            }
            if (entry == null) {
                pool.unreserve();
                if (frontier.closeIfExhausted()) return;
                frontier.awaitChange(config.idlePoll());
                continue;
            }
            process(entry);
        }
    }

    private void process(FrontierEntry entry) throws InterruptedException {
        Instant date = Instant.now();
        updateInfo(new Info(id, entry.id(), entry.address(), date));
        long start = System.nanoTime();
        FetchCycle cycle;
        try {
            FetchResponse response = transport.fetch(entry.address(), config.timeout());
            pool.recordProxySuccess();
            cycle = toCycle(entry, date, response);
        } catch (TransportException e) {
            if (e.kind() == TransportException.Kind.PROXY_UNAVAILABLE) {
                pool.recordProxyFailure();
            } else {
                pool.recordProxySuccess();
            }
            long fetchTimeMs = (System.nanoTime() - start) / 1_000_000;
            log.atInfo().addKeyValue("url", entry.address()).addKeyValue("kind", e.kind())
                    .addKeyValue("attempts", entry.attempts()).log("Fetch failed: {}", e.getMessage());
            cycle = FetchCycle.failed(entry, date, outcomeOf(e.kind()), fetchTimeMs, e.getMessage());
        } catch (InterruptedException e) {
            frontier.release(entry);
            throw e;
        } catch (RuntimeException e) {
            long fetchTimeMs = (System.nanoTime() - start) / 1_000_000;
            log.atError().addKeyValue("url", entry.address()).setCause(e).log("Unexpected error processing page");
            cycle = new FetchCycle(entry, date, 0, Page.Outcome.ERROR, FrontierEntry.Disposition.FAIL, null, 0,
                    fetchTimeMs, null, null, e.toString(), List.of(), List.of());
        }

        try {
            CycleResult result = frontier.complete(entry, cycle);
            pool.recordPersistenceSuccess();
            log.atInfo().addKeyValue("url", entry.address()).addKeyValue("status", cycle.status())
                    .addKeyValue("outcome", cycle.outcome()).addKeyValue("findings", result.findingsInserted())
                    .addKeyValue("links", result.discovered().size()).addKeyValue("state", result.entry().state())
                    .log("Fetched page");
        } catch (PersistenceException e) {
            log.atError().addKeyValue("url", entry.address()).setCause(e).log("Failed to persist fetch cycle");
            pool.recordPersistenceFailure();
            try {
                frontier.fail(entry, e.getMessage());
            } catch (PersistenceException e2) {
                log.atError().addKeyValue("url", entry.address()).setCause(e2).log("Failed to mark entry failed");
            }
        } finally {
            updateInfo(new Info(id, null, null, Instant.now()));
        }
    }

    FetchCycle toCycle(FrontierEntry entry, Instant date, FetchResponse response) {
        byte[] body = response.body();
        String contentHash = body.length == 0 ? null : sha1(body);
        String contentType = response.header("Content-Type");
        int status = response.status();
        long fetchTimeMs = response.fetchTimeMs();

        if (response.isSuccess()) {
            BareMediaType mediaType = BareMediaType.of(contentType);
            byte[] analyzed = mediaType == null || mediaType.isText() ? body : new byte[0];
            Analysis analysis = analyzer.analyze(analyzed, contentType, response.headers(), entry.address());
            String error = analysis.errors().isEmpty() ? null : String.join("; ", analysis.errors());
            return new FetchCycle(entry, date, status, Page.Outcome.OK, FrontierEntry.Disposition.DONE, contentHash,
                    body.length, fetchTimeMs, contentType, analysis.title(), error, analysis.findings(),
                    analysis.links(), analysis.extracts());
        }
        if (response.isRedirect()) {
            List<Address> links = analyzer.resolveLink(entry.address(), response.header("Location")).stream().toList();
            return new FetchCycle(entry, date, status, Page.Outcome.OK, FrontierEntry.Disposition.DONE, contentHash,
                    body.length, fetchTimeMs, contentType, null, null, List.of(), links);
        }
        var disposition = response.isRetryable() ? FrontierEntry.Disposition.RETRY : FrontierEntry.Disposition.FAIL;
        return new FetchCycle(entry, date, status, Page.Outcome.ERROR, disposition, contentHash, body.length,
                fetchTimeMs, contentType, null, "HTTP " + status, List.of(), List.of());
    }

    static Page.Outcome outcomeOf(TransportException.Kind kind) {
        return switch (kind) {
            case TIMEOUT -> Page.Outcome.TIMEOUT;
            case REFUSED -> Page.Outcome.REFUSED;
            case PROXY_UNAVAILABLE, ERROR -> Page.Outcome.ERROR;
        };
    }

    static String sha1(byte[] data) {
        try {
            var digest = MessageDigest.getInstance("SHA-1");
            digest.update(data);
            return new WarcDigest(digest).prefixedBase32();
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException(e);
        }
    }

    private void updateInfo(Info info) {
        this.info = info;
    }

    public Info info() {
        return info;
    }

    public record Info(
            String id,
            @Nullable Long frontierId,
            @Nullable Address address,
            Instant updateTime) {
    }
}
