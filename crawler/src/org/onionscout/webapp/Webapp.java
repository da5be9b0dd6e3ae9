package org.onionscout.webapp;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.jetbrains.annotations.Nullable;
import org.onionscout.*;
import org.onionscout.util.Address;
import org.onionscout.util.InvalidAddressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.onionscout.webapp.Route.*;

/**
 * The dashboard's JSON API. Reads go straight to the database and are paged; nothing here blocks the crawl for
 * longer than one short query.
 */
public class Webapp implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(Webapp.class);
    static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final CrawlSupervisor supervisor;
    private final Database db;
    private final Map<String, Route> routes = buildMap(this);

    public Webapp(CrawlSupervisor supervisor) {
        this.supervisor = supervisor;
        this.db = supervisor.db();
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            var route = routes.get(exchange.getRequestURI().getPath());
            if (route != null) {
                route.handle(exchange);
            } else {
                sendText(exchange, 404, "Not found");
            }
        } catch (IllegalArgumentException e) {
            sendText(exchange, 400, String.valueOf(e.getMessage()));
        } catch (Exception e) {
            if (exchange.getResponseCode() == -1) {
                try {
                    sendText(exchange, 500, "Internal server error");
                } catch (IOException e2) {
                    e.addSuppressed(e2);
                }
            }
            log.error("Error handling request " + exchange.getRequestURI(), e);
        } finally {
            exchange.close();
        }
    }

    public static class HostsQuery extends Query {
        /** Glob matched against the host name, e.g. "*.onion". */
        public String host;
    }

    @GET("/api/hosts")
    Page<Host> hosts(HostsQuery query) {
        long count = db.hosts().count(query.host);
        var rows = db.hosts().byTrustScore(query.host, query.limit(), query.offset());
        return new Page<>(query, count, rows);
    }

    public static class SearchQuery extends Query {
        /** Text to look for in finding values and in page content hashes, titles, addresses and host names. */
        public String q;
        public Finding.Kind kind;
    }

    @GET("/api/search")
    Page<SearchHit> search(SearchQuery query) {
        if (query.q == null || query.q.isBlank()) throw new IllegalArgumentException("q is required");
        String pattern = "%" + escapeLike(query.q.strip()) + "%";
        long count = db.findings().countSearch(pattern, query.kind);
        var rows = db.findings().search(pattern, query.kind, query.limit(), query.offset());
        return new Page<>(query, count, rows);
    }

    static String escapeLike(String text) {
        return text.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    public static class FeedQuery extends Query {
        /** Only hosts first seen at or after this time. */
        public Instant since;
    }

    @GET("/api/feed")
    Page<Host> feed(FeedQuery query) {
        Instant since = query.since == null ? Instant.EPOCH : query.since;
        long count = db.hosts().countSince(since);
        var rows = db.hosts().feed(since, query.limit(), query.offset());
        return new Page<>(query, count, rows);
    }

    public static class FrontierQuery extends Query {
        public FrontierEntry.State state;
    }

    @GET("/api/frontier")
    Page<FrontierEntry> frontier(FrontierQuery query) {
        long count = db.frontier().count(query.state);
        var rows = db.frontier().list(query.state, query.limit(), query.offset());
        return new Page<>(query, count, rows);
    }

    public static class ProgressQuery {
        /** Number of most recent progress snapshots to include. */
        public int history = 60;
    }

    public record ProgressResponse(
            CrawlSupervisor.State state,
            @Nullable String stopReason,
            Progress current,
            int queued,
            int inFlight,
            List<Progress> history) {
    }

    @GET("/api/progress")
    ProgressResponse progress(ProgressQuery query) {
        if (query.history < 0 || query.history > Query.MAX_SIZE) {
            throw new IllegalArgumentException("history must be between 0 and " + Query.MAX_SIZE);
        }
        var frontier = supervisor.frontier();
        return new ProgressResponse(supervisor.state(), supervisor.stopReason(), supervisor.progress(),
                frontier.pendingCount(), frontier.inFlightCount(), db.progress().snapshots(query.history));
    }

    @GET("/api/workers")
    List<Worker.Info> workers() {
        return supervisor.workerInfo();
    }

    @GET("/api/export")
    void export(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.getResponseHeaders().set("Content-Disposition", "attachment; filename=\"onionscout-export.json\"");
        try (var out = encodeResponse(exchange, 200, 0)) {
            supervisor.exporter().export(out);
        }
    }

    public record SeedsRequest(List<String> addresses) {
    }

    public record RejectedSeed(String address, String error) {
    }

    public record SeedsResponse(List<String> added, List<String> duplicates, List<RejectedSeed> rejected) {
    }

    @POST("/api/seeds")
    SeedsResponse addSeeds(SeedsRequest request) throws CrawlSupervisor.BadStateException {
        if (request == null || request.addresses() == null) throw new IllegalArgumentException("addresses is required");
        var added = new ArrayList<String>();
        var duplicates = new ArrayList<String>();
        var rejected = new ArrayList<RejectedSeed>();
        for (String raw : request.addresses()) {
            try {
                boolean isNew = supervisor.addSeed(raw);
                String normalized = Address.parse(raw).toString();
                (isNew ? added : duplicates).add(normalized);
            } catch (InvalidAddressException e) {
                rejected.add(new RejectedSeed(raw, e.getMessage()));
            }
        }
        return new SeedsResponse(added, duplicates, rejected);
    }

    @POST("/api/stop")
    void stop() throws CrawlSupervisor.BadStateException {
        supervisor.stop();
    }

    public static class Page<T> {
        /** Index of the last page of results. */
        public final long last_page;
        /** Total number of matching rows. */
        public final long last_row;
        public final List<T> data;

        Page(Query query, long lastRow, List<T> data) {
            this(Math.max(1, (lastRow + query.limit() - 1) / query.limit()), lastRow, data);
        }

        public Page(long lastPage, long lastRow, List<T> data) {
            last_page = lastPage;
            last_row = lastRow;
            this.data = data;
        }
    }
}
