package org.onionscout;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.argument.NullArgument;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.jetbrains.annotations.Nullable;
import org.onionscout.db.*;
import org.onionscout.util.Address;
import org.onionscout.util.MustUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.jdbi.v3.core.generic.GenericTypes.getErasedType;

/**
 * The crawl's persistent store: hosts, pages, findings, the frontier and progress counters in one SQLite database.
 * <p>
 * All access goes through a single pooled connection so writers never contend on SQLite's file lock. Dashboard
 * reads wait at most {@link #CONNECTION_TIMEOUT} for the connection.
 */
public interface Database extends AutoCloseable, Transactional<Database> {
    Duration CONNECTION_TIMEOUT = Duration.ofSeconds(10);

    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    /**
     * Opens the database and brings its schema up to date.
     *
     * @throws MigrationException if the schema couldn't be migrated
     */
    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setPoolName("onionscout-db");
        config.addDataSourceProperty("foreign_keys", "true");
        config.addDataSourceProperty("busy_timeout", "60000");
        config.addDataSourceProperty("synchronous", "NORMAL");
        if (!jdbcUrl.contains(":memory:")) config.addDataSourceProperty("journal_mode", "WAL");
        config.setMaximumPoolSize(1);
        config.setMaxLifetime(0); // an in-memory database lives only as long as its connection
        config.setConnectionTimeout(CONNECTION_TIMEOUT.toMillis());
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(Address.class, stringColumnMapper(Address::fromNormalized));
        jdbi.registerArgument(stringArgument(Address.class, Address::toString));
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SqlLogger() {
            private static final Logger log = LoggerFactory.getLogger(Database.class);

            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                long durationMillis = Duration.between(context.getExecutionMoment(), context.getCompletionMoment())
                        .toMillis();
                if (durationMillis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    String sql = parsedSql != null ? parsedSql.getSql() : "<sql unavailable>";
                    log.atWarn().addKeyValue("ms", durationMillis).log("[Slow SQL] {}", sql);
                }
            }
        });
        Database db = jdbi.onDemand(Database.class);
        try {
            db.init();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
        return db;
    }

    private static <T> ColumnMapper<T> stringColumnMapper(Function<String, T> constructor) {
        return (r, col, ctx) -> {
            String value = r.getString(col);
            return value == null ? null : constructor.apply(value);
        };
    }

    @SuppressWarnings("unchecked")
    private static <T> ArgumentFactory.Preparable stringArgument(Class<T> clazz, Function<T, String> getter) {
        return (type, config) -> {
            if (!clazz.isAssignableFrom(getErasedType(type))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(Types.VARCHAR);
                return (pos, stmt, ctx) -> stmt.setString(pos, getter.apply((T) value));
            });
        };
    }

    default void init() {
        Migrations migrations = Migrations.bundled();
        useHandle(migrations::apply);
    }

    default int schemaVersion() {
        return withHandle(Migrations::currentVersion);
    }

    @CreateSqlObject
    ExtractDAO extracts();

    @CreateSqlObject
    FindingDAO findings();

    @CreateSqlObject
    FrontierDAO frontier();

    @CreateSqlObject
    HostDAO hosts();

    @CreateSqlObject
    PageDAO pages();

    @CreateSqlObject
    ProgressDAO progress();

    default boolean hasSeenAddress(Address address) {
        return frontier().findId(address) != null;
    }

    default long upsertHost(String name, Instant now) {
        return hosts().upsert(name, now);
    }

    default long insertPage(Page page) {
        return pages().insert(page);
    }

    /**
     * @return the number of findings inserted, excluding repeats of a (kind, value) pair already on the page
     */
    default int insertFindings(long pageId, Collection<Finding> findings) {
        if (findings.isEmpty()) return 0;
        int inserted = 0;
        for (int count : findings().insertAll(pageId, findings)) {
            if (count > 0) inserted += count;
        }
        return inserted;
    }

    default List<FrontierEntry> loadFrontierSnapshot() {
        return frontier().openEntries();
    }

    default void updateTrustScore(long hostId, double score) {
        hosts().updateTrustScore(hostId, score);
    }

    /**
     * Adds an address to the frontier, creating its host on first sight. Must run inside a transaction.
     *
     * @return the new entry, or null if the address has been seen before
     */
    default @Nullable FrontierEntry insertAddress(Address address, int depth, @Nullable Address via, Instant now) {
        if (hasSeenAddress(address)) return null;
        long hostId = upsertHost(address.authority(), now);
        Long id = frontier().insert(address, hostId, depth, via, now);
        if (id == null) return null;
        return frontier().find(id);
    }

    /**
     * Adds addresses to the frontier in one transaction.
     *
     * @return the entries that were newly inserted, in queue order
     */
    default List<FrontierEntry> enqueue(Collection<Address> addresses, int depth, @Nullable Address via) {
        try {
            return inTransaction(db -> {
                Instant now = Instant.now();
                var inserted = new ArrayList<FrontierEntry>();
                for (Address address : addresses) {
                    FrontierEntry entry = db.insertAddress(address, depth, via, now);
                    if (entry != null) inserted.add(entry);
                }
                if (!inserted.isEmpty()) db.progress().addDiscovered(inserted.size());
                return inserted;
            });
        } catch (JdbiException e) {
            throw new PersistenceException("Failed to enqueue " + addresses.size() + " addresses", e);
        }
    }

    /**
     * Records one fetch cycle as a single transaction: the page with its findings and extracts, the host's
     * aggregates and trust score, the frontier entry's transition and any newly discovered links. Either all of it is
     * written or none.
     *
     * @throws PersistenceException if the transaction failed and was rolled back
     */
    default CycleResult commitCycle(FetchCycle cycle, TrustScorer trustScorer, int retryLimit) {
        FrontierEntry entry = cycle.entry();
        try {
            return inTransaction(db -> {
                long pageId = db.insertPage(cycle.toPage());
                int findingsInserted = db.insertFindings(pageId, cycle.findings());
                if (!cycle.extracts().isEmpty()) db.extracts().insertAll(pageId, cycle.extracts());

                boolean success = cycle.outcome() == Page.Outcome.OK;
                db.hosts().recordFetch(entry.hostId(), success ? 1 : 0, cycle.date(),
                        FindingCounts.of(cycle.findings()));
                Host host = db.hosts().find(entry.hostId());
                double score = trustScorer.score(host, cycle.date());
                db.updateTrustScore(entry.hostId(), score);

                FrontierEntry next = entry.next(cycle.disposition(), retryLimit);
                db.frontier().finish(entry.id(), next.state(), next.attempts());
                if (next.state() == FrontierEntry.State.PENDING) {
                    next = db.frontier().find(entry.id());
                }

                var discovered = new ArrayList<FrontierEntry>();
                for (Address link : cycle.links()) {
                    FrontierEntry added = db.insertAddress(link, entry.depth() + 1, entry.address(), cycle.date());
                    if (added != null) discovered.add(added);
                }
                if (!discovered.isEmpty()) db.progress().addDiscovered(discovered.size());

                boolean settled = next.state() != FrontierEntry.State.PENDING;
                db.progress().recordFetch(success ? 1 : 0,
                        next.state() == FrontierEntry.State.FAILED ? 1 : 0,
                        settled ? 1 : 0, findingsInserted);
                return new CycleResult(pageId, next, discovered, findingsInserted, score);
            });
        } catch (JdbiException | MustUpdate.Exception e) {
            throw new PersistenceException("Failed to commit fetch of " + entry.address(), e);
        }
    }

    /**
     * Marks an in-flight entry as terminally failed without recording a page, used when its fetch cycle couldn't be
     * committed.
     */
    default void failEntry(FrontierEntry entry) {
        try {
            useTransaction(db -> {
                db.frontier().finish(entry.id(), FrontierEntry.State.FAILED, entry.attempts() + 1);
                db.progress().recordFailure();
            });
        } catch (JdbiException | MustUpdate.Exception e) {
            throw new PersistenceException("Failed to mark " + entry.address() + " as failed", e);
        }
    }

    /**
     * Recomputes every host's trust score, so hosts that haven't been fetched lately decay toward neutral. Runs in
     * small batches so crawl writers are never blocked for long.
     *
     * @return the number of hosts rescored
     */
    default int rescoreAll(TrustScorer trustScorer, Instant now) {
        int rescored = 0;
        long afterId = 0;
        while (true) {
            List<Host> batch = hosts().batchAfter(afterId, 500);
            if (batch.isEmpty()) return rescored;
            useTransaction(db -> {
                for (Host host : batch) {
                    db.updateTrustScore(host.id(), trustScorer.score(host, now));
                }
            });
            rescored += batch.size();
            afterId = batch.get(batch.size() - 1).id();
        }
    }

    /**
     * Discards all crawl state, keeping the schema.
     */
    @SuppressWarnings("SqlWithoutWhere")
    default void reset() {
        useTransaction(db -> db.useHandle(handle -> {
            handle.execute("DELETE FROM extracts");
            handle.execute("DELETE FROM findings");
            handle.execute("DELETE FROM pages");
            handle.execute("DELETE FROM frontier");
            handle.execute("DELETE FROM hosts");
            db.progress().deleteSnapshots();
            db.progress().clear();
        }));
    }

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
