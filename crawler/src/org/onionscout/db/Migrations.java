package org.onionscout.db;

import org.jdbi.v3.core.Handle;
import org.onionscout.MigrationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Forward-only schema migrations. Each migration runs in its own transaction together with the insert into
 * schema_version that records it, so a failed migration leaves the database at the previous version.
 */
public class Migrations {
    private static final Logger log = LoggerFactory.getLogger(Migrations.class);
    private static final Pattern FILENAME = Pattern.compile("V(\\d+)__(\\w+)\\.sql");
    static final List<String> FILES = List.of(
            "V1__initial.sql",
            "V2__dashboard_indexes.sql",
            "V3__page_extracts.sql");

    public record Migration(int version, String description, String sql) {
    }

    private final List<Migration> migrations;

    public Migrations(List<Migration> migrations) {
        var sorted = new ArrayList<>(migrations);
        sorted.sort(Comparator.comparingInt(Migration::version));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).version() != i + 1) {
                throw new IllegalArgumentException("Migration versions must run 1.." + sorted.size() +
                                                   " without gaps, found V" + sorted.get(i).version());
            }
        }
        this.migrations = List.copyOf(sorted);
    }

    /**
     * Loads the migrations bundled on the classpath.
     */
    public static Migrations bundled() {
        var list = new ArrayList<Migration>();
        for (String file : FILES) {
            Matcher matcher = FILENAME.matcher(file);
            if (!matcher.matches()) throw new IllegalStateException("Bad migration filename " + file);
            try (InputStream stream = Migrations.class.getResourceAsStream("/org/onionscout/migrations/" + file)) {
                if (stream == null) throw new MigrationException("Missing migration resource " + file);
                list.add(new Migration(Integer.parseInt(matcher.group(1)), matcher.group(2).replace('_', ' '),
                        new String(stream.readAllBytes(), UTF_8)));
            } catch (IOException e) {
                throw new MigrationException("Unable to read migration " + file, e);
            }
        }
        return new Migrations(list);
    }

    public List<Migration> migrations() {
        return migrations;
    }

    public int latestVersion() {
        return migrations.size();
    }

    public static int currentVersion(Handle handle) {
        return handle.createQuery("SELECT coalesce(max(version), 0) FROM schema_version")
                .mapTo(Integer.class)
                .one();
    }

    /**
     * Brings the schema up to the latest version.
     *
     * @return the number of migrations applied
     * @throws MigrationException if a migration fails or the database was written by a newer version
     */
    public int apply(Handle handle) {
        handle.execute("CREATE TABLE IF NOT EXISTS schema_version (version INTEGER PRIMARY KEY, " +
                       "description TEXT NOT NULL, applied_at INTEGER NOT NULL)");
        int current = currentVersion(handle);
        if (current > latestVersion()) {
            throw new MigrationException("Database schema version " + current + " is newer than the latest " +
                                         "supported version " + latestVersion());
        }
        int applied = 0;
        for (Migration migration : migrations) {
            if (migration.version() <= current) continue;
            log.atInfo().addKeyValue("version", migration.version())
                    .log("Applying migration: {}", migration.description());
            try {
                handle.useTransaction(h -> {
                    // sqlite needs executeAsSeparateStatements() as the driver only runs the first statement
                    h.createScript(migration.sql()).executeAsSeparateStatements();
                    h.createUpdate("INSERT INTO schema_version (version, description, applied_at) " +
                                   "VALUES (:version, :description, :appliedAt)")
                            .bind("version", migration.version())
                            .bind("description", migration.description())
                            .bind("appliedAt", Instant.now())
                            .execute();
                });
            } catch (RuntimeException e) {
                throw new MigrationException("Migration V" + migration.version() + " (" + migration.description() +
                                             ") failed, database left at version " + currentVersion(handle), e);
            }
            applied++;
        }
        return applied;
    }
}
