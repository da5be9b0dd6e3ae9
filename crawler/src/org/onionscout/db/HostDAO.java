package org.onionscout.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.onionscout.FindingCounts;
import org.onionscout.Host;
import org.onionscout.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(Host.class)
public interface HostDAO {
    @SqlQuery("SELECT * FROM hosts WHERE id = ?")
    Host find(long id);

    @SqlQuery("SELECT * FROM hosts WHERE name = ?")
    Host findByName(String name);

    /**
     * Returns the id of the named host, creating it with first_seen set to now if it doesn't exist yet.
     */
    @SqlQuery("""
            INSERT INTO hosts (name, first_seen, last_seen) VALUES (:name, :now, :now)
            ON CONFLICT (name) DO UPDATE SET name = excluded.name
            RETURNING id""")
    long upsert(String name, Instant now);

    @SqlUpdate("""
            UPDATE hosts
            SET attempts = attempts + 1,
                successes = successes + :successes,
                last_seen = :now,
                secrets = secrets + :c.secrets,
                crypto_addresses = crypto_addresses + :c.cryptoAddresses,
                social_handles = social_handles + :c.socialHandles,
                emails = emails + :c.emails,
                leaked_ips = leaked_ips + :c.leakedIps,
                tech_fingerprints = tech_fingerprints + :c.techFingerprints
            WHERE id = :id""")
    @MustUpdate(1)
    void recordFetch(long id, int successes, Instant now, @BindMethods("c") FindingCounts counts);

    @SqlUpdate("UPDATE hosts SET trust_score = :score WHERE id = :id")
    @MustUpdate(1)
    void updateTrustScore(long id, double score);

    @SqlQuery("SELECT * FROM hosts WHERE id > :afterId ORDER BY id LIMIT :limit")
    List<Host> batchAfter(long afterId, int limit);

    @SqlQuery("SELECT COUNT(*) FROM hosts WHERE (:name IS NULL OR name GLOB :name)")
    long count(String name);

    @SqlQuery("""
            SELECT * FROM hosts
            WHERE (:name IS NULL OR name GLOB :name)
            ORDER BY trust_score DESC, id
            LIMIT :limit OFFSET :offset""")
    List<Host> byTrustScore(String name, int limit, long offset);

    @SqlQuery("""
            SELECT * FROM hosts
            WHERE first_seen >= :since
            ORDER BY first_seen, id
            LIMIT :limit OFFSET :offset""")
    List<Host> feed(Instant since, int limit, long offset);

    @SqlQuery("SELECT COUNT(*) FROM hosts WHERE first_seen >= :since")
    long countSince(Instant since);
}
