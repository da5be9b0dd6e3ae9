package org.onionscout.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.onionscout.Progress;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(Progress.class)
public interface ProgressDAO {
    @SqlUpdate("UPDATE progress SET discovered = discovered + :count, pending = pending + :count WHERE id = 0")
    void addDiscovered(int count);

    @SqlUpdate("""
            UPDATE progress
            SET fetched = fetched + 1,
                succeeded = succeeded + :succeeded,
                failed = failed + :failed,
                pending = pending - :settled,
                findings = findings + :findings
            WHERE id = 0""")
    void recordFetch(int succeeded, int failed, int settled, int findings);

    @SqlUpdate("UPDATE progress SET pending = pending - 1, failed = failed + 1 WHERE id = 0")
    void recordFailure();

    @SqlUpdate("INSERT INTO progress (date, discovered, pending, fetched, succeeded, failed, findings) " +
               "SELECT :date, discovered, pending, fetched, succeeded, failed, findings FROM progress WHERE id = 0")
    void createSnapshot(Instant date);

    @SqlQuery("SELECT * FROM progress WHERE id = 0")
    Progress current();

    @SqlQuery("SELECT * FROM (SELECT * FROM progress WHERE id > 0 ORDER BY id DESC LIMIT :limit) ORDER BY id")
    List<Progress> snapshots(int limit);

    @SqlUpdate("UPDATE progress SET discovered = 0, pending = 0, fetched = 0, succeeded = 0, failed = 0, findings = 0 " +
               "WHERE id = 0")
    void clear();

    @SqlUpdate("DELETE FROM progress WHERE id > 0")
    void deleteSnapshots();
}
