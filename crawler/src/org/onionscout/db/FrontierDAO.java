package org.onionscout.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.onionscout.FrontierEntry;
import org.onionscout.util.Address;
import org.onionscout.util.MustUpdate;

import java.time.Instant;
import java.util.List;

@RegisterConstructorMapper(FrontierEntry.class)
public interface FrontierDAO {
    String ENTRY_SELECT = """
            SELECT f.id, f.address, f.host_id, h.name AS host, f.depth, f.via, f.time_added, f.state, f.attempts,
                   f.queue_position
            FROM frontier f
            JOIN hosts h ON h.id = f.host_id
            """;

    @SqlQuery("SELECT id FROM frontier WHERE address = ?")
    Long findId(Address address);

    @SqlQuery(ENTRY_SELECT + "WHERE f.id = ?")
    FrontierEntry find(long id);

    @SqlQuery(ENTRY_SELECT + "WHERE f.address = ?")
    FrontierEntry findByAddress(Address address);

    /**
     * Inserts a pending entry at the back of the queue.
     *
     * @return the new entry's id, or null if the address was already present
     */
    @SqlQuery("""
            INSERT INTO frontier (address, host_id, depth, via, time_added, state, attempts, queue_position)
            VALUES (:address, :hostId, :depth, :via, :timeAdded, 'PENDING', 0,
                    (SELECT coalesce(max(queue_position), 0) + 1 FROM frontier))
            ON CONFLICT (address) DO NOTHING
            RETURNING id""")
    Long insert(Address address, long hostId, int depth, Address via, Instant timeAdded);

    @SqlQuery(ENTRY_SELECT + "WHERE f.state IN ('PENDING', 'IN_FLIGHT') ORDER BY f.queue_position")
    List<FrontierEntry> openEntries();

    @SqlUpdate("UPDATE frontier SET state = 'PENDING' WHERE state = 'IN_FLIGHT'")
    int revertInFlight();

    @SqlUpdate("UPDATE frontier SET state = :state WHERE id = :id AND state = :expected")
    @MustUpdate(1)
    void transition(long id, FrontierEntry.State expected, FrontierEntry.State state);

    /**
     * Moves an in-flight entry to its next state. A retried entry is moved to the back of the queue.
     */
    @SqlUpdate("""
            UPDATE frontier
            SET state = :state,
                attempts = :attempts,
                queue_position = iif(:state = 'PENDING',
                                     (SELECT max(queue_position) + 1 FROM frontier), queue_position)
            WHERE id = :id AND state = 'IN_FLIGHT'""")
    @MustUpdate(1)
    void finish(long id, FrontierEntry.State state, int attempts);

    @SqlQuery("SELECT COUNT(*) FROM frontier WHERE (:state IS NULL OR state = :state)")
    long count(FrontierEntry.State state);

    @SqlQuery(ENTRY_SELECT + """
            WHERE (:state IS NULL OR f.state = :state)
            ORDER BY f.queue_position
            LIMIT :limit OFFSET :offset""")
    List<FrontierEntry> list(FrontierEntry.State state, int limit, long offset);
}
