package org.onionscout.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.onionscout.Page;
import org.onionscout.util.Address;

import java.util.List;

@RegisterConstructorMapper(Page.class)
public interface PageDAO {
    @SqlUpdate("""
            INSERT INTO pages (frontier_id, address, host_id, date, status, outcome, content_hash, size,
                               fetch_time_ms, content_type, title, error)
            VALUES (:frontierId, :address, :hostId, :date, :status, :outcome, :contentHash, :size,
                    :fetchTimeMs, :contentType, :title, :error)""")
    @GetGeneratedKeys
    long insert(@BindMethods Page page);

    @SqlQuery("SELECT * FROM pages WHERE id = ?")
    Page find(long id);

    @SqlQuery("SELECT * FROM pages WHERE address = ? ORDER BY id")
    List<Page> forAddress(Address address);

    @SqlQuery("SELECT * FROM pages WHERE host_id = ? ORDER BY id")
    List<Page> forHost(long hostId);

    @SqlQuery("SELECT * FROM pages WHERE content_hash = ? ORDER BY id")
    List<Page> withContentHash(String contentHash);

    @SqlQuery("SELECT COUNT(*) FROM pages")
    long count();
}
