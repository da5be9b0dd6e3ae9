package org.onionscout.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.onionscout.Finding;
import org.onionscout.SearchHit;

import java.util.Collection;
import java.util.List;

@RegisterConstructorMapper(Finding.class)
@RegisterConstructorMapper(SearchHit.class)
public interface FindingDAO {
    /**
     * Inserts findings for a page, ignoring any that repeat an earlier (kind, value) pair for the same page.
     *
     * @return the number of rows inserted for each finding, 0 for ignored duplicates
     */
    @SqlBatch("""
            INSERT OR IGNORE INTO findings (page_id, kind, label, value, byte_offset)
            VALUES (:pageId, :f.kind, :f.label, :f.value, :f.byteOffset)""")
    int[] insertAll(long pageId, @BindMethods("f") Collection<Finding> findings);

    @SqlQuery("SELECT * FROM findings WHERE page_id = ? ORDER BY id")
    List<Finding> forPage(long pageId);

    @SqlQuery("SELECT * FROM findings WHERE page_id IN (<pageIds>) ORDER BY page_id, id")
    List<Finding> forPages(@BindList(value = "pageIds", onEmpty = BindList.EmptyHandling.NULL_STRING) Collection<Long> pageIds);

    @SqlQuery("SELECT COUNT(*) FROM findings")
    long count();

    /**
     * Findings whose value matches, then OK pages whose content hash, title, address or host name matches. Page
     * matches are left out when a kind is given. The pattern is a LIKE pattern with '!' as its escape character.
     */
    String SEARCH_HITS = """
            SELECT f.id AS finding_id, f.page_id, f.kind, f.label, f.value, f.byte_offset,
                   p.address, p.content_hash, p.date, h.name AS host
            FROM findings f
            JOIN pages p ON p.id = f.page_id
            JOIN hosts h ON h.id = p.host_id
            WHERE (:kind IS NULL OR f.kind = :kind)
              AND f.value LIKE :pattern ESCAPE '!'
            UNION ALL
            SELECT NULL, p.id, NULL,
                   CASE WHEN p.content_hash LIKE :pattern ESCAPE '!' THEN 'CONTENT_HASH'
                        WHEN p.title LIKE :pattern ESCAPE '!' THEN 'TITLE'
                        WHEN p.address LIKE :pattern ESCAPE '!' THEN 'ADDRESS'
                        ELSE 'HOST' END,
                   CASE WHEN p.content_hash LIKE :pattern ESCAPE '!' THEN p.content_hash
                        WHEN p.title LIKE :pattern ESCAPE '!' THEN p.title
                        WHEN p.address LIKE :pattern ESCAPE '!' THEN p.address
                        ELSE h.name END,
                   NULL, p.address, p.content_hash, p.date, h.name
            FROM pages p
            JOIN hosts h ON h.id = p.host_id
            WHERE :kind IS NULL
              AND p.outcome = 'OK'
              AND (p.content_hash LIKE :pattern ESCAPE '!'
                OR p.title LIKE :pattern ESCAPE '!'
                OR p.address LIKE :pattern ESCAPE '!'
                OR h.name LIKE :pattern ESCAPE '!')
            """;

    @SqlQuery("SELECT * FROM (" + SEARCH_HITS + """
            ) ORDER BY date DESC, page_id DESC, finding_id DESC
            LIMIT :limit OFFSET :offset""")
    List<SearchHit> search(String pattern, Finding.Kind kind, int limit, long offset);

    @SqlQuery("SELECT COUNT(*) FROM (" + SEARCH_HITS + ")")
    long countSearch(String pattern, Finding.Kind kind);
}
