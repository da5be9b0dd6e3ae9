package org.onionscout.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.onionscout.Extract;

import java.util.Collection;
import java.util.List;

@RegisterConstructorMapper(Extract.class)
public interface ExtractDAO {
    @SqlBatch("INSERT INTO extracts (page_id, kind, content) VALUES (:pageId, :e.kind, :e.content)")
    void insertAll(long pageId, @BindMethods("e") Collection<Extract> extracts);

    @SqlQuery("SELECT * FROM extracts WHERE page_id = ? ORDER BY id")
    List<Extract> forPage(long pageId);

    @SqlQuery("SELECT * FROM extracts WHERE page_id IN (<pageIds>) ORDER BY page_id, id")
    List<Extract> forPages(@BindList(value = "pageIds", onEmpty = BindList.EmptyHandling.NULL_STRING) Collection<Long> pageIds);
}
