package com.libragraph.drive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(UploadChunkRecord.class)
public interface UploadChunkDao {

    @SqlUpdate("INSERT INTO upload_chunk (session_id, chunk_index, content_tag, part_tag, size_bytes, received_at) " +
            "VALUES (:sessionId, :chunkIndex, :contentTag, :partTag, :sizeBytes, :receivedAt)")
    void insert(@BindMethods UploadChunkRecord chunk);

    @SqlQuery("SELECT * FROM upload_chunk WHERE session_id = :sessionId AND chunk_index = :chunkIndex")
    Optional<UploadChunkRecord> find(@Bind("sessionId") UUID sessionId, @Bind("chunkIndex") int chunkIndex);

    @SqlQuery("SELECT * FROM upload_chunk WHERE session_id = :sessionId ORDER BY chunk_index")
    List<UploadChunkRecord> list(@Bind("sessionId") UUID sessionId);

    @SqlQuery("SELECT COUNT(*) FROM upload_chunk WHERE session_id = :sessionId")
    int count(@Bind("sessionId") UUID sessionId);

    @SqlUpdate("DELETE FROM upload_chunk WHERE session_id = :sessionId")
    int deleteAll(@Bind("sessionId") UUID sessionId);
}
