package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.UploadStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterColumnMapper(ContentHashColumnMapper.class)
@RegisterColumnMapper(UploadStatusColumnMapper.class)
@RegisterArgumentFactory(ContentHashArgumentFactory.class)
@RegisterArgumentFactory(UploadStatusArgumentFactory.class)
@RegisterConstructorMapper(UploadSessionRecord.class)
public interface UploadSessionDao {

    @SqlUpdate("INSERT INTO upload_session (id, owner_id, file_id, file_name, folder_id, content_type, " +
            "declared_size, chunk_size, expected_chunks, bucket, storage_key, multipart_id, reservation_id, " +
            "expected_hash, status, result_file_id, result_version, warning, failure, " +
            "created_at, updated_at, expires_at) " +
            "VALUES (:id, :ownerId, :fileId, :fileName, :folderId, :contentType, " +
            ":declaredSize, :chunkSize, :expectedChunks, :bucket, :storageKey, :multipartId, :reservationId, " +
            ":expectedHash, :status, :resultFileId, :resultVersion, :warning, :failure, " +
            ":createdAt, :updatedAt, :expiresAt)")
    void insert(@BindMethods UploadSessionRecord session);

    @SqlQuery("SELECT * FROM upload_session WHERE id = :id")
    Optional<UploadSessionRecord> findById(@Bind("id") UUID id);

    /**
     * Compare-and-set status change. Returns 0 if the session was not in {@code from}.
     */
    @SqlUpdate("UPDATE upload_session SET status = :to, updated_at = :now WHERE id = :id AND status = :from")
    int transition(@Bind("id") UUID id,
                   @Bind("from") UploadStatus from,
                   @Bind("to") UploadStatus to,
                   @Bind("now") Instant now);

    @SqlUpdate("UPDATE upload_session SET updated_at = :now WHERE id = :id")
    void touch(@Bind("id") UUID id, @Bind("now") Instant now);

    @SqlUpdate("UPDATE upload_session SET failure = :failure, updated_at = :now WHERE id = :id")
    void recordFailure(@Bind("id") UUID id, @Bind("failure") String failure, @Bind("now") Instant now);

    @SqlUpdate("UPDATE upload_session SET status = :completed, result_file_id = :fileId, " +
            "result_version = :version, warning = :warning, failure = NULL, updated_at = :now " +
            "WHERE id = :id AND status = :completing")
    int markCompleted(@Bind("id") UUID id,
                      @Bind("fileId") UUID fileId,
                      @Bind("version") int version,
                      @Bind("warning") String warning,
                      @Bind("completing") UploadStatus completing,
                      @Bind("completed") UploadStatus completed,
                      @Bind("now") Instant now);

    @SqlUpdate("UPDATE upload_session SET status = :aborted, failure = :reason, updated_at = :now " +
            "WHERE id = :id AND status IN (<open>)")
    int markAborted(@Bind("id") UUID id,
                    @Bind("reason") String reason,
                    @BindList("open") List<UploadStatus> open,
                    @Bind("aborted") UploadStatus aborted,
                    @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM upload_session WHERE status IN (<statuses>) " +
            "AND (updated_at < :idleCutoff OR expires_at < :now) ORDER BY updated_at LIMIT :limit")
    List<UploadSessionRecord> findStale(@BindList("statuses") List<UploadStatus> statuses,
                                        @Bind("idleCutoff") Instant idleCutoff,
                                        @Bind("now") Instant now,
                                        @Bind("limit") int limit);

    @SqlQuery("SELECT id FROM upload_session WHERE status IN (<terminal>) AND updated_at < :cutoff " +
            "ORDER BY updated_at LIMIT :limit")
    List<UUID> findTombstones(@BindList("terminal") List<UploadStatus> terminal,
                              @Bind("cutoff") Instant cutoff,
                              @Bind("limit") int limit);

    @SqlUpdate("DELETE FROM upload_session WHERE id = :id")
    int delete(@Bind("id") UUID id);
}
