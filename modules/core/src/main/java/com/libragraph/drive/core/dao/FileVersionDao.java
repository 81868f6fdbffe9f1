package com.libragraph.drive.core.dao;

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
@RegisterArgumentFactory(ContentHashArgumentFactory.class)
@RegisterConstructorMapper(FileVersionRecord.class)
public interface FileVersionDao {

    @SqlUpdate("INSERT INTO file_version (id, file_id, version_number, bucket, storage_key, blob_id, " +
            "size_bytes, content_hash, description, created_by, created_at, restored_at, restored_from) " +
            "VALUES (:id, :fileId, :versionNumber, :bucket, :storageKey, :blobId, " +
            ":sizeBytes, :contentHash, :description, :createdBy, :createdAt, :restoredAt, :restoredFrom)")
    void insert(@BindMethods FileVersionRecord version);

    @SqlQuery("SELECT * FROM file_version WHERE file_id = :fileId ORDER BY version_number")
    List<FileVersionRecord> listByFile(@Bind("fileId") UUID fileId);

    @SqlQuery("SELECT * FROM file_version WHERE file_id = :fileId AND version_number = :versionNumber")
    Optional<FileVersionRecord> find(@Bind("fileId") UUID fileId, @Bind("versionNumber") int versionNumber);

    @SqlQuery("SELECT COALESCE(MAX(version_number), 0) FROM file_version WHERE file_id = :fileId")
    int maxVersion(@Bind("fileId") UUID fileId);

    @SqlUpdate("UPDATE file_version SET restored_at = :now WHERE id = :id")
    void markRestored(@Bind("id") UUID id, @Bind("now") Instant now);

    @SqlUpdate("DELETE FROM file_version WHERE id IN (<ids>)")
    int delete(@BindList("ids") List<UUID> ids);
}
