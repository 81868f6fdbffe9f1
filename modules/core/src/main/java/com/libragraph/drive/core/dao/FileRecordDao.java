package com.libragraph.drive.core.dao;

import com.libragraph.drive.types.ProcessingStatus;
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
@RegisterColumnMapper(ProcessingStatusColumnMapper.class)
@RegisterArgumentFactory(ContentHashArgumentFactory.class)
@RegisterArgumentFactory(ProcessingStatusArgumentFactory.class)
@RegisterConstructorMapper(FileRecord.class)
public interface FileRecordDao {

    @SqlUpdate("INSERT INTO file_record (id, file_id, owner_id, name, folder_id, bucket, storage_key, " +
            "upload_key, blob_id, size_bytes, content_type, content_hash, version_number, is_current, " +
            "parent_version_id, processing_status, metadata, thumbnail_key, created_at, updated_at, " +
            "deleted_at, last_accessed_at) " +
            "VALUES (:id, :fileId, :ownerId, :name, :folderId, :bucket, :storageKey, " +
            ":uploadKey, :blobId, :sizeBytes, :contentType, :contentHash, :versionNumber, :current, " +
            ":parentVersionId, :processingStatus, :metadata, :thumbnailKey, :createdAt, :updatedAt, " +
            ":deletedAt, :lastAccessedAt)")
    void insert(@BindMethods FileRecord record);

    @SqlQuery("SELECT * FROM file_record WHERE file_id = :fileId AND is_current = TRUE AND deleted_at IS NULL")
    Optional<FileRecord> findCurrent(@Bind("fileId") UUID fileId);

    @SqlQuery("SELECT * FROM file_record WHERE file_id = :fileId AND is_current = TRUE " +
            "AND deleted_at IS NULL FOR UPDATE")
    Optional<FileRecord> findCurrentForUpdate(@Bind("fileId") UUID fileId);

    @SqlQuery("SELECT * FROM file_record WHERE upload_key = :uploadKey")
    Optional<FileRecord> findByUploadKey(@Bind("uploadKey") String uploadKey);

    @SqlQuery("SELECT * FROM file_record WHERE file_id = :fileId ORDER BY version_number")
    List<FileRecord> findLineage(@Bind("fileId") UUID fileId);

    /**
     * Compare-and-set retirement of the current row. Returns 0 if another writer got there first.
     */
    @SqlUpdate("UPDATE file_record SET is_current = FALSE, updated_at = :now " +
            "WHERE id = :id AND is_current = TRUE AND deleted_at IS NULL")
    int retire(@Bind("id") UUID id, @Bind("now") Instant now);

    @SqlUpdate("UPDATE file_record SET last_accessed_at = :now WHERE id = :id")
    void touch(@Bind("id") UUID id, @Bind("now") Instant now);

    @SqlUpdate("UPDATE file_record SET processing_status = :status, metadata = :metadata, " +
            "thumbnail_key = :thumbnailKey, updated_at = :now WHERE id = :id")
    void updateProcessing(@Bind("id") UUID id,
                          @Bind("status") ProcessingStatus status,
                          @Bind("metadata") String metadata,
                          @Bind("thumbnailKey") String thumbnailKey,
                          @Bind("now") Instant now);

    @SqlUpdate("UPDATE file_record SET folder_id = :folderId, name = :name, updated_at = :now " +
            "WHERE file_id = :fileId AND deleted_at IS NULL")
    int relocate(@Bind("fileId") UUID fileId,
                 @Bind("folderId") UUID folderId,
                 @Bind("name") String name,
                 @Bind("now") Instant now);

    @SqlUpdate("UPDATE file_record SET deleted_at = :deletedAt, updated_at = :deletedAt " +
            "WHERE file_id IN (<fileIds>) AND deleted_at IS NULL")
    int softDelete(@BindList("fileIds") List<UUID> fileIds, @Bind("deletedAt") Instant deletedAt);

    @SqlQuery("SELECT * FROM file_record WHERE owner_id = :ownerId AND folder_id = :folderId " +
            "AND is_current = TRUE AND deleted_at IS NULL ORDER BY name")
    List<FileRecord> listInFolder(@Bind("ownerId") UUID ownerId, @Bind("folderId") UUID folderId);

    @SqlQuery("SELECT * FROM file_record WHERE owner_id = :ownerId AND folder_id IS NULL " +
            "AND is_current = TRUE AND deleted_at IS NULL ORDER BY name")
    List<FileRecord> listInRoot(@Bind("ownerId") UUID ownerId);

    @SqlQuery("SELECT * FROM file_record WHERE owner_id = :ownerId AND folder_id IN (<folderIds>) " +
            "AND is_current = TRUE AND deleted_at IS NULL ORDER BY name")
    List<FileRecord> listInFolders(@Bind("ownerId") UUID ownerId,
                                   @BindList("folderIds") List<UUID> folderIds);

    @SqlQuery("SELECT COUNT(*) FROM file_record WHERE file_id = :fileId " +
            "AND is_current = TRUE AND deleted_at IS NULL")
    int countCurrent(@Bind("fileId") UUID fileId);

    /**
     * Drops history rows of a lineage whose version no longer exists in file_version.
     */
    @SqlUpdate("DELETE FROM file_record WHERE file_id = :fileId AND is_current = FALSE " +
            "AND version_number IN (<versions>)")
    int deleteHistory(@Bind("fileId") UUID fileId, @BindList("versions") List<Integer> versions);
}
