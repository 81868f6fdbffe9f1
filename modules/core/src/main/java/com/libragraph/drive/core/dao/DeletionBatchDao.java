package com.libragraph.drive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(DeletionBatchRecord.class)
@RegisterConstructorMapper(DeletionItemRecord.class)
public interface DeletionBatchDao {

    @SqlUpdate("INSERT INTO deletion_batch (id, owner_id, root_folder_id, deleted_at, created_at, completed_at) " +
            "VALUES (:id, :ownerId, :rootFolderId, :deletedAt, :createdAt, :completedAt)")
    void insert(@BindMethods DeletionBatchRecord batch);

    @SqlBatch("INSERT INTO deletion_batch_item (batch_id, seq, resource_type, resource_id, applied) " +
            "VALUES (:batchId, :seq, :resourceType, :resourceId, :applied)")
    void insertItems(@BindMethods List<DeletionItemRecord> items);

    @SqlQuery("SELECT * FROM deletion_batch WHERE id = :id")
    Optional<DeletionBatchRecord> findById(@Bind("id") UUID id);

    @SqlQuery("SELECT * FROM deletion_batch WHERE completed_at IS NULL ORDER BY created_at")
    List<DeletionBatchRecord> findIncomplete();

    @SqlQuery("SELECT * FROM deletion_batch_item WHERE batch_id = :batchId AND applied = FALSE " +
            "ORDER BY seq LIMIT :limit")
    List<DeletionItemRecord> findPendingItems(@Bind("batchId") UUID batchId, @Bind("limit") int limit);

    @SqlQuery("SELECT COUNT(*) FROM deletion_batch_item WHERE batch_id = :batchId")
    int countItems(@Bind("batchId") UUID batchId);

    @SqlQuery("SELECT resource_id FROM deletion_batch_item WHERE batch_id = :batchId " +
            "AND resource_type = 'FOLDER'")
    List<UUID> listFolderIds(@Bind("batchId") UUID batchId);

    @SqlUpdate("UPDATE deletion_batch_item SET applied = TRUE WHERE batch_id = :batchId AND seq IN (<seqs>)")
    int markApplied(@Bind("batchId") UUID batchId, @BindList("seqs") List<Integer> seqs);

    @SqlUpdate("UPDATE deletion_batch SET completed_at = :now WHERE id = :id AND completed_at IS NULL")
    int complete(@Bind("id") UUID id, @Bind("now") Instant now);
}
