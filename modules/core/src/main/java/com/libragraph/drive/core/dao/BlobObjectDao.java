package com.libragraph.drive.core.dao;

import com.libragraph.drive.util.ContentHash;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.Optional;
import java.util.UUID;

@RegisterColumnMapper(ContentHashColumnMapper.class)
@RegisterArgumentFactory(ContentHashArgumentFactory.class)
@RegisterConstructorMapper(BlobObjectRecord.class)
public interface BlobObjectDao {

    @SqlQuery("SELECT * FROM blob_object WHERE owner_id = :ownerId AND content_hash = :hash FOR UPDATE")
    Optional<BlobObjectRecord> findForUpdate(@Bind("ownerId") UUID ownerId, @Bind("hash") ContentHash hash);

    @SqlQuery("SELECT * FROM blob_object WHERE id = :id FOR UPDATE")
    Optional<BlobObjectRecord> findByIdForUpdate(@Bind("id") UUID id);

    @SqlQuery("SELECT * FROM blob_object WHERE id = :id")
    Optional<BlobObjectRecord> findById(@Bind("id") UUID id);

    @SqlUpdate("INSERT INTO blob_object (id, owner_id, content_hash, bucket, storage_key, size_bytes, " +
            "ref_count, created_at) " +
            "VALUES (:id, :ownerId, :contentHash, :bucket, :storageKey, :sizeBytes, :refCount, :createdAt)")
    void insert(@BindMethods BlobObjectRecord blob);

    @SqlUpdate("UPDATE blob_object SET ref_count = ref_count + :delta WHERE id = :id")
    void adjustRefCount(@Bind("id") UUID id, @Bind("delta") int delta);

    @SqlUpdate("DELETE FROM blob_object WHERE id = :id AND ref_count = 0")
    int deleteUnreferenced(@Bind("id") UUID id);
}
