package com.libragraph.drive.core.dao;

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

@RegisterConstructorMapper(FolderRecord.class)
public interface FolderDao {

    @SqlUpdate("INSERT INTO folder (id, owner_id, name, parent_id, path, color, icon, " +
            "created_at, updated_at, deleted_at) " +
            "VALUES (:id, :ownerId, :name, :parentId, :path, :color, :icon, " +
            ":createdAt, :updatedAt, :deletedAt)")
    void insert(@BindMethods FolderRecord folder);

    @SqlQuery("SELECT * FROM folder WHERE id = :id")
    Optional<FolderRecord> findById(@Bind("id") UUID id);

    @SqlQuery("SELECT * FROM folder WHERE id = :id AND owner_id = :ownerId AND deleted_at IS NULL")
    Optional<FolderRecord> findActive(@Bind("ownerId") UUID ownerId, @Bind("id") UUID id);

    @SqlQuery("SELECT * FROM folder WHERE owner_id = :ownerId AND parent_id = :parentId " +
            "AND name = :name AND deleted_at IS NULL")
    Optional<FolderRecord> findActiveChild(@Bind("ownerId") UUID ownerId,
                                           @Bind("parentId") UUID parentId,
                                           @Bind("name") String name);

    @SqlQuery("SELECT * FROM folder WHERE owner_id = :ownerId AND parent_id IS NULL " +
            "AND name = :name AND deleted_at IS NULL")
    Optional<FolderRecord> findActiveRootChild(@Bind("ownerId") UUID ownerId, @Bind("name") String name);

    @SqlQuery("SELECT * FROM folder WHERE owner_id = :ownerId AND parent_id = :parentId " +
            "AND deleted_at IS NULL ORDER BY name")
    List<FolderRecord> listChildren(@Bind("ownerId") UUID ownerId, @Bind("parentId") UUID parentId);

    @SqlQuery("SELECT * FROM folder WHERE owner_id = :ownerId AND parent_id IS NULL " +
            "AND deleted_at IS NULL ORDER BY name")
    List<FolderRecord> listRoot(@Bind("ownerId") UUID ownerId);

    /**
     * Active folders whose path matches an escaped {@code LIKE} prefix pattern.
     */
    @SqlQuery("SELECT * FROM folder WHERE owner_id = :ownerId AND path LIKE :pattern ESCAPE '\\' " +
            "AND deleted_at IS NULL ORDER BY path")
    List<FolderRecord> listByPathPrefix(@Bind("ownerId") UUID ownerId, @Bind("pattern") String pattern);

    @SqlUpdate("UPDATE folder SET name = :name, parent_id = :parentId, path = :path, updated_at = :now " +
            "WHERE id = :id")
    void relocate(@Bind("id") UUID id,
                  @Bind("parentId") UUID parentId,
                  @Bind("name") String name,
                  @Bind("path") String path,
                  @Bind("now") Instant now);

    /**
     * Replaces the first {@code cut - 1} characters of every matching path with {@code newPrefix}.
     */
    @SqlUpdate("UPDATE folder SET path = :newPrefix || SUBSTRING(path, :cut), updated_at = :now " +
            "WHERE owner_id = :ownerId AND path LIKE :pattern ESCAPE '\\' AND deleted_at IS NULL")
    int rewritePathPrefix(@Bind("ownerId") UUID ownerId,
                          @Bind("pattern") String pattern,
                          @Bind("newPrefix") String newPrefix,
                          @Bind("cut") int cut,
                          @Bind("now") Instant now);

    @SqlUpdate("UPDATE folder SET color = :color, icon = :icon, updated_at = :now WHERE id = :id")
    void updateAppearance(@Bind("id") UUID id,
                          @Bind("color") String color,
                          @Bind("icon") String icon,
                          @Bind("now") Instant now);

    @SqlUpdate("UPDATE folder SET deleted_at = :deletedAt, updated_at = :deletedAt " +
            "WHERE id IN (<ids>) AND deleted_at IS NULL")
    int softDelete(@BindList("ids") List<UUID> ids, @Bind("deletedAt") Instant deletedAt);
}
