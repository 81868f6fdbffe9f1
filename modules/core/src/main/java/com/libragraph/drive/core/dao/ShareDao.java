package com.libragraph.drive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Enums bind by name here: resource_type and permission are VARCHAR columns.
 */
@RegisterConstructorMapper(ShareRecord.class)
public interface ShareDao {

    @SqlUpdate("INSERT INTO resource_share (resource_id, resource_type, grantee_id, permission, shared_by, shared_at) " +
            "VALUES (:resourceId, :resourceType, :granteeId, :permission, :sharedBy, :sharedAt)")
    void insert(@BindMethods ShareRecord share);

    @SqlQuery("SELECT * FROM resource_share WHERE resource_id = :resourceId AND grantee_id = :granteeId")
    Optional<ShareRecord> find(@Bind("resourceId") UUID resourceId, @Bind("granteeId") UUID granteeId);

    @SqlQuery("SELECT * FROM resource_share WHERE grantee_id = :granteeId AND resource_id IN (<resourceIds>)")
    List<ShareRecord> findForGrantee(@Bind("granteeId") UUID granteeId,
                                     @BindList("resourceIds") List<UUID> resourceIds);

    @SqlQuery("SELECT * FROM resource_share WHERE resource_id = :resourceId ORDER BY shared_at")
    List<ShareRecord> listForResource(@Bind("resourceId") UUID resourceId);

    @SqlUpdate("DELETE FROM resource_share WHERE resource_id = :resourceId AND grantee_id = :granteeId")
    int delete(@Bind("resourceId") UUID resourceId, @Bind("granteeId") UUID granteeId);
}
