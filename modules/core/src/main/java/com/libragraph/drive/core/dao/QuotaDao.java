package com.libragraph.drive.core.dao;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@RegisterConstructorMapper(QuotaAccountRecord.class)
@RegisterConstructorMapper(QuotaReservationRecord.class)
public interface QuotaDao {

    @SqlQuery("SELECT * FROM quota_account WHERE owner_id = :ownerId")
    Optional<QuotaAccountRecord> find(@Bind("ownerId") UUID ownerId);

    @SqlQuery("SELECT * FROM quota_account WHERE owner_id = :ownerId FOR UPDATE")
    Optional<QuotaAccountRecord> findForUpdate(@Bind("ownerId") UUID ownerId);

    @SqlUpdate("INSERT INTO quota_account (owner_id, quota_limit, used_bytes, reserved_bytes, updated_at) " +
            "VALUES (:ownerId, :limit, 0, 0, :now)")
    void insert(@Bind("ownerId") UUID ownerId, @Bind("limit") long limit, @Bind("now") Instant now);

    @SqlUpdate("UPDATE quota_account SET used_bytes = :used, reserved_bytes = :reserved, updated_at = :now " +
            "WHERE owner_id = :ownerId")
    void updateBalances(@Bind("ownerId") UUID ownerId,
                        @Bind("used") long used,
                        @Bind("reserved") long reserved,
                        @Bind("now") Instant now);

    @SqlUpdate("UPDATE quota_account SET quota_limit = :limit, updated_at = :now WHERE owner_id = :ownerId")
    void updateLimit(@Bind("ownerId") UUID ownerId, @Bind("limit") long limit, @Bind("now") Instant now);

    @SqlUpdate("INSERT INTO quota_reservation (id, owner_id, bytes, created_at) " +
            "VALUES (:id, :ownerId, :bytes, :now)")
    void insertReservation(@Bind("id") UUID id,
                           @Bind("ownerId") UUID ownerId,
                           @Bind("bytes") long bytes,
                           @Bind("now") Instant now);

    @SqlQuery("SELECT * FROM quota_reservation WHERE id = :id AND owner_id = :ownerId")
    Optional<QuotaReservationRecord> findReservation(@Bind("id") UUID id, @Bind("ownerId") UUID ownerId);

    @SqlUpdate("DELETE FROM quota_reservation WHERE id = :id")
    int deleteReservation(@Bind("id") UUID id);
}
