package com.libragraph.drive.core.quota;

import com.libragraph.drive.core.dao.QuotaAccountRecord;
import com.libragraph.drive.core.dao.QuotaDao;
import com.libragraph.drive.core.dao.QuotaReservationRecord;
import com.libragraph.drive.core.db.Constraints;
import com.libragraph.drive.core.error.DriveException;
import com.libragraph.drive.types.QuotaTier;
import com.libragraph.drive.util.KeyedLocks;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Per-owner storage accounting.
 *
 * <p>Usage is tracked in physical bytes: content that deduplicates against an existing blob
 * costs nothing. Every mutation runs under the owner's in-process lock and inside a
 * transaction holding the account row lock, so concurrent reservations for one owner can
 * never jointly overshoot the limit. Accounts are created on first use with
 * {@code drive.quota.default-limit}.
 */
@ApplicationScoped
public class QuotaLedger {

    private static final Logger log = Logger.getLogger(QuotaLedger.class);

    private final Jdbi jdbi;
    private final Clock clock;
    private final long defaultLimit;
    private final KeyedLocks<UUID> ownerLocks = new KeyedLocks<>();

    @Inject
    public QuotaLedger(Jdbi jdbi,
                       Clock clock,
                       @ConfigProperty(name = "drive.quota.default-limit", defaultValue = "10737418240")
                       long defaultLimit) {
        this.jdbi = jdbi;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
    }

    /**
     * Creates the account with the tier's limit. An existing account is left unchanged.
     */
    public QuotaSnapshot openAccount(UUID ownerId, QuotaTier tier) {
        return openAccount(ownerId, tier.limitBytes());
    }

    public QuotaSnapshot openAccount(UUID ownerId, long limit) {
        requireNonNegative(limit, "limit");
        ensureAccount(ownerId, limit);
        return account(ownerId);
    }

    /**
     * Changes the limit. Lowering it below current usage is allowed; further reservations fail.
     */
    public QuotaSnapshot setLimit(UUID ownerId, long limit) {
        requireNonNegative(limit, "limit");
        ensureAccount(ownerId, defaultLimit);
        return ownerLocks.withLock(ownerId, () -> jdbi.inTransaction(h -> {
            QuotaDao dao = h.attach(QuotaDao.class);
            dao.findForUpdate(ownerId);
            dao.updateLimit(ownerId, limit, clock.instant());
            log.infof("Quota limit for %s set to %d", ownerId, limit);
            return QuotaSnapshot.of(dao.find(ownerId).orElseThrow());
        }));
    }

    public QuotaSnapshot account(UUID ownerId) {
        return jdbi.withExtension(QuotaDao.class, dao -> dao.find(ownerId))
                .map(QuotaSnapshot::of)
                .orElseGet(() -> new QuotaSnapshot(ownerId, defaultLimit, 0, 0));
    }

    /**
     * Holds {@code bytes} against the owner's remaining quota.
     *
     * @throws DriveException QUOTA_EXCEEDED if {@code used + reserved + bytes > limit};
     *                        nothing is reserved in that case
     */
    public Reservation reserve(UUID ownerId, long bytes) {
        requireNonNegative(bytes, "bytes");
        ensureAccount(ownerId, defaultLimit);
        return ownerLocks.withLock(ownerId, () -> jdbi.inTransaction(h -> {
            QuotaDao dao = h.attach(QuotaDao.class);
            QuotaAccountRecord acct = lockAccount(dao, ownerId);
            if (acct.usedBytes() + acct.reservedBytes() + bytes > acct.quotaLimit()) {
                throw DriveException.quotaExceeded(ownerId, acct.usedBytes(), acct.reservedBytes(),
                        acct.quotaLimit(), bytes);
            }
            Instant now = clock.instant();
            UUID id = UUID.randomUUID();
            dao.insertReservation(id, ownerId, bytes, now);
            dao.updateBalances(ownerId, acct.usedBytes(), acct.reservedBytes() + bytes, now);
            log.debugf("Reserved %d bytes for %s (reservation %s)", bytes, ownerId, id);
            return new Reservation(id, ownerId, bytes, now);
        }));
    }

    /**
     * Converts a reservation into permanent usage of {@code actualBytes}.
     * A differing actual size is accepted; the blob store is the source of truth.
     *
     * @throws DriveException INVALID_STATE if the reservation was already committed or released
     */
    public QuotaSnapshot commit(UUID ownerId, UUID reservationId, long actualBytes) {
        requireNonNegative(actualBytes, "actualBytes");
        return ownerLocks.withLock(ownerId, () -> jdbi.inTransaction(h -> {
            QuotaDao dao = h.attach(QuotaDao.class);
            QuotaAccountRecord acct = lockAccount(dao, ownerId);
            QuotaReservationRecord reservation = dao.findReservation(reservationId, ownerId)
                    .orElseThrow(() -> DriveException.invalidState(
                            "Reservation " + reservationId + " is not open for " + ownerId));
            if (actualBytes > reservation.bytes()) {
                log.warnf("Commit for %s exceeds reservation %s: %d > %d bytes",
                        ownerId, reservationId, actualBytes, reservation.bytes());
            }
            long reserved = Math.max(0, acct.reservedBytes() - reservation.bytes());
            long used = Math.max(0, acct.usedBytes() + actualBytes);
            dao.deleteReservation(reservationId);
            dao.updateBalances(ownerId, used, reserved, clock.instant());
            log.debugf("Committed %d bytes for %s (reservation %s)", actualBytes, ownerId, reservationId);
            return new QuotaSnapshot(ownerId, acct.quotaLimit(), used, reserved);
        }));
    }

    /**
     * Cancels a reservation without touching committed usage. Idempotent.
     *
     * @return true if the reservation was open
     */
    public boolean release(UUID ownerId, UUID reservationId) {
        return ownerLocks.withLock(ownerId, () -> jdbi.inTransaction(h -> {
            QuotaDao dao = h.attach(QuotaDao.class);
            Optional<QuotaAccountRecord> maybeAcct = dao.findForUpdate(ownerId);
            if (maybeAcct.isEmpty()) {
                return false;
            }
            QuotaAccountRecord acct = maybeAcct.get();
            Optional<QuotaReservationRecord> reservation = dao.findReservation(reservationId, ownerId);
            if (reservation.isEmpty()) {
                return false;
            }
            dao.deleteReservation(reservationId);
            dao.updateBalances(ownerId, acct.usedBytes(),
                    Math.max(0, acct.reservedBytes() - reservation.get().bytes()), clock.instant());
            log.debugf("Released reservation %s for %s", reservationId, ownerId);
            return true;
        }));
    }

    /**
     * Returns freed physical bytes to the owner. Usage never goes below zero.
     */
    public QuotaSnapshot reclaim(UUID ownerId, long bytes) {
        requireNonNegative(bytes, "bytes");
        ensureAccount(ownerId, defaultLimit);
        return ownerLocks.withLock(ownerId, () -> jdbi.inTransaction(h -> {
            QuotaDao dao = h.attach(QuotaDao.class);
            QuotaAccountRecord acct = lockAccount(dao, ownerId);
            long used = Math.max(0, acct.usedBytes() - bytes);
            dao.updateBalances(ownerId, used, acct.reservedBytes(), clock.instant());
            return new QuotaSnapshot(ownerId, acct.quotaLimit(), used, acct.reservedBytes());
        }));
    }

    private QuotaAccountRecord lockAccount(QuotaDao dao, UUID ownerId) {
        return dao.findForUpdate(ownerId)
                .orElseThrow(() -> DriveException.notFound("Quota account", ownerId));
    }

    private void ensureAccount(UUID ownerId, long limit) {
        if (jdbi.withExtension(QuotaDao.class, dao -> dao.find(ownerId)).isPresent()) {
            return;
        }
        try {
            jdbi.useExtension(QuotaDao.class, dao -> dao.insert(ownerId, limit, clock.instant()));
            log.infof("Opened quota account for %s with limit %d", ownerId, limit);
        } catch (JdbiException e) {
            if (!Constraints.isUniqueViolation(e)) {
                throw e;
            }
            log.debugf("Quota account for %s created concurrently", ownerId);
        }
    }

    private static void requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, got " + value);
        }
    }
}
