package com.libragraph.drive.core.quota;

import com.libragraph.drive.core.dao.QuotaAccountRecord;

import java.util.UUID;

public record QuotaSnapshot(UUID ownerId, long limit, long used, long reserved) {

    static QuotaSnapshot of(QuotaAccountRecord record) {
        return new QuotaSnapshot(record.ownerId(), record.quotaLimit(), record.usedBytes(), record.reservedBytes());
    }

    public long available() {
        return Math.max(0, limit - used - reserved);
    }
}
