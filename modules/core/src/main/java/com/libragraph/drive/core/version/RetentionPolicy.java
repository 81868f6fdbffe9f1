package com.libragraph.drive.core.version;

import java.time.Duration;

/**
 * Which historical versions survive pruning. A version is kept if it satisfies any
 * enabled rule. {@code keepLast <= 0} and a null or zero {@code maxAge} disable their rule.
 */
public record RetentionPolicy(int keepLast, Duration maxAge) {

    public static RetentionPolicy keepLast(int n) {
        return new RetentionPolicy(n, null);
    }

    public static RetentionPolicy maxAge(Duration age) {
        return new RetentionPolicy(0, age);
    }

    public boolean countRuleEnabled() {
        return keepLast > 0;
    }

    public boolean ageRuleEnabled() {
        return maxAge != null && !maxAge.isZero() && !maxAge.isNegative();
    }
}
