package com.streamfirst.mindmap.retention.domain;

import java.time.Duration;
import java.util.Objects;

/**
 * Age and storage limits applied to one plan tier's snapshot history.
 *
 * <p>Ordinary snapshots older than {@code maxAge} are stale; major snapshots get twice that.
 * {@code storageQuota} is the aggregate byte ceiling across all of a user's snapshots.
 *
 * @param maxAge age past which an ordinary snapshot becomes stale, strictly positive
 * @param storageQuota aggregate byte ceiling, strictly positive
 */
public record RetentionPolicy(Duration maxAge, long storageQuota) {

  /** Major snapshots outlive ordinary ones by this factor. */
  public static final int MAJOR_AGE_MULTIPLIER = 2;

  public RetentionPolicy {
    Objects.requireNonNull(maxAge, "Max age cannot be null");
    if (maxAge.isZero() || maxAge.isNegative()) {
      throw new IllegalArgumentException("Max age must be positive: " + maxAge);
    }
    try {
      Math.multiplyExact(MAJOR_AGE_MULTIPLIER, maxAge.toMillis());
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Max age too large to express in milliseconds: " + maxAge, e);
    }
    if (storageQuota <= 0) {
      throw new IllegalArgumentException("Storage quota must be positive: " + storageQuota);
    }
  }

  public static RetentionPolicy of(Duration maxAge, long storageQuota) {
    return new RetentionPolicy(maxAge, storageQuota);
  }

  public long maxAgeMillis() {
    return maxAge.toMillis();
  }

  /** Staleness threshold for major snapshots. */
  public long majorMaxAgeMillis() {
    return Math.multiplyExact(MAJOR_AGE_MULTIPLIER, maxAge.toMillis());
  }

  /** True when this policy is at least as generous as {@code other} on both axes. */
  public boolean dominates(RetentionPolicy other) {
    return maxAge.compareTo(other.maxAge) >= 0 && storageQuota >= other.storageQuota;
  }
}
