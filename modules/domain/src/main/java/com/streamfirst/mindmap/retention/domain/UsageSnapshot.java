package com.streamfirst.mindmap.retention.domain;

/**
 * Aggregate snapshot storage for one user at one point in time, as reported by the storage
 * collaborator. Computed per run and never persisted by the engine.
 *
 * @param totalBytes bytes currently held across all of the user's snapshots
 * @param quotaBytes ceiling those bytes are measured against
 */
public record UsageSnapshot(long totalBytes, long quotaBytes) {
  public UsageSnapshot {
    if (totalBytes < 0) {
      throw new IllegalArgumentException("Total bytes cannot be negative: " + totalBytes);
    }
    if (quotaBytes <= 0) {
      throw new IllegalArgumentException("Quota bytes must be positive: " + quotaBytes);
    }
  }

  public static UsageSnapshot of(long totalBytes, long quotaBytes) {
    return new UsageSnapshot(totalBytes, quotaBytes);
  }

  public double percentage() {
    return (double) totalBytes / quotaBytes * 100.0;
  }

  /** Usage after {@code reclaimedBytes} have been deleted, floored at zero. */
  public UsageSnapshot minus(long reclaimedBytes) {
    return new UsageSnapshot(Math.max(0L, totalBytes - reclaimedBytes), quotaBytes);
  }
}
