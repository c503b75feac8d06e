package com.streamfirst.mindmap.retention.domain;

import java.util.List;
import java.util.Objects;

/**
 * What the storage collaborator actually removed when asked to delete a batch of snapshots.
 *
 * @param deleted ids confirmed gone
 * @param failed ids that could not be deleted
 */
public record DeletionReport(List<SnapshotId> deleted, List<SnapshotId> failed) {
  public DeletionReport {
    Objects.requireNonNull(deleted, "Deleted ids cannot be null");
    Objects.requireNonNull(failed, "Failed ids cannot be null");
    deleted = List.copyOf(deleted);
    failed = List.copyOf(failed);
  }

  public static DeletionReport empty() {
    return new DeletionReport(List.of(), List.of());
  }

  /** Every id failed, used when the collaborator call itself blew up. */
  public static DeletionReport allFailed(List<SnapshotId> requested) {
    return new DeletionReport(List.of(), requested);
  }

  public boolean hasFailures() {
    return !failed.isEmpty();
  }
}
