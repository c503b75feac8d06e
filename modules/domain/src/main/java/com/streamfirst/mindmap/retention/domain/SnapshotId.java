package com.streamfirst.mindmap.retention.domain;

import java.util.Objects;

/**
 * Opaque identifier of one stored edit-history snapshot. Assigned by the storage collaborator.
 *
 * @param value the raw identifier
 */
public record SnapshotId(String value) {
  public SnapshotId {
    Objects.requireNonNull(value, "Snapshot ID cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Snapshot ID cannot be empty");
    }
  }

  public static SnapshotId of(String value) {
    return new SnapshotId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
