package com.streamfirst.mindmap.retention.domain;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

/**
 * Metadata of one stored edit-history snapshot. Immutable once written; the payload itself stays
 * with the storage collaborator and never crosses into the retention engine.
 */
@Value
@EqualsAndHashCode(of = "id")
public class SnapshotMetadata {
  /** Storage-assigned identifier */
  @NonNull SnapshotId id;

  /** When the edit that produced this snapshot was committed */
  @NonNull Instant createdAt;

  /** Flagged checkpoint (named save) that should outlive routine auto-saves */
  boolean major;

  /** Serialized payload size in bytes */
  long sizeBytes;

  /** Mind map the snapshot belongs to, null when the collaborator does not report it */
  MapId mapId;

  /** Label of the edit, e.g. "Manual Checkpoint" or "baseline"; may be null */
  String actionName;

  @Builder
  private SnapshotMetadata(
      @NonNull SnapshotId id,
      @NonNull Instant createdAt,
      boolean major,
      long sizeBytes,
      MapId mapId,
      String actionName) {
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("Snapshot size cannot be negative: " + sizeBytes);
    }
    this.id = id;
    this.createdAt = createdAt;
    this.major = major;
    this.sizeBytes = sizeBytes;
    this.mapId = mapId;
    this.actionName = actionName;
  }

  public static SnapshotMetadata of(String id, Instant createdAt, boolean major, long sizeBytes) {
    return builder()
        .id(SnapshotId.of(id))
        .createdAt(createdAt)
        .major(major)
        .sizeBytes(sizeBytes)
        .build();
  }

  /**
   * Milliseconds elapsed between creation and {@code now}. Clamped at zero so a snapshot stamped
   * slightly in the future by a skewed writer is treated as brand new.
   */
  public long ageMillisAt(Instant now) {
    return Math.max(0L, Duration.between(createdAt, now).toMillis());
  }

  @Override
  public String toString() {
    return "SnapshotMetadata{"
        + "id="
        + id
        + ", createdAt="
        + createdAt
        + ", major="
        + major
        + ", sizeBytes="
        + sizeBytes
        + '}';
  }
}
