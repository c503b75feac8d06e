package com.streamfirst.mindmap.retention.domain;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotMetadataTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Test
  void age_is_clamped_at_zero_for_future_timestamps() {
    var future = SnapshotMetadata.of("s", NOW.plusSeconds(30), false, 1);
    var past = SnapshotMetadata.of("s", NOW.minus(Duration.ofHours(1)), false, 1);

    assertThat(future.ageMillisAt(NOW)).isZero();
    assertThat(past.ageMillisAt(NOW)).isEqualTo(Duration.ofHours(1).toMillis());
  }

  @Test
  void rejects_negative_size_and_blank_id() {
    assertThatThrownBy(() -> SnapshotMetadata.of("s", NOW, false, -1)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SnapshotMetadata.of(" ", NOW, false, 1)).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void builder_carries_history_fields() {
    var snapshot = SnapshotMetadata.builder()
        .id(SnapshotId.of("s-1"))
        .createdAt(NOW)
        .major(true)
        .sizeBytes(42)
        .mapId(MapId.of("map-7"))
        .actionName("Manual Checkpoint")
        .build();

    assertThat(snapshot.isMajor()).isTrue();
    assertThat(snapshot.getMapId()).isEqualTo(MapId.of("map-7"));
    assertThat(snapshot.getActionName()).isEqualTo("Manual Checkpoint");
  }
}
