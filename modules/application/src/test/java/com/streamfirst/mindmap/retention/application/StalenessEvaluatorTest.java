package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.RetentionPolicy;
import com.streamfirst.mindmap.retention.domain.SnapshotMetadata;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class StalenessEvaluatorTest {

  private static final RetentionPolicy POLICY = RetentionPolicy.of(Duration.ofDays(30), 1024);
  private static final long MAX_AGE = POLICY.maxAgeMillis();

  private final StalenessEvaluator evaluator = new StalenessEvaluator();

  @Test
  void ordinary_snapshot_becomes_stale_strictly_after_max_age() {
    assertThat(evaluator.isStale(0, false, POLICY)).isFalse();
    assertThat(evaluator.isStale(MAX_AGE - 1, false, POLICY)).isFalse();
    assertThat(evaluator.isStale(MAX_AGE, false, POLICY)).isFalse();
    assertThat(evaluator.isStale(MAX_AGE + 1, false, POLICY)).isTrue();
  }

  @Test
  void major_snapshot_uses_double_max_age() {
    assertThat(evaluator.isStale(MAX_AGE + 1, true, POLICY)).isFalse();
    assertThat(evaluator.isStale(2 * MAX_AGE, true, POLICY)).isFalse();
    assertThat(evaluator.isStale(2 * MAX_AGE + 1, true, POLICY)).isTrue();
  }

  @Test
  void sixty_five_day_major_and_thirty_five_day_ordinary_are_both_stale() {
    assertThat(evaluator.isStale(Duration.ofDays(65).toMillis(), true, POLICY)).isTrue();
    assertThat(evaluator.isStale(Duration.ofDays(35).toMillis(), false, POLICY)).isTrue();
  }

  @Test
  void derives_age_from_creation_time() {
    var now = Instant.parse("2026-03-01T00:00:00Z");
    var old = SnapshotMetadata.of("old", now.minus(Duration.ofDays(31)), false, 10);
    var fresh = SnapshotMetadata.of("fresh", now.minus(Duration.ofDays(29)), false, 10);
    var future = SnapshotMetadata.of("skewed", now.plus(Duration.ofMinutes(5)), false, 10);

    assertThat(evaluator.isStale(old, now, POLICY)).isTrue();
    assertThat(evaluator.isStale(fresh, now, POLICY)).isFalse();
    assertThat(evaluator.isStale(future, now, POLICY)).isFalse();
  }
}
