package com.streamfirst.mindmap.retention.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultTest {

  @Test
  void flat_map_preserves_error_code() {
    Result<String> failed = Result.failure("no tier", RetentionErrorCode.INVALID_POLICY_TIER);

    Result<Integer> mapped = failed.flatMap(s -> Result.success(s.length()));

    assertThat(mapped.isFailure()).isTrue();
    assertThat(mapped.hasErrorCode(RetentionErrorCode.INVALID_POLICY_TIER)).isTrue();
    assertThat(mapped.getErrorMessage()).contains("no tier");
  }

  @Test
  void or_else_throw_includes_the_code() {
    Result<String> failed = Result.failure("down", RetentionErrorCode.QUOTA_DATA_UNAVAILABLE);

    assertThatThrownBy(failed::orElseThrow)
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("down (code: QUOTA_DATA_UNAVAILABLE)");
  }

  @Test
  void success_is_never_tagged() {
    Result<String> ok = Result.success("run");

    assertThat(ok.hasErrorCode(RetentionErrorCode.INVALID_POLICY_TIER)).isFalse();
    assertThat(ok.map(String::length).orElse(0)).isEqualTo(3);
  }
}
