package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.QuotaAssessment;
import com.streamfirst.mindmap.retention.domain.UsageSnapshot;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class QuotaAssessorTest {

  private final PolicyCatalog catalog = PolicyCatalog.defaults();
  private final QuotaAssessor assessor = new QuotaAssessor(catalog);

  @Test
  void empty_usage_defaults_to_zero_against_free_quota() {
    QuotaAssessment assessment = assessor.assess(Optional.empty());

    assertThat(assessment).isEqualTo(
        new QuotaAssessment(false, 0L, PolicyCatalog.DEFAULT_FREE.storageQuota(), 0.0));
  }

  @Test
  void usage_exactly_at_quota_is_not_exceeded() {
    QuotaAssessment assessment = assessor.assess(UsageSnapshot.of(1000, 1000));

    assertThat(assessment.percentage()).isEqualTo(100.0);
    assertThat(assessment.exceeded()).isFalse();
    assertThat(assessment.overageBytes()).isZero();
  }

  @Test
  void one_byte_over_quota_is_exceeded() {
    QuotaAssessment assessment = assessor.assess(UsageSnapshot.of(1001, 1000));

    assertThat(assessment.exceeded()).isTrue();
    assertThat(assessment.overageBytes()).isEqualTo(1);
  }

  @Test
  void reports_usage_quota_and_percentage() {
    QuotaAssessment assessment = assessor.assess(Optional.of(UsageSnapshot.of(120, 100)));

    assertThat(assessment.usageBytes()).isEqualTo(120);
    assertThat(assessment.quotaBytes()).isEqualTo(100);
    assertThat(assessment.percentage()).isEqualTo(120.0);
    assertThat(assessment.exceeded()).isTrue();
  }
}
