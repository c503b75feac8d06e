package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.QuotaAssessment;
import com.streamfirst.mindmap.retention.domain.UsageSnapshot;

import java.util.Objects;
import java.util.Optional;

/**
 * Measures aggregate usage against a quota.
 *
 * <p>Missing usage data (a user with no snapshots) assesses as zero usage against the free
 * tier's quota. This only applies to a legitimately empty result; a failed usage query must be
 * handled by the caller before reaching here.
 */
public final class QuotaAssessor {

  private final PolicyCatalog catalog;

  public QuotaAssessor(PolicyCatalog catalog) {
    this.catalog = Objects.requireNonNull(catalog, "Policy catalog cannot be null");
  }

  public QuotaAssessment assess(UsageSnapshot usage) {
    double percentage = usage.percentage();
    return new QuotaAssessment(percentage > 100.0, usage.totalBytes(), usage.quotaBytes(), percentage);
  }

  public QuotaAssessment assess(Optional<UsageSnapshot> usage) {
    return usage.map(this::assess).orElseGet(this::emptyUsage);
  }

  private QuotaAssessment emptyUsage() {
    return new QuotaAssessment(false, 0L, catalog.floor().storageQuota(), 0.0);
  }
}
