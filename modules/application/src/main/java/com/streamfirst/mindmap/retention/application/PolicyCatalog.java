package com.streamfirst.mindmap.retention.application;

import com.streamfirst.mindmap.retention.domain.PlanTier;
import com.streamfirst.mindmap.retention.domain.RetentionPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Maps each plan tier to its retention policy.
 *
 * <p>The catalog is built once and never changes. Construction enforces the upgrade guarantee: the
 * pro policy keeps snapshots at least as long, and allows at least as much storage, as free.
 */
public final class PolicyCatalog {

  public static final long MIB = 1024L * 1024L;

  public static final RetentionPolicy DEFAULT_FREE = RetentionPolicy.of(Duration.ofDays(30), 100 * MIB);
  public static final RetentionPolicy DEFAULT_PRO = RetentionPolicy.of(Duration.ofDays(365), 1024 * MIB);

  private final RetentionPolicy free;
  private final RetentionPolicy pro;

  private PolicyCatalog(RetentionPolicy free, RetentionPolicy pro) {
    this.free = Objects.requireNonNull(free, "Free policy cannot be null");
    this.pro = Objects.requireNonNull(pro, "Pro policy cannot be null");
    if (!pro.dominates(free)) {
      throw new IllegalArgumentException(
          "Pro policy " + pro + " must be at least as generous as free policy " + free);
    }
  }

  public static PolicyCatalog of(RetentionPolicy free, RetentionPolicy pro) {
    return new PolicyCatalog(free, pro);
  }

  public static PolicyCatalog defaults() {
    return new PolicyCatalog(DEFAULT_FREE, DEFAULT_PRO);
  }

  /** Total over {@link PlanTier}; unknown codes are rejected earlier by {@link PlanTier#fromCode}. */
  public RetentionPolicy policyFor(PlanTier tier) {
    return switch (Objects.requireNonNull(tier, "Plan tier cannot be null")) {
      case FREE -> free;
      case PRO -> pro;
    };
  }

  /** The most restrictive policy, used as the fail-safe floor when usage data is absent. */
  public RetentionPolicy floor() {
    return free;
  }

  @Override
  public String toString() {
    return "PolicyCatalog{free=" + free + ", pro=" + pro + '}';
  }
}
