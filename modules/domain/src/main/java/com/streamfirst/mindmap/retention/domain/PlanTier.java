package com.streamfirst.mindmap.retention.domain;

import java.util.Locale;

/**
 * Billing tiers that select a {@link RetentionPolicy}. Exactly two exist.
 */
public enum PlanTier {
  FREE("free"),
  PRO("pro");

  private final String code;

  PlanTier(String code) {
    this.code = code;
  }

  /** The lower-case code used by the billing component. */
  public String code() {
    return code;
  }

  /**
   * Parses a billing code such as {@code "free"} or {@code " PRO "}.
   *
   * @throws InvalidPolicyTierException if the code is null, blank or unknown
   */
  public static PlanTier fromCode(String code) {
    if (code == null) {
      throw new InvalidPolicyTierException(null);
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (PlanTier tier : values()) {
      if (tier.code.equals(normalized)) {
        return tier;
      }
    }
    throw new InvalidPolicyTierException(code);
  }

  @Override
  public String toString() {
    return code;
  }
}
