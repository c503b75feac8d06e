package com.streamfirst.mindmap.retention.domain;

/**
 * Thrown when a billing tier code does not name a tier in the policy catalog. Never defaulted
 * silently: an unknown tier could otherwise grant a user more headroom than they pay for.
 */
public class InvalidPolicyTierException extends IllegalArgumentException {

  private final String tierCode;

  public InvalidPolicyTierException(String tierCode) {
    super("Unknown plan tier: " + tierCode);
    this.tierCode = tierCode;
  }

  public String getTierCode() {
    return tierCode;
  }
}
