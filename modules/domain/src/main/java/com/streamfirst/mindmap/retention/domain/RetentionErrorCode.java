package com.streamfirst.mindmap.retention.domain;

/**
 * Typed failure conditions reported by the retention pipeline. Callers switch on these to decide
 * which message to render (upgrade prompt, retry later, quota warning).
 */
public enum RetentionErrorCode {
  /** The billing tier code is not present in the policy catalog. */
  INVALID_POLICY_TIER,

  /** The aggregate usage query failed or timed out. Distinct from a legitimately empty result. */
  QUOTA_DATA_UNAVAILABLE,

  /** Some planned deletions succeeded and others failed. Re-running the pipeline converges. */
  PARTIAL_DELETION_FAILURE,

  /** The whole inventory was consumed without bringing usage under quota. */
  EXHAUSTED_WITHOUT_SATISFACTION
}
