package com.streamfirst.mindmap.retention.domain;

/**
 * Terminal state of a single eviction planning pass.
 */
public enum EvictionOutcome {
  /** Usage was at or below quota; the plan is empty. */
  NOT_REQUIRED,

  /** Planned deletions bring projected usage back to or below quota. */
  SATISFIED,

  /** Every snapshot was planned and usage is still projected over quota. */
  EXHAUSTED
}
