package com.streamfirst.mindmap.retention.domain;

/**
 * How a retention run ended once its plan was executed.
 */
public enum RetentionStatus {
  /** Nothing to delete. */
  COMPLIANT,
  /** Every planned deletion succeeded. */
  RECLAIMED,
  /** At least one planned deletion failed; re-run to converge. */
  PARTIAL_DELETION_FAILURE,
  /** Everything deletable was deleted and usage is still over quota. */
  EXHAUSTED_WITHOUT_SATISFACTION;

  /** The error code a caller reports for this status, or null for the clean states. */
  public RetentionErrorCode errorCode() {
    return switch (this) {
      case PARTIAL_DELETION_FAILURE -> RetentionErrorCode.PARTIAL_DELETION_FAILURE;
      case EXHAUSTED_WITHOUT_SATISFACTION -> RetentionErrorCode.EXHAUSTED_WITHOUT_SATISFACTION;
      case COMPLIANT, RECLAIMED -> null;
    };
  }
}
