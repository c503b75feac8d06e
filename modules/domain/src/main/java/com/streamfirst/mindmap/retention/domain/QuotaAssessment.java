package com.streamfirst.mindmap.retention.domain;

/**
 * Outcome of measuring usage against a quota. Only a percentage strictly above 100 is exceeded.
 *
 * @param exceeded true when usage is over quota
 * @param usageBytes bytes in use
 * @param quotaBytes applicable ceiling
 * @param percentage usage as a percentage of quota
 */
public record QuotaAssessment(boolean exceeded, long usageBytes, long quotaBytes, double percentage) {

  /** Bytes that must be reclaimed to get back to 100%, zero when not exceeded. */
  public long overageBytes() {
    return Math.max(0L, usageBytes - quotaBytes);
  }
}
