package com.streamfirst.mindmap.retention.domain;

import java.util.Objects;

/**
 * Identifier of the account whose snapshot storage is governed by a plan tier.
 *
 * @param value the raw identifier
 */
public record UserId(String value) {
  public UserId {
    Objects.requireNonNull(value, "User ID cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("User ID cannot be empty");
    }
  }

  public static UserId of(String value) {
    return new UserId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
