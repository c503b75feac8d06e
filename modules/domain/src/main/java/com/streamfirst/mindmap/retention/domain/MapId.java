package com.streamfirst.mindmap.retention.domain;

import java.util.Objects;

/**
 * Identifier of the mind map a snapshot was recorded for.
 *
 * @param value the raw identifier
 */
public record MapId(String value) {
  public MapId {
    Objects.requireNonNull(value, "Map ID cannot be null");
    if (value.trim().isEmpty()) {
      throw new IllegalArgumentException("Map ID cannot be empty");
    }
  }

  public static MapId of(String value) {
    return new MapId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
