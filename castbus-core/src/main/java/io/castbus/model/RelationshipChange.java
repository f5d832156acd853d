package io.castbus.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a relationship's history.
 *
 * @param timestamp when the change happened
 * @param previousType type before the change
 * @param previousStrength strength before the change
 * @param newType type after the change
 * @param newStrength strength after the change
 * @param reason why the change happened
 */
public record RelationshipChange(
    Instant timestamp,
    RelationshipType previousType,
    double previousStrength,
    RelationshipType newType,
    double newStrength,
    String reason) {

  public RelationshipChange {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(previousType, "previousType");
    Objects.requireNonNull(newType, "newType");
    reason = reason == null ? "" : reason;
  }
}
