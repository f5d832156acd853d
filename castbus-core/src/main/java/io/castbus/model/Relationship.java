package io.castbus.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Directed relationship towards {@code targetId}. The source is implied by whoever owns it.
 *
 * <p>Instances are immutable: {@code strength} is clamped to {@code [0,1]} on construction
 * and the history only grows through {@link #recordChange}.
 *
 * @param targetId the character this relationship points to
 * @param type the relationship type
 * @param strength strength in {@code [0,1]}
 * @param description free text, never {@code null}
 * @param history change records, oldest first
 */
public record Relationship(
    String targetId,
    RelationshipType type,
    double strength,
    String description,
    List<RelationshipChange> history) {

  public Relationship {
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(type, "type");
    if (Double.isNaN(strength)) {
      throw new IllegalArgumentException("strength must be a number");
    }
    strength = clamp(strength);
    description = description == null ? "" : description;
    history = history == null ? List.of() : List.copyOf(history);
  }

  public static Relationship of(String targetId, RelationshipType type, double strength) {
    return new Relationship(targetId, type, strength, "", List.of());
  }

  public static double clamp(double strength) {
    return Math.max(0.0, Math.min(1.0, strength));
  }

  public Relationship withDescription(String newDescription) {
    return new Relationship(targetId, type, strength, newDescription, history);
  }

  /**
   * Returns a copy with a new type and strength and a history entry describing the change.
   *
   * @param newType the new type
   * @param newStrength the new strength, clamped
   * @param reason the reason recorded in history
   * @param at when the change happened
   * @return the changed relationship
   */
  public Relationship recordChange(RelationshipType newType, double newStrength, String reason, Instant at) {
    double clamped = clamp(newStrength);
    List<RelationshipChange> next = new ArrayList<>(history);
    next.add(new RelationshipChange(at, type, strength, newType, clamped, reason));
    return new Relationship(targetId, newType, clamped, description, next);
  }

  /**
   * Appends a sentence to the description, separated by a space.
   *
   * @param note the text to append
   * @return the changed relationship
   */
  public Relationship appendDescription(String note) {
    return withDescription(description.isEmpty() ? note : description + " " + note);
  }
}
