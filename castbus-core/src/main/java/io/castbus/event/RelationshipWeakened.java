package io.castbus.event;

import io.castbus.model.RelationshipType;

import java.util.Objects;

/** The relationship from {@code sourceId} to {@code targetId} grew weaker. */
public record RelationshipWeakened(
    String sourceId,
    String targetId,
    RelationshipType relationType,
    double previousStrength,
    double newStrength,
    String reason) implements CharacterEvent {

  public RelationshipWeakened {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
  }
}
