package io.castbus.event;

import io.castbus.model.RelationshipType;

import java.util.Objects;

/** The relationship from {@code sourceId} to {@code targetId} was removed. */
public record RelationshipDeleted(String sourceId, String targetId, RelationshipType relationType)
    implements CharacterEvent {

  public RelationshipDeleted {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
  }
}
