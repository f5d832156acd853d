package io.castbus.event;

import io.castbus.model.Relationship;

import java.util.Objects;

/**
 * The relationship from {@code sourceId} to {@code targetId} changed.
 *
 * @param sourceId the source character
 * @param targetId the target character
 * @param relationship the relationship after the change
 * @param previous the relationship before the change, may be {@code null}
 */
public record RelationshipUpdated(String sourceId, String targetId, Relationship relationship, Relationship previous)
    implements CharacterEvent {

  public RelationshipUpdated {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(relationship, "relationship");
  }
}
