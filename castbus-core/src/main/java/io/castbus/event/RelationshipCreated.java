package io.castbus.event;

import io.castbus.model.Relationship;

import java.util.Objects;

/** A relationship from {@code sourceId} to {@code targetId} came into existence. */
public record RelationshipCreated(String sourceId, String targetId, Relationship relationship)
    implements CharacterEvent {

  public RelationshipCreated {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(relationship, "relationship");
  }
}
