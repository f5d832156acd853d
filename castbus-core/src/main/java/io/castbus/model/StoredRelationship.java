package io.castbus.model;

import java.util.Objects;

/**
 * A relationship together with the id of the character that owns it.
 *
 * @param sourceId the owning character
 * @param relationship the relationship
 */
public record StoredRelationship(String sourceId, Relationship relationship) {

  public StoredRelationship {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(relationship, "relationship");
  }

  public String targetId() {
    return relationship.targetId();
  }
}
