package io.castbus.model;

import java.util.List;
import java.util.Objects;

/**
 * A character of the story together with its outgoing relationships.
 *
 * @param id unique character id
 * @param name display name
 * @param type narrative weight
 * @param state current state
 * @param relationships outgoing relationships, never {@code null}
 * @param firstAppearance chapter of the first appearance, may be {@code null}
 * @param significance significance score in {@code [0,1]}, may be {@code null}
 */
public record StoryCharacter(
    String id,
    String name,
    CharacterType type,
    CharacterState state,
    List<Relationship> relationships,
    Integer firstAppearance,
    Double significance) {

  public StoryCharacter {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(state, "state");
    relationships = relationships == null ? List.of() : List.copyOf(relationships);
  }

  public static StoryCharacter of(String id, String name, CharacterType type) {
    return new StoryCharacter(id, name, type, CharacterState.initial(), List.of(), null, null);
  }

  public StoryCharacter withType(CharacterType newType) {
    return new StoryCharacter(id, name, newType, state, relationships, firstAppearance, significance);
  }

  public StoryCharacter withState(CharacterState newState) {
    return new StoryCharacter(id, name, type, newState, relationships, firstAppearance, significance);
  }

  public StoryCharacter withRelationships(List<Relationship> newRelationships) {
    return new StoryCharacter(id, name, type, state, newRelationships, firstAppearance, significance);
  }

  public StoryCharacter withFirstAppearance(Integer chapter) {
    return new StoryCharacter(id, name, type, state, relationships, chapter, significance);
  }
}
