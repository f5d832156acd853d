package io.castbus.event;

import io.castbus.model.CharacterPatch;
import io.castbus.model.StoryCharacter;

import java.util.Objects;

/**
 * A character changed.
 *
 * @param characterId the character id
 * @param character the character after the change
 * @param changes the fields that changed, with their new values
 * @param previous the previous values of the same fields
 */
public record CharacterUpdated(
    String characterId, StoryCharacter character, CharacterPatch changes, CharacterPatch previous)
    implements CharacterEvent {

  public CharacterUpdated {
    Objects.requireNonNull(characterId, "characterId");
    Objects.requireNonNull(character, "character");
    changes = changes == null ? CharacterPatch.EMPTY : changes;
    previous = previous == null ? CharacterPatch.EMPTY : previous;
  }
}
