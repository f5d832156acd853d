package io.castbus.spi;

import io.castbus.model.StoryCharacter;

import java.util.Optional;

/**
 * Read access to persisted characters.
 */
public interface CharacterStore {

  /**
   * Looks up a character by id.
   *
   * @param characterId the character id
   * @return the character, or empty if unknown
   */
  Optional<StoryCharacter> findCharacter(String characterId);
}
