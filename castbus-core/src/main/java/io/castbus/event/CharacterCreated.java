package io.castbus.event;

import io.castbus.model.StoryCharacter;

import java.util.Objects;

/** A character was added to the story. */
public record CharacterCreated(StoryCharacter character) implements CharacterEvent {

  public CharacterCreated {
    Objects.requireNonNull(character, "character");
  }
}
