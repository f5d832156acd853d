package io.castbus.event;

/** A character was removed from the story. */
public record CharacterDeleted(String characterId, String characterName) implements CharacterEvent {
}
