package io.castbus.event;

/** A character appeared in a chapter. */
public record CharacterAppearance(String characterId, int chapterNumber, double significance, String summary)
    implements CharacterEvent {
}
