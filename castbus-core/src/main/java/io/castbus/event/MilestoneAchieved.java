package io.castbus.event;

/** A character reached a development milestone, optionally in a given chapter. */
public record MilestoneAchieved(String characterId, int stage, String description, Integer chapterNumber)
    implements CharacterEvent {
}
