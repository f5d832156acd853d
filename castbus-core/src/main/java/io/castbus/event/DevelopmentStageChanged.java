package io.castbus.event;

/** A character reached a different development stage. */
public record DevelopmentStageChanged(String characterId, int oldStage, int newStage, String reason)
    implements CharacterEvent {
}
