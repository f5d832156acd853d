package io.castbus.event;

import io.castbus.model.CharacterType;

/** A character moved to a less prominent or equal {@link CharacterType}. */
public record CharacterDemoted(String characterId, CharacterType fromType, CharacterType toType, String reason)
    implements CharacterEvent {
}
