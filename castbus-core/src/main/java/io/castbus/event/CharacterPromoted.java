package io.castbus.event;

import io.castbus.model.CharacterType;

/** A character moved to a more prominent {@link CharacterType}. */
public record CharacterPromoted(String characterId, CharacterType fromType, CharacterType toType, String reason)
    implements CharacterEvent {
}
