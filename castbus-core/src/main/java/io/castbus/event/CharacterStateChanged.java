package io.castbus.event;

import io.castbus.model.CharacterState;

import java.util.Objects;

/**
 * A character's state changed.
 *
 * @param characterId the character id
 * @param state the new state
 * @param previousState the old state, may be {@code null}
 */
public record CharacterStateChanged(String characterId, CharacterState state, CharacterState previousState)
    implements CharacterEvent {

  public CharacterStateChanged {
    Objects.requireNonNull(state, "state");
  }
}
