package io.castbus.model;

import java.util.List;

/**
 * Partial view of a character. A {@code null} component means "not part of this patch".
 *
 * <p>Used both for the changes carried by a character update and for the snapshot of the
 * previous values of those fields.
 *
 * @param type new or previous type
 * @param state new or previous state
 * @param relationships new or previous relationship list
 */
public record CharacterPatch(CharacterType type, CharacterState state, List<Relationship> relationships) {

  public static final CharacterPatch EMPTY = new CharacterPatch(null, null, null);

  public CharacterPatch {
    relationships = relationships == null ? null : List.copyOf(relationships);
  }

  /**
   * Captures the fields of {@code character} that {@code changes} touches.
   *
   * @param character the character before the change
   * @param changes the change
   * @return the previous values of the changed fields
   */
  public static CharacterPatch previousOf(StoryCharacter character, CharacterPatch changes) {
    return new CharacterPatch(
        changes.type() != null ? character.type() : null,
        changes.state() != null ? character.state() : null,
        changes.relationships() != null ? character.relationships() : null);
  }

  /**
   * Applies this patch to a character.
   *
   * @param character the character to update
   * @return the updated character
   */
  public StoryCharacter applyTo(StoryCharacter character) {
    StoryCharacter result = character;
    if (type != null) result = result.withType(type);
    if (state != null) result = result.withState(state);
    if (relationships != null) result = result.withRelationships(relationships);
    return result;
  }
}
