package io.castbus.model;

/**
 * Mutable-by-replacement narrative state of a character.
 *
 * @param active whether the character currently takes part in the story
 * @param developmentStage numeric development stage, starting at 0
 * @param emotionalState free-form emotional state, e.g. {@code "NEUTRAL"}
 * @param development short description of the character's development so far
 * @param location current location, may be {@code null}
 * @param lastAppearance chapter of the last appearance, may be {@code null}
 */
public record CharacterState(
    boolean active,
    int developmentStage,
    String emotionalState,
    String development,
    String location,
    Integer lastAppearance) {

  public CharacterState {
    if (developmentStage < 0) {
      throw new IllegalArgumentException("developmentStage must be >= 0");
    }
  }

  public static CharacterState initial() {
    return new CharacterState(true, 0, "NEUTRAL", "", null, null);
  }

  public CharacterState withDevelopmentStage(int stage) {
    return new CharacterState(active, stage, emotionalState, development, location, lastAppearance);
  }

  public CharacterState withEmotionalState(String state) {
    return new CharacterState(active, developmentStage, state, development, location, lastAppearance);
  }
}
