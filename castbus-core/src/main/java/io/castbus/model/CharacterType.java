package io.castbus.model;

/**
 * Narrative weight of a character, ordered from least to most prominent.
 */
public enum CharacterType {
  MOB,
  SUB,
  MAIN;

  /**
   * Returns {@code true} if moving from this type to {@code target} is a promotion:
   * MOB to SUB, MOB to MAIN or SUB to MAIN.
   *
   * @param target the new type
   * @return whether the change raises the character's prominence
   */
  public boolean isPromotionTo(CharacterType target) {
    return target.ordinal() > ordinal();
  }
}
