package io.castbus.model;

/**
 * Kind of a directed relationship between two characters.
 */
public enum RelationshipType {
  FRIEND,
  ENEMY,
  RIVAL,
  MENTOR,
  STUDENT,
  PARENT,
  CHILD,
  LEADER,
  FOLLOWER,
  PROTECTOR,
  PROTECTED,
  LOVER,
  COLLEAGUE,
  NEUTRAL;

  /**
   * Returns the type the reverse direction must have. Asymmetric pairs map to each other
   * (PARENT and CHILD, MENTOR and STUDENT, LEADER and FOLLOWER, PROTECTOR and PROTECTED);
   * every other type is its own mirror.
   *
   * @return the mirror type
   */
  public RelationshipType mutual() {
    return switch (this) {
      case PARENT -> CHILD;
      case CHILD -> PARENT;
      case MENTOR -> STUDENT;
      case STUDENT -> MENTOR;
      case LEADER -> FOLLOWER;
      case FOLLOWER -> LEADER;
      case PROTECTOR -> PROTECTED;
      case PROTECTED -> PROTECTOR;
      default -> this;
    };
  }

  public boolean isSymmetric() {
    return mutual() == this;
  }
}
