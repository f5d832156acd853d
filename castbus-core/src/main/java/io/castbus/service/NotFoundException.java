package io.castbus.service;

/**
 * Raised when a requested character or relationship does not exist.
 */
public class NotFoundException extends RuntimeException {

  private final String entity;
  private final String id;

  public NotFoundException(String entity, String id) {
    super(entity + " not found: " + id);
    this.entity = entity;
    this.id = id;
  }

  public String entity() {
    return entity;
  }

  public String id() {
    return id;
  }
}
