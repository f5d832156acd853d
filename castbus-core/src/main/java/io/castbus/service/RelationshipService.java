package io.castbus.service;

import io.castbus.EventBus;
import io.castbus.event.RelationshipCreated;
import io.castbus.event.RelationshipDeleted;
import io.castbus.event.RelationshipStrengthened;
import io.castbus.event.RelationshipUpdated;
import io.castbus.event.RelationshipWeakened;
import io.castbus.model.Relationship;
import io.castbus.model.RelationshipType;
import io.castbus.model.StoredRelationship;
import io.castbus.spi.CharacterStore;
import io.castbus.spi.RelationshipStore;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_CREATED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_DELETED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_STRENGTHENED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_UPDATED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_WEAKENED;

/**
 * Entry point for changing relationships.
 *
 * <p>Every mutating call validates its input, reads the current state, and publishes the
 * matching relationship event; the store is written by the relationship handlers when the
 * event is delivered, not by this class. Reads go straight to the store.
 */
public final class RelationshipService {
  private static final Logger logger = Logger.getLogger(RelationshipService.class.getName());

  private final CharacterStore characters;
  private final RelationshipStore relationships;
  private final EventBus bus;
  private final Clock clock;

  public RelationshipService(CharacterStore characters, RelationshipStore relationships, EventBus bus, Clock clock) {
    this.characters = Objects.requireNonNull(characters, "characters");
    this.relationships = Objects.requireNonNull(relationships, "relationships");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public RelationshipService(CharacterStore characters, RelationshipStore relationships, EventBus bus) {
    this(characters, relationships, bus, Clock.systemUTC());
  }

  /**
   * Sets the type and strength of the relationship from {@code sourceId} to {@code targetId}.
   *
   * <p>Publishes {@code relationship.created} when no relationship exists yet, otherwise
   * {@code relationship.updated} carrying the previous value. The existing history is kept
   * and a change record is appended.
   *
   * @param sourceId the source character
   * @param targetId the target character
   * @param type the relationship type
   * @param strength the strength, within {@code [0,1]}
   * @return the relationship that was published
   * @throws IllegalArgumentException if an id is blank, both ids are equal, or
   *     {@code strength} is outside {@code [0,1]}
   * @throws NotFoundException if either character does not exist
   */
  public Relationship updateRelationship(String sourceId, String targetId, RelationshipType type, double strength) {
    validatePair(sourceId, targetId);
    Objects.requireNonNull(type, "type");
    if (!(strength >= 0.0 && strength <= 1.0)) {
      throw new IllegalArgumentException("strength must be within [0,1]: " + strength);
    }
    requireCharacter(sourceId);
    requireCharacter(targetId);

    Optional<Relationship> existing = relationships.getRelationship(sourceId, targetId);
    if (existing.isEmpty()) {
      Relationship created = Relationship.of(targetId, type, strength);
      bus.publish(RELATIONSHIP_CREATED, new RelationshipCreated(sourceId, targetId, created));
      return created;
    }
    Relationship previous = existing.get();
    Relationship updated = previous.recordChange(type, strength, "Relationship updated", clock.instant());
    bus.publish(RELATIONSHIP_UPDATED, new RelationshipUpdated(sourceId, targetId, updated, previous));
    return updated;
  }

  /**
   * Raises the strength of an existing relationship by {@code amount}, clamped to 1.
   *
   * @param sourceId the source character
   * @param targetId the target character
   * @param amount a non-negative increment
   * @param reason recorded in the relationship history
   * @return the new strength
   * @throws NotFoundException if no relationship exists
   */
  public double strengthenRelationship(String sourceId, String targetId, double amount, String reason) {
    requireNonNegative(amount);
    Relationship current = requireRelationship(sourceId, targetId);
    double next = Relationship.clamp(current.strength() + amount);
    bus.publish(RELATIONSHIP_STRENGTHENED, new RelationshipStrengthened(sourceId, targetId, current.type(),
        current.strength(), next, reason));
    return next;
  }

  /**
   * Lowers the strength of an existing relationship by {@code amount}, clamped to 0.
   *
   * @param sourceId the source character
   * @param targetId the target character
   * @param amount a non-negative decrement
   * @param reason recorded in the relationship history
   * @return the new strength
   * @throws NotFoundException if no relationship exists
   */
  public double weakenRelationship(String sourceId, String targetId, double amount, String reason) {
    requireNonNegative(amount);
    Relationship current = requireRelationship(sourceId, targetId);
    double next = Relationship.clamp(current.strength() - amount);
    bus.publish(RELATIONSHIP_WEAKENED, new RelationshipWeakened(sourceId, targetId, current.type(),
        current.strength(), next, reason));
    return next;
  }

  /**
   * Requests a soft delete of the relationship; both directions end up {@code NEUTRAL}.
   *
   * @param sourceId the source character
   * @param targetId the target character
   * @throws NotFoundException if no relationship exists
   */
  public void deleteRelationship(String sourceId, String targetId) {
    Relationship current = requireRelationship(sourceId, targetId);
    bus.publish(RELATIONSHIP_DELETED, new RelationshipDeleted(sourceId, targetId, current.type()));
  }

  /**
   * Returns the characters linked to {@code characterId} in either direction by a
   * relationship other than {@code NEUTRAL}.
   *
   * @param characterId the character
   * @return connected character ids in store order
   */
  public List<String> getConnectedCharacters(String characterId) {
    Objects.requireNonNull(characterId, "characterId");
    Set<String> connected = new LinkedHashSet<>();
    for (StoredRelationship row : relationships.getAllRelationships()) {
      if (row.relationship().type() == RelationshipType.NEUTRAL) {
        continue;
      }
      if (row.sourceId().equals(characterId)) {
        connected.add(row.targetId());
      } else if (row.targetId().equals(characterId)) {
        connected.add(row.sourceId());
      }
    }
    connected.remove(characterId);
    logger.fine("Found " + connected.size() + " connected characters for " + characterId);
    return List.copyOf(connected);
  }

  private Relationship requireRelationship(String sourceId, String targetId) {
    validatePair(sourceId, targetId);
    return relationships.getRelationship(sourceId, targetId)
        .orElseThrow(() -> new NotFoundException("Relationship", sourceId + "-" + targetId));
  }

  private void requireCharacter(String characterId) {
    if (characters.findCharacter(characterId).isEmpty()) {
      throw new NotFoundException("Character", characterId);
    }
  }

  private static void validatePair(String sourceId, String targetId) {
    if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
      throw new IllegalArgumentException("Character ids must not be blank");
    }
    if (sourceId.equals(targetId)) {
      throw new IllegalArgumentException("A character cannot have a relationship with itself: " + sourceId);
    }
  }

  private static void requireNonNegative(double amount) {
    if (!(amount >= 0.0)) {
      throw new IllegalArgumentException("amount must be >= 0: " + amount);
    }
  }
}
