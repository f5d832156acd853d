package io.castbus.handler;

import io.castbus.Event;
import io.castbus.EventBus;
import io.castbus.Registration;
import io.castbus.event.RelationshipCreated;
import io.castbus.event.RelationshipDeleted;
import io.castbus.event.RelationshipError;
import io.castbus.event.RelationshipStrengthened;
import io.castbus.event.RelationshipUpdated;
import io.castbus.event.RelationshipWeakened;
import io.castbus.model.Relationship;
import io.castbus.model.RelationshipType;
import io.castbus.registry.EventHandlers;
import io.castbus.registry.HandlerRegistration;
import io.castbus.spi.RelationshipStore;
import io.castbus.spi.StoreException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_CREATED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_DELETED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_ERROR;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_STRENGTHENED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_UPDATED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_WEAKENED;

/**
 * Persists relationship events and keeps both directions of a pair consistent.
 *
 * <ul>
 *   <li><b>created / updated</b>: save the relationship, then make sure the reverse
 *       direction exists with the mirror type ({@link RelationshipType#mutual()}). A missing
 *       reverse is created at {@code mutualStrengthFactor} of the forward strength; a reverse
 *       with the wrong type is retyped. An update that changed the strength is followed by a
 *       strengthened or weakened event. A create for a pair that is already stored is
 *       merged into the stored record like an update, so its history is kept.</li>
 *   <li><b>deleted</b>: soft reset of both directions to {@code NEUTRAL} with strength 0.</li>
 *   <li><b>strengthened / weakened</b>: apply the new strength if the store does not hold it
 *       yet. Nothing further is published.</li>
 * </ul>
 *
 * <p>After each committed change the {@link RelationshipGraphProjector} rebuilds the graph.
 * A {@link StoreException} stops the remaining work for that event, is logged, and is
 * reported as a {@code relationship.error} event; it never reaches the bus.
 */
public final class RelationshipChangeHandler {
  private static final Logger logger = Logger.getLogger(RelationshipChangeHandler.class.getName());

  static final String DELETE_REASON = "Relationship reset to neutral";
  static final String MERGE_REASON = "Relationship updated";

  private final RelationshipStore store;
  private final EventBus bus;
  private final RelationshipGraphProjector projector;
  private final Options options;

  public RelationshipChangeHandler(RelationshipStore store, EventBus bus,
      RelationshipGraphProjector projector, Options options) {
    this.store = Objects.requireNonNull(store, "store");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.projector = Objects.requireNonNull(projector, "projector");
    this.options = Objects.requireNonNull(options, "options");
    if (options.updateMutualRelationships() && !options.autoSave()) {
      logger.warning("updateMutualRelationships requires autoSave; mutual sync is disabled");
    }
  }

  public RelationshipChangeHandler(RelationshipStore store, EventBus bus) {
    this(store, bus, new RelationshipGraphProjector(store), Options.defaults());
  }

  /**
   * Subscribes the five relationship handlers.
   *
   * @return a registration that unsubscribes them all
   */
  public Registration register() {
    return EventHandlers.register(bus, List.of(
        HandlerRegistration.of(RELATIONSHIP_CREATED, this::onCreated),
        HandlerRegistration.of(RELATIONSHIP_UPDATED, this::onUpdated),
        HandlerRegistration.of(RELATIONSHIP_DELETED, this::onDeleted),
        HandlerRegistration.of(RELATIONSHIP_STRENGTHENED, this::onStrengthened),
        HandlerRegistration.of(RELATIONSHIP_WEAKENED, this::onWeakened)));
  }

  public RelationshipGraphProjector projector() {
    return projector;
  }

  void onCreated(Event<RelationshipCreated> event) {
    RelationshipCreated payload = event.payload();
    String source = payload.sourceId();
    String target = payload.targetId();
    Relationship incoming = payload.relationship();
    logger.fine("Relationship created: " + source + " -> " + target + " (" + incoming.type() + ")");
    Relationship previous = null;
    Relationship relationship = incoming;
    try {
      Optional<Relationship> stored = store.getRelationship(source, target);
      if (stored.isPresent()) {
        // pair already stored: treat as an update of the stored record
        previous = stored.get();
        relationship = sameValue(previous, incoming)
            ? previous
            : previous.recordChange(incoming.type(), incoming.strength(), MERGE_REASON, event.timestamp());
      }
      save(source, target, relationship);
      syncMutual(source, target, relationship, event.timestamp());
      projector.rebuild();
    } catch (StoreException e) {
      reportFailure("created", source, target, e);
      return;
    }
    if (previous != null) {
      publishStrengthChange(source, target, relationship, previous);
    }
  }

  void onUpdated(Event<RelationshipUpdated> event) {
    RelationshipUpdated payload = event.payload();
    String source = payload.sourceId();
    String target = payload.targetId();
    Relationship relationship = payload.relationship();
    Relationship previous = payload.previous();
    logger.fine("Relationship updated: " + source + " -> " + target + " (" + relationship.type() + ")");
    try {
      save(source, target, relationship);
      syncMutual(source, target, relationship, event.timestamp());
      projector.rebuild();
    } catch (StoreException e) {
      reportFailure("updated", source, target, e);
      return;
    }

    if (previous != null) {
      publishStrengthChange(source, target, relationship, previous);
    }
  }

  private void publishStrengthChange(String source, String target, Relationship relationship, Relationship previous) {
    int direction = Double.compare(relationship.strength(), previous.strength());
    if (direction > 0) {
      bus.publish(RELATIONSHIP_STRENGTHENED, new RelationshipStrengthened(source, target, relationship.type(),
          previous.strength(), relationship.strength(), "Updated from relationship update"));
    } else if (direction < 0) {
      bus.publish(RELATIONSHIP_WEAKENED, new RelationshipWeakened(source, target, relationship.type(),
          previous.strength(), relationship.strength(), "Updated from relationship update"));
    }
  }

  private static boolean sameValue(Relationship a, Relationship b) {
    return a.type() == b.type() && Double.compare(a.strength(), b.strength()) == 0;
  }

  void onDeleted(Event<RelationshipDeleted> event) {
    RelationshipDeleted payload = event.payload();
    String source = payload.sourceId();
    String target = payload.targetId();
    logger.fine("Relationship deleted: " + source + " -> " + target);
    try {
      Optional<Relationship> forward = store.getRelationship(source, target);
      if (forward.isEmpty()) {
        logger.warning("Relationship not found for deletion: " + source + " -> " + target);
        return;
      }
      save(source, target, neutral(forward.get(), DELETE_REASON, event.timestamp()));
      if (mutualSyncEnabled()) {
        Relationship reverse = store.getRelationship(target, source)
            .orElseGet(() -> Relationship.of(source, RelationshipType.NEUTRAL, 0.0));
        save(target, source, neutral(reverse, DELETE_REASON + " (mutual update)", event.timestamp()));
      }
      projector.rebuild();
    } catch (StoreException e) {
      reportFailure("deleted", source, target, e);
    }
  }

  void onStrengthened(Event<RelationshipStrengthened> event) {
    RelationshipStrengthened payload = event.payload();
    applyStrength("strengthened", payload.sourceId(), payload.targetId(),
        payload.newStrength(), payload.reason(), event.timestamp());
  }

  void onWeakened(Event<RelationshipWeakened> event) {
    RelationshipWeakened payload = event.payload();
    applyStrength("weakened", payload.sourceId(), payload.targetId(),
        payload.newStrength(), payload.reason(), event.timestamp());
    if (payload.newStrength() < 0.1) {
      logger.info("Relationship almost dissolved: " + payload.sourceId() + " -> " + payload.targetId());
    }
  }

  private void applyStrength(String operation, String source, String target, double newStrength,
      String reason, Instant at) {
    logger.fine("Relationship " + operation + ": " + source + " -> " + target + " to " + newStrength);
    try {
      Optional<Relationship> stored = store.getRelationship(source, target);
      if (stored.isEmpty()) {
        reportFailure(operation, source, target, "Relationship not found: " + source + " -> " + target);
        return;
      }
      Relationship relationship = stored.get();
      if (Double.compare(relationship.strength(), Relationship.clamp(newStrength)) == 0) {
        return;
      }
      save(source, target, relationship.recordChange(relationship.type(), newStrength, reason, at));
      projector.rebuild();
    } catch (StoreException e) {
      reportFailure(operation, source, target, e);
    }
  }

  private void syncMutual(String source, String target, Relationship forward, Instant at) {
    if (!mutualSyncEnabled()) {
      return;
    }
    RelationshipType mirror = forward.type().mutual();
    Optional<Relationship> existing = store.getRelationship(target, source);
    if (existing.isEmpty()) {
      Relationship reverse = Relationship.of(source, mirror, forward.strength() * options.mutualStrengthFactor())
          .withDescription("Auto-generated mutual relationship for " + forward.type());
      save(target, source, reverse);
      logger.fine("Created mutual relationship: " + target + " -> " + source + " (" + mirror + ")");
      bus.publish(RELATIONSHIP_CREATED, new RelationshipCreated(target, source, reverse));
    } else if (existing.get().type() != mirror) {
      Relationship previous = existing.get();
      Relationship retyped = previous
          .recordChange(mirror, previous.strength(), "Auto-updated to " + mirror, at)
          .appendDescription("Auto-updated to " + mirror);
      save(target, source, retyped);
      logger.fine("Updated mutual relationship type: " + target + " -> " + source + " (" + mirror + ")");
      bus.publish(RELATIONSHIP_UPDATED, new RelationshipUpdated(target, source, retyped, previous));
    }
  }

  private boolean mutualSyncEnabled() {
    return options.updateMutualRelationships() && options.autoSave();
  }

  private void save(String source, String target, Relationship relationship) {
    if (options.autoSave()) {
      store.saveRelationship(source, target, relationship);
    }
  }

  private static Relationship neutral(Relationship relationship, String reason, Instant at) {
    return relationship.recordChange(RelationshipType.NEUTRAL, 0.0, reason, at).withDescription(reason);
  }

  private void reportFailure(String operation, String source, String target, StoreException e) {
    logger.log(Level.SEVERE, "Failed to persist relationship " + operation + " between "
        + source + " and " + target, e);
    bus.publish(RELATIONSHIP_ERROR, new RelationshipError(source, target, operation, e.getMessage()));
  }

  private void reportFailure(String operation, String source, String target, String message) {
    logger.warning(message);
    bus.publish(RELATIONSHIP_ERROR, new RelationshipError(source, target, operation, message));
  }

  /**
   * Handler settings.
   *
   * @param autoSave write relationships to the store; when off the handler only projects
   * @param updateMutualRelationships keep the reverse direction in sync; requires {@code autoSave}
   * @param mutualStrengthFactor fraction of the forward strength given to a new reverse relationship
   */
  public record Options(boolean autoSave, boolean updateMutualRelationships, double mutualStrengthFactor) {

    public Options {
      if (!(mutualStrengthFactor >= 0.0 && mutualStrengthFactor <= 1.0)) {
        throw new IllegalArgumentException("mutualStrengthFactor must be within [0,1]");
      }
    }

    public static Options defaults() {
      return new Options(true, true, 0.8);
    }
  }
}
