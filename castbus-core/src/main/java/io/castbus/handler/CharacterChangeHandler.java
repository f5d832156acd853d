package io.castbus.handler;

import io.castbus.Event;
import io.castbus.EventBus;
import io.castbus.EventPriority;
import io.castbus.Registration;
import io.castbus.event.CharacterAppearance;
import io.castbus.event.CharacterCreated;
import io.castbus.event.CharacterDeleted;
import io.castbus.event.CharacterDemoted;
import io.castbus.event.CharacterPromoted;
import io.castbus.event.CharacterStateChanged;
import io.castbus.event.CharacterUpdated;
import io.castbus.event.ConsistencyViolation;
import io.castbus.event.DevelopmentStageChanged;
import io.castbus.event.MilestoneAchieved;
import io.castbus.event.RelationshipCreated;
import io.castbus.event.RelationshipDeleted;
import io.castbus.event.RelationshipUpdated;
import io.castbus.model.CharacterPatch;
import io.castbus.model.CharacterState;
import io.castbus.model.CharacterType;
import io.castbus.model.Relationship;
import io.castbus.model.StoryCharacter;
import io.castbus.registry.EventHandlers;
import io.castbus.registry.HandlerRegistration;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static io.castbus.event.CharacterEventTypes.CHARACTER_APPEARANCE;
import static io.castbus.event.CharacterEventTypes.CHARACTER_CREATED;
import static io.castbus.event.CharacterEventTypes.CHARACTER_DELETED;
import static io.castbus.event.CharacterEventTypes.CHARACTER_DEMOTED;
import static io.castbus.event.CharacterEventTypes.CHARACTER_PROMOTED;
import static io.castbus.event.CharacterEventTypes.CHARACTER_STATE_CHANGED;
import static io.castbus.event.CharacterEventTypes.CHARACTER_UPDATED;
import static io.castbus.event.CharacterEventTypes.CONSISTENCY_VIOLATION;
import static io.castbus.event.CharacterEventTypes.DEVELOPMENT_STAGE_CHANGED;
import static io.castbus.event.CharacterEventTypes.MILESTONE_ACHIEVED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_CREATED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_DELETED;
import static io.castbus.event.CharacterEventTypes.RELATIONSHIP_UPDATED;

/**
 * Turns coarse character events into finer-grained ones.
 *
 * <p>A character update is diffed against the previous snapshot carried in the event:
 * <ul>
 *   <li>a type change becomes a promotion or demotion</li>
 *   <li>a different state becomes a state change, and a moved development stage a
 *       development-stage change</li>
 *   <li>the relationship list is diffed by target id into relationship created, updated
 *       and deleted events</li>
 * </ul>
 *
 * <p>This handler never writes storage; it only republishes.
 */
public final class CharacterChangeHandler {
  private static final Logger logger = Logger.getLogger(CharacterChangeHandler.class.getName());

  static final double DEFAULT_APPEARANCE_SIGNIFICANCE = 0.3;

  private final EventBus bus;

  public CharacterChangeHandler(EventBus bus) {
    this.bus = Objects.requireNonNull(bus, "bus");
  }

  /**
   * Subscribes every handler of this class.
   *
   * @return a registration that unsubscribes them all
   */
  public Registration register() {
    return EventHandlers.register(bus, List.of(
        HandlerRegistration.of(CHARACTER_CREATED, this::onCreated, EventPriority.HIGH),
        HandlerRegistration.of(CHARACTER_UPDATED, this::onUpdated),
        HandlerRegistration.of(CHARACTER_DELETED, this::onDeleted, EventPriority.HIGH),
        HandlerRegistration.of(CHARACTER_PROMOTED, this::onPromoted),
        HandlerRegistration.of(CHARACTER_DEMOTED, this::onDemoted),
        HandlerRegistration.of(CHARACTER_STATE_CHANGED, this::onStateChanged),
        HandlerRegistration.of(CHARACTER_APPEARANCE, this::onAppearance, EventPriority.LOW),
        HandlerRegistration.of(CONSISTENCY_VIOLATION, this::onConsistencyViolation, EventPriority.HIGH),
        HandlerRegistration.of(DEVELOPMENT_STAGE_CHANGED, this::onDevelopmentStageChanged),
        HandlerRegistration.of(MILESTONE_ACHIEVED, this::onMilestoneAchieved, EventPriority.LOW)));
  }

  void onCreated(Event<CharacterCreated> event) {
    StoryCharacter character = event.payload().character();
    logger.info("Character created: " + character.name() + " (" + character.id() + ")");
    if (character.firstAppearance() != null) {
      double significance = character.significance() != null
          ? character.significance() : DEFAULT_APPEARANCE_SIGNIFICANCE;
      bus.publish(CHARACTER_APPEARANCE, new CharacterAppearance(character.id(),
          character.firstAppearance(), significance, "Initial appearance of " + character.name()));
    }
    for (Relationship relationship : character.relationships()) {
      bus.publish(RELATIONSHIP_CREATED,
          new RelationshipCreated(character.id(), relationship.targetId(), relationship));
    }
  }

  void onUpdated(Event<CharacterUpdated> event) {
    CharacterUpdated payload = event.payload();
    String characterId = payload.characterId();
    CharacterPatch changes = payload.changes();
    CharacterPatch previous = payload.previous();
    logger.fine("Character updated: " + characterId);

    CharacterType fromType = previous.type();
    CharacterType toType = changes.type();
    if (fromType != null && toType != null && fromType != toType) {
      if (fromType.isPromotionTo(toType)) {
        bus.publish(CHARACTER_PROMOTED, new CharacterPromoted(characterId, fromType, toType,
            "Character promoted from " + fromType + " to " + toType));
      } else {
        bus.publish(CHARACTER_DEMOTED, new CharacterDemoted(characterId, fromType, toType,
            "Character demoted from " + fromType + " to " + toType));
      }
    }

    if (changes.state() != null && !changes.state().equals(previous.state())) {
      bus.publish(CHARACTER_STATE_CHANGED,
          new CharacterStateChanged(characterId, changes.state(), previous.state()));
    }

    if (changes.relationships() != null) {
      List<Relationship> before = previous.relationships() != null ? previous.relationships() : List.of();
      diffRelationships(characterId, before, changes.relationships());
    }
  }

  private void diffRelationships(String characterId, List<Relationship> before, List<Relationship> after) {
    Map<String, Relationship> previousByTarget = new HashMap<>();
    for (Relationship relationship : before) {
      previousByTarget.put(relationship.targetId(), relationship);
    }
    Set<String> currentTargets = new HashSet<>();
    for (Relationship current : after) {
      currentTargets.add(current.targetId());
      Relationship old = previousByTarget.get(current.targetId());
      if (old == null) {
        bus.publish(RELATIONSHIP_CREATED, new RelationshipCreated(characterId, current.targetId(), current));
      } else if (old.type() != current.type() || Double.compare(old.strength(), current.strength()) != 0) {
        bus.publish(RELATIONSHIP_UPDATED,
            new RelationshipUpdated(characterId, current.targetId(), current, old));
      }
    }
    for (Relationship old : before) {
      if (!currentTargets.contains(old.targetId())) {
        bus.publish(RELATIONSHIP_DELETED, new RelationshipDeleted(characterId, old.targetId(), old.type()));
      }
    }
  }

  void onStateChanged(Event<CharacterStateChanged> event) {
    CharacterStateChanged payload = event.payload();
    CharacterState state = payload.state();
    CharacterState previous = payload.previousState();
    logger.fine("Character state changed: " + payload.characterId());
    if (previous == null) {
      return;
    }
    if (state.developmentStage() != previous.developmentStage()) {
      String reason = state.development() != null && !state.development().isEmpty()
          ? state.development() : "Character development progression";
      bus.publish(DEVELOPMENT_STAGE_CHANGED, new DevelopmentStageChanged(payload.characterId(),
          previous.developmentStage(), state.developmentStage(), reason));
    }
    if (!Objects.equals(state.emotionalState(), previous.emotionalState())) {
      logger.fine("Emotional state of " + payload.characterId() + ": "
          + previous.emotionalState() + " -> " + state.emotionalState());
    }
    if (state.active() != previous.active()) {
      logger.info("Active state of " + payload.characterId() + ": " + previous.active() + " -> " + state.active());
    }
  }

  void onDeleted(Event<CharacterDeleted> event) {
    logger.info("Character deleted: " + event.payload().characterId());
  }

  void onPromoted(Event<CharacterPromoted> event) {
    CharacterPromoted payload = event.payload();
    logger.info("Character promoted: " + payload.characterId()
        + " (" + payload.fromType() + " -> " + payload.toType() + ")");
  }

  void onDemoted(Event<CharacterDemoted> event) {
    CharacterDemoted payload = event.payload();
    logger.info("Character demoted: " + payload.characterId()
        + " (" + payload.fromType() + " -> " + payload.toType() + ")");
  }

  void onAppearance(Event<CharacterAppearance> event) {
    CharacterAppearance payload = event.payload();
    Level level = payload.significance() > 0.7 ? Level.INFO : Level.FINE;
    logger.log(level, "Character " + payload.characterId() + " appears in chapter " + payload.chapterNumber()
        + " (significance " + payload.significance() + ")");
  }

  void onConsistencyViolation(Event<ConsistencyViolation> event) {
    ConsistencyViolation payload = event.payload();
    logger.log(severityLevel(payload.severity()), "Consistency violation for character "
        + payload.characterId() + ": " + payload.description() + " (severity " + payload.severity() + ")");
  }

  static Level severityLevel(double severity) {
    if (severity > 0.8) return Level.SEVERE;
    if (severity > 0.5) return Level.WARNING;
    return Level.INFO;
  }

  void onDevelopmentStageChanged(Event<DevelopmentStageChanged> event) {
    DevelopmentStageChanged payload = event.payload();
    String direction = payload.newStage() > payload.oldStage() ? "progressed" : "regressed";
    logger.info("Character " + payload.characterId() + " " + direction + " from stage "
        + payload.oldStage() + " to " + payload.newStage() + ": " + payload.reason());
  }

  void onMilestoneAchieved(Event<MilestoneAchieved> event) {
    MilestoneAchieved payload = event.payload();
    logger.info("Character " + payload.characterId() + " achieved milestone: "
        + payload.description() + " (stage " + payload.stage() + ")");
  }
}
