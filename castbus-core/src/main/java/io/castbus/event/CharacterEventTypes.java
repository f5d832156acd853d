package io.castbus.event;

import io.castbus.EventPriority;
import io.castbus.EventType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Catalog of the character and relationship event types.
 *
 * <p>Each constant binds a dotted event name to its payload record and declared priority;
 * {@link #category(EventType)} groups them. Applications may define further types with
 * {@link EventType#of(String, Class, EventPriority)}.
 */
public final class CharacterEventTypes {

  public static final EventType<CharacterCreated> CHARACTER_CREATED =
      EventType.of("character.created", CharacterCreated.class, EventPriority.HIGH);
  public static final EventType<CharacterUpdated> CHARACTER_UPDATED =
      EventType.of("character.updated", CharacterUpdated.class);
  public static final EventType<CharacterDeleted> CHARACTER_DELETED =
      EventType.of("character.deleted", CharacterDeleted.class, EventPriority.HIGH);
  public static final EventType<CharacterPromoted> CHARACTER_PROMOTED =
      EventType.of("character.promoted", CharacterPromoted.class);
  public static final EventType<CharacterDemoted> CHARACTER_DEMOTED =
      EventType.of("character.demoted", CharacterDemoted.class);
  public static final EventType<CharacterStateChanged> CHARACTER_STATE_CHANGED =
      EventType.of("character.state.changed", CharacterStateChanged.class);
  public static final EventType<CharacterAppearance> CHARACTER_APPEARANCE =
      EventType.of("character.appearance", CharacterAppearance.class);

  public static final EventType<RelationshipCreated> RELATIONSHIP_CREATED =
      EventType.of("relationship.created", RelationshipCreated.class);
  public static final EventType<RelationshipUpdated> RELATIONSHIP_UPDATED =
      EventType.of("relationship.updated", RelationshipUpdated.class);
  public static final EventType<RelationshipDeleted> RELATIONSHIP_DELETED =
      EventType.of("relationship.deleted", RelationshipDeleted.class);
  public static final EventType<RelationshipStrengthened> RELATIONSHIP_STRENGTHENED =
      EventType.of("relationship.strengthened", RelationshipStrengthened.class);
  public static final EventType<RelationshipWeakened> RELATIONSHIP_WEAKENED =
      EventType.of("relationship.weakened", RelationshipWeakened.class);
  public static final EventType<RelationshipError> RELATIONSHIP_ERROR =
      EventType.of("relationship.error", RelationshipError.class, EventPriority.HIGH);

  public static final EventType<DevelopmentStageChanged> DEVELOPMENT_STAGE_CHANGED =
      EventType.of("development.stage.changed", DevelopmentStageChanged.class);
  public static final EventType<MilestoneAchieved> MILESTONE_ACHIEVED =
      EventType.of("milestone.achieved", MilestoneAchieved.class);

  public static final EventType<ConsistencyViolation> CONSISTENCY_VIOLATION =
      EventType.of("consistency.violation", ConsistencyViolation.class, EventPriority.HIGH);

  private static final Map<String, EventType<?>> BY_NAME;
  private static final Map<String, EventCategory> CATEGORIES;

  static {
    Map<String, EventType<?>> byName = new LinkedHashMap<>();
    Map<String, EventCategory> categories = new LinkedHashMap<>();
    add(byName, categories, CHARACTER_CREATED, EventCategory.CHARACTER);
    add(byName, categories, CHARACTER_UPDATED, EventCategory.CHARACTER);
    add(byName, categories, CHARACTER_DELETED, EventCategory.CHARACTER);
    add(byName, categories, CHARACTER_PROMOTED, EventCategory.CHARACTER);
    add(byName, categories, CHARACTER_DEMOTED, EventCategory.CHARACTER);
    add(byName, categories, CHARACTER_STATE_CHANGED, EventCategory.CHARACTER);
    add(byName, categories, CHARACTER_APPEARANCE, EventCategory.CHARACTER);
    add(byName, categories, RELATIONSHIP_CREATED, EventCategory.RELATIONSHIP);
    add(byName, categories, RELATIONSHIP_UPDATED, EventCategory.RELATIONSHIP);
    add(byName, categories, RELATIONSHIP_DELETED, EventCategory.RELATIONSHIP);
    add(byName, categories, RELATIONSHIP_STRENGTHENED, EventCategory.RELATIONSHIP);
    add(byName, categories, RELATIONSHIP_WEAKENED, EventCategory.RELATIONSHIP);
    add(byName, categories, RELATIONSHIP_ERROR, EventCategory.RELATIONSHIP);
    add(byName, categories, DEVELOPMENT_STAGE_CHANGED, EventCategory.DEVELOPMENT);
    add(byName, categories, MILESTONE_ACHIEVED, EventCategory.DEVELOPMENT);
    add(byName, categories, CONSISTENCY_VIOLATION, EventCategory.ANALYSIS);
    BY_NAME = Collections.unmodifiableMap(byName);
    CATEGORIES = Collections.unmodifiableMap(categories);
  }

  private CharacterEventTypes() {}

  private static void add(Map<String, EventType<?>> byName, Map<String, EventCategory> categories,
      EventType<?> type, EventCategory category) {
    byName.put(type.name(), type);
    categories.put(type.name(), category);
  }

  /**
   * Returns every catalog type in declaration order.
   *
   * @return the event types
   */
  public static List<EventType<?>> all() {
    return List.copyOf(BY_NAME.values());
  }

  /**
   * Looks up a catalog type by its dotted name.
   *
   * @param name e.g. {@code "relationship.updated"}
   * @return the type, or empty if the name is not part of the catalog
   */
  public static Optional<EventType<?>> find(String name) {
    return Optional.ofNullable(BY_NAME.get(name));
  }

  /**
   * Returns the category of a catalog type.
   *
   * @param type the event type
   * @return the category
   * @throws IllegalArgumentException if {@code type} is not part of the catalog
   */
  public static EventCategory category(EventType<?> type) {
    EventCategory category = CATEGORIES.get(type.name());
    if (category == null) {
      throw new IllegalArgumentException("Not a catalog event type: " + type.name());
    }
    return category;
  }
}
