package io.castbus.event;

import io.castbus.EventPayload;

/**
 * Closed family of payloads carried by the character and relationship events.
 *
 * @see CharacterEventTypes
 */
public sealed interface CharacterEvent extends EventPayload
    permits CharacterCreated, CharacterUpdated, CharacterDeleted, CharacterPromoted,
        CharacterDemoted, CharacterStateChanged, CharacterAppearance,
        RelationshipCreated, RelationshipUpdated, RelationshipDeleted,
        RelationshipStrengthened, RelationshipWeakened, RelationshipError,
        DevelopmentStageChanged, MilestoneAchieved, ConsistencyViolation {
}
