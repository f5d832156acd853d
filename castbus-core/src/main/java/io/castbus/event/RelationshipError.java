package io.castbus.event;

/**
 * A relationship handler could not persist a change.
 *
 * @param sourceId the source character
 * @param targetId the target character
 * @param operation the failed operation, e.g. {@code "created"}
 * @param message the failure message
 */
public record RelationshipError(String sourceId, String targetId, String operation, String message)
    implements CharacterEvent {
}
