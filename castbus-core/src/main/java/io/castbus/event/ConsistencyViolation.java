package io.castbus.event;

/**
 * Analysis found a character behaving inconsistently.
 *
 * @param characterId the character id
 * @param violationType short classifier such as {@code "personality"}
 * @param description what was inconsistent
 * @param severity severity in {@code [0,1]}; above 0.8 is severe, above 0.5 moderate
 */
public record ConsistencyViolation(String characterId, String violationType, String description, double severity)
    implements CharacterEvent {
}
