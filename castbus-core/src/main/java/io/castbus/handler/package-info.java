/**
 * Cascading handlers for character and relationship events.
 *
 * <p>{@link io.castbus.handler.CharacterChangeHandler} diffs character updates into
 * finer-grained events; {@link io.castbus.handler.RelationshipChangeHandler} persists
 * relationship events, keeps reverse relationships in sync and triggers the
 * {@link io.castbus.handler.RelationshipGraphProjector}.
 */
package io.castbus.handler;
