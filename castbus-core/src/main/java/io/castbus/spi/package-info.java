/**
 * Extension points: storage collaborators and the metrics hook.
 *
 * @see io.castbus.spi.RelationshipStore
 * @see io.castbus.spi.CharacterStore
 * @see io.castbus.spi.BusMetrics
 */
package io.castbus.spi;
