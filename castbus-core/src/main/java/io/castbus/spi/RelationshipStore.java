package io.castbus.spi;

import io.castbus.model.Relationship;
import io.castbus.model.RelationshipGraph;
import io.castbus.model.StoredRelationship;

import java.util.List;
import java.util.Optional;

/**
 * Persistence abstraction for directed relationships and the derived relationship graph.
 *
 * <p>Relationships are keyed by the ordered pair {@code (sourceId, targetId)}. Only the
 * relationship handlers write through this interface; producers publish events instead.
 * Implementations signal failures with {@link StoreException}.
 *
 * @see io.castbus.store.InMemoryStoryStore
 */
public interface RelationshipStore {

  /**
   * Inserts or replaces the relationship from {@code sourceId} to {@code targetId}.
   *
   * @param sourceId the source character id
   * @param targetId the target character id
   * @param relationship the relationship to store
   */
  void saveRelationship(String sourceId, String targetId, Relationship relationship);

  /**
   * Looks up the relationship from {@code sourceId} to {@code targetId}.
   *
   * @param sourceId the source character id
   * @param targetId the target character id
   * @return the relationship, or empty if none is stored
   */
  Optional<Relationship> getRelationship(String sourceId, String targetId);

  /**
   * Returns every stored relationship together with its source id.
   *
   * @return all relationships
   */
  List<StoredRelationship> getAllRelationships();

  /**
   * Stores the projected relationship graph, replacing the previous one.
   *
   * @param graph the graph
   */
  void saveRelationshipGraph(RelationshipGraph graph);
}
