package io.castbus.store;

import io.castbus.model.Relationship;
import io.castbus.model.RelationshipGraph;
import io.castbus.model.StoredRelationship;
import io.castbus.model.StoryCharacter;
import io.castbus.spi.CharacterStore;
import io.castbus.spi.RelationshipStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link CharacterStore} and {@link RelationshipStore}.
 *
 * <p>Nothing survives the process. Used as the default store of the Spring Boot starter
 * and in tests.
 */
public class InMemoryStoryStore implements CharacterStore, RelationshipStore {

  private final Map<String, StoryCharacter> characters = new ConcurrentHashMap<>();
  private final Map<String, Map<String, Relationship>> relationships = new ConcurrentHashMap<>();
  private volatile RelationshipGraph graph = RelationshipGraph.EMPTY;

  public void saveCharacter(StoryCharacter character) {
    Objects.requireNonNull(character, "character");
    characters.put(character.id(), character);
  }

  public void removeCharacter(String characterId) {
    characters.remove(characterId);
  }

  @Override
  public Optional<StoryCharacter> findCharacter(String characterId) {
    return Optional.ofNullable(characters.get(characterId));
  }

  @Override
  public void saveRelationship(String sourceId, String targetId, Relationship relationship) {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(relationship, "relationship");
    if (!targetId.equals(relationship.targetId())) {
      throw new IllegalArgumentException("targetId " + targetId
          + " does not match relationship target " + relationship.targetId());
    }
    relationships.computeIfAbsent(sourceId, ignored -> new ConcurrentHashMap<>()).put(targetId, relationship);
  }

  @Override
  public Optional<Relationship> getRelationship(String sourceId, String targetId) {
    Map<String, Relationship> outgoing = relationships.get(sourceId);
    return outgoing == null ? Optional.empty() : Optional.ofNullable(outgoing.get(targetId));
  }

  @Override
  public List<StoredRelationship> getAllRelationships() {
    List<StoredRelationship> rows = new ArrayList<>();
    relationships.forEach((sourceId, outgoing) ->
        outgoing.values().forEach(relationship -> rows.add(new StoredRelationship(sourceId, relationship))));
    return rows;
  }

  @Override
  public void saveRelationshipGraph(RelationshipGraph graph) {
    this.graph = Objects.requireNonNull(graph, "graph");
  }

  /**
   * Returns the graph passed to the last {@link #saveRelationshipGraph} call.
   *
   * @return the saved graph, empty if none was saved yet
   */
  public RelationshipGraph savedGraph() {
    return graph;
  }
}
