package io.castbus.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Denormalized nodes/edges view over all stored relationships. Always derived, never edited.
 *
 * @param nodes every character id that appears as a source or target
 * @param edges one edge per stored relationship
 */
public record RelationshipGraph(Set<String> nodes, List<Edge> edges) {

  public static final RelationshipGraph EMPTY = new RelationshipGraph(Set.of(), List.of());

  public RelationshipGraph {
    nodes = Set.copyOf(nodes);
    edges = List.copyOf(edges);
  }

  /**
   * Builds the graph from stored relationship rows.
   *
   * @param relationships the rows
   * @return the graph
   */
  public static RelationshipGraph from(Collection<StoredRelationship> relationships) {
    Set<String> nodes = new LinkedHashSet<>();
    List<Edge> edges = new ArrayList<>(relationships.size());
    for (StoredRelationship row : relationships) {
      Relationship relationship = row.relationship();
      nodes.add(row.sourceId());
      nodes.add(relationship.targetId());
      edges.add(new Edge(row.sourceId(), relationship.targetId(), relationship.type(), relationship.strength()));
    }
    return new RelationshipGraph(nodes, edges);
  }

  /**
   * Finds the edge from {@code source} to {@code target}.
   *
   * @param source source id
   * @param target target id
   * @return the edge or {@code null}
   */
  public Edge edge(String source, String target) {
    for (Edge edge : edges) {
      if (edge.source().equals(source) && edge.target().equals(target)) {
        return edge;
      }
    }
    return null;
  }

  /** A directed graph edge. */
  public record Edge(String source, String target, RelationshipType type, double strength) {}
}
