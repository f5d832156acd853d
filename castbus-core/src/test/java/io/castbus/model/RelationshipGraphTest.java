package io.castbus.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class RelationshipGraphTest {

    @Test
    void buildsNodesAndEdgesFromStoredRows() {
        RelationshipGraph graph = RelationshipGraph.from(List.of(
                new StoredRelationship("a", Relationship.of("b", RelationshipType.MENTOR, 0.5)),
                new StoredRelationship("b", Relationship.of("a", RelationshipType.STUDENT, 0.4)),
                new StoredRelationship("c", Relationship.of("a", RelationshipType.RIVAL, 0.9))));

        assertEquals(Set.of("a", "b", "c"), graph.nodes());
        assertEquals(3, graph.edges().size());
        RelationshipGraph.Edge edge = graph.edge("c", "a");
        assertEquals(RelationshipType.RIVAL, edge.type());
        assertEquals(0.9, edge.strength());
        assertNull(graph.edge("a", "c"));
    }

    @Test
    void emptyInputGivesEmptyGraph() {
        assertEquals(RelationshipGraph.EMPTY, RelationshipGraph.from(List.of()));
    }
}
