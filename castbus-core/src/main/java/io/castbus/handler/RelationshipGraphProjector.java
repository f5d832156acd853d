package io.castbus.handler;

import io.castbus.model.RelationshipGraph;
import io.castbus.spi.RelationshipStore;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Rebuilds the {@link RelationshipGraph} from the full set of stored relationships and
 * saves it back to the store. The most recent projection is kept in memory.
 *
 * <p>The graph is never patched incrementally; every rebuild reads
 * {@link RelationshipStore#getAllRelationships()} from scratch.
 */
public final class RelationshipGraphProjector {
  private static final Logger logger = Logger.getLogger(RelationshipGraphProjector.class.getName());

  private final RelationshipStore store;
  private final AtomicReference<RelationshipGraph> current = new AtomicReference<>(RelationshipGraph.EMPTY);

  public RelationshipGraphProjector(RelationshipStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Projects and saves the graph.
   *
   * @return the new graph
   * @throws io.castbus.spi.StoreException if reading relationships or saving the graph fails;
   *     the previous projection is kept in that case
   */
  public RelationshipGraph rebuild() {
    RelationshipGraph graph = RelationshipGraph.from(store.getAllRelationships());
    store.saveRelationshipGraph(graph);
    current.set(graph);
    logger.fine("Relationship graph rebuilt: " + graph.nodes().size() + " nodes, "
        + graph.edges().size() + " edges");
    return graph;
  }

  /**
   * Returns the last successfully saved projection.
   *
   * @return the graph, empty before the first rebuild
   */
  public RelationshipGraph current() {
    return current.get();
  }
}
