package com.legisgraph.citegraph.service.graph;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Labeled-node / typed-edge store. Every method runs as one unit of work against the store;
 * the batch methods commit their whole batch or nothing. The JPA store gets this from the
 * surrounding transaction, the in-memory store by staging the batch before publishing it.
 * <p>
 * Failures of the underlying store are not retried here and propagate to the caller.
 */
public interface GraphStore {

    Optional<GraphNode> findNode(NodeLabel label, String id);

    /**
     * Creates the node when absent, otherwise overlays {@code properties} on the stored ones.
     */
    GraphNode upsertNode(NodeLabel label, String id, Map<String, Object> properties);

    int upsertNodes(List<GraphNode> batch);

    /**
     * Subset of {@code ids} that already exist under {@code label}.
     */
    Set<String> existingNodeIds(NodeLabel label, Collection<String> ids);

    boolean edgeExists(String fromId, String toId, RelationshipType type);

    /**
     * Creates the edge unless one of the same type already joins the same ordered pair, or
     * either endpoint is missing.
     *
     * @return true when a new edge was written
     */
    boolean createEdgeIfAbsent(GraphEdge edge);

    /**
     * @return the edges of the batch that were newly written
     */
    List<GraphEdge> createEdgesIfAbsent(List<GraphEdge> batch);

    List<GraphEdge> findIncomingEdges(String toId, RelationshipType type);

    Map<String, Long> countNodesByLabel();

    Map<String, Long> countEdgesByType();
}
