package com.legisgraph.citegraph.service.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Component
@Profile("inmemory")
public class InMemoryGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final Map<String, GraphNode> nodes = new ConcurrentHashMap<>();
    private final Map<GraphEdge.Key, StoredEdge> edges = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Optional<GraphNode> findNode(NodeLabel label, String id) {
        GraphNode node = nodes.get(id);
        return node != null && node.label() == label ? Optional.of(node) : Optional.empty();
    }

    @Override
    public GraphNode upsertNode(NodeLabel label, String id, Map<String, Object> properties) {
        return nodes.compute(id, (key, existing) -> existing == null
                ? new GraphNode(label, id, Map.of()).mergedWith(properties)
                : existing.mergedWith(properties));
    }

    /**
     * Merges the whole batch into a staging map first and publishes it only once every node
     * merged, so a bad entry leaves the store untouched.
     */
    @Override
    public synchronized int upsertNodes(List<GraphNode> batch) {
        Map<String, GraphNode> staged = new LinkedHashMap<>();
        for (GraphNode node : batch) {
            GraphNode current = staged.getOrDefault(node.id(), nodes.get(node.id()));
            staged.put(node.id(), current == null
                    ? new GraphNode(node.label(), node.id(), Map.of()).mergedWith(node.properties())
                    : current.mergedWith(node.properties()));
        }
        nodes.putAll(staged);
        return batch.size();
    }

    @Override
    public Set<String> existingNodeIds(NodeLabel label, Collection<String> ids) {
        return ids.stream()
                .filter(id -> findNode(label, id).isPresent())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public boolean edgeExists(String fromId, String toId, RelationshipType type) {
        return edges.containsKey(new GraphEdge.Key(fromId, toId, type));
    }

    @Override
    public boolean createEdgeIfAbsent(GraphEdge edge) {
        if (!nodes.containsKey(edge.fromId()) || !nodes.containsKey(edge.toId())) {
            log.debug("Skipping {} edge {} -> {}: endpoint missing", edge.type(), edge.fromId(), edge.toId());
            return false;
        }
        StoredEdge stored = new StoredEdge(sequence.incrementAndGet(), edge);
        return edges.putIfAbsent(edge.key(), stored) == null;
    }

    @Override
    public synchronized List<GraphEdge> createEdgesIfAbsent(List<GraphEdge> batch) {
        Map<GraphEdge.Key, GraphEdge> staged = new LinkedHashMap<>();
        for (GraphEdge edge : batch) {
            GraphEdge.Key key = edge.key();
            if (edges.containsKey(key) || staged.containsKey(key)) {
                continue;
            }
            if (!nodes.containsKey(edge.fromId()) || !nodes.containsKey(edge.toId())) {
                log.debug("Skipping {} edge {} -> {}: endpoint missing", edge.type(), edge.fromId(), edge.toId());
                continue;
            }
            staged.put(key, edge);
        }
        List<GraphEdge> created = new ArrayList<>();
        for (GraphEdge edge : staged.values()) {
            if (edges.putIfAbsent(edge.key(), new StoredEdge(sequence.incrementAndGet(), edge)) == null) {
                created.add(edge);
            }
        }
        return created;
    }

    @Override
    public List<GraphEdge> findIncomingEdges(String toId, RelationshipType type) {
        return edges.values().stream()
                .filter(stored -> stored.edge().toId().equals(toId) && stored.edge().type() == type)
                .sorted(Comparator.comparingLong(StoredEdge::sequence))
                .map(StoredEdge::edge)
                .toList();
    }

    @Override
    public Map<String, Long> countNodesByLabel() {
        return nodes.values().stream()
                .collect(Collectors.groupingBy(node -> node.label().label(), TreeMap::new, Collectors.counting()));
    }

    @Override
    public Map<String, Long> countEdgesByType() {
        return edges.values().stream()
                .collect(Collectors.groupingBy(stored -> stored.edge().type().name(), TreeMap::new, Collectors.counting()));
    }

    private record StoredEdge(long sequence, GraphEdge edge) {
    }
}
