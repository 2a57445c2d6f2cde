package com.legisgraph.citegraph.service.graph;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.legisgraph.citegraph.persistence.entity.GraphEdgeEntity;
import com.legisgraph.citegraph.persistence.entity.GraphNodeEntity;
import com.legisgraph.citegraph.persistence.repository.GraphEdgeRepository;
import com.legisgraph.citegraph.persistence.repository.GraphNodeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Relational rendition of the graph. A unique key on {@code (from_id, to_id, relationship_type)}
 * backs the existence check so a racing duplicate edge fails instead of being stored twice.
 */
@Service
@Profile("!inmemory")
@Transactional
public class JpaGraphStore implements GraphStore {

    private static final Logger log = LoggerFactory.getLogger(JpaGraphStore.class);
    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTIES = new TypeReference<>() {
    };

    private final GraphNodeRepository nodeRepository;
    private final GraphEdgeRepository edgeRepository;
    private final ObjectMapper objectMapper;

    public JpaGraphStore(GraphNodeRepository nodeRepository,
                         GraphEdgeRepository edgeRepository,
                         ObjectMapper objectMapper) {
        this.nodeRepository = nodeRepository;
        this.edgeRepository = edgeRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<GraphNode> findNode(NodeLabel label, String id) {
        return nodeRepository.findByIdAndLabel(id, label.label()).map(this::toNode);
    }

    @Override
    public GraphNode upsertNode(NodeLabel label, String id, Map<String, Object> properties) {
        GraphNodeEntity entity = nodeRepository.findById(id).orElse(null);
        GraphNode merged;
        if (entity == null) {
            merged = new GraphNode(label, id, Map.of()).mergedWith(properties);
            entity = new GraphNodeEntity(id, label.label(), toJson(merged.properties()));
        } else {
            if (!entity.getLabel().equals(label.label())) {
                log.warn("Node {} is stored as {} but was written as {}; keeping {}", id, entity.getLabel(), label.label(), entity.getLabel());
            }
            merged = toNode(entity).mergedWith(properties);
            entity.setPropertiesJson(toJson(merged.properties()));
        }
        nodeRepository.save(entity);
        return merged;
    }

    @Override
    public int upsertNodes(List<GraphNode> batch) {
        for (GraphNode node : batch) {
            upsertNode(node.label(), node.id(), node.properties());
        }
        return batch.size();
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> existingNodeIds(NodeLabel label, Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return Set.of();
        }
        Set<String> existing = new LinkedHashSet<>();
        nodeRepository.findByLabelAndIdIn(label.label(), ids).forEach(entity -> existing.add(entity.getId()));
        return existing;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean edgeExists(String fromId, String toId, RelationshipType type) {
        return edgeRepository.existsByFromIdAndToIdAndType(fromId, toId, type.name());
    }

    @Override
    public boolean createEdgeIfAbsent(GraphEdge edge) {
        if (edgeRepository.existsByFromIdAndToIdAndType(edge.fromId(), edge.toId(), edge.type().name())) {
            return false;
        }
        if (!nodeRepository.existsById(edge.fromId()) || !nodeRepository.existsById(edge.toId())) {
            log.debug("Skipping {} edge {} -> {}: endpoint missing", edge.type(), edge.fromId(), edge.toId());
            return false;
        }
        edgeRepository.save(new GraphEdgeEntity(edge.fromId(), edge.toId(), edge.type().name(), toJson(edge.properties())));
        return true;
    }

    @Override
    public List<GraphEdge> createEdgesIfAbsent(List<GraphEdge> batch) {
        List<GraphEdge> created = new ArrayList<>();
        for (GraphEdge edge : batch) {
            if (createEdgeIfAbsent(edge)) {
                created.add(edge);
            }
        }
        edgeRepository.flush();
        return created;
    }

    @Override
    @Transactional(readOnly = true)
    public List<GraphEdge> findIncomingEdges(String toId, RelationshipType type) {
        return edgeRepository.findByToIdAndTypeOrderByIdAsc(toId, type.name()).stream()
                .map(entity -> new GraphEdge(entity.getFromId(), entity.getToId(),
                        RelationshipType.valueOf(entity.getType()), fromJson(entity.getPropertiesJson())))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countNodesByLabel() {
        return toCounts(nodeRepository.countGroupedByLabel());
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countEdgesByType() {
        return toCounts(edgeRepository.countGroupedByType());
    }

    private GraphNode toNode(GraphNodeEntity entity) {
        NodeLabel label = NodeLabel.fromLabel(entity.getLabel())
                .orElseThrow(() -> new IllegalStateException("Unknown node label " + entity.getLabel()));
        return new GraphNode(label, entity.getId(), fromJson(entity.getPropertiesJson()));
    }

    private Map<String, Long> toCounts(List<Object[]> rows) {
        Map<String, Long> counts = new TreeMap<>();
        for (Object[] row : rows) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private String toJson(Map<String, Object> properties) {
        try {
            return objectMapper.writeValueAsString(properties == null ? Map.of() : properties);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize graph properties", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PROPERTIES);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize graph properties", e);
        }
    }
}
