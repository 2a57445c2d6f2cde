package com.legisgraph.citegraph.service.lineage;

import com.legisgraph.citegraph.model.GraphStats;
import com.legisgraph.citegraph.model.LawLink;
import com.legisgraph.citegraph.model.SectionLineage;
import com.legisgraph.citegraph.service.graph.GraphEdge;
import com.legisgraph.citegraph.service.graph.GraphNode;
import com.legisgraph.citegraph.service.graph.GraphStore;
import com.legisgraph.citegraph.service.graph.NodeLabel;
import com.legisgraph.citegraph.service.graph.RelationshipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
public class DefaultGraphQueryService implements GraphQueryService {

    private static final Logger log = LoggerFactory.getLogger(DefaultGraphQueryService.class);

    private static final Comparator<LawLink> BY_ENACTED_DATE = Comparator
            .comparing(LawLink::enactedDate, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(LawLink::lawId);

    private final GraphStore graphStore;

    public DefaultGraphQueryService(GraphStore graphStore) {
        this.graphStore = graphStore;
    }

    @Override
    public Optional<LawLink> enactingLaw(String sectionId) {
        List<LawLink> enacting = linksOf(sectionId, RelationshipType.ENACTS);
        if (enacting.size() > 1) {
            log.warn("Section {} has {} enacting laws; reporting {}", sectionId, enacting.size(), enacting.get(0).lawId());
        }
        return enacting.stream().findFirst();
    }

    @Override
    public List<LawLink> amendments(String sectionId) {
        return linksOf(sectionId, RelationshipType.AMENDS).stream()
                .sorted(BY_ENACTED_DATE)
                .toList();
    }

    @Override
    public SectionLineage lineage(String sectionId) {
        GraphNode section = graphStore.findNode(NodeLabel.USC_SECTION, sectionId)
                .orElseThrow(() -> new SectionNotFoundException(sectionId));
        return new SectionLineage(
                sectionId,
                stringProperty(section, "section_name"),
                enactingLaw(sectionId).orElse(null),
                amendments(sectionId));
    }

    @Override
    public GraphStats stats() {
        return new GraphStats(graphStore.countNodesByLabel(), graphStore.countEdgesByType());
    }

    private List<LawLink> linksOf(String sectionId, RelationshipType type) {
        return graphStore.findIncomingEdges(sectionId, type).stream()
                .map(edge -> toLink(edge, type))
                .toList();
    }

    private LawLink toLink(GraphEdge edge, RelationshipType type) {
        Optional<GraphNode> law = graphStore.findNode(NodeLabel.PUBLIC_LAW, edge.fromId());
        return new LawLink(
                edge.fromId(),
                law.map(node -> stringProperty(node, "title")).orElse(null),
                law.map(node -> dateProperty(node, "enacted_date")).orElse(null),
                law.map(node -> stringProperty(node, "statutes_at_large_citation")).orElse(null),
                type.name());
    }

    private String stringProperty(GraphNode node, String key) {
        Object value = node.property(key);
        return value == null ? null : value.toString();
    }

    private LocalDate dateProperty(GraphNode node, String key) {
        String value = stringProperty(node, key);
        if (value == null) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring malformed {} '{}' on {}", key, value, node.id());
            return null;
        }
    }
}
