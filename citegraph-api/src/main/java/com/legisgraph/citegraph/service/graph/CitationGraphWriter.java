package com.legisgraph.citegraph.service.graph;

import com.legisgraph.citegraph.model.PublicLawMetadata;
import com.legisgraph.citegraph.model.SectionRecord;
import com.legisgraph.citegraph.service.extraction.ExtractedPublicLaw;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Writes sections, Public Laws and the ENACTS / AMENDS edges between them.
 * <p>
 * Writes are chunked into batches of {@code citegraph.graph.batch-size}; every batch is one
 * store call and commits on its own. A failing batch stops the run with a
 * {@link GraphWriteException}; the batches before it stay written and replaying them changes
 * nothing.
 */
@Component
public class CitationGraphWriter {

    static final String EDGE_SOURCE = "usc_source_credit";

    private static final Logger log = LoggerFactory.getLogger(CitationGraphWriter.class);

    private final GraphStore graphStore;
    private final PropertyFlattener propertyFlattener;
    private final MeterRegistry meterRegistry;
    private final int batchSize;

    public CitationGraphWriter(GraphStore graphStore,
                               PropertyFlattener propertyFlattener,
                               MeterRegistry meterRegistry,
                               @Value("${citegraph.graph.batch-size:500}") int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("citegraph.graph.batch-size must be positive");
        }
        this.graphStore = graphStore;
        this.propertyFlattener = propertyFlattener;
        this.meterRegistry = meterRegistry;
        this.batchSize = batchSize;
    }

    public RelationshipType relationshipFor(int position) {
        return RelationshipType.forPosition(position);
    }

    public GraphNode upsertNode(NodeLabel label, String id, Object model) {
        GraphNode node = graphStore.upsertNode(label, id, propertyFlattener.flatten(model));
        meterRegistry.counter("citegraph.graph.nodes", "label", label.label()).increment();
        return node;
    }

    /**
     * Writes one node per distinct section id; records repeating an id are overlaid in order.
     *
     * @return the number of section nodes written
     */
    public int writeSections(List<SectionRecord> sections, Provenance provenance) {
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        for (SectionRecord section : sections) {
            GraphNode node = toNode(NodeLabel.USC_SECTION, section.sectionId(), UscSectionNode.from(section, provenance));
            nodes.merge(section.sectionId(), node, (earlier, later) -> earlier.mergedWith(later.properties()));
        }
        return writeNodes(NodeLabel.USC_SECTION, List.copyOf(nodes.values()));
    }

    public int writePublicLaws(Collection<ExtractedPublicLaw> laws, Provenance provenance) {
        List<GraphNode> nodes = laws.stream()
                .map(law -> toNode(NodeLabel.PUBLIC_LAW, law.canonicalId(), PublicLawNode.from(law, provenance)))
                .toList();
        return writeNodes(NodeLabel.PUBLIC_LAW, nodes);
    }

    /**
     * The edges {@code law} implies: one per citing section, ENACTS where the law came first
     * in that section's source credit, AMENDS elsewhere.
     */
    public List<GraphEdge> plannedEdges(ExtractedPublicLaw law) {
        List<GraphEdge> edges = new ArrayList<>();
        law.positionInSource().forEach((sectionId, position) -> edges.add(new GraphEdge(
                law.canonicalId(),
                sectionId,
                relationshipFor(position),
                Map.of("source", EDGE_SOURCE))));
        return edges;
    }

    /**
     * Writes the edges of one law that are not in the graph yet.
     *
     * @return the edges that were created
     */
    public List<GraphEdge> linkLaw(ExtractedPublicLaw law) {
        List<GraphEdge> created = graphStore.createEdgesIfAbsent(plannedEdges(law));
        created.forEach(edge -> countEdge(edge.type()));
        return created;
    }

    public LinkResult linkPublicLaws(Collection<ExtractedPublicLaw> laws) {
        List<GraphEdge> planned = laws.stream()
                .flatMap(law -> plannedEdges(law).stream())
                .toList();
        List<List<GraphEdge>> created = inBatches("edge", planned, graphStore::createEdgesIfAbsent);
        int enacts = 0;
        int amends = 0;
        for (List<GraphEdge> batch : created) {
            for (GraphEdge edge : batch) {
                countEdge(edge.type());
                if (edge.type() == RelationshipType.ENACTS) {
                    enacts++;
                } else {
                    amends++;
                }
            }
        }
        LinkResult result = new LinkResult(enacts, amends, planned.size() - enacts - amends);
        log.info("Linked {} laws: {} ENACTS and {} AMENDS created, {} skipped",
                laws.size(), result.enactsCreated(), result.amendsCreated(), result.skipped());
        return result;
    }

    /**
     * Fills {@code title}, {@code enacted_date} and {@code statutes_at_large_citation} on
     * existing Public Law nodes that lack them. Values already on a node are never replaced and
     * laws without a node are ignored.
     *
     * @return the number of nodes that received at least one value
     */
    public int enrichPublicLaws(List<PublicLawMetadata> metadata) {
        int enriched = 0;
        for (PublicLawMetadata law : metadata) {
            Optional<GraphNode> node = graphStore.findNode(NodeLabel.PUBLIC_LAW, law.canonicalId());
            if (node.isEmpty()) {
                log.debug("No PublicLaw node for {}; skipping enrichment", law.canonicalId());
                continue;
            }
            Map<String, Object> missing = new LinkedHashMap<>();
            fillGap(node.get(), missing, "title", law.title());
            fillGap(node.get(), missing, "enacted_date", law.enactedDate() == null ? null : law.enactedDate().toString());
            fillGap(node.get(), missing, "statutes_at_large_citation", law.statutesAtLargeCitation());
            if (!missing.isEmpty()) {
                graphStore.upsertNode(NodeLabel.PUBLIC_LAW, law.canonicalId(), missing);
                enriched++;
            }
        }
        log.info("Enriched {} of {} Public Laws", enriched, metadata.size());
        return enriched;
    }

    private void fillGap(GraphNode node, Map<String, Object> missing, String key, Object value) {
        if (value != null && !node.hasProperty(key)) {
            missing.put(key, value);
        }
    }

    private GraphNode toNode(NodeLabel label, String id, Object model) {
        return new GraphNode(label, id, propertyFlattener.flatten(model));
    }

    private int writeNodes(NodeLabel label, List<GraphNode> nodes) {
        int written = inBatches(label.label() + " node", nodes, graphStore::upsertNodes).stream()
                .mapToInt(Integer::intValue)
                .sum();
        meterRegistry.counter("citegraph.graph.nodes", "label", label.label()).increment(written);
        log.info("Wrote {} {} nodes", written, label.label());
        return written;
    }

    private void countEdge(RelationshipType type) {
        meterRegistry.counter("citegraph.graph.edges", "type", type.name()).increment();
    }

    private <T, R> List<R> inBatches(String what, List<T> items, Function<List<T>, R> write) {
        int batches = (items.size() + batchSize - 1) / batchSize;
        List<R> results = new ArrayList<>(batches);
        for (int index = 0; index < batches; index++) {
            List<T> batch = List.copyOf(items.subList(index * batchSize, Math.min(items.size(), (index + 1) * batchSize)));
            try {
                results.add(write.apply(batch));
            } catch (RuntimeException ex) {
                log.error("Failed to write {} batch {} of {}; {} batches committed", what, index + 1, batches, index, ex);
                throw new GraphWriteException("Failed to write " + what + " batch " + index, index, index, ex);
            }
            log.debug("Committed {} batch {} of {} ({} items)", what, index + 1, batches, batch.size());
        }
        return results;
    }

    public record LinkResult(int enactsCreated, int amendsCreated, int skipped) {
    }
}
