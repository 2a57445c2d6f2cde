package com.legisgraph.citegraph.service.graph;

import com.legisgraph.citegraph.persistence.entity.GraphEdgeEntity;
import com.legisgraph.citegraph.persistence.repository.GraphEdgeRepository;
import com.legisgraph.citegraph.persistence.repository.GraphNodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class JpaGraphStoreTest {

    @Autowired
    private JpaGraphStore graphStore;

    @Autowired
    private GraphNodeRepository nodeRepository;

    @Autowired
    private GraphEdgeRepository edgeRepository;

    @BeforeEach
    void clean() {
        edgeRepository.deleteAll();
        nodeRepository.deleteAll();
    }

    @Test
    void upsertCreatesThenOverlaysProperties() {
        graphStore.upsertNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97", Map.of("citation_congress", 89, "title", "Social Security Amendments of 1965"));
        graphStore.upsertNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97", Map.of("enacted_date", "1965-07-30"));

        GraphNode stored = graphStore.findNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97").orElseThrow();

        assertThat(stored.properties())
                .containsEntry("id", "Pub. L. 89-97")
                .containsEntry("citation_congress", 89)
                .containsEntry("title", "Social Security Amendments of 1965")
                .containsEntry("enacted_date", "1965-07-30");
        assertThat(graphStore.findNode(NodeLabel.USC_SECTION, "Pub. L. 89-97")).isEmpty();
        assertThat(nodeRepository.count()).isEqualTo(1);
    }

    @Test
    void batchUpsertAndExistenceLookup() {
        int written = graphStore.upsertNodes(List.of(
                new GraphNode(NodeLabel.USC_SECTION, "42 USC 1395", Map.of("section_name", "Prohibition against any Federal interference")),
                new GraphNode(NodeLabel.USC_SECTION, "42 USC 1395a", Map.of())));

        assertThat(written).isEqualTo(2);
        assertThat(graphStore.existingNodeIds(NodeLabel.USC_SECTION, List.of("42 USC 1395", "42 USC 1395z")))
                .containsExactly("42 USC 1395");
        assertThat(graphStore.existingNodeIds(NodeLabel.PUBLIC_LAW, List.of("42 USC 1395"))).isEmpty();
        assertThat(graphStore.countNodesByLabel()).containsExactly(Map.entry("USCSection", 2L));
    }

    @Test
    void edgesAreCreatedOncePerTypedPair() {
        seedLawAndSection();
        GraphEdge enacts = new GraphEdge("Pub. L. 89-97", "42 USC 1395", RelationshipType.ENACTS, Map.of("source", "usc_source_credit"));

        assertThat(graphStore.createEdgeIfAbsent(enacts)).isTrue();
        assertThat(graphStore.createEdgeIfAbsent(enacts)).isFalse();
        assertThat(graphStore.edgeExists("Pub. L. 89-97", "42 USC 1395", RelationshipType.ENACTS)).isTrue();
        assertThat(graphStore.edgeExists("Pub. L. 89-97", "42 USC 1395", RelationshipType.AMENDS)).isFalse();

        List<GraphEdge> incoming = graphStore.findIncomingEdges("42 USC 1395", RelationshipType.ENACTS);
        assertThat(incoming).singleElement().satisfies(edge -> {
            assertThat(edge.fromId()).isEqualTo("Pub. L. 89-97");
            assertThat(edge.properties()).containsEntry("source", "usc_source_credit");
        });
        assertThat(graphStore.countEdgesByType()).containsExactly(Map.entry("ENACTS", 1L));
    }

    @Test
    void edgesNeedBothEndpoints() {
        seedLawAndSection();

        List<GraphEdge> created = graphStore.createEdgesIfAbsent(List.of(
                new GraphEdge("Pub. L. 89-97", "42 USC 1395", RelationshipType.ENACTS, Map.of()),
                new GraphEdge("Pub. L. 89-97", "42 USC 9999", RelationshipType.AMENDS, Map.of()),
                new GraphEdge("Pub. L. 1-1", "42 USC 1395", RelationshipType.AMENDS, Map.of())));

        assertThat(created).extracting(GraphEdge::toId).containsExactly("42 USC 1395");
        assertThat(edgeRepository.count()).isEqualTo(1);
    }

    @Test
    void schemaRejectsDuplicateEdges() {
        seedLawAndSection();
        edgeRepository.saveAndFlush(new GraphEdgeEntity("Pub. L. 89-97", "42 USC 1395", "AMENDS", "{}"));

        assertThatThrownBy(() -> edgeRepository.saveAndFlush(new GraphEdgeEntity("Pub. L. 89-97", "42 USC 1395", "AMENDS", "{}")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    private void seedLawAndSection() {
        graphStore.upsertNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97", Map.of());
        graphStore.upsertNode(NodeLabel.USC_SECTION, "42 USC 1395", Map.of());
    }
}
