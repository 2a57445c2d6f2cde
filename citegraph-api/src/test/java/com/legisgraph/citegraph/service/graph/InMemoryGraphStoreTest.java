package com.legisgraph.citegraph.service.graph;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphStoreTest {

    private final InMemoryGraphStore store = new InMemoryGraphStore();

    @Test
    void failedNodeBatchLeavesStoreUntouched() {
        store.upsertNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97", Map.of("title", "Social Security Amendments of 1965"));

        List<GraphNode> batch = Arrays.asList(
                new GraphNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97", Map.of("title", "Replaced")),
                new GraphNode(NodeLabel.USC_SECTION, "42 USC 1395", Map.of()),
                null);

        assertThatThrownBy(() -> store.upsertNodes(batch)).isInstanceOf(NullPointerException.class);

        assertThat(store.findNode(NodeLabel.USC_SECTION, "42 USC 1395")).isEmpty();
        assertThat(store.findNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97"))
                .get()
                .extracting(node -> node.property("title"))
                .isEqualTo("Social Security Amendments of 1965");
    }

    @Test
    void nodeBatchMergesRepeatedIdsInOrder() {
        int written = store.upsertNodes(List.of(
                new GraphNode(NodeLabel.USC_SECTION, "42 USC 1395", Map.of("section_name", "Prohibition")),
                new GraphNode(NodeLabel.USC_SECTION, "42 USC 1395", Map.of("chapter", "7"))));

        assertThat(written).isEqualTo(2);
        assertThat(store.findNode(NodeLabel.USC_SECTION, "42 USC 1395").orElseThrow().properties())
                .containsEntry("section_name", "Prohibition")
                .containsEntry("chapter", "7");
        assertThat(store.countNodesByLabel()).containsEntry("USCSection", 1L);
    }

    @Test
    void failedEdgeBatchWritesNoEdge() {
        seedNodes();
        GraphEdge enacts = new GraphEdge("Pub. L. 89-97", "42 USC 1395", RelationshipType.ENACTS, Map.of());

        assertThatThrownBy(() -> store.createEdgesIfAbsent(Arrays.asList(enacts, null)))
                .isInstanceOf(NullPointerException.class);

        assertThat(store.edgeExists("Pub. L. 89-97", "42 USC 1395", RelationshipType.ENACTS)).isFalse();
        assertThat(store.countEdgesByType()).isEmpty();
    }

    @Test
    void edgeBatchSkipsDuplicatesAndMissingEndpoints() {
        seedNodes();
        GraphEdge enacts = new GraphEdge("Pub. L. 89-97", "42 USC 1395", RelationshipType.ENACTS, Map.of());
        GraphEdge dangling = new GraphEdge("Pub. L. 111-148", "42 USC 1395", RelationshipType.AMENDS, Map.of());

        List<GraphEdge> created = store.createEdgesIfAbsent(List.of(enacts, enacts, dangling));

        assertThat(created).containsExactly(enacts);
        assertThat(store.createEdgesIfAbsent(List.of(enacts))).isEmpty();
        assertThat(store.findIncomingEdges("42 USC 1395", RelationshipType.ENACTS)).containsExactly(enacts);
    }

    private void seedNodes() {
        store.upsertNode(NodeLabel.PUBLIC_LAW, "Pub. L. 89-97", Map.of());
        store.upsertNode(NodeLabel.USC_SECTION, "42 USC 1395", Map.of());
    }
}
