package com.legisgraph.citegraph.service.ingestion;

import com.legisgraph.citegraph.model.IngestionReport;
import com.legisgraph.citegraph.model.PublicLawMetadata;
import com.legisgraph.citegraph.model.SectionRecord;
import com.legisgraph.citegraph.service.extraction.AmendmentExtractor;
import com.legisgraph.citegraph.service.extraction.ExtractedPublicLaw;
import com.legisgraph.citegraph.service.extraction.PublicLawMerger;
import com.legisgraph.citegraph.service.graph.CitationGraphWriter;
import com.legisgraph.citegraph.service.graph.GraphEdge;
import com.legisgraph.citegraph.service.graph.GraphStore;
import com.legisgraph.citegraph.service.graph.GraphWriteException;
import com.legisgraph.citegraph.service.graph.NodeLabel;
import com.legisgraph.citegraph.service.graph.Provenance;
import com.legisgraph.citegraph.service.graph.RelationshipType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Section records in, citation graph out: extract every source credit, fold the extractions
 * into one aggregate per Public Law, then write section nodes, law nodes and edges in that
 * order.
 */
@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private final AmendmentExtractor amendmentExtractor;
    private final PublicLawMerger publicLawMerger;
    private final CitationGraphWriter graphWriter;
    private final GraphStore graphStore;
    private final IngestionProperties properties;
    private final MeterRegistry meterRegistry;
    private final Counter sectionsCounter;
    private final Timer ingestionTimer;

    public DefaultIngestionService(AmendmentExtractor amendmentExtractor,
                                   PublicLawMerger publicLawMerger,
                                   CitationGraphWriter graphWriter,
                                   GraphStore graphStore,
                                   IngestionProperties properties,
                                   MeterRegistry meterRegistry) {
        this.amendmentExtractor = amendmentExtractor;
        this.publicLawMerger = publicLawMerger;
        this.graphWriter = graphWriter;
        this.graphStore = graphStore;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.sectionsCounter = meterRegistry.counter("citegraph.ingest.sections");
        this.ingestionTimer = meterRegistry.timer("citegraph.ingest.duration");
    }

    @Override
    public IngestionReport ingestSections(IngestSectionsCommand command) {
        if (command == null || command.sections() == null || command.sections().isEmpty()) {
            throw IngestionException.badRequest("At least one section is required");
        }
        List<SectionRecord> sections = command.sections();
        for (int i = 0; i < sections.size(); i++) {
            SectionRecord section = sections.get(i);
            if (section == null || section.sectionId() == null || section.sectionId().isBlank()) {
                throw IngestionException.badRequest("Section at index " + i + " has no section id");
            }
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            IngestionReport report = ingest(sections, command.dryRun());
            sectionsCounter.increment(sections.size());
            return report;
        } catch (GraphWriteException ex) {
            throw new IngestionException(HttpStatus.BAD_GATEWAY,
                    "Graph write failed at batch " + ex.batchIndex() + " after " + ex.committedBatches() + " committed batches", ex);
        } catch (DataAccessException ex) {
            log.error("Graph store unavailable during ingestion", ex);
            throw IngestionException.storeUnavailable(ex);
        } finally {
            sample.stop(ingestionTimer);
        }
    }

    @Override
    public int enrichPublicLaws(List<PublicLawMetadata> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            throw IngestionException.badRequest("At least one Public Law is required");
        }
        try {
            return graphWriter.enrichPublicLaws(metadata);
        } catch (DataAccessException ex) {
            log.error("Graph store unavailable during enrichment", ex);
            throw IngestionException.storeUnavailable(ex);
        }
    }

    private IngestionReport ingest(List<SectionRecord> sections, boolean dryRun) {
        Map<String, ExtractedPublicLaw> laws = Map.of();
        int citations = 0;
        int roundSize = Math.max(1, properties.getExtractionBatchSize());
        for (int from = 0; from < sections.size(); from += roundSize) {
            List<ExtractedPublicLaw> extracted = extract(sections.subList(from, Math.min(sections.size(), from + roundSize)));
            citations += extracted.size();
            laws = publicLawMerger.mergeInto(laws, extracted);
        }
        log.info("Extracted {} Public Law citations ({} unique laws) from {} sections", citations, laws.size(), sections.size());

        Set<String> existingLaws = graphStore.existingNodeIds(NodeLabel.PUBLIC_LAW, laws.keySet());
        int newLaws = laws.size() - existingLaws.size();
        int lawsWithDate = (int) laws.values().stream().filter(law -> law.enactedDate() != null).count();
        int lawsWithStat = (int) laws.values().stream().filter(law -> law.statutesAtLarge() != null).count();
        Map<Integer, Long> topCongresses = topCongresses(laws.values());

        if (dryRun) {
            Map<RelationshipType, Long> pending = pendingEdges(laws.values());
            long enacts = pending.getOrDefault(RelationshipType.ENACTS, 0L);
            long amends = pending.getOrDefault(RelationshipType.AMENDS, 0L);
            long planned = laws.values().stream().mapToLong(law -> law.positionInSource().size()).sum();
            log.info("Dry run over {} sections: {} new laws, {} ENACTS and {} AMENDS would be created",
                    sections.size(), newLaws, enacts, amends);
            int sectionNodes = (int) sections.stream().map(SectionRecord::sectionId).distinct().count();
            return new IngestionReport(sections.size(), citations, laws.size(), newLaws, lawsWithDate, lawsWithStat,
                    sectionNodes, (int) enacts, (int) amends, (int) (planned - enacts - amends), topCongresses, true);
        }

        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        int sectionNodes = graphWriter.writeSections(sections, new Provenance(properties.getSectionSourceName(), now));
        graphWriter.writePublicLaws(laws.values(), new Provenance(properties.getLawSourceName(), now));
        CitationGraphWriter.LinkResult links = graphWriter.linkPublicLaws(laws.values());
        log.info("Ingested {} sections: {} new laws, {} ENACTS and {} AMENDS created",
                sections.size(), newLaws, links.enactsCreated(), links.amendsCreated());
        return new IngestionReport(sections.size(), citations, laws.size(), newLaws, lawsWithDate, lawsWithStat,
                sectionNodes, links.enactsCreated(), links.amendsCreated(), links.skipped(), topCongresses, false);
    }

    private List<ExtractedPublicLaw> extract(List<SectionRecord> round) {
        Function<SectionRecord, List<ExtractedPublicLaw>> extractor =
                section -> amendmentExtractor.extractFromSourceCredit(section.sourceCredit(), section.sectionId());
        Stream<SectionRecord> stream = properties.isParallelExtraction() ? round.parallelStream() : round.stream();
        List<List<ExtractedPublicLaw>> perSection = stream.map(extractor).toList();
        List<ExtractedPublicLaw> extracted = new ArrayList<>();
        perSection.forEach(extracted::addAll);
        return extracted;
    }

    private Map<RelationshipType, Long> pendingEdges(Collection<ExtractedPublicLaw> laws) {
        return laws.stream()
                .flatMap(law -> graphWriter.plannedEdges(law).stream())
                .filter(edge -> !graphStore.edgeExists(edge.fromId(), edge.toId(), edge.type()))
                .collect(Collectors.groupingBy(GraphEdge::type, Collectors.counting()));
    }

    private Map<Integer, Long> topCongresses(Collection<ExtractedPublicLaw> laws) {
        Map<Integer, Long> counts = laws.stream()
                .collect(Collectors.groupingBy(ExtractedPublicLaw::congress, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<Integer, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<Integer, Long>comparingByKey()))
                .limit(Math.max(0, properties.getTopCongresses()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
    }
}
