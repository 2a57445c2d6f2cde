package com.legisgraph.citegraph.controller;

import com.legisgraph.citegraph.model.CitationView;
import com.legisgraph.citegraph.model.GraphStats;
import com.legisgraph.citegraph.model.ParseCitationsRequest;
import com.legisgraph.citegraph.model.SectionLineage;
import com.legisgraph.citegraph.service.citation.CitationParser;
import com.legisgraph.citegraph.service.lineage.GraphQueryService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class GraphController {

    private final GraphQueryService graphQueryService;
    private final CitationParser citationParser;

    public GraphController(GraphQueryService graphQueryService, CitationParser citationParser) {
        this.graphQueryService = graphQueryService;
        this.citationParser = citationParser;
    }

    @GetMapping(value = "/sections/{sectionId}/lineage", produces = MediaType.APPLICATION_JSON_VALUE)
    public SectionLineage lineage(@PathVariable String sectionId) {
        return graphQueryService.lineage(sectionId);
    }

    @PostMapping(value = "/citations/parse", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public List<CitationView> parse(@Valid @RequestBody ParseCitationsRequest request) {
        return citationParser.parse(request.text()).stream()
                .map(CitationView::from)
                .toList();
    }

    @GetMapping(value = "/graph/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public GraphStats stats() {
        return graphQueryService.stats();
    }
}
