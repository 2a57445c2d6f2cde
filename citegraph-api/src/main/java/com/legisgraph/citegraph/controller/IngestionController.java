package com.legisgraph.citegraph.controller;

import com.legisgraph.citegraph.model.IngestSectionsRequest;
import com.legisgraph.citegraph.model.IngestionReport;
import com.legisgraph.citegraph.model.PublicLawMetadata;
import com.legisgraph.citegraph.service.ingestion.IngestSectionsCommand;
import com.legisgraph.citegraph.service.ingestion.IngestionService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/admin/ingest")
@Validated
public class IngestionController {

    private final IngestionService ingestionService;

    public IngestionController(IngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    @PostMapping(value = "/sections", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public IngestionReport ingestSections(@Valid @RequestBody IngestSectionsRequest request) {
        return ingestionService.ingestSections(new IngestSectionsCommand(request.sections(), request.dryRun()));
    }

    @PostMapping(value = "/public-laws", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> enrichPublicLaws(@RequestBody List<@Valid PublicLawMetadata> metadata) {
        int enriched = ingestionService.enrichPublicLaws(metadata);
        return Map.of(
                "received", metadata == null ? 0 : metadata.size(),
                "enriched", enriched
        );
    }
}
