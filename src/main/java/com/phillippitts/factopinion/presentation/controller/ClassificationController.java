package com.phillippitts.factopinion.presentation.controller;

import com.phillippitts.factopinion.config.properties.FusionProperties;
import com.phillippitts.factopinion.domain.ClassificationReport;
import com.phillippitts.factopinion.presentation.dto.ClassifyRequest;
import com.phillippitts.factopinion.presentation.dto.ClassifyResponse;
import com.phillippitts.factopinion.presentation.dto.SentenceView;
import com.phillippitts.factopinion.service.orchestration.ClassificationOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Classifies the sentences of a text as fact- or opinion-leaning.
 *
 * <p>A failed batch answers 503 with an empty sentence list and the failure reason; invalid
 * input is mapped to 400 by the global exception handler.
 */
@RestController
@RequestMapping("/api/v1")
class ClassificationController {

    private static final Logger LOG = LogManager.getLogger(ClassificationController.class);

    private final ClassificationOrchestrator orchestrator;
    private final double factThreshold;

    ClassificationController(ClassificationOrchestrator orchestrator, FusionProperties fusionProperties) {
        this.orchestrator = orchestrator;
        this.factThreshold = fusionProperties.getFactThreshold();
    }

    @PostMapping("/classify")
    ResponseEntity<ClassifyResponse> classify(@RequestBody ClassifyRequest request) {
        ClassificationReport report = orchestrator.classify(request.text());
        if (!report.succeeded()) {
            LOG.warn("Returning 503 for failed batch: {}", report.failure());
            return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ClassifyResponse.failed(report.failure()));
        }
        List<SentenceView> views = report.sentences().stream()
                .map(s -> SentenceView.from(s, factThreshold))
                .toList();
        return ResponseEntity.ok(ClassifyResponse.of(views, report.skippedIndexes()));
    }
}
