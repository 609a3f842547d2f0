package io.github.drompincen.ledgersync.gateway.controller;

import io.github.drompincen.ledgersync.protocol.api.ClassifyRequest;
import io.github.drompincen.ledgersync.protocol.api.TriageClassification;
import io.github.drompincen.ledgersync.runtime.triage.TriageClassifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/triage")
public class TriageController {

    private final TriageClassifier classifier;

    public TriageController(TriageClassifier classifier) {
        this.classifier = classifier;
    }

    @PostMapping("/classify")
    public ResponseEntity<TriageClassification> classify(@RequestBody ClassifyRequest request) {
        if (request == null || request.title() == null || request.title().isBlank()) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(classifier.classify(request));
    }
}
