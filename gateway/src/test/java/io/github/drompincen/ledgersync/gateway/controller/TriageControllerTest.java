package io.github.drompincen.ledgersync.gateway.controller;

import io.github.drompincen.ledgersync.protocol.api.ClassifyRequest;
import io.github.drompincen.ledgersync.protocol.api.Persona;
import io.github.drompincen.ledgersync.protocol.api.TriageClassification;
import io.github.drompincen.ledgersync.runtime.triage.TriageClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TriageControllerTest {

    @Mock private TriageClassifier classifier;

    private TriageController controller;

    @BeforeEach
    void setUp() {
        controller = new TriageController(classifier);
    }

    @Test
    void classifiesTitle() {
        TriageClassification work = new TriageClassification(Persona.WORK, 0.9, "heuristic", null);
        when(classifier.classify(any(ClassifyRequest.class))).thenReturn(work);

        ResponseEntity<TriageClassification> response =
                controller.classify(new ClassifyRequest("Deploy production fix", null, List.of()));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(work);
    }

    @Test
    void blankTitleIsBadRequest() {
        assertThat(controller.classify(new ClassifyRequest("  ", null, null)).getStatusCode().value()).isEqualTo(400);
        verifyNoInteractions(classifier);
    }
}
