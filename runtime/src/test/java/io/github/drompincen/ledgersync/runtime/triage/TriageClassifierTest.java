package io.github.drompincen.ledgersync.runtime.triage;

import io.github.drompincen.ledgersync.protocol.api.ClassifyRequest;
import io.github.drompincen.ledgersync.protocol.api.Persona;
import io.github.drompincen.ledgersync.protocol.api.TriageClassification;
import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class TriageClassifierTest {

    @Mock private RemoteTriageClient remoteClient;

    private SyncProperties properties;
    private TriageClassifier classifier;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.getTriage().setEnabled(true);
        classifier = new TriageClassifier(properties, remoteClient);
    }

    @Test
    void explicitTagWinsEvenWhenDisabled() {
        properties.getTriage().setEnabled(false);

        TriageClassification c = classifier.classify("Deploy production fix", null, List.of(" Personal "));

        assertThat(c.persona()).isEqualTo(Persona.PERSONAL);
        assertThat(c.source()).isEqualTo("tag");
        assertThat(c.confidence()).isEqualTo(0.95);
    }

    @Test
    void disabledWithoutTagIsUnknown() {
        properties.getTriage().setEnabled(false);

        assertThat(classifier.classify("Deploy production fix", null, List.of())).isEqualTo(TriageClassification.disabled());
    }

    @Test
    void heuristicRecognisesWork() {
        TriageClassification c = classifier.classify("Deploy production fix", null, null);

        assertThat(c.persona()).isEqualTo(Persona.WORK);
        assertThat(c.source()).isEqualTo("heuristic");
        assertThat(c.suggestedCategory()).isNull();
    }

    @Test
    void heuristicRecognisesPersonalWithCategory() {
        TriageClassification c = classifier.classify(new ClassifyRequest("Book dentist appointment", null, null));

        assertThat(c.persona()).isEqualTo(Persona.PERSONAL);
        assertThat(c.suggestedCategory()).isEqualTo("Health");
    }

    @Test
    void mixedSignalsFallBelowThreshold() {
        TriageClassification c = classifier.classify("Client meeting at the gym", null, null);

        assertThat(c.persona()).isEqualTo(Persona.UNKNOWN);
        assertThat(c.confidence()).isLessThan(0.70);
    }

    @Test
    void noKeywordsIsUnknownWithZeroConfidence() {
        TriageClassification c = classifier.classify("Think about it", null, null);

        assertThat(c.persona()).isEqualTo(Persona.UNKNOWN);
        assertThat(c.confidence()).isZero();
    }

    @Test
    void remoteAnswerIsUsedAndCategoryFilledFromKeywords() {
        properties.getTriage().setEndpoint("http://triage.local/classify");
        when(remoteClient.classify(anyString(), any(Duration.class), any(ClassifyRequest.class)))
                .thenReturn(Optional.of(new TriageClassification(Persona.PERSONAL, 0.9, "remote", null)));

        TriageClassification c = classifier.classify("Laundry", null, null);

        assertThat(c.source()).isEqualTo("remote");
        assertThat(c.suggestedCategory()).isEqualTo("Home");
    }

    @Test
    void remoteFailureFallsBackToKeywords() {
        properties.getTriage().setEndpoint("http://triage.local/classify");
        when(remoteClient.classify(anyString(), any(Duration.class), any(ClassifyRequest.class)))
                .thenReturn(Optional.empty());

        TriageClassification c = classifier.classify("Deploy production fix", null, null);

        assertThat(c.source()).isEqualTo("heuristic");
        assertThat(c.isWork()).isTrue();
    }

    @Test
    void remoteIsNotCalledWithoutEndpoint() {
        classifier.classify("Deploy production fix", null, null);

        verify(remoteClient, never()).classify(anyString(), any(), any());
    }
}
