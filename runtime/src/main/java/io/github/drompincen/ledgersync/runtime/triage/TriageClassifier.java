package io.github.drompincen.ledgersync.runtime.triage;

import io.github.drompincen.ledgersync.protocol.api.ClassifyRequest;
import io.github.drompincen.ledgersync.protocol.api.Persona;
import io.github.drompincen.ledgersync.protocol.api.TriageClassification;
import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether an incoming item is work or personal. An explicit {@code work} or
 * {@code personal} tag always wins; otherwise the remote classifier is asked when configured,
 * then the keyword tables. Below the minimum confidence the answer is {@link Persona#UNKNOWN}.
 */
@Component
public class TriageClassifier {

    static final double TAG_CONFIDENCE = 0.95;

    private final SyncProperties properties;
    private final RemoteTriageClient remoteClient;

    public TriageClassifier(SyncProperties properties, RemoteTriageClient remoteClient) {
        this.properties = properties;
        this.remoteClient = remoteClient;
    }

    public TriageClassification classify(String title, String notes, List<String> tags) {
        String text = (title == null ? "" : title) + " " + (notes == null ? "" : notes);
        if (tags != null) {
            for (String tag : tags) {
                String t = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
                if (t.equals("work")) return new TriageClassification(Persona.WORK, TAG_CONFIDENCE, "tag", null);
                if (t.equals("personal")) {
                    return new TriageClassification(Persona.PERSONAL, TAG_CONFIDENCE, "tag",
                            KeywordTriageScorer.suggestCategory(text));
                }
            }
        }

        SyncProperties.Triage triage = properties.getTriage();
        if (!triage.isEnabled()) return TriageClassification.disabled();

        if (triage.getEndpoint() != null && !triage.getEndpoint().isBlank()) {
            Optional<TriageClassification> remote = remoteClient.classify(triage.getEndpoint(), triage.getTimeout(),
                    new ClassifyRequest(title, notes, tags == null ? List.of() : tags));
            if (remote.isPresent()) {
                TriageClassification r = remote.get();
                String category = r.suggestedCategory();
                if (r.isPersonal() && category == null) category = KeywordTriageScorer.suggestCategory(text);
                return threshold(new TriageClassification(r.persona(), r.confidence(), r.source(),
                        r.isPersonal() ? category : null));
            }
        }

        KeywordTriageScorer.Score score = KeywordTriageScorer.score(text);
        if (score.total() <= 0) return new TriageClassification(Persona.UNKNOWN, 0.0, "heuristic", null);
        boolean work = score.work() >= score.personal();
        double winner = work ? score.work() : score.personal();
        double confidence = winner / Math.max(score.total(), 1.0);
        return threshold(new TriageClassification(work ? Persona.WORK : Persona.PERSONAL, confidence, "heuristic",
                work ? null : KeywordTriageScorer.suggestCategory(text)));
    }

    public TriageClassification classify(ClassifyRequest request) {
        return classify(request.title(), request.notes(), request.tags());
    }

    private TriageClassification threshold(TriageClassification c) {
        if (c.confidence() >= properties.getTriage().getMinConfidence()) return c;
        return new TriageClassification(Persona.UNKNOWN, c.confidence(), c.source(), null);
    }
}
