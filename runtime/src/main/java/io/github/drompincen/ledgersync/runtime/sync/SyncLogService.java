package io.github.drompincen.ledgersync.runtime.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.drompincen.ledgersync.persistence.document.ActivityDocument;
import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.persistence.repository.ActivityRepository;
import io.github.drompincen.ledgersync.protocol.api.DedupeReport;
import io.github.drompincen.ledgersync.protocol.api.SyncDecision;
import io.github.drompincen.ledgersync.protocol.api.SyncDirection;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Writes sync decisions as single-line JSON to the {@code ledgersync.sync} logger and mirrors
 * them to the {@code activity} collection. Persistence is best-effort and skipped for dry runs.
 */
@Service
public class SyncLogService {

    public static final String DECISION_LOGGER = "ledgersync.sync";

    private static final Logger log = LoggerFactory.getLogger(SyncLogService.class);
    private static final Logger decisions = LoggerFactory.getLogger(DECISION_LOGGER);

    private final ActivityRepository activityRepository;
    private final SyncProperties properties;
    private final ObjectMapper json = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public SyncLogService(ActivityRepository activityRepository, SyncProperties properties) {
        this.activityRepository = activityRepository;
        this.properties = properties;
    }

    public void record(String ownerId, SyncDecision decision, LedgerTaskDocument task) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("direction", decision.direction().wireName());
        entry.put("action", decision.action().wireName());
        entry.put("taskId", decision.taskId());
        entry.put("deviceItemId", decision.deviceItemId());
        entry.put("dryRun", decision.dryRun());
        entry.put("at", decision.at());
        if (decision.metadata() != null && !decision.metadata().isEmpty()) entry.put("metadata", decision.metadata());
        decisions.info(toJson(entry));

        if (decision.dryRun()) return;
        ActivityDocument doc = newActivity(ownerId, decision.direction().wireName(), decision.action().wireName(), decision.at());
        doc.setTaskId(decision.taskId());
        doc.setDeviceItemId(decision.deviceItemId());
        doc.setMetadata(decision.metadata());
        if (task != null) {
            doc.setTitle(task.getTitle());
            doc.setStatus(task.effectiveStatus().noteValue());
            doc.setTaskRef(task.displayRef());
        }
        persist(doc);
    }

    public void recordSweep(String ownerId, DedupeReport report, Instant at) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("mode", report.mode().name().toLowerCase(Locale.ROOT));
        metadata.put("groups", report.groups());
        metadata.put("duplicates", report.duplicates());
        metadata.put("errors", report.errors());
        decisions.info(toJson(Map.of("action", "dedupeSweep", "ownerId", ownerId, "metadata", metadata)));

        ActivityDocument doc = newActivity(ownerId, SyncDirection.DIAGNOSTICS.wireName(), "dedupeSweep", at);
        doc.setMetadata(metadata);
        persist(doc);
    }

    public void recordPass(SyncResult result) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("action", "passSummary");
        entry.put("ownerId", result.ownerId());
        entry.put("mode", result.mode() == null ? null : result.mode().name().toLowerCase(Locale.ROOT));
        entry.put("dryRun", result.dryRun());
        entry.put("summary", result.summaryLine());
        entry.put("phaseMillis", result.phaseMillis());
        entry.put("errors", result.errors());
        decisions.info(toJson(entry));
    }

    public List<ActivityDocument> recent(String ownerId) {
        return activityRepository.findTop50ByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    String toJson(Map<String, Object> entry) {
        try {
            return json.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize sync log entry: {}", e.getMessage());
            return entry.toString();
        }
    }

    private ActivityDocument newActivity(String ownerId, String direction, String action, Instant at) {
        ActivityDocument doc = new ActivityDocument();
        doc.setActivityId(UUID.randomUUID().toString());
        doc.setOwnerId(ownerId);
        doc.setDirection(direction);
        doc.setAction(action);
        doc.setSource(properties.getSource());
        doc.setCreatedAt(at != null ? at : Instant.now());
        return doc;
    }

    private void persist(ActivityDocument doc) {
        try {
            activityRepository.save(doc);
        } catch (Exception e) {
            log.error("Failed to persist activity {} for task {}", doc.getAction(), doc.getTaskId(), e);
        }
    }
}
