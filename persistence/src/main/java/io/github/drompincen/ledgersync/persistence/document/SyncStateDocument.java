package io.github.drompincen.ledgersync.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/** Per-owner bookkeeping between passes. */
@Document(collection = "sync_state")
public class SyncStateDocument {

    @Id
    private String ownerId;
    private Instant watermark;
    private Instant lastSyncAt;
    private Instant lastFullSyncAt;
    private Instant lastDeltaSyncAt;
    private String lastSummary;
    private List<String> lastErrors;

    public SyncStateDocument() {}

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public Instant getWatermark() { return watermark; }
    public void setWatermark(Instant watermark) { this.watermark = watermark; }

    public Instant getLastSyncAt() { return lastSyncAt; }
    public void setLastSyncAt(Instant lastSyncAt) { this.lastSyncAt = lastSyncAt; }

    public Instant getLastFullSyncAt() { return lastFullSyncAt; }
    public void setLastFullSyncAt(Instant lastFullSyncAt) { this.lastFullSyncAt = lastFullSyncAt; }

    public Instant getLastDeltaSyncAt() { return lastDeltaSyncAt; }
    public void setLastDeltaSyncAt(Instant lastDeltaSyncAt) { this.lastDeltaSyncAt = lastDeltaSyncAt; }

    public String getLastSummary() { return lastSummary; }
    public void setLastSummary(String lastSummary) { this.lastSummary = lastSummary; }

    public List<String> getLastErrors() { return lastErrors; }
    public void setLastErrors(List<String> lastErrors) { this.lastErrors = lastErrors; }
}
