package io.github.drompincen.ledgersync.runtime.config;

import io.github.drompincen.ledgersync.protocol.api.SyncMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "ledgersync.sync")
public class SyncProperties {

    /** Minimum spacing between background passes. */
    public static final Duration MIN_BACKGROUND_INTERVAL = Duration.ofMinutes(15);

    private SyncMode mode = SyncMode.DELTA;
    private boolean dryRun = false;
    private boolean showMetadataInNotes = true;
    private Duration ttl = Duration.ofDays(30);
    private Duration fullResyncInterval = Duration.ofHours(6);
    private int fullPageSize = 500;
    private int fullMaxTasks = 10_000;
    private int batchSize = 400;
    private String ownerId;
    private String deepLinkBase = "https://ledger.example.app";
    private String defaultList = "Reminders";
    private String source = "ledgersync";
    private Triage triage = new Triage();
    private Background background = new Background();
    private DeviceStore deviceStore = new DeviceStore();

    public SyncMode getMode() { return mode; }
    public void setMode(SyncMode mode) { this.mode = mode; }

    public boolean isDryRun() { return dryRun; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }

    public boolean isShowMetadataInNotes() { return showMetadataInNotes; }
    public void setShowMetadataInNotes(boolean showMetadataInNotes) { this.showMetadataInNotes = showMetadataInNotes; }

    public Duration getTtl() { return ttl; }
    public void setTtl(Duration ttl) { this.ttl = ttl; }

    public Duration getFullResyncInterval() { return fullResyncInterval; }
    public void setFullResyncInterval(Duration fullResyncInterval) { this.fullResyncInterval = fullResyncInterval; }

    public int getFullPageSize() { return fullPageSize; }
    public void setFullPageSize(int fullPageSize) { this.fullPageSize = fullPageSize; }

    public int getFullMaxTasks() { return fullMaxTasks; }
    public void setFullMaxTasks(int fullMaxTasks) { this.fullMaxTasks = fullMaxTasks; }

    public int getBatchSize() { return batchSize; }
    public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getDeepLinkBase() { return deepLinkBase; }
    public void setDeepLinkBase(String deepLinkBase) { this.deepLinkBase = deepLinkBase; }

    public String getDefaultList() { return defaultList; }
    public void setDefaultList(String defaultList) { this.defaultList = defaultList; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public Triage getTriage() { return triage; }
    public void setTriage(Triage triage) { this.triage = triage; }

    public Background getBackground() { return background; }
    public void setBackground(Background background) { this.background = background; }

    public DeviceStore getDeviceStore() { return deviceStore; }
    public void setDeviceStore(DeviceStore deviceStore) { this.deviceStore = deviceStore; }

    public static class Triage {
        private boolean enabled = false;
        private String sourceList;
        private String workList = "Work";
        private String endpoint;
        private Duration timeout = Duration.ofSeconds(3);
        private double minConfidence = 0.70;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getSourceList() { return sourceList; }
        public void setSourceList(String sourceList) { this.sourceList = sourceList; }

        public String getWorkList() { return workList; }
        public void setWorkList(String workList) { this.workList = workList; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }
    }

    public static class Background {
        private boolean enabled = false;
        private Duration interval = MIN_BACKGROUND_INTERVAL;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        /** Configured interval, never below fifteen minutes. */
        public Duration effectiveInterval() {
            if (interval == null || interval.compareTo(MIN_BACKGROUND_INTERVAL) < 0) {
                return MIN_BACKGROUND_INTERVAL;
            }
            return interval;
        }
    }

    public static class DeviceStore {
        /** {@code memory} or {@code file}. */
        private String type = "memory";
        private String path = "device-store.json";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }
}
