package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.SyncStateDocument;
import io.github.drompincen.ledgersync.persistence.repository.SyncStateRepository;
import io.github.drompincen.ledgersync.protocol.api.SyncMode;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;

/** Per-owner delta watermark and last pass summaries. */
@Service
public class SyncStateService {

    private static final Logger log = LoggerFactory.getLogger(SyncStateService.class);

    private final SyncStateRepository stateRepository;

    public SyncStateService(SyncStateRepository stateRepository) {
        this.stateRepository = stateRepository;
    }

    public SyncStateDocument load(String ownerId) {
        return stateRepository.findById(ownerId).orElseGet(() -> {
            SyncStateDocument fresh = new SyncStateDocument();
            fresh.setOwnerId(ownerId);
            return fresh;
        });
    }

    public void recordPass(SyncResult result, Instant watermark) {
        try {
            SyncStateDocument state = load(result.ownerId());
            if (watermark != null && (state.getWatermark() == null || watermark.isAfter(state.getWatermark()))) {
                state.setWatermark(watermark);
            }
            state.setLastSyncAt(result.finishedAt());
            if (result.mode() == SyncMode.FULL) {
                state.setLastFullSyncAt(result.finishedAt());
            } else {
                state.setLastDeltaSyncAt(result.finishedAt());
            }
            state.setLastSummary(result.summaryLine());
            state.setLastErrors(new ArrayList<>(result.errors()));
            stateRepository.save(state);
        } catch (Exception e) {
            log.error("Failed to record sync state for owner {}", result.ownerId(), e);
        }
    }
}
