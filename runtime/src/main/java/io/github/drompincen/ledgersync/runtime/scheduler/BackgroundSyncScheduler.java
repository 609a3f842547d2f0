package io.github.drompincen.ledgersync.runtime.scheduler;

import io.github.drompincen.ledgersync.persistence.document.SyncStateDocument;
import io.github.drompincen.ledgersync.protocol.api.SyncMode;
import io.github.drompincen.ledgersync.protocol.api.SyncRequest;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import io.github.drompincen.ledgersync.runtime.auth.OwnerIdentityProvider;
import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import io.github.drompincen.ledgersync.runtime.sync.ReconciliationEngine;
import io.github.drompincen.ledgersync.runtime.sync.SyncStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Wakes up every minute and starts a pass once the configured interval has elapsed since the
 * owner's last one. Every {@code full-resync-interval} the pass is a full one.
 */
@Component
@ConditionalOnProperty(prefix = "ledgersync.sync.background", name = "enabled", havingValue = "true")
public class BackgroundSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundSyncScheduler.class);

    private final ReconciliationEngine engine;
    private final SyncStateService stateService;
    private final OwnerIdentityProvider ownerIdentityProvider;
    private final SyncProperties properties;
    private final Clock clock;

    public BackgroundSyncScheduler(ReconciliationEngine engine, SyncStateService stateService,
                                   OwnerIdentityProvider ownerIdentityProvider, SyncProperties properties, Clock clock) {
        this.engine = engine;
        this.stateService = stateService;
        this.ownerIdentityProvider = ownerIdentityProvider;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelay = 60000)
    public void tick() {
        Optional<String> owner = ownerIdentityProvider.currentOwnerId();
        if (owner.isEmpty()) return;
        try {
            nextMode(stateService.load(owner.get()), clock.instant()).ifPresent(mode -> {
                SyncResult result = engine.reconcile(new SyncRequest(mode, null, "background"));
                if (result.hasErrors()) {
                    log.warn("Background {} sync finished with errors: {}", mode, result.errors());
                }
            });
        } catch (Exception e) {
            log.error("Background sync tick failed", e);
        }
    }

    /** The mode of the pass due now, or empty when the last pass is recent enough. */
    Optional<SyncMode> nextMode(SyncStateDocument state, Instant now) {
        Duration interval = properties.getBackground().effectiveInterval();
        if (state.getLastSyncAt() != null && now.isBefore(state.getLastSyncAt().plus(interval))) {
            return Optional.empty();
        }
        Instant lastFull = state.getLastFullSyncAt();
        if (lastFull == null || !now.isBefore(lastFull.plus(properties.getFullResyncInterval()))) {
            return Optional.of(SyncMode.FULL);
        }
        return Optional.of(SyncMode.DELTA);
    }
}
