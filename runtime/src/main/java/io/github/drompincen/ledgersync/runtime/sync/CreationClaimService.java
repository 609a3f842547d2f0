package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.CreationClaimDocument;
import io.github.drompincen.ledgersync.persistence.repository.CreationClaimRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Advisory marker that one process is about to create the ledger task for a device item.
 * Claims expire after a minute; the TTL index on {@code expiresAt} cleans them up.
 */
@Service
public class CreationClaimService {

    private static final Logger log = LoggerFactory.getLogger(CreationClaimService.class);

    static final Duration TTL = Duration.ofSeconds(60);

    private final CreationClaimRepository claimRepository;
    private final Clock clock;
    private final String claimant = UUID.randomUUID().toString();

    public CreationClaimService(CreationClaimRepository claimRepository, Clock clock) {
        this.claimRepository = claimRepository;
        this.clock = clock;
    }

    /** True when this process holds the claim afterwards. */
    public boolean tryClaim(String ownerId, String deviceItemId) {
        Instant now = clock.instant();
        var existing = claimRepository.findByOwnerIdAndDeviceItemId(ownerId, deviceItemId);
        if (existing.isPresent() && existing.get().getExpiresAt().isAfter(now)
                && !claimant.equals(existing.get().getClaimant())) {
            log.info("Device item {} already claimed by {}", deviceItemId, existing.get().getClaimant());
            return false;
        }
        existing.ifPresent(claimRepository::delete);

        CreationClaimDocument claim = new CreationClaimDocument();
        claim.setClaimId(UUID.randomUUID().toString());
        claim.setOwnerId(ownerId);
        claim.setDeviceItemId(deviceItemId);
        claim.setClaimant(claimant);
        claim.setClaimedAt(now);
        claim.setExpiresAt(now.plus(TTL));
        try {
            claimRepository.save(claim);
            return true;
        } catch (DuplicateKeyException e) {
            log.info("Lost creation race for device item {}", deviceItemId);
            return false;
        }
    }

    /** Drops this process's claim once the task exists; claims of other processes are left alone. */
    public void release(String ownerId, String deviceItemId) {
        claimRepository.findByOwnerIdAndDeviceItemId(ownerId, deviceItemId)
                .filter(c -> claimant.equals(c.getClaimant()))
                .ifPresent(claimRepository::delete);
    }

    String claimant() {
        return claimant;
    }
}
