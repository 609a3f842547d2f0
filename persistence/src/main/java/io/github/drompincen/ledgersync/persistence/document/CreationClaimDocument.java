package io.github.drompincen.ledgersync.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Advisory marker written before a pass creates a ledger task for a device item.
 * Best effort only: two passes can still both create, and dedupe cleans up afterwards.
 */
@Document(collection = "creation_claims")
@CompoundIndex(name = "owner_device", def = "{'ownerId': 1, 'deviceItemId': 1}", unique = true)
public class CreationClaimDocument {

    @Id
    private String claimId;
    private String ownerId;
    private String deviceItemId;
    private String claimant;
    private Instant claimedAt;

    @Indexed(expireAfterSeconds = 0)
    private Instant expiresAt;

    public CreationClaimDocument() {}

    public String getClaimId() { return claimId; }
    public void setClaimId(String claimId) { this.claimId = claimId; }

    public String getOwnerId() { return ownerId; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }

    public String getDeviceItemId() { return deviceItemId; }
    public void setDeviceItemId(String deviceItemId) { this.deviceItemId = deviceItemId; }

    public String getClaimant() { return claimant; }
    public void setClaimant(String claimant) { this.claimant = claimant; }

    public Instant getClaimedAt() { return claimedAt; }
    public void setClaimedAt(Instant claimedAt) { this.claimedAt = claimedAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }
}
