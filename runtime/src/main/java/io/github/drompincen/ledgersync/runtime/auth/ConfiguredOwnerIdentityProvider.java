package io.github.drompincen.ledgersync.runtime.auth;

import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Reads the owner id from {@code ledgersync.sync.owner-id}. */
@Component
public class ConfiguredOwnerIdentityProvider implements OwnerIdentityProvider {

    private final SyncProperties properties;

    public ConfiguredOwnerIdentityProvider(SyncProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> currentOwnerId() {
        String ownerId = properties.getOwnerId();
        if (ownerId == null || ownerId.isBlank()) return Optional.empty();
        return Optional.of(ownerId.trim());
    }
}
