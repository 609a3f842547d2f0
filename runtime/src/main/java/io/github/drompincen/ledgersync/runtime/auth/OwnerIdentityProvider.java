package io.github.drompincen.ledgersync.runtime.auth;

import java.util.Optional;

/** Supplies the verified owner id of the signed-in user, if any. */
public interface OwnerIdentityProvider {
    Optional<String> currentOwnerId();
}
