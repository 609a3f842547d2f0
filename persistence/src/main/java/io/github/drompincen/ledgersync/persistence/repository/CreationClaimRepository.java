package io.github.drompincen.ledgersync.persistence.repository;

import io.github.drompincen.ledgersync.persistence.document.CreationClaimDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CreationClaimRepository extends MongoRepository<CreationClaimDocument, String> {
    Optional<CreationClaimDocument> findByOwnerIdAndDeviceItemId(String ownerId, String deviceItemId);
}
