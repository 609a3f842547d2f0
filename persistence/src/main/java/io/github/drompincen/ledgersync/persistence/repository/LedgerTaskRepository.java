package io.github.drompincen.ledgersync.persistence.repository;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface LedgerTaskRepository extends MongoRepository<LedgerTaskDocument, String> {

    List<LedgerTaskDocument> findByOwnerId(String ownerId);

    List<LedgerTaskDocument> findByOwnerIdAndLinkedDeviceIdIn(String ownerId, Collection<String> linkedDeviceIds);

    Optional<LedgerTaskDocument> findFirstByOwnerIdAndHumanRefIgnoreCase(String ownerId, String humanRef);

    Optional<LedgerTaskDocument> findByIdAndOwnerId(String id, String ownerId);
}
