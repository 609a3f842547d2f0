package io.github.drompincen.ledgersync.persistence.repository;

import io.github.drompincen.ledgersync.persistence.document.SyncStateDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SyncStateRepository extends MongoRepository<SyncStateDocument, String> {
}
