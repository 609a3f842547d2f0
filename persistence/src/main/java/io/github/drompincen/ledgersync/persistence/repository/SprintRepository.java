package io.github.drompincen.ledgersync.persistence.repository;

import io.github.drompincen.ledgersync.persistence.document.SprintDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface SprintRepository extends MongoRepository<SprintDocument, String> {
}
