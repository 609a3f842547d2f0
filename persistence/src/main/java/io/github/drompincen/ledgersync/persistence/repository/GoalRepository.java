package io.github.drompincen.ledgersync.persistence.repository;

import io.github.drompincen.ledgersync.persistence.document.GoalDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface GoalRepository extends MongoRepository<GoalDocument, String> {
}
