package io.github.drompincen.ledgersync.persistence.repository;

import io.github.drompincen.ledgersync.persistence.document.ActivityDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ActivityRepository extends MongoRepository<ActivityDocument, String> {
    List<ActivityDocument> findTop50ByOwnerIdOrderByCreatedAtDesc(String ownerId);
    List<ActivityDocument> findByOwnerIdAndAction(String ownerId, String action);
}
