package io.github.drompincen.ledgersync.persistence.repository;

import io.github.drompincen.ledgersync.persistence.document.ThemeDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ThemeRepository extends MongoRepository<ThemeDocument, String> {
    List<ThemeDocument> findByOwnerId(String ownerId);
}
