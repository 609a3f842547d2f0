package io.github.drompincen.ledgersync.runtime.ledger;

import io.github.drompincen.ledgersync.persistence.document.GoalDocument;
import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.persistence.document.SprintDocument;
import io.github.drompincen.ledgersync.persistence.document.StoryDocument;
import io.github.drompincen.ledgersync.persistence.document.ThemeDocument;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Everything the engine reads from or writes to the ledger. Implementations throw
 * {@link LedgerAccessException} on failure.
 */
public interface LedgerGateway {

    /** Tasks changed on the server after {@code watermark}; every task of the owner when it is null. */
    List<LedgerTaskDocument> fetchChangedSince(String ownerId, Instant watermark);

    /** Tasks of the owner in id order, {@code pageSize} per round trip, at most {@code maxTasks}. */
    List<LedgerTaskDocument> fetchAll(String ownerId, int pageSize, int maxTasks);

    List<LedgerTaskDocument> findByLinkedDeviceIds(String ownerId, Collection<String> deviceIds);

    Optional<LedgerTaskDocument> findByHumanRef(String ownerId, String humanRef);

    Optional<LedgerTaskDocument> findById(String ownerId, String id);

    /**
     * Tasks of the owner whose title holds the words of {@code normalizedTitle} in order, ignoring
     * case, oldest first. A loose prefilter: callers compare normalized titles themselves.
     */
    List<LedgerTaskDocument> findByTitleWords(String ownerId, String normalizedTitle);

    List<StoryDocument> findStories(Collection<String> ids);

    List<GoalDocument> findGoals(Collection<String> ids);

    List<SprintDocument> findSprints(Collection<String> ids);

    List<ThemeDocument> findThemes(String ownerId);

    /** Inserts a new task; the store assigns the id and the server timestamps. */
    LedgerTaskDocument create(LedgerTaskDocument task);

    /** Applies the mutations as one batch. */
    void commit(List<LedgerMutation> mutations);

    void delete(Collection<String> taskIds);
}
