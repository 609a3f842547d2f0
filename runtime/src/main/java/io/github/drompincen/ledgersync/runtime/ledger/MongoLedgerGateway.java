package io.github.drompincen.ledgersync.runtime.ledger;

import io.github.drompincen.ledgersync.persistence.document.GoalDocument;
import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.persistence.document.SprintDocument;
import io.github.drompincen.ledgersync.persistence.document.StoryDocument;
import io.github.drompincen.ledgersync.persistence.document.ThemeDocument;
import io.github.drompincen.ledgersync.persistence.repository.GoalRepository;
import io.github.drompincen.ledgersync.persistence.repository.LedgerTaskRepository;
import io.github.drompincen.ledgersync.persistence.repository.SprintRepository;
import io.github.drompincen.ledgersync.persistence.repository.StoryRepository;
import io.github.drompincen.ledgersync.persistence.repository.ThemeRepository;
import io.github.drompincen.ledgersync.protocol.api.SyncErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class MongoLedgerGateway implements LedgerGateway {

    private static final Logger log = LoggerFactory.getLogger(MongoLedgerGateway.class);

    static final String SERVER_UPDATED_INDEX = "owner_serverUpdatedAt";
    static final String UPDATED_INDEX = "owner_updatedAt";
    static final int TITLE_CANDIDATE_LIMIT = 50;

    private final MongoTemplate mongoTemplate;
    private final LedgerTaskRepository taskRepository;
    private final StoryRepository storyRepository;
    private final GoalRepository goalRepository;
    private final SprintRepository sprintRepository;
    private final ThemeRepository themeRepository;

    public MongoLedgerGateway(MongoTemplate mongoTemplate, LedgerTaskRepository taskRepository,
                              StoryRepository storyRepository, GoalRepository goalRepository,
                              SprintRepository sprintRepository, ThemeRepository themeRepository) {
        this.mongoTemplate = mongoTemplate;
        this.taskRepository = taskRepository;
        this.storyRepository = storyRepository;
        this.goalRepository = goalRepository;
        this.sprintRepository = sprintRepository;
        this.themeRepository = themeRepository;
    }

    @Override
    public List<LedgerTaskDocument> fetchChangedSince(String ownerId, Instant watermark) {
        if (watermark == null) {
            return call("fetch all tasks", () -> taskRepository.findByOwnerId(ownerId));
        }
        try {
            return changedSince(ownerId, LedgerFields.SERVER_UPDATED_AT, SERVER_UPDATED_INDEX, watermark);
        } catch (RuntimeException e) {
            LedgerAccessException failure = LedgerErrors.translate("delta query", e);
            if (failure.kind() != SyncErrorKind.MISSING_INDEX) throw failure;
            log.warn("Index {} unavailable for owner {}, falling back to {}",
                    SERVER_UPDATED_INDEX, ownerId, LedgerFields.UPDATED_AT);
        }
        try {
            return changedSince(ownerId, LedgerFields.UPDATED_AT, null, watermark);
        } catch (RuntimeException e) {
            throw LedgerErrors.translate("delta query on updatedAt", e);
        }
    }

    private List<LedgerTaskDocument> changedSince(String ownerId, String field, String hint, Instant watermark) {
        Query query = new Query()
                .addCriteria(Criteria.where("ownerId").is(ownerId))
                .addCriteria(Criteria.where(field).gt(Date.from(watermark)))
                .with(Sort.by(Sort.Direction.ASC, field));
        if (hint != null) query.withHint(hint);
        return mongoTemplate.find(query, LedgerTaskDocument.class);
    }

    @Override
    public List<LedgerTaskDocument> fetchAll(String ownerId, int pageSize, int maxTasks) {
        List<LedgerTaskDocument> all = new ArrayList<>();
        String cursor = null;
        while (all.size() < maxTasks) {
            Query query = new Query().addCriteria(Criteria.where("ownerId").is(ownerId));
            if (cursor != null) query.addCriteria(Criteria.where("id").gt(cursor));
            query.with(Sort.by(Sort.Direction.ASC, "id")).limit(Math.min(pageSize, maxTasks - all.size()));
            List<LedgerTaskDocument> page = call("fetch page after " + cursor,
                    () -> mongoTemplate.find(query, LedgerTaskDocument.class));
            all.addAll(page);
            if (page.size() < pageSize) break;
            cursor = page.get(page.size() - 1).getId();
        }
        if (all.size() >= maxTasks) {
            log.warn("Full fetch for owner {} stopped at the {} task cap", ownerId, maxTasks);
        }
        return all;
    }

    @Override
    public List<LedgerTaskDocument> findByLinkedDeviceIds(String ownerId, Collection<String> deviceIds) {
        if (deviceIds.isEmpty()) return List.of();
        return call("linked device lookup", () -> taskRepository.findByOwnerIdAndLinkedDeviceIdIn(ownerId, deviceIds));
    }

    @Override
    public Optional<LedgerTaskDocument> findByHumanRef(String ownerId, String humanRef) {
        return call("human ref lookup " + humanRef,
                () -> taskRepository.findFirstByOwnerIdAndHumanRefIgnoreCase(ownerId, humanRef));
    }

    @Override
    public Optional<LedgerTaskDocument> findById(String ownerId, String id) {
        return call("task lookup " + id, () -> taskRepository.findByIdAndOwnerId(id, ownerId));
    }

    @Override
    public List<LedgerTaskDocument> findByTitleWords(String ownerId, String normalizedTitle) {
        if (normalizedTitle == null || normalizedTitle.isBlank()) return List.of();
        return call("title lookup", () -> mongoTemplate.find(titleWordsQuery(ownerId, normalizedTitle),
                LedgerTaskDocument.class));
    }

    static Query titleWordsQuery(String ownerId, String normalizedTitle) {
        String pattern = Arrays.stream(normalizedTitle.trim().split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*"));
        return new Query()
                .addCriteria(Criteria.where("ownerId").is(ownerId))
                .addCriteria(Criteria.where(LedgerFields.TITLE).regex(pattern, "i"))
                .with(Sort.by(Sort.Direction.ASC, "createdAt"))
                .limit(TITLE_CANDIDATE_LIMIT);
    }

    @Override
    public List<StoryDocument> findStories(Collection<String> ids) {
        return call("story lookup", () -> storyRepository.findAllById(ids));
    }

    @Override
    public List<GoalDocument> findGoals(Collection<String> ids) {
        return call("goal lookup", () -> goalRepository.findAllById(ids));
    }

    @Override
    public List<SprintDocument> findSprints(Collection<String> ids) {
        return call("sprint lookup", () -> sprintRepository.findAllById(ids));
    }

    @Override
    public List<ThemeDocument> findThemes(String ownerId) {
        return call("theme lookup", () -> themeRepository.findByOwnerId(ownerId));
    }

    @Override
    public LedgerTaskDocument create(LedgerTaskDocument task) {
        return call("create task " + task.getTitle(), () -> {
            LedgerTaskDocument saved = mongoTemplate.insert(task);
            mongoTemplate.updateFirst(Query.query(Criteria.where("id").is(saved.getId())),
                    new Update().currentDate(LedgerFields.SERVER_UPDATED_AT), LedgerTaskDocument.class);
            return saved;
        });
    }

    @Override
    public void commit(List<LedgerMutation> mutations) {
        if (mutations.isEmpty()) return;
        try {
            BulkOperations ops = mongoTemplate.bulkOps(BulkOperations.BulkMode.UNORDERED, LedgerTaskDocument.class);
            for (LedgerMutation mutation : mutations) {
                ops.updateOne(Query.query(Criteria.where("id").is(mutation.taskId())), toUpdate(mutation));
            }
            ops.execute();
            log.debug("Committed {} task mutations", mutations.size());
        } catch (RuntimeException e) {
            LedgerAccessException failure = LedgerErrors.translate("batch commit", e);
            SyncErrorKind kind = failure.kind() == SyncErrorKind.PERMISSION_DENIED
                    ? SyncErrorKind.PERMISSION_DENIED : SyncErrorKind.BATCH_COMMIT_FAILURE;
            throw new LedgerAccessException(kind, failure.getMessage(), e);
        }
    }

    @Override
    public void delete(Collection<String> taskIds) {
        if (taskIds.isEmpty()) return;
        call("delete tasks", () -> mongoTemplate.remove(
                Query.query(Criteria.where("id").in(taskIds)), LedgerTaskDocument.class));
    }

    static Update toUpdate(LedgerMutation mutation) {
        Update update = new Update();
        mutation.sets().forEach(update::set);
        mutation.unsets().forEach(update::unset);
        mutation.serverTimestamps().forEach(update::currentDate);
        return update;
    }

    private static <T> T call(String context, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw LedgerErrors.translate(context, e);
        }
    }
}
