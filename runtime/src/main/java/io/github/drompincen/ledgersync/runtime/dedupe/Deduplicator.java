package io.github.drompincen.ledgersync.runtime.dedupe;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.protocol.api.DedupeMode;
import io.github.drompincen.ledgersync.protocol.api.DedupeReport;
import io.github.drompincen.ledgersync.protocol.api.TaskStatus;
import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerAccessException;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerFields;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerGateway;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerMutation;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerWriteBatch;
import io.github.drompincen.ledgersync.runtime.sync.SyncLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds tasks that share an identity key and keeps one per group: the most recently
 * updated, ties broken by id. Keys are checked in {@link DuplicateKey} order and a task
 * claimed as a duplicate under one key is not considered again under a later one.
 */
@Component
public class Deduplicator {

    private static final Logger log = LoggerFactory.getLogger(Deduplicator.class);

    static final Comparator<LedgerTaskDocument> SURVIVOR_FIRST = Comparator
            .comparing((LedgerTaskDocument t) -> t.getUpdatedAt() != null ? t.getUpdatedAt() : Instant.MIN,
                    Comparator.reverseOrder())
            .thenComparing(t -> t.getId() != null ? t.getId() : "");

    private final LedgerGateway ledgerGateway;
    private final SyncLogService syncLogService;
    private final SyncProperties properties;
    private final Clock clock;

    public Deduplicator(LedgerGateway ledgerGateway, SyncLogService syncLogService,
                        SyncProperties properties, Clock clock) {
        this.ledgerGateway = ledgerGateway;
        this.syncLogService = syncLogService;
        this.properties = properties;
        this.clock = clock;
    }

    public DedupePlan plan(Collection<LedgerTaskDocument> tasks) {
        Set<LedgerTaskDocument> claimed = new HashSet<>();
        List<DuplicateAssignment> assignments = new ArrayList<>();
        int groups = 0;

        for (DuplicateKey key : DuplicateKey.values()) {
            Map<String, List<LedgerTaskDocument>> byValue = new LinkedHashMap<>();
            for (LedgerTaskDocument task : tasks) {
                if (task.markedDuplicate() || claimed.contains(task)) continue;
                String value = key.valueOf(task);
                if (value == null || value.isBlank()) continue;
                byValue.computeIfAbsent(value.trim().toLowerCase(Locale.ROOT), k -> new ArrayList<>()).add(task);
            }
            for (List<LedgerTaskDocument> group : byValue.values()) {
                if (group.size() < 2) continue;
                groups++;
                group.sort(SURVIVOR_FIRST);
                LedgerTaskDocument survivor = group.get(0);
                for (LedgerTaskDocument loser : group.subList(1, group.size())) {
                    claimed.add(loser);
                    assignments.add(new DuplicateAssignment(loser, survivor, key, key.valueOf(loser)));
                }
            }
        }
        return new DedupePlan(groups, assignments);
    }

    /**
     * Marks the losers in memory and returns the matching ledger mutations. Losers become
     * done, which starts their retention window.
     */
    public List<LedgerMutation> softMutations(DedupePlan plan, Instant now) {
        List<LedgerMutation> mutations = new ArrayList<>();
        for (DuplicateAssignment assignment : plan.assignments()) {
            LedgerTaskDocument loser = assignment.loser();
            Instant completedAt = loser.getCompletedAt() != null ? loser.getCompletedAt() : now;
            Instant deleteAfter = completedAt.plus(properties.getTtl());

            loser.setDuplicateOf(assignment.survivor().getId());
            loser.setDuplicateKey(assignment.value());
            loser.setStatus(TaskStatus.DONE);
            loser.setCompletedAt(completedAt);
            loser.setDeleteAfter(deleteAfter);

            mutations.add(new LedgerMutation(loser.getId())
                    .set(LedgerFields.DUPLICATE_OF, assignment.survivor().getId())
                    .set(LedgerFields.DUPLICATE_KEY, assignment.value())
                    .set(LedgerFields.STATUS, TaskStatus.DONE)
                    .set(LedgerFields.COMPLETED_AT, completedAt)
                    .set(LedgerFields.DELETE_AFTER, deleteAfter)
                    .touch());
        }
        return mutations;
    }

    /** Maintenance sweep over every task of the owner. */
    public DedupeReport sweep(String ownerId, DedupeMode mode) {
        Instant now = clock.instant();
        List<String> errors = new ArrayList<>();
        DedupePlan plan = new DedupePlan(0, List.of());
        int applied = 0;
        try {
            List<LedgerTaskDocument> tasks = ledgerGateway.fetchAll(ownerId, properties.getFullPageSize(), Integer.MAX_VALUE);
            plan = plan(tasks);
            if (mode == DedupeMode.HARD) {
                applied = deleteLosers(plan);
            } else {
                LedgerWriteBatch batch = new LedgerWriteBatch(properties.getBatchSize());
                softMutations(plan, now).forEach(batch::add);
                applied = batch.flush(ledgerGateway);
            }
        } catch (LedgerAccessException e) {
            log.error("Dedupe sweep for owner {} aborted after {} of {} duplicates: {}",
                    ownerId, applied, plan.duplicates(), e.getMessage());
            errors.add(e.kind() + ": " + e.getMessage());
        }

        DedupeReport report = new DedupeReport(mode, plan.groups(), applied, errors);
        log.info("Dedupe sweep ({}) for owner {}: {} groups, {} duplicates", mode, ownerId, report.groups(), applied);
        syncLogService.recordSweep(ownerId, report, now);
        return report;
    }

    private int deleteLosers(DedupePlan plan) {
        List<String> ids = new ArrayList<>();
        plan.assignments().forEach(a -> ids.add(a.loser().getId()));
        int deleted = 0;
        for (int from = 0; from < ids.size(); from += LedgerWriteBatch.MAX_BATCH) {
            List<String> chunk = ids.subList(from, Math.min(from + LedgerWriteBatch.MAX_BATCH, ids.size()));
            ledgerGateway.delete(chunk);
            deleted += chunk.size();
        }
        return deleted;
    }
}
