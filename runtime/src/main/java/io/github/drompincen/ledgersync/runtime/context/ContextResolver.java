package io.github.drompincen.ledgersync.runtime.context;

import io.github.drompincen.ledgersync.persistence.document.GoalDocument;
import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.persistence.document.SprintDocument;
import io.github.drompincen.ledgersync.persistence.document.StoryDocument;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Pass-scoped cache of stories, goals and sprints. {@link #prefetch(Collection)} loads every
 * id referenced by the working set in small {@code $in} chunks; {@link #resolve(LedgerTaskDocument)}
 * reads from the cache and falls back to a single lookup on a miss. Misses, including failed
 * lookups, are remembered. Never throws.
 */
public class ContextResolver {

    private static final Logger log = LoggerFactory.getLogger(ContextResolver.class);

    static final int CHUNK_SIZE = 10;

    private final LedgerGateway ledgerGateway;
    private final Executor executor;

    private final Map<String, Optional<StoryDocument>> stories = new ConcurrentHashMap<>();
    private final Map<String, Optional<GoalDocument>> goals = new ConcurrentHashMap<>();
    private final Map<String, Optional<SprintDocument>> sprints = new ConcurrentHashMap<>();

    public ContextResolver(LedgerGateway ledgerGateway, Executor executor) {
        this.ledgerGateway = ledgerGateway;
        this.executor = executor;
    }

    public void prefetch(Collection<LedgerTaskDocument> tasks) {
        Set<String> storyIds = new LinkedHashSet<>();
        Set<String> goalIds = new LinkedHashSet<>();
        Set<String> sprintIds = new LinkedHashSet<>();
        for (LedgerTaskDocument task : tasks) {
            addId(storyIds, task.getParentId());
            addId(goalIds, task.getGroupId());
            addId(sprintIds, task.getSprintId());
        }

        await(load(storyIds, stories, ledgerGateway::findStories, StoryDocument::getId, "stories"));

        for (String storyId : storyIds) {
            stories.getOrDefault(storyId, Optional.empty()).ifPresent(story -> {
                addId(goalIds, story.getGoalId());
                addId(sprintIds, story.getSprintId());
            });
        }
        List<CompletableFuture<Void>> pending = new ArrayList<>();
        pending.addAll(load(goalIds, goals, ledgerGateway::findGoals, GoalDocument::getId, "goals"));
        pending.addAll(load(sprintIds, sprints, ledgerGateway::findSprints, SprintDocument::getId, "sprints"));
        await(pending);
        log.debug("Prefetched context: {} stories, {} goals, {} sprints", stories.size(), goals.size(), sprints.size());
    }

    public TaskContext resolve(LedgerTaskDocument task) {
        StoryDocument story = lookup(task.getParentId(), stories, ledgerGateway::findStories);

        String goalId = firstNonBlank(task.getGroupId(), story != null ? story.getGoalId() : null);
        GoalDocument goal = lookup(goalId, goals, ledgerGateway::findGoals);

        String sprintId = firstNonBlank(task.getSprintId(), story != null ? story.getSprintId() : null);
        SprintDocument sprint = lookup(sprintId, sprints, ledgerGateway::findSprints);

        String storyRef = task.getParentId() == null ? null
                : story != null && notBlank(story.getReference()) ? story.getReference() : task.getParentId();
        String goalRef = goalId == null ? null
                : goal != null && notBlank(goal.getReference()) ? goal.getReference() : goalId;
        String theme = firstNonBlank(
                story != null ? story.getThemeName() : null,
                goal != null ? goal.getThemeName() : null,
                task.getCategory());
        String sprintName = sprint != null && notBlank(sprint.getName()) ? sprint.getName() : null;

        return new TaskContext(task.getParentId(), storyRef, goalId, goalRef, theme, sprintId, sprintName);
    }

    private <T> List<CompletableFuture<Void>> load(Set<String> ids, Map<String, Optional<T>> cache,
                                                   Function<Collection<String>, List<T>> query,
                                                   Function<T, String> idOf, String what) {
        List<String> missing = new ArrayList<>();
        for (String id : ids) {
            if (!cache.containsKey(id)) missing.add(id);
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        for (int from = 0; from < missing.size(); from += CHUNK_SIZE) {
            List<String> chunk = List.copyOf(missing.subList(from, Math.min(from + CHUNK_SIZE, missing.size())));
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    for (T found : query.apply(chunk)) cache.put(idOf.apply(found), Optional.of(found));
                    for (String id : chunk) cache.putIfAbsent(id, Optional.empty());
                } catch (RuntimeException e) {
                    // left uncached; resolve() retries each id once on its own
                    log.warn("Prefetch of {} {} failed: {}", chunk.size(), what, e.getMessage());
                }
            }, executor));
        }
        return futures;
    }

    private <T> T lookup(String id, Map<String, Optional<T>> cache, Function<Collection<String>, List<T>> query) {
        if (id == null || id.isBlank()) return null;
        return cache.computeIfAbsent(id, key -> {
            try {
                List<T> found = query.apply(List.of(key));
                return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
            } catch (RuntimeException e) {
                log.warn("Context lookup for {} failed: {}", key, e.getMessage());
                return Optional.empty();
            }
        }).orElse(null);
    }

    private static void await(List<CompletableFuture<Void>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    private static void addId(Set<String> ids, String id) {
        if (id != null && !id.isBlank()) ids.add(id);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (notBlank(value)) return value;
        }
        return null;
    }
}
