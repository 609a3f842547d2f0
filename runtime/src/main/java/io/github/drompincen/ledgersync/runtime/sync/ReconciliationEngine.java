package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.persistence.document.SyncStateDocument;
import io.github.drompincen.ledgersync.protocol.api.DedupeMode;
import io.github.drompincen.ledgersync.protocol.api.DedupeReport;
import io.github.drompincen.ledgersync.protocol.api.Persona;
import io.github.drompincen.ledgersync.protocol.api.SyncAction;
import io.github.drompincen.ledgersync.protocol.api.SyncDecision;
import io.github.drompincen.ledgersync.protocol.api.SyncDirection;
import io.github.drompincen.ledgersync.protocol.api.SyncErrorKind;
import io.github.drompincen.ledgersync.protocol.api.SyncMode;
import io.github.drompincen.ledgersync.protocol.api.SyncRequest;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import io.github.drompincen.ledgersync.protocol.api.SyncStatusResponse;
import io.github.drompincen.ledgersync.protocol.api.TaskStatus;
import io.github.drompincen.ledgersync.protocol.api.TriageClassification;
import io.github.drompincen.ledgersync.runtime.auth.OwnerIdentityProvider;
import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import io.github.drompincen.ledgersync.runtime.context.ContextResolverFactory;
import io.github.drompincen.ledgersync.runtime.context.TaskContext;
import io.github.drompincen.ledgersync.runtime.dedupe.DedupePlan;
import io.github.drompincen.ledgersync.runtime.dedupe.Deduplicator;
import io.github.drompincen.ledgersync.runtime.dedupe.DuplicateAssignment;
import io.github.drompincen.ledgersync.runtime.device.DeviceItem;
import io.github.drompincen.ledgersync.runtime.device.DeviceList;
import io.github.drompincen.ledgersync.runtime.device.DeviceStore;
import io.github.drompincen.ledgersync.runtime.device.DeviceStoreException;
import io.github.drompincen.ledgersync.runtime.identity.HumanRefGenerator;
import io.github.drompincen.ledgersync.runtime.identity.IdentityResolver;
import io.github.drompincen.ledgersync.runtime.identity.LedgerIndex;
import io.github.drompincen.ledgersync.runtime.identity.Resolution;
import io.github.drompincen.ledgersync.runtime.identity.TitleNormalizer;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerAccessException;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerFields;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerGateway;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerMutation;
import io.github.drompincen.ledgersync.runtime.note.NoteCodec;
import io.github.drompincen.ledgersync.runtime.note.NoteMetadata;
import io.github.drompincen.ledgersync.runtime.triage.TriageClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Two-way reconciliation between the ledger and the device store. A pass runs its phases
 * strictly in order (load, index, repair, import, conflicts, priority, orphans, deletions,
 * ttl, commit) and never throws: failures are collected into the returned {@link SyncResult}.
 * Device writes happen as they are decided; ledger writes are batched into the commit phase.
 */
@Service
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    static final int LINK_TOP_UP_CHUNK = 100;

    private final LedgerGateway ledgerGateway;
    private final DeviceStore deviceStore;
    private final NoteCodec noteCodec;
    private final IdentityResolver identityResolver;
    private final Deduplicator deduplicator;
    private final ContextResolverFactory contextResolverFactory;
    private final TriageClassifier triageClassifier;
    private final CreationClaimService claimService;
    private final SyncLogService syncLogService;
    private final SyncStateService syncStateService;
    private final OwnerIdentityProvider ownerIdentityProvider;
    private final HumanRefGenerator humanRefGenerator;
    private final SyncProperties properties;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> reportedPermissionContexts = ConcurrentHashMap.newKeySet();

    public ReconciliationEngine(LedgerGateway ledgerGateway, DeviceStore deviceStore, NoteCodec noteCodec,
                                IdentityResolver identityResolver, Deduplicator deduplicator,
                                ContextResolverFactory contextResolverFactory, TriageClassifier triageClassifier,
                                CreationClaimService claimService, SyncLogService syncLogService,
                                SyncStateService syncStateService, OwnerIdentityProvider ownerIdentityProvider,
                                HumanRefGenerator humanRefGenerator, SyncProperties properties, Clock clock) {
        this.ledgerGateway = ledgerGateway;
        this.deviceStore = deviceStore;
        this.noteCodec = noteCodec;
        this.identityResolver = identityResolver;
        this.deduplicator = deduplicator;
        this.contextResolverFactory = contextResolverFactory;
        this.triageClassifier = triageClassifier;
        this.claimService = claimService;
        this.syncLogService = syncLogService;
        this.syncStateService = syncStateService;
        this.ownerIdentityProvider = ownerIdentityProvider;
        this.humanRefGenerator = humanRefGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    public SyncResult reconcile(SyncRequest request) {
        return reconcile(request, new CancellationFlag());
    }

    public SyncResult reconcile(SyncRequest request, CancellationFlag cancellation) {
        SyncRequest req = request != null ? request : new SyncRequest(null, null, null);
        SyncMode mode = req.mode() != null ? req.mode() : properties.getMode();
        boolean dryRun = req.dryRun() != null ? req.dryRun() : properties.isDryRun();

        Optional<String> owner = ownerIdentityProvider.currentOwnerId();
        if (owner.isEmpty()) {
            log.warn("Sync requested ({}) without a signed-in owner", req.reason());
            return SyncResult.aborted(null, mode, dryRun, SyncErrorKind.NOT_AUTHENTICATED + ": no signed-in owner");
        }
        String ownerId = owner.get();
        if (!inFlight.add(ownerId)) {
            log.info("Sync for owner {} already running, rejecting {} pass ({})", ownerId, mode, req.reason());
            return SyncResult.rejected(ownerId, mode, dryRun);
        }
        try {
            log.info("Starting {} sync for owner {} ({}){}", mode, ownerId, req.reason(), dryRun ? " [dry run]" : "");
            ReconciliationPass pass = new ReconciliationPass(ownerId, mode, dryRun, clock.instant(),
                    properties.getBatchSize());
            return run(pass, cancellation);
        } finally {
            inFlight.remove(ownerId);
        }
    }

    public Optional<DedupeReport> dedupe(DedupeMode mode) {
        Optional<String> owner = ownerIdentityProvider.currentOwnerId();
        if (owner.isEmpty()) return Optional.empty();
        String ownerId = owner.get();
        if (!inFlight.add(ownerId)) {
            return Optional.of(new DedupeReport(mode, 0, 0, List.of("Sync already running for owner " + ownerId)));
        }
        try {
            return Optional.of(deduplicator.sweep(ownerId, mode));
        } finally {
            inFlight.remove(ownerId);
        }
    }

    public Optional<SyncStatusResponse> status() {
        return ownerIdentityProvider.currentOwnerId().map(ownerId -> {
            SyncStateDocument state = syncStateService.load(ownerId);
            return new SyncStatusResponse(ownerId, isRunning(ownerId), state.getLastSyncAt(),
                    state.getLastFullSyncAt(), state.getWatermark(), state.getLastSummary());
        });
    }

    public boolean isRunning(String ownerId) {
        return inFlight.contains(ownerId);
    }

    SyncResult run(ReconciliationPass pass, CancellationFlag cancellation) {
        boolean ok = phase(pass, cancellation, "load", this::load)
                && phase(pass, cancellation, "index", this::index)
                && phase(pass, cancellation, "repair", this::repair)
                && phase(pass, cancellation, "import", this::importItems)
                && phase(pass, cancellation, "conflicts", this::resolveConflicts)
                && phase(pass, cancellation, "priority", this::remapPriorities)
                && phase(pass, cancellation, "orphans", this::clearOrphans)
                && phase(pass, cancellation, "deletions", this::propagateDeletions)
                && phase(pass, cancellation, "ttl", this::sweepExpired)
                && phase(pass, cancellation, "commit", this::commit);
        if (!ok) log.warn("Sync for owner {} stopped early: {}", pass.ownerId, pass.errors);

        SyncResult result = pass.toResult(clock.instant());
        syncLogService.recordPass(result);
        if (!pass.dryRun) {
            syncStateService.recordPass(result, pass.committed ? pass.watermark : null);
        }
        log.info("Finished {} sync for owner {}: {}", pass.mode, pass.ownerId, result.summaryLine());
        return result;
    }

    private boolean phase(ReconciliationPass pass, CancellationFlag cancellation, String name,
                          Consumer<ReconciliationPass> body) {
        if (cancellation.isCancelled()) {
            pass.errors.add("cancelled before " + name);
            return false;
        }
        long start = System.nanoTime();
        try {
            body.accept(pass);
            return true;
        } catch (LedgerAccessException e) {
            report(pass, name, e);
            return false;
        } catch (RuntimeException e) {
            log.error("Sync phase {} failed for owner {}", name, pass.ownerId, e);
            pass.errors.add(name + ": " + e.getMessage());
            return false;
        } finally {
            pass.phaseMillis.put(name, (System.nanoTime() - start) / 1_000_000);
        }
    }

    // ---- 1. load ----

    private void load(ReconciliationPass pass) {
        List<LedgerTaskDocument> tasks;
        if (pass.mode == SyncMode.FULL) {
            tasks = ledgerGateway.fetchAll(pass.ownerId, properties.getFullPageSize(), properties.getFullMaxTasks());
        } else {
            tasks = ledgerGateway.fetchChangedSince(pass.ownerId, syncStateService.load(pass.ownerId).getWatermark());
        }
        pass.loaded = new ArrayList<>(tasks);
        pass.items = deviceStore.items();
        pass.items.forEach(item -> pass.trackDevice(item.getId()));

        if (pass.mode == SyncMode.DELTA) topUpLinkedTasks(pass);

        for (LedgerTaskDocument task : pass.loaded) {
            Instant stamp = task.getServerUpdatedAt() != null ? task.getServerUpdatedAt() : task.getUpdatedAt();
            if (stamp != null && (pass.watermark == null || stamp.isAfter(pass.watermark))) pass.watermark = stamp;
        }
        log.debug("Loaded {} tasks and {} device items for owner {}", pass.loaded.size(), pass.items.size(), pass.ownerId);
    }

    /** Adds the tasks linked to device items that the delta query did not return. */
    private void topUpLinkedTasks(ReconciliationPass pass) {
        Set<String> covered = new HashSet<>();
        Set<String> loadedIds = new HashSet<>();
        for (LedgerTaskDocument task : pass.loaded) {
            loadedIds.add(task.getId());
            if (task.getLinkedDeviceId() != null) covered.add(task.getLinkedDeviceId());
        }
        List<String> missing = new ArrayList<>();
        for (DeviceItem item : pass.items) {
            if (!covered.contains(item.getId())) missing.add(item.getId());
        }
        for (int from = 0; from < missing.size(); from += LINK_TOP_UP_CHUNK) {
            List<String> chunk = missing.subList(from, Math.min(from + LINK_TOP_UP_CHUNK, missing.size()));
            for (LedgerTaskDocument task : ledgerGateway.findByLinkedDeviceIds(pass.ownerId, chunk)) {
                if (loadedIds.add(task.getId())) pass.loaded.add(task);
            }
        }
    }

    // ---- 2. index ----

    private void index(ReconciliationPass pass) {
        DedupePlan plan = deduplicator.plan(pass.loaded);
        if (!plan.isEmpty()) {
            deduplicator.softMutations(plan, pass.now).forEach(pass.batch::add);
            for (DuplicateAssignment a : plan.assignments()) {
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("survivorId", a.survivor().getId());
                meta.put("key", a.key().field());
                meta.put("value", a.value());
                decide(pass, SyncDirection.DIAGNOSTICS, SyncAction.COMPLETE_DUPLICATE, a.loser(), null, meta);
            }
            pass.duplicates += plan.duplicates();
        }

        boolean complete = pass.mode == SyncMode.FULL && pass.loaded.size() < properties.getFullMaxTasks();
        pass.index = new LedgerIndex(pass.loaded, complete);
        pass.context = contextResolverFactory.newResolver();
        pass.context.prefetch(pass.index.survivors());
        try {
            pass.themes = new ThemeListMapping(ledgerGateway.findThemes(pass.ownerId));
        } catch (LedgerAccessException e) {
            report(pass, "theme lookup", e);
        }
    }

    // ---- 3. reverse-link repair ----

    private void repair(ReconciliationPass pass) {
        for (DeviceItem item : pass.items) {
            NoteMetadata note = noteCodec.decode(item.getNotes());
            Resolution resolution = identityResolver.resolve(pass.ownerId, item, note, pass.index);
            if (resolution.kind() == Resolution.MatchKind.LOOKUP_FAILED) {
                pass.errors.add(SyncErrorKind.TRANSIENT_IO + ": identity lookup for device item " + item.getId());
                continue;
            }
            if (!resolution.resolved()) {
                pass.unresolved.add(item);
                continue;
            }

            LedgerTaskDocument task = resolution.task();
            String linked = task.getLinkedDeviceId();
            boolean linkedHere = linked != null && linked.equalsIgnoreCase(item.getId());
            if (!linkedHere && linked != null && !linked.isBlank() && pass.deviceExists(linked)) {
                if (pass.index.linkedToDuplicate(item.getId())) {
                    closeDuplicateItem(pass, item, task);
                    continue;
                }
                decide(pass, SyncDirection.DIAGNOSTICS, SyncAction.SUPPRESS_DEVICE_DUPLICATE, task, item.getId(),
                        Map.of("linkedDeviceId", linked, "matchedBy", resolution.kind().name().toLowerCase(Locale.ROOT)));
                continue;
            }
            if (!linkedHere) relink(pass, task, item, resolution);

            LinkedPair pair = new LinkedPair(item, task, note, deviceEffective(item, note), false);
            pair.context = pass.context.resolve(task);
            pass.pairs.add(pair);

            if (DeletionSignals.tagFor(task) != null) continue;
            String desired = renderNotes(pair, note.get(NoteCodec.SYNCED), null);
            if (!desired.equals(nullToEmpty(item.getNotes()))) {
                writeNotes(pass, pair, null);
                saveItem(pass, pair);
                pass.repaired++;
                decide(pass, SyncDirection.TO_DEVICE, SyncAction.REPAIR_METADATA, task, item.getId(), Map.of());
            }
        }
    }

    /** Completes a device item whose task lost deduplication to a task that has its own item. */
    private void closeDuplicateItem(ReconciliationPass pass, DeviceItem item, LedgerTaskDocument survivor) {
        if (item.isCompleted()) return;
        if (!pass.dryRun) {
            item.setCompleted(true);
            try {
                deviceStore.save(item);
            } catch (DeviceStoreException e) {
                log.warn("Cannot close duplicate device item {}: {}", item.getId(), e.getMessage());
                pass.errors.add("device: " + e.getMessage());
                return;
            }
        }
        pass.duplicates++;
        decide(pass, SyncDirection.TO_DEVICE, SyncAction.COMPLETE_DUPLICATE, survivor, item.getId(),
                Map.of("linkedDeviceId", survivor.getLinkedDeviceId()));
    }

    private void relink(ReconciliationPass pass, LedgerTaskDocument task, DeviceItem item, Resolution resolution) {
        LedgerMutation mutation = new LedgerMutation(task.getId())
                .set(LedgerFields.LINKED_DEVICE_ID, item.getId())
                .unset(LedgerFields.DEVICE_MISSING_AT)
                .stampServerTime(LedgerFields.SERVER_UPDATED_AT);
        if (task.getDeviceListName() == null && item.getListName() != null) {
            mutation.set(LedgerFields.DEVICE_LIST_ID, item.getListId()).set(LedgerFields.DEVICE_LIST_NAME, item.getListName());
            task.setDeviceListId(item.getListId());
            task.setDeviceListName(item.getListName());
        }
        pass.batch.add(mutation);
        pass.index.linkDevice(task, item.getId());
        task.setDeviceMissingAt(null);
        pass.repaired++;
        decide(pass, SyncDirection.TO_LEDGER, SyncAction.RELINK_DEVICE_ITEM, task, item.getId(),
                Map.of("matchedBy", resolution.kind().name().toLowerCase(Locale.ROOT)));
    }

    // ---- 4. import ----

    private void importItems(ReconciliationPass pass) {
        for (DeviceItem item : pass.unresolved) {
            try {
                importItem(pass, item);
            } catch (LedgerAccessException e) {
                report(pass, "import " + item.getId(), e);
            } catch (DeviceStoreException e) {
                log.warn("Device write failed while importing {}: {}", item.getId(), e.getMessage());
                pass.errors.add("device: " + e.getMessage());
            }
        }
        exportLedgerOnlyTasks(pass);
    }

    private void importItem(ReconciliationPass pass, DeviceItem item) {
        if (item.isCompleted() || item.getTitle() == null || item.getTitle().isBlank()) return;

        NoteMetadata note = noteCodec.decode(item.getNotes());
        List<String> tags = NoteCodec.splitTags(note.get(NoteCodec.TAGS));
        String itemType = ItemTypes.infer(item.getListName(), tags);
        if (item.recurring() && !ItemTypes.importableRecurring(itemType)) {
            log.debug("Skipping recurring device item {} '{}'", item.getId(), item.getTitle());
            return;
        }

        TriageClassification triage = null;
        if (inTriageList(item)) {
            triage = triageClassifier.classify(item.getTitle(), String.join("\n", note.userLines()), tags);
            if (triage.isWork()) {
                DeviceList workList = listNamed(pass, properties.getTriage().getWorkList());
                moveItem(pass, item, workList);
                decide(pass, SyncDirection.TO_DEVICE, SyncAction.ROUTE_WORK, null, item.getId(), triageMeta(triage, workList));
                return;
            }
            if (triage.isPersonal() && triage.suggestedCategory() != null) {
                DeviceList categoryList = listNamed(pass, triage.suggestedCategory());
                item = moveItem(pass, item, categoryList);
                decide(pass, SyncDirection.TO_DEVICE, SyncAction.ROUTE_PERSONAL, null, item.getId(), triageMeta(triage, categoryList));
            }
        }

        if (pass.index.byDeviceId(item.getId()) != null) return;
        LedgerTaskDocument sameTitle = pass.index.byNormalizedTitle(TitleNormalizer.normalize(item.getTitle()));
        if (sameTitle != null) {
            decide(pass, SyncDirection.DIAGNOSTICS, SyncAction.SUPPRESS_DEVICE_DUPLICATE, sameTitle, item.getId(),
                    Map.of("matchedBy", "title"));
            return;
        }
        if (!pass.dryRun && !claimService.tryClaim(pass.ownerId, item.getId())) {
            decide(pass, SyncDirection.TO_LEDGER, SyncAction.SKIP_CLAIMED, null, item.getId(), Map.of());
            return;
        }

        LedgerTaskDocument draft = new LedgerTaskDocument();
        draft.setOwnerId(pass.ownerId);
        draft.setTitle(item.getTitle().trim());
        draft.setStatus(TaskStatus.OPEN);
        draft.setDueAt(item.getDueAt());
        draft.setCreatedAt(pass.now);
        draft.setUpdatedAt(pass.now);
        draft.setLinkedDeviceId(item.getId());
        draft.setDeviceListId(item.getListId());
        draft.setDeviceListName(item.getListName());
        draft.setHumanRef(humanRefGenerator.next(pass.index::humanRefTaken));
        draft.setTags(tags.isEmpty() ? null : new ArrayList<>(tags));
        draft.setPriority(PriorityMapper.toLedger(item.getPriority()));
        draft.setRecurrence(item.getRecurrence());
        draft.setItemType(itemType);
        draft.setSource(properties.getSource());
        if (triage != null && triage.persona() != Persona.UNKNOWN) draft.setPersona(triage.persona().wireName());
        String category = triage != null && triage.suggestedCategory() != null
                ? triage.suggestedCategory() : pass.themes.themeFor(item.getListName());
        draft.setCategory(category);

        Map<String, Object> meta = Map.of("title", draft.getTitle(), "humanRef", draft.getHumanRef());
        pass.created++;
        if (pass.dryRun) {
            decide(pass, SyncDirection.TO_LEDGER, SyncAction.IMPORT_ITEM, draft, item.getId(), meta);
            pass.index.register(draft);
            return;
        }

        LedgerTaskDocument task = ledgerGateway.create(draft);
        claimService.release(pass.ownerId, item.getId());
        pass.index.register(task);
        decide(pass, SyncDirection.TO_LEDGER, SyncAction.IMPORT_ITEM, task, item.getId(), meta);

        LinkedPair pair = new LinkedPair(item, task, note, pass.now, true);
        pair.context = pass.context.resolve(task);
        writeNotes(pass, pair, null);
        saveItem(pass, pair);
        pass.pairs.add(pair);
    }

    private void exportLedgerOnlyTasks(ReconciliationPass pass) {
        for (LedgerTaskDocument task : pass.index.survivors()) {
            boolean linked = task.getLinkedDeviceId() != null && !task.getLinkedDeviceId().isBlank();
            if (linked || !task.effectiveStatus().isOpen() || task.getDeviceMissingAt() != null
                    || DeletionSignals.tagFor(task) != null || task.getId() == null) {
                continue;
            }
            try {
                exportTask(pass, task);
            } catch (LedgerAccessException e) {
                report(pass, "export " + task.getId(), e);
            } catch (DeviceStoreException e) {
                log.warn("Cannot create device item for task {}: {}", task.getId(), e.getMessage());
                pass.errors.add("device: " + e.getMessage());
            }
        }
    }

    private void exportTask(ReconciliationPass pass, LedgerTaskDocument task) {
        TaskContext context = pass.context.resolve(task);
        String listName = firstNonBlank(task.getDeviceListName(), pass.themes.listFor(context.themeName()),
                properties.getDefaultList());
        DeviceList list = listNamed(pass, listName);

        DeviceItem draft = new DeviceItem(task.getTitle());
        draft.setDueAt(task.getDueAt());
        draft.setRecurrence(task.getRecurrence());
        draft.setPriority(PriorityMapper.toDevice(task.getPriority()));
        draft.setListId(list.id());
        draft.setListName(list.name());

        LinkedPair pair = new LinkedPair(draft, task, NoteMetadata.empty(), pass.now, true);
        pair.context = context;
        writeNotes(pass, pair, null);
        if (task.getHumanRef() != null) draft.setUrl(noteCodec.deepLink("task", task.getHumanRef()));

        pass.created++;
        if (pass.dryRun) {
            decide(pass, SyncDirection.TO_DEVICE, SyncAction.CREATE_DEVICE_ITEM, task, null, Map.of("list", list.name()));
            return;
        }
        DeviceItem created = deviceStore.create(pair.item, list);
        pair.item = created;
        pass.trackDevice(created.getId());
        pass.pairs.add(pair);

        pass.batch.add(new LedgerMutation(task.getId())
                .set(LedgerFields.LINKED_DEVICE_ID, created.getId())
                .set(LedgerFields.DEVICE_LIST_ID, list.id())
                .set(LedgerFields.DEVICE_LIST_NAME, list.name())
                .stampServerTime(LedgerFields.SERVER_UPDATED_AT));
        pass.index.linkDevice(task, created.getId());
        task.setDeviceListId(list.id());
        task.setDeviceListName(list.name());
        decide(pass, SyncDirection.TO_DEVICE, SyncAction.CREATE_DEVICE_ITEM, task, created.getId(), Map.of("list", list.name()));
    }

    // ---- 5. conflict resolution ----

    private void resolveConflicts(ReconciliationPass pass) {
        for (LinkedPair pair : pass.pairs) {
            if (pair.fresh || DeletionSignals.tagFor(pair.task) != null) continue;
            Instant ledgerTime = ledgerTime(pair.task);
            pair.deviceNewer = pair.deviceEffective != null && pair.deviceEffective.isAfter(ledgerTime);
            if (pair.deviceNewer) {
                pushDeviceToLedger(pass, pair);
            } else {
                pushLedgerToDevice(pass, pair);
            }
        }
    }

    private void pushDeviceToLedger(ReconciliationPass pass, LinkedPair pair) {
        DeviceItem item = pair.item;
        LedgerTaskDocument task = pair.task;
        LedgerMutation mutation = new LedgerMutation(task.getId());
        Map<String, Object> changed = new LinkedHashMap<>();

        if (item.getTitle() != null && !item.getTitle().isBlank() && !item.getTitle().equals(task.getTitle())) {
            pass.index.forgetTitle(task);
            task.setTitle(item.getTitle());
            mutation.set(LedgerFields.TITLE, item.getTitle());
            changed.put("title", item.getTitle());
        }
        if (item.isCompleted() && task.effectiveStatus().isOpen()) {
            markDone(pass, task, mutation);
            changed.put("status", "done");
        } else if (!item.isCompleted() && task.effectiveStatus().isDone()) {
            task.setStatus(TaskStatus.OPEN);
            task.setCompletedAt(null);
            task.setDeleteAfter(null);
            mutation.set(LedgerFields.STATUS, TaskStatus.OPEN)
                    .unset(LedgerFields.COMPLETED_AT)
                    .unset(LedgerFields.DELETE_AFTER);
            changed.put("status", "open");
        }
        if (!Objects.equals(item.getDueAt(), task.getDueAt())) {
            task.setDueAt(item.getDueAt());
            mutation.set(LedgerFields.DUE_AT, item.getDueAt());
            changed.put("dueAt", item.getDueAt());
        }
        if (!Objects.equals(emptyToNull(item.getRecurrence()), emptyToNull(task.getRecurrence()))) {
            task.setRecurrence(emptyToNull(item.getRecurrence()));
            mutation.set(LedgerFields.RECURRENCE, task.getRecurrence());
            changed.put("recurrence", task.getRecurrence());
        }
        if (item.getListName() != null && !item.getListName().equalsIgnoreCase(nullToEmpty(task.getDeviceListName()))) {
            task.setDeviceListId(item.getListId());
            task.setDeviceListName(item.getListName());
            mutation.set(LedgerFields.DEVICE_LIST_ID, item.getListId())
                    .set(LedgerFields.DEVICE_LIST_NAME, item.getListName());
            changed.put("list", item.getListName());
        }
        String theme = pass.themes.themeFor(item.getListName());
        if (theme != null && !theme.equalsIgnoreCase(nullToEmpty(task.getCategory()))) {
            task.setCategory(theme);
            mutation.set(LedgerFields.CATEGORY, theme);
            changed.put("category", theme);
        }

        if (mutation.isEmpty()) return;
        mutation.touch();
        task.setUpdatedAt(pass.now);
        pass.batch.add(mutation);
        if (task.effectiveStatus().isOpen()) pass.index.register(task);
        pair.ledgerChanged = true;
        decide(pass, SyncDirection.TO_LEDGER, SyncAction.UPDATE_FROM_DEVICE, task, item.getId(), changed);
    }

    private void pushLedgerToDevice(ReconciliationPass pass, LinkedPair pair) {
        DeviceItem item = pair.item;
        LedgerTaskDocument task = pair.task;
        Map<String, Object> changed = new LinkedHashMap<>();

        if (task.getTitle() != null && !task.getTitle().isBlank() && !task.getTitle().equals(item.getTitle())) {
            item.setTitle(task.getTitle());
            changed.put("title", task.getTitle());
        }
        boolean done = task.effectiveStatus().isDone();
        if (done != item.isCompleted()) {
            item.setCompleted(done);
            changed.put("completed", done);
        }
        if (!Objects.equals(task.getDueAt(), item.getDueAt())) {
            item.setDueAt(task.getDueAt());
            changed.put("dueAt", task.getDueAt());
        }
        String target = firstNonBlank(task.getDeviceListName(), pass.themes.listFor(pair.context.themeName()));
        if (target != null && !target.equalsIgnoreCase(nullToEmpty(item.getListName()))) {
            DeviceList list = listNamed(pass, target);
            item.setListId(list.id());
            item.setListName(list.name());
            changed.put("list", list.name());
        }

        if (changed.isEmpty()) return;
        pair.deviceDirty = true;
        pair.deviceChanged = true;
        decide(pass, SyncDirection.TO_DEVICE, SyncAction.UPDATE_DEVICE_FROM_LEDGER, task, item.getId(), changed);
    }

    // ---- 6. priority remapping, then device writes for reconciled pairs ----

    private void remapPriorities(ReconciliationPass pass) {
        for (LinkedPair pair : pass.pairs) {
            if (DeletionSignals.tagFor(pair.task) != null) continue;
            if (!pair.fresh) remapPriority(pass, pair);
            flushPair(pass, pair);
        }
    }

    private void remapPriority(ReconciliationPass pass, LinkedPair pair) {
        LedgerTaskDocument task = pair.task;
        DeviceItem item = pair.item;
        // compared in device buckets so a ledger 5 is not rewritten as 4 when nothing changed
        if (item.getPriority() == PriorityMapper.toDevice(task.getPriority())) return;

        if (pair.deviceNewer) {
            int priority = PriorityMapper.toLedger(item.getPriority());
            if (Objects.equals(priority, task.getPriority())) return;
            task.setPriority(priority);
            task.setUpdatedAt(pass.now);
            pass.batch.add(new LedgerMutation(task.getId()).set(LedgerFields.PRIORITY, priority).touch());
            pair.ledgerChanged = true;
            decide(pass, SyncDirection.TO_LEDGER, SyncAction.UPDATE_FROM_DEVICE, task, item.getId(),
                    Map.of("priority", priority));
        } else if (task.getPriority() != null) {
            item.setPriority(PriorityMapper.toDevice(task.getPriority()));
            pair.deviceDirty = true;
            pair.deviceChanged = true;
            decide(pass, SyncDirection.TO_DEVICE, SyncAction.UPDATE_DEVICE_FROM_LEDGER, task, item.getId(),
                    Map.of("priority", item.getPriority()));
        }
    }

    private void flushPair(ReconciliationPass pass, LinkedPair pair) {
        String desired = renderNotes(pair, pair.note.get(NoteCodec.SYNCED), null);
        boolean notesDrifted = !desired.equals(nullToEmpty(pair.item.getNotes()));
        if (notesDrifted) {
            writeNotes(pass, pair, null);
            pair.deviceDirty = true;
        }
        if (pair.deviceDirty) {
            try {
                saveItem(pass, pair);
            } catch (DeviceStoreException e) {
                log.warn("Device write for {} failed: {}", pair.item.getId(), e.getMessage());
                pass.errors.add("device: " + e.getMessage());
                return;
            }
        }
        if (pair.fresh) return;
        if (pair.ledgerChanged || pair.deviceChanged) {
            pass.updated++;
        } else if (notesDrifted) {
            pass.repaired++;
        }
    }

    // ---- 7. orphan cleanup ----

    private void clearOrphans(ReconciliationPass pass) {
        for (LedgerTaskDocument task : pass.index.survivors()) {
            String linked = task.getLinkedDeviceId();
            if (linked == null || linked.isBlank() || pass.deviceExists(linked)) continue;
            try {
                // created after the snapshot
                if (deviceStore.find(linked).isPresent()) continue;
            } catch (DeviceStoreException e) {
                pass.errors.add("device: " + e.getMessage());
                continue;
            }
            pass.index.unlinkDevice(task);
            task.setLinkedDeviceId(null);
            task.setDeviceMissingAt(pass.now);
            pass.batch.add(new LedgerMutation(task.getId())
                    .unset(LedgerFields.LINKED_DEVICE_ID)
                    .stampServerTime(LedgerFields.DEVICE_MISSING_AT)
                    .stampServerTime(LedgerFields.SERVER_UPDATED_AT));
            pass.updated++;
            decide(pass, SyncDirection.TO_LEDGER, SyncAction.CLEAR_MISSING_DEVICE_ITEM, task, linked, Map.of());
        }
    }

    // ---- 8. deletion propagation ----

    private void propagateDeletions(ReconciliationPass pass) {
        for (LinkedPair pair : pass.pairs) {
            String tag = DeletionSignals.tagFor(pair.task);
            if (tag == null) continue;
            boolean tagged = NoteCodec.splitTags(pair.note.get(NoteCodec.TAGS)).stream().anyMatch(tag::equalsIgnoreCase);
            if (pair.item.isCompleted() && tagged) continue;

            pair.item.setCompleted(true);
            writeNotes(pass, pair, tag);
            try {
                saveItem(pass, pair);
            } catch (DeviceStoreException e) {
                pass.errors.add("device: " + e.getMessage());
                continue;
            }
            pass.updated++;
            decide(pass, SyncDirection.TO_DEVICE, SyncAction.COMPLETE_FROM_LEDGER_DELETE, pair.task,
                    pair.item.getId(), Map.of("tag", tag));
        }
    }

    // ---- 9. TTL sweep ----

    private void sweepExpired(ReconciliationPass pass) {
        for (LinkedPair pair : pass.pairs) {
            Instant deleteAfter = pair.task.getDeleteAfter();
            if (deleteAfter == null || !pass.now.isAfter(deleteAfter) || pair.item.getId() == null) continue;
            String itemId = pair.item.getId();
            if (!pass.dryRun) {
                try {
                    deviceStore.delete(itemId);
                } catch (DeviceStoreException e) {
                    pass.errors.add("device: " + e.getMessage());
                    continue;
                }
            }
            pass.index.unlinkDevice(pair.task);
            pair.task.setLinkedDeviceId(null);
            pass.batch.add(new LedgerMutation(pair.task.getId())
                    .unset(LedgerFields.LINKED_DEVICE_ID)
                    .stampServerTime(LedgerFields.SERVER_UPDATED_AT));
            pass.removed++;
            decide(pass, SyncDirection.TO_DEVICE, SyncAction.TTL_REMOVE, pair.task, itemId,
                    Map.of("deleteAfter", deleteAfter.toString()));
        }
    }

    // ---- 10. commit ----

    private void commit(ReconciliationPass pass) {
        if (pass.dryRun) {
            log.info("Dry run for owner {}: {} ledger mutations not committed", pass.ownerId, pass.batch.size());
            return;
        }
        int pending = pass.batch.size();
        try {
            pass.batch.flush(ledgerGateway);
            pass.committed = true;
        } catch (LedgerAccessException e) {
            report(pass, "commit", e);
            log.error("Commit for owner {} failed with {} of {} mutations pending",
                    pass.ownerId, pass.batch.size(), pending);
        }
    }

    // ---- helpers ----

    private String renderNotes(LinkedPair pair, String synced, String extraTag) {
        LedgerTaskDocument task = pair.task;
        TaskContext ctx = pair.context != null ? pair.context : TaskContext.empty();
        Map<String, String> meta = pair.note.copyMeta();
        meta.remove(NoteCodec.TASK_ID);
        meta.remove(NoteCodec.LIST_ID);
        put(meta, NoteCodec.TASK_REF, task.displayRef());
        put(meta, NoteCodec.STORY_REF, ctx.storyRef());
        put(meta, NoteCodec.GOAL_REF, ctx.goalRef());
        put(meta, NoteCodec.STATUS, task.effectiveStatus().noteValue());
        put(meta, NoteCodec.DUE, task.getDueAt() == null ? null : Instant.ofEpochMilli(task.getDueAt()).toString());
        put(meta, NoteCodec.LIST, pair.item.getListName());
        put(meta, NoteCodec.SPRINT, ctx.sprintName());
        put(meta, NoteCodec.THEME, ctx.themeName());
        put(meta, NoteCodec.SYNCED, synced);

        List<String> tags = mergeTags(task.tagsOrEmpty(), NoteCodec.splitTags(pair.note.get(NoteCodec.TAGS)));
        if (extraTag != null) tags = mergeTags(tags, List.of(extraTag));
        meta = NoteCodec.withTags(meta, tags);

        List<String> userLines = NoteCodec.withPriorityTag(pair.note.userLines(), task.getPriority());
        return noteCodec.encode(meta, userLines, properties.isShowMetadataInNotes());
    }

    private void writeNotes(ReconciliationPass pass, LinkedPair pair, String extraTag) {
        String notes = renderNotes(pair, pass.now.toString(), extraTag);
        pair.item.setNotes(notes);
        pair.note = noteCodec.decode(notes);
    }

    private void saveItem(ReconciliationPass pass, LinkedPair pair) {
        if (pass.dryRun) return;
        pair.item = deviceStore.save(pair.item);
        pair.deviceDirty = false;
    }

    private DeviceItem moveItem(ReconciliationPass pass, DeviceItem item, DeviceList target) {
        if (pass.dryRun) {
            DeviceItem moved = item.copy();
            moved.setListId(target.id());
            moved.setListName(target.name());
            return moved;
        }
        return deviceStore.move(item, target);
    }

    /** The device list with this name; a dry run never creates one. */
    private DeviceList listNamed(ReconciliationPass pass, String name) {
        if (!pass.dryRun) return deviceStore.ensureList(name);
        for (DeviceList list : deviceStore.lists()) {
            if (list.name().equalsIgnoreCase(name)) return list;
        }
        return new DeviceList(null, name);
    }

    private boolean inTriageList(DeviceItem item) {
        String source = properties.getTriage().getSourceList();
        return source != null && !source.isBlank() && source.equalsIgnoreCase(item.getListName());
    }

    private void markDone(ReconciliationPass pass, LedgerTaskDocument task, LedgerMutation mutation) {
        Instant deleteAfter = pass.now.plus(properties.getTtl());
        task.setStatus(TaskStatus.DONE);
        task.setCompletedAt(pass.now);
        task.setDeleteAfter(deleteAfter);
        pass.index.forgetTitle(task);
        mutation.set(LedgerFields.STATUS, TaskStatus.DONE)
                .set(LedgerFields.COMPLETED_AT, pass.now)
                .set(LedgerFields.DELETE_AFTER, deleteAfter);
    }

    private void decide(ReconciliationPass pass, SyncDirection direction, SyncAction action,
                        LedgerTaskDocument task, String deviceItemId, Map<String, Object> metadata) {
        SyncDecision decision = new SyncDecision(direction, action, task != null ? task.getId() : null,
                deviceItemId, metadata, pass.dryRun, pass.now);
        syncLogService.record(pass.ownerId, decision, task);
    }

    /** Records a ledger failure; permission problems are logged once per context. */
    private void report(ReconciliationPass pass, String context, LedgerAccessException e) {
        pass.errors.add(e.kind() + ": " + context);
        if (e.kind() == SyncErrorKind.PERMISSION_DENIED) {
            if (reportedPermissionContexts.add(context)) {
                log.error("Permission denied for owner {} during {}: {}", pass.ownerId, context, e.getMessage());
            }
            return;
        }
        log.warn("Ledger {} failure for owner {} during {}: {}", e.kind(), pass.ownerId, context, e.getMessage());
    }

    private static Instant deviceEffective(DeviceItem item, NoteMetadata note) {
        Instant effective = item.getLastModified();
        String synced = note.get(NoteCodec.SYNCED);
        if (synced != null) {
            try {
                Instant stamp = Instant.parse(synced);
                if (effective == null || stamp.isAfter(effective)) effective = stamp;
            } catch (DateTimeParseException e) {
                log.debug("Ignoring unparseable synced stamp '{}' on {}", synced, item.getId());
            }
        }
        return effective;
    }

    private static Instant ledgerTime(LedgerTaskDocument task) {
        if (task.getUpdatedAt() != null) return task.getUpdatedAt();
        if (task.getServerUpdatedAt() != null) return task.getServerUpdatedAt();
        if (task.getCreatedAt() != null) return task.getCreatedAt();
        return Instant.EPOCH;
    }

    private static Map<String, Object> triageMeta(TriageClassification triage, DeviceList list) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("persona", triage.persona().wireName());
        meta.put("confidence", triage.confidence());
        meta.put("source", triage.source());
        meta.put("list", list.name());
        return meta;
    }

    static List<String> mergeTags(List<String> first, List<String> second) {
        List<String> merged = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (List<String> source : List.of(first, second)) {
            for (String tag : source) {
                if (tag == null || tag.isBlank()) continue;
                if (seen.add(tag.trim().toLowerCase(Locale.ROOT))) merged.add(tag.trim());
            }
        }
        return merged;
    }

    private static void put(Map<String, String> meta, String key, String value) {
        if (value == null || value.isBlank()) {
            meta.remove(key);
        } else {
            meta.put(key, value);
        }
    }

    private static Map<String, Object> emptyToNull(Map<String, Object> map) {
        return map == null || map.isEmpty() ? null : map;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }
}
