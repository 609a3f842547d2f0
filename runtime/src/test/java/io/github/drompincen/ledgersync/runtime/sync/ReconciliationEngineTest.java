package io.github.drompincen.ledgersync.runtime.sync;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.persistence.document.SyncStateDocument;
import io.github.drompincen.ledgersync.persistence.repository.ActivityRepository;
import io.github.drompincen.ledgersync.persistence.repository.CreationClaimRepository;
import io.github.drompincen.ledgersync.persistence.repository.SyncStateRepository;
import io.github.drompincen.ledgersync.protocol.api.SyncErrorKind;
import io.github.drompincen.ledgersync.protocol.api.SyncMode;
import io.github.drompincen.ledgersync.protocol.api.SyncRequest;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import io.github.drompincen.ledgersync.protocol.api.TaskStatus;
import io.github.drompincen.ledgersync.runtime.auth.OwnerIdentityProvider;
import io.github.drompincen.ledgersync.runtime.config.SyncProperties;
import io.github.drompincen.ledgersync.runtime.context.ContextResolverFactory;
import io.github.drompincen.ledgersync.runtime.dedupe.Deduplicator;
import io.github.drompincen.ledgersync.runtime.device.DeviceItem;
import io.github.drompincen.ledgersync.runtime.device.InMemoryDeviceStore;
import io.github.drompincen.ledgersync.runtime.identity.HumanRefGenerator;
import io.github.drompincen.ledgersync.runtime.identity.IdentityResolver;
import io.github.drompincen.ledgersync.runtime.ledger.InMemoryLedgerGateway;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerAccessException;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerMutation;
import io.github.drompincen.ledgersync.runtime.note.NoteCodec;
import io.github.drompincen.ledgersync.runtime.note.NoteMetadata;
import io.github.drompincen.ledgersync.runtime.triage.RemoteTriageClient;
import io.github.drompincen.ledgersync.runtime.triage.TriageClassifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ReconciliationEngineTest {

    private static final String OWNER = "owner-1";
    private static final Instant START = Instant.parse("2024-03-01T09:00:00Z");

    @Mock private ActivityRepository activityRepository;
    @Mock private CreationClaimRepository claimRepository;
    @Mock private SyncStateRepository stateRepository;
    @Mock private RemoteTriageClient remoteTriageClient;
    @Mock private OwnerIdentityProvider ownerIdentityProvider;

    private MutableClock clock;
    private SyncProperties properties;
    private InMemoryLedgerGateway ledger;
    private InMemoryDeviceStore device;
    private NoteCodec codec;
    private ReconciliationEngine engine;
    private final Map<String, SyncStateDocument> states = new HashMap<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new SyncProperties();
        ledger = new InMemoryLedgerGateway(clock);
        device = new InMemoryDeviceStore(clock);
        codec = new NoteCodec(properties.getDeepLinkBase());

        when(ownerIdentityProvider.currentOwnerId()).thenReturn(Optional.of(OWNER));
        when(stateRepository.findById(anyString())).thenAnswer(inv -> Optional.ofNullable(states.get(inv.<String>getArgument(0))));
        when(stateRepository.save(any(SyncStateDocument.class))).thenAnswer(inv -> {
            SyncStateDocument doc = inv.getArgument(0);
            states.put(doc.getOwnerId(), doc);
            return doc;
        });

        engine = newEngine(ledger);
    }

    private ReconciliationEngine newEngine(InMemoryLedgerGateway gateway) {
        SyncLogService syncLog = new SyncLogService(activityRepository, properties);
        return new ReconciliationEngine(gateway, device, codec, new IdentityResolver(gateway),
                new Deduplicator(gateway, syncLog, properties, clock),
                new ContextResolverFactory(gateway, Runnable::run),
                new TriageClassifier(properties, remoteTriageClient),
                new CreationClaimService(claimRepository, clock), syncLog,
                new SyncStateService(stateRepository), ownerIdentityProvider,
                new HumanRefGenerator(), properties, clock);
    }

    private DeviceItem deviceItem(String title) {
        DeviceItem item = new DeviceItem(title);
        item.setListName("Reminders");
        return device.put(item);
    }

    private LedgerTaskDocument openTask(String title) {
        LedgerTaskDocument task = new LedgerTaskDocument();
        task.setOwnerId(OWNER);
        task.setTitle(title);
        task.setStatus(TaskStatus.OPEN);
        task.setCreatedAt(START.minus(Duration.ofDays(2)));
        task.setUpdatedAt(START.minus(Duration.ofDays(1)));
        return ledger.seed(task);
    }

    private SyncResult full() {
        return engine.reconcile(SyncRequest.full("test"));
    }

    @Test
    void importsNewDeviceItemAndStampsNote() {
        DeviceItem milk = deviceItem("Buy milk");

        SyncResult result = full();

        assertThat(result.errors()).isEmpty();
        assertThat(result.created()).isEqualTo(1);
        List<LedgerTaskDocument> tasks = ledger.all();
        assertThat(tasks).hasSize(1);
        LedgerTaskDocument task = tasks.get(0);
        assertThat(task.getTitle()).isEqualTo("Buy milk");
        assertThat(task.effectiveStatus()).isEqualTo(TaskStatus.OPEN);
        assertThat(task.getLinkedDeviceId()).isEqualTo(milk.getId());
        assertThat(task.getHumanRef()).startsWith("TK-");
        assertThat(task.getPriority()).isEqualTo(4);

        DeviceItem stored = device.find(milk.getId()).orElseThrow();
        NoteMetadata note = codec.decode(stored.getNotes());
        assertThat(note.get(NoteCodec.TASK_REF)).isEqualTo(task.getHumanRef());
        assertThat(note.get(NoteCodec.STATUS)).isEqualTo("open");
        assertThat(note.get(NoteCodec.SYNCED)).isEqualTo(START.toString());
        assertThat(stored.getNotes()).contains("BOB: taskRef=" + task.getHumanRef());
    }

    @Test
    void secondPassWithoutChangesIsQuiet() {
        deviceItem("Buy milk");
        full();
        String notesAfterFirst = device.items().get(0).getNotes();

        clock.advance(Duration.ofMinutes(5));
        SyncResult second = full();

        assertThat(second.created()).isZero();
        assertThat(second.updated()).isZero();
        assertThat(second.repaired()).isZero();
        assertThat(ledger.all()).hasSize(1);
        assertThat(device.items().get(0).getNotes()).isEqualTo(notesAfterFirst);
    }

    @Test
    void deviceCompletionMarksTaskDoneWithRetentionWindow() {
        DeviceItem milk = deviceItem("Buy milk");
        full();

        clock.advance(Duration.ofMinutes(10));
        DeviceItem done = device.find(milk.getId()).orElseThrow();
        done.setCompleted(true);
        device.save(done);
        Instant completedAt = clock.instant();

        SyncResult result = full();

        assertThat(result.errors()).isEmpty();
        assertThat(result.updated()).isEqualTo(1);
        LedgerTaskDocument task = ledger.all().get(0);
        assertThat(task.effectiveStatus()).isEqualTo(TaskStatus.DONE);
        assertThat(task.getCompletedAt()).isEqualTo(completedAt);
        assertThat(task.getDeleteAfter()).isEqualTo(completedAt.plus(Duration.ofDays(30)));
        assertThat(codec.decode(device.find(milk.getId()).orElseThrow().getNotes()).get(NoteCodec.STATUS))
                .isEqualTo("complete");
    }

    @Test
    void expiredTaskRemovesDeviceItem() {
        DeviceItem milk = deviceItem("Buy milk");
        full();
        clock.advance(Duration.ofMinutes(1));
        DeviceItem done = device.find(milk.getId()).orElseThrow();
        done.setCompleted(true);
        device.save(done);
        full();

        clock.advance(Duration.ofDays(29));
        assertThat(full().removed()).isZero();
        assertThat(device.find(milk.getId())).isPresent();

        clock.advance(Duration.ofDays(2));
        SyncResult result = full();

        assertThat(result.removed()).isEqualTo(1);
        assertThat(device.find(milk.getId())).isEmpty();
        assertThat(ledger.all().get(0).getLinkedDeviceId()).isNull();
    }

    @Test
    void matchesExistingOpenTaskByNormalizedTitle() {
        LedgerTaskDocument existing = openTask("Buy milk");
        DeviceItem item = deviceItem("  buy   MILK! ");

        SyncResult result = full();

        assertThat(result.created()).isZero();
        assertThat(ledger.all()).hasSize(1);
        assertThat(ledger.stored(existing.getId()).orElseThrow().getLinkedDeviceId()).isEqualTo(item.getId());
        assertThat(ledger.titleLookups()).isZero();
    }

    @Test
    void deltaPassMatchesOpenTaskOlderThanWatermarkByTitle() {
        LedgerTaskDocument existing = openTask("Buy milk");
        existing.setUpdatedAt(START.minus(Duration.ofDays(2)));
        existing.setServerUpdatedAt(START.minus(Duration.ofDays(2)));
        existing.setDeviceMissingAt(START.minus(Duration.ofDays(2)));
        ledger.seed(existing);
        SyncStateDocument state = new SyncStateDocument();
        state.setOwnerId(OWNER);
        state.setWatermark(START.minus(Duration.ofDays(1)));
        states.put(OWNER, state);
        DeviceItem item = deviceItem("Buy milk");

        SyncResult result = engine.reconcile(SyncRequest.delta("test"));

        assertThat(result.errors()).isEmpty();
        assertThat(result.created()).isZero();
        assertThat(ledger.all()).hasSize(1);
        LedgerTaskDocument stored = ledger.stored(existing.getId()).orElseThrow();
        assertThat(stored.getLinkedDeviceId()).isEqualTo(item.getId());
        assertThat(stored.getDeviceMissingAt()).isNull();
        assertThat(ledger.titleLookups()).isEqualTo(1);
    }

    @Test
    void sameTitleTwiceOnDeviceCreatesOneTask() {
        deviceItem("Call plumber");
        deviceItem("call plumber");

        SyncResult result = full();

        assertThat(result.created()).isEqualTo(1);
        assertThat(ledger.all()).hasSize(1);
    }

    @Test
    void exportsLedgerOnlyTaskToDefaultList() {
        LedgerTaskDocument task = openTask("Renew passport");
        task.setHumanRef("TK-ABC234");
        ledger.seed(task);

        SyncResult result = full();

        assertThat(result.created()).isEqualTo(1);
        List<DeviceItem> items = device.items();
        assertThat(items).hasSize(1);
        assertThat(items.get(0).getTitle()).isEqualTo("Renew passport");
        assertThat(items.get(0).getListName()).isEqualTo("Reminders");
        assertThat(items.get(0).getUrl()).isEqualTo("https://ledger.example.app/task/TK-ABC234");
        assertThat(ledger.stored(task.getId()).orElseThrow().getLinkedDeviceId()).isEqualTo(items.get(0).getId());
    }

    @Test
    void ledgerTitleChangeReachesDevice() {
        DeviceItem milk = deviceItem("Buy milk");
        full();
        LedgerTaskDocument task = ledger.all().get(0);

        clock.advance(Duration.ofMinutes(5));
        task.setTitle("Buy oat milk");
        task.setUpdatedAt(clock.instant());
        ledger.seed(task);
        clock.advance(Duration.ofMinutes(1));

        SyncResult result = full();

        assertThat(result.updated()).isEqualTo(1);
        assertThat(device.find(milk.getId()).orElseThrow().getTitle()).isEqualTo("Buy oat milk");
    }

    @Test
    void deviceTitleChangeReachesLedger() {
        DeviceItem milk = deviceItem("Buy milk");
        full();

        clock.advance(Duration.ofMinutes(10));
        DeviceItem renamed = device.find(milk.getId()).orElseThrow();
        renamed.setTitle("Buy oat milk");
        device.save(renamed);

        SyncResult result = full();

        assertThat(result.errors()).isEmpty();
        assertThat(result.updated()).isEqualTo(1);
        LedgerTaskDocument task = ledger.all().get(0);
        assertThat(task.getTitle()).isEqualTo("Buy oat milk");
        assertThat(task.getUpdatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void deviceDueDateChangeReachesLedger() {
        DeviceItem milk = deviceItem("Buy milk");
        full();

        clock.advance(Duration.ofMinutes(10));
        long due = START.plus(Duration.ofDays(3)).toEpochMilli();
        DeviceItem rescheduled = device.find(milk.getId()).orElseThrow();
        rescheduled.setDueAt(due);
        device.save(rescheduled);

        SyncResult result = full();

        assertThat(result.updated()).isEqualTo(1);
        assertThat(ledger.all().get(0).getDueAt()).isEqualTo(due);
        assertThat(codec.decode(device.find(milk.getId()).orElseThrow().getNotes()).get(NoteCodec.DUE))
                .isEqualTo(Instant.ofEpochMilli(due).toString());
    }

    @Test
    void deviceItemOfDuplicateTaskMovesToSurvivor() {
        DeviceItem item = new DeviceItem("Water plants");
        item.setListName("Reminders");
        item.setNotes("-------\nBOB: taskRef=TK-AAAAAA");
        item.setLastModified(START.minus(Duration.ofDays(3)));
        item = device.put(item);
        LedgerTaskDocument older = openTask("Water plants");
        older.setHumanRef("TK-AAAAAA");
        older.setExternalId("ext-42");
        older.setLinkedDeviceId(item.getId());
        ledger.seed(older);
        LedgerTaskDocument newer = openTask("Water the plants");
        newer.setExternalId("ext-42");
        newer.setUpdatedAt(START.minus(Duration.ofHours(1)));
        newer.setServerUpdatedAt(START.minus(Duration.ofHours(1)));
        ledger.seed(newer);

        full();
        clock.advance(Duration.ofMinutes(5));
        SyncResult second = full();

        assertThat(second.errors()).isEmpty();
        assertThat(second.created()).isZero();
        assertThat(device.items()).hasSize(1);
        assertThat(device.items().get(0).getId()).isEqualTo(item.getId());
        assertThat(ledger.stored(newer.getId()).orElseThrow().getLinkedDeviceId()).isEqualTo(item.getId());
        assertThat(ledger.stored(older.getId()).orElseThrow().getDuplicateOf()).isEqualTo(newer.getId());
        assertThat(codec.decode(device.items().get(0).getNotes()).get(NoteCodec.TASK_REF)).isEqualTo(newer.getId());
    }

    @Test
    void deviceItemOfDuplicateIsClosedWhenSurvivorHasItsOwn() {
        DeviceItem loserItem = deviceItem("Water plants");
        DeviceItem survivorItem = deviceItem("Water the plants");
        LedgerTaskDocument older = openTask("Water plants");
        older.setExternalId("ext-42");
        older.setLinkedDeviceId(loserItem.getId());
        ledger.seed(older);
        LedgerTaskDocument newer = openTask("Water the plants");
        newer.setExternalId("ext-42");
        newer.setLinkedDeviceId(survivorItem.getId());
        newer.setUpdatedAt(START.minus(Duration.ofHours(1)));
        newer.setServerUpdatedAt(START.minus(Duration.ofHours(1)));
        ledger.seed(newer);

        SyncResult result = full();

        assertThat(result.errors()).isEmpty();
        assertThat(result.created()).isZero();
        assertThat(device.find(loserItem.getId()).orElseThrow().isCompleted()).isTrue();
        assertThat(device.find(survivorItem.getId()).orElseThrow().isCompleted()).isFalse();
        assertThat(device.items()).hasSize(2);
    }

    @Test
    void failedCommitKeepsDeviceWritesAndHoldsWatermark() {
        boolean[] failing = {false};
        ledger = new InMemoryLedgerGateway(clock) {
            @Override
            public void commit(List<LedgerMutation> mutations) {
                if (failing[0]) throw new LedgerAccessException(SyncErrorKind.BATCH_COMMIT_FAILURE, "bulk write rejected");
                super.commit(mutations);
            }
        };
        engine = newEngine(ledger);
        openTask("Renew passport");
        engine.reconcile(SyncRequest.delta("test"));
        Instant watermark = states.get(OWNER).getWatermark();

        clock.advance(Duration.ofMinutes(5));
        LedgerTaskDocument plumber = openTask("Call plumber");
        plumber.setUpdatedAt(clock.instant());
        plumber.setServerUpdatedAt(clock.instant());
        ledger.seed(plumber);
        failing[0] = true;

        SyncResult failed = engine.reconcile(SyncRequest.delta("test"));

        assertThat(failed.errors()).contains(SyncErrorKind.BATCH_COMMIT_FAILURE + ": commit");
        assertThat(device.items()).extracting(DeviceItem::getTitle).contains("Call plumber");
        assertThat(ledger.stored(plumber.getId()).orElseThrow().getLinkedDeviceId()).isNull();
        assertThat(states.get(OWNER).getWatermark()).isEqualTo(watermark);
        assertThat(states.get(OWNER).getLastErrors()).isNotEmpty();

        failing[0] = false;
        clock.advance(Duration.ofMinutes(5));
        SyncResult retry = engine.reconcile(SyncRequest.delta("test"));

        assertThat(retry.errors()).isEmpty();
        assertThat(device.items()).extracting(DeviceItem::getTitle).containsOnlyOnce("Call plumber");
        DeviceItem plumberItem = device.items().stream()
                .filter(i -> i.getTitle().equals("Call plumber")).findFirst().orElseThrow();
        assertThat(ledger.stored(plumber.getId()).orElseThrow().getLinkedDeviceId()).isEqualTo(plumberItem.getId());
        assertThat(states.get(OWNER).getWatermark()).isAfter(watermark);
    }

    @Test
    void linkedItemMissingFromSnapshotButStillStoredKeepsItsLink() {
        device = new InMemoryDeviceStore(clock) {
            @Override
            public synchronized List<DeviceItem> items() {
                return List.of();
            }
        };
        engine = newEngine(ledger);
        DeviceItem milk = deviceItem("Buy milk");
        LedgerTaskDocument task = openTask("Buy milk");
        task.setLinkedDeviceId(milk.getId());
        ledger.seed(task);

        SyncResult result = full();

        assertThat(result.updated()).isZero();
        LedgerTaskDocument stored = ledger.stored(task.getId()).orElseThrow();
        assertThat(stored.getLinkedDeviceId()).isEqualTo(milk.getId());
        assertThat(stored.getDeviceMissingAt()).isNull();
    }

    @Test
    void deletedDeviceItemClearsLinkAndIsNotRecreated() {
        DeviceItem milk = deviceItem("Buy milk");
        full();
        device.delete(milk.getId());
        clock.advance(Duration.ofMinutes(1));

        SyncResult first = full();
        SyncResult second = full();

        LedgerTaskDocument task = ledger.all().get(0);
        assertThat(first.updated()).isEqualTo(1);
        assertThat(task.getLinkedDeviceId()).isNull();
        assertThat(task.getDeviceMissingAt()).isNotNull();
        assertThat(second.created()).isZero();
        assertThat(device.items()).isEmpty();
    }

    @Test
    void ledgerDeletionCompletesDeviceItemWithTag() {
        DeviceItem milk = deviceItem("Buy milk");
        full();
        LedgerTaskDocument task = ledger.all().get(0);
        task.setStatus(TaskStatus.DELETED);
        ledger.seed(task);

        full();

        DeviceItem stored = device.find(milk.getId()).orElseThrow();
        assertThat(stored.isCompleted()).isTrue();
        assertThat(NoteCodec.splitTags(codec.decode(stored.getNotes()).get(NoteCodec.TAGS))).contains("deleted");
    }

    @Test
    void priorityFiveSurvivesUnchangedPass() {
        DeviceItem milk = deviceItem("Buy milk");
        full();
        LedgerTaskDocument task = ledger.all().get(0);
        task.setPriority(5);
        ledger.seed(task);

        full();
        SyncResult quiet = full();

        assertThat(ledger.all().get(0).getPriority()).isEqualTo(5);
        assertThat(device.find(milk.getId()).orElseThrow().getPriority()).isZero();
        assertThat(quiet.updated()).isZero();
    }

    @Test
    void dryRunWritesNothing() {
        DeviceItem milk = deviceItem("Buy milk");
        openTask("Renew passport");

        SyncResult result = engine.reconcile(new SyncRequest(SyncMode.FULL, true, "preview"));

        assertThat(result.dryRun()).isTrue();
        assertThat(result.created()).isEqualTo(2);
        assertThat(ledger.all()).hasSize(1);
        assertThat(device.items()).hasSize(1);
        assertThat(device.find(milk.getId()).orElseThrow().getNotes()).isNull();
        assertThat(states).isEmpty();
    }

    @Test
    void deltaPassAdvancesWatermark() {
        openTask("Renew passport");
        engine.reconcile(SyncRequest.delta("test"));

        assertThat(states.get(OWNER).getWatermark()).isEqualTo(START.minus(Duration.ofDays(1)));
        assertThat(states.get(OWNER).getLastDeltaSyncAt()).isNotNull();
    }

    @Test
    void softDuplicatesAreCompletedDuringPass() {
        LedgerTaskDocument older = openTask("Water plants");
        older.setSourceRef("ext-42");
        ledger.seed(older);
        LedgerTaskDocument newer = openTask("Water the plants");
        newer.setSourceRef("ext-42");
        newer.setUpdatedAt(START.minus(Duration.ofHours(1)));
        ledger.seed(newer);

        SyncResult result = full();

        assertThat(result.duplicates()).isEqualTo(1);
        LedgerTaskDocument loser = ledger.stored(older.getId()).orElseThrow();
        assertThat(loser.getDuplicateOf()).isEqualTo(newer.getId());
        assertThat(loser.effectiveStatus()).isEqualTo(TaskStatus.DONE);
        assertThat(device.items()).extracting(DeviceItem::getTitle).containsExactly("Water the plants");
    }

    @Test
    void workItemInTriageListIsRoutedNotImported() {
        properties.getTriage().setEnabled(true);
        properties.getTriage().setSourceList("Inbox");
        DeviceItem item = new DeviceItem("Deploy production fix");
        item.setListName("Inbox");
        item = device.put(item);

        SyncResult result = full();

        assertThat(result.created()).isZero();
        assertThat(ledger.all()).isEmpty();
        assertThat(device.find(item.getId()).orElseThrow().getListName()).isEqualTo("Work");
    }

    @Test
    void personalItemInTriageListMovesToCategoryAndImports() {
        properties.getTriage().setEnabled(true);
        properties.getTriage().setSourceList("Inbox");
        DeviceItem item = new DeviceItem("Book dentist appointment");
        item.setListName("Inbox");
        item = device.put(item);

        full();

        LedgerTaskDocument task = ledger.all().get(0);
        assertThat(task.getCategory()).isEqualTo("Health");
        assertThat(task.getPersona()).isEqualTo("personal");
        assertThat(device.find(item.getId()).orElseThrow().getListName()).isEqualTo("Health");
    }

    @Test
    void completedAndNonRoutineRecurringItemsAreNotImported() {
        DeviceItem done = new DeviceItem("Old errand");
        done.setCompleted(true);
        device.put(done);
        DeviceItem weekly = new DeviceItem("Team sync");
        weekly.setRecurrence(Map.of("frequency", "weekly"));
        device.put(weekly);
        DeviceItem chore = new DeviceItem("Take out bins");
        chore.setListName("Chores");
        chore.setRecurrence(Map.of("frequency", "weekly"));
        device.put(chore);

        full();

        assertThat(ledger.all()).extracting(LedgerTaskDocument::getTitle).containsExactly("Take out bins");
        assertThat(ledger.all().get(0).getItemType()).isEqualTo("chore");
    }

    @Test
    void noOwnerAbortsBeforeAnyRead() {
        when(ownerIdentityProvider.currentOwnerId()).thenReturn(Optional.empty());
        deviceItem("Buy milk");

        SyncResult result = full();

        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).startsWith(SyncErrorKind.NOT_AUTHENTICATED.name());
        assertThat(ledger.all()).isEmpty();
    }

    @Test
    void overlappingPassForSameOwnerIsRejected() {
        SyncResult[] nested = new SyncResult[1];
        InMemoryLedgerGateway reentrant = new InMemoryLedgerGateway(clock) {
            @Override
            public List<LedgerTaskDocument> fetchAll(String ownerId, int pageSize, int maxTasks) {
                if (nested[0] == null) nested[0] = engine.reconcile(SyncRequest.full("overlap"));
                return super.fetchAll(ownerId, pageSize, maxTasks);
            }
        };
        engine = newEngine(reentrant);

        SyncResult outer = full();

        assertThat(outer.rejected()).isFalse();
        assertThat(nested[0].rejected()).isTrue();
        assertThat(engine.isRunning(OWNER)).isFalse();
    }

    @Test
    void cancelledPassStopsBeforeCommit() {
        deviceItem("Buy milk");
        CancellationFlag flag = new CancellationFlag();
        flag.cancel();

        SyncResult result = engine.reconcile(SyncRequest.full("test"), flag);

        assertThat(result.errors()).contains("cancelled before load");
        assertThat(ledger.all()).isEmpty();
    }
}
