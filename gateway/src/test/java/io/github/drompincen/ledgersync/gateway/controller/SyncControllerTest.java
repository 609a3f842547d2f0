package io.github.drompincen.ledgersync.gateway.controller;

import io.github.drompincen.ledgersync.persistence.document.ActivityDocument;
import io.github.drompincen.ledgersync.protocol.api.DedupeMode;
import io.github.drompincen.ledgersync.protocol.api.DedupeReport;
import io.github.drompincen.ledgersync.protocol.api.SyncMode;
import io.github.drompincen.ledgersync.protocol.api.SyncRequest;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import io.github.drompincen.ledgersync.protocol.api.SyncStatusResponse;
import io.github.drompincen.ledgersync.runtime.auth.OwnerIdentityProvider;
import io.github.drompincen.ledgersync.runtime.sync.ReconciliationEngine;
import io.github.drompincen.ledgersync.runtime.sync.SyncLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SyncControllerTest {

    @Mock private ReconciliationEngine engine;
    @Mock private SyncLogService syncLogService;
    @Mock private OwnerIdentityProvider ownerIdentityProvider;

    private SyncController controller;

    @BeforeEach
    void setUp() {
        controller = new SyncController(engine, syncLogService, ownerIdentityProvider);
        when(ownerIdentityProvider.currentOwnerId()).thenReturn(Optional.of("alice"));
    }

    private static SyncResult ok(SyncMode mode) {
        return new SyncResult("alice", mode, false, false, 1, 0, 0, 0, 0,
                List.of(), Map.of(), Instant.EPOCH, Instant.EPOCH);
    }

    @Test
    void missingBodyRunsManualDeltaPass() {
        when(engine.reconcile(any(SyncRequest.class))).thenReturn(ok(SyncMode.DELTA));

        ResponseEntity<SyncResult> response = controller.sync(null);

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        ArgumentCaptor<SyncRequest> request = ArgumentCaptor.forClass(SyncRequest.class);
        verify(engine).reconcile(request.capture());
        assertThat(request.getValue()).isEqualTo(SyncRequest.delta("manual"));
    }

    @Test
    void overlappingPassIsConflict() {
        when(engine.reconcile(any(SyncRequest.class))).thenReturn(SyncResult.rejected("alice", SyncMode.FULL, false));

        ResponseEntity<SyncResult> response = controller.sync(SyncRequest.full("ui"));

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(response.getBody().rejected()).isTrue();
    }

    @Test
    void noOwnerIsUnauthorized() {
        when(engine.reconcile(any(SyncRequest.class)))
                .thenReturn(SyncResult.aborted(null, SyncMode.DELTA, false, "NOT_AUTHENTICATED: no signed-in owner"));

        assertThat(controller.sync(SyncRequest.delta("ui")).getStatusCode().value()).isEqualTo(401);
    }

    @Test
    void passWithErrorsIsStillOk() {
        when(engine.reconcile(any(SyncRequest.class)))
                .thenReturn(SyncResult.aborted("alice", SyncMode.FULL, false, "PERMISSION_DENIED: load"));

        assertThat(controller.sync(SyncRequest.full("ui")).getStatusCode().value()).isEqualTo(200);
    }

    @Test
    void statusWithoutOwnerIsUnauthorized() {
        when(engine.status()).thenReturn(Optional.empty());

        assertThat(controller.status().getStatusCode().value()).isEqualTo(401);
    }

    @Test
    void statusReturnsState() {
        SyncStatusResponse status = new SyncStatusResponse("alice", false, Instant.EPOCH, null, Instant.EPOCH, "created=0");
        when(engine.status()).thenReturn(Optional.of(status));

        ResponseEntity<SyncStatusResponse> response = controller.status();

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(status);
    }

    @Test
    void hardFlagSelectsHardDedupe() {
        when(engine.dedupe(DedupeMode.HARD)).thenReturn(Optional.of(new DedupeReport(DedupeMode.HARD, 2, 3, List.of())));

        ResponseEntity<DedupeReport> response = controller.dedupe(true);

        assertThat(response.getBody().duplicates()).isEqualTo(3);
        verify(engine, never()).dedupe(DedupeMode.SOFT);
    }

    @Test
    void activityListsRecentEntriesOfOwner() {
        ActivityDocument entry = new ActivityDocument();
        entry.setAction("importItem");
        when(syncLogService.recent("alice")).thenReturn(List.of(entry));

        ResponseEntity<List<ActivityDocument>> response = controller.activity();

        assertThat(response.getBody()).containsExactly(entry);
    }

    @Test
    void activityWithoutOwnerIsUnauthorized() {
        when(ownerIdentityProvider.currentOwnerId()).thenReturn(Optional.empty());

        assertThat(controller.activity().getStatusCode().value()).isEqualTo(401);
        verifyNoInteractions(syncLogService);
    }
}
