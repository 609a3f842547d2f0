package io.github.drompincen.ledgersync.gateway.controller;

import io.github.drompincen.ledgersync.persistence.document.ActivityDocument;
import io.github.drompincen.ledgersync.protocol.api.DedupeMode;
import io.github.drompincen.ledgersync.protocol.api.DedupeReport;
import io.github.drompincen.ledgersync.protocol.api.SyncErrorKind;
import io.github.drompincen.ledgersync.protocol.api.SyncRequest;
import io.github.drompincen.ledgersync.protocol.api.SyncResult;
import io.github.drompincen.ledgersync.protocol.api.SyncStatusResponse;
import io.github.drompincen.ledgersync.runtime.auth.OwnerIdentityProvider;
import io.github.drompincen.ledgersync.runtime.sync.ReconciliationEngine;
import io.github.drompincen.ledgersync.runtime.sync.SyncLogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private final ReconciliationEngine engine;
    private final SyncLogService syncLogService;
    private final OwnerIdentityProvider ownerIdentityProvider;

    public SyncController(ReconciliationEngine engine, SyncLogService syncLogService,
                          OwnerIdentityProvider ownerIdentityProvider) {
        this.engine = engine;
        this.syncLogService = syncLogService;
        this.ownerIdentityProvider = ownerIdentityProvider;
    }

    @PostMapping
    public ResponseEntity<SyncResult> sync(@RequestBody(required = false) SyncRequest request) {
        SyncResult result = engine.reconcile(request != null ? request : SyncRequest.delta("manual"));
        if (result.rejected()) return ResponseEntity.status(HttpStatus.CONFLICT).body(result);
        if (result.ownerId() == null && result.hasErrors()
                && result.errors().get(0).startsWith(SyncErrorKind.NOT_AUTHENTICATED.name())) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(result);
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/status")
    public ResponseEntity<SyncStatusResponse> status() {
        return engine.status()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
    }

    @PostMapping("/dedupe")
    public ResponseEntity<DedupeReport> dedupe(@RequestParam(defaultValue = "false") boolean hard) {
        Optional<DedupeReport> report = engine.dedupe(hard ? DedupeMode.HARD : DedupeMode.SOFT);
        return report.map(ResponseEntity::ok)
                .orElse(ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
    }

    @GetMapping("/activity")
    public ResponseEntity<List<ActivityDocument>> activity() {
        return ownerIdentityProvider.currentOwnerId()
                .map(owner -> ResponseEntity.ok(syncLogService.recent(owner)))
                .orElse(ResponseEntity.status(HttpStatus.UNAUTHORIZED).build());
    }
}
