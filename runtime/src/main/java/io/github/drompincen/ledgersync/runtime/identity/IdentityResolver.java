package io.github.drompincen.ledgersync.runtime.identity;

import io.github.drompincen.ledgersync.persistence.document.LedgerTaskDocument;
import io.github.drompincen.ledgersync.runtime.device.DeviceItem;
import io.github.drompincen.ledgersync.runtime.identity.Resolution.MatchKind;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerAccessException;
import io.github.drompincen.ledgersync.runtime.ledger.LedgerGateway;
import io.github.drompincen.ledgersync.runtime.note.NoteCodec;
import io.github.drompincen.ledgersync.runtime.note.NoteMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Maps a device item to its ledger task. First hit wins:
 * <ol>
 *   <li>the item's own id (or an alternate device id recorded on the task)</li>
 *   <li>the ledger reference embedded in the notes, then a raw ledger id, then one
 *       point lookup against the ledger for tasks outside the loaded set</li>
 *   <li>source ref and external id hints carried in the notes</li>
 *   <li>the normalized title of an open task, asking the ledger when the index holds only
 *       part of the owner's tasks</li>
 * </ol>
 * References to a task marked as a duplicate resolve to the task that survived it.
 */
@Component
public class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final LedgerGateway ledgerGateway;

    public IdentityResolver(LedgerGateway ledgerGateway) {
        this.ledgerGateway = ledgerGateway;
    }

    public Resolution resolve(String ownerId, DeviceItem item, NoteMetadata note, LedgerIndex index) {
        LedgerTaskDocument byDevice = index.byDeviceId(item.getId());
        if (byDevice == null) byDevice = index.byAltDeviceId(item.getId());
        if (byDevice != null) return new Resolution(byDevice, MatchKind.DEVICE_ID);

        String ref = note.get(NoteCodec.TASK_REF);
        String rawId = note.get(NoteCodec.TASK_ID);
        if (ref != null) {
            LedgerTaskDocument byRef = index.byHumanRef(ref);
            if (byRef != null) return new Resolution(byRef, MatchKind.HUMAN_REF);
            LedgerTaskDocument byId = index.survivorOf(index.byId(ref));
            if (byId != null) return new Resolution(byId, MatchKind.LEDGER_ID);
        }
        if (rawId != null) {
            LedgerTaskDocument byId = index.survivorOf(index.byId(rawId));
            if (byId != null) return new Resolution(byId, MatchKind.LEDGER_ID);
        }
        if (ref != null || rawId != null) {
            try {
                Optional<LedgerTaskDocument> remote = pointLookup(ownerId, ref, rawId);
                if (remote.isPresent()) {
                    LedgerTaskDocument found = remote.get();
                    // outside the loaded set; from now on it takes part in the pass
                    index.register(found);
                    LedgerTaskDocument task = found.getId() != null ? index.byId(found.getId()) : found;
                    LedgerTaskDocument resolved = survivorOf(ownerId, index, task);
                    if (resolved != null) {
                        return new Resolution(resolved, ref != null && ref.equalsIgnoreCase(found.getHumanRef())
                                ? MatchKind.HUMAN_REF : MatchKind.LEDGER_ID);
                    }
                }
            } catch (LedgerAccessException e) {
                log.warn("Point lookup for device item {} (ref {}) failed: {}", item.getId(), ref, e.getMessage());
                return Resolution.lookupFailed();
            }
        }

        LedgerTaskDocument hinted = index.bySourceRef(note.get("sourceRef"));
        if (hinted == null) hinted = index.byExternalId(note.get("externalId"));
        if (hinted != null) return new Resolution(hinted, MatchKind.HINT);

        String title = TitleNormalizer.normalize(item.getTitle());
        LedgerTaskDocument byTitle = index.byNormalizedTitle(title);
        if (byTitle == null && !index.complete() && !title.isEmpty()) {
            try {
                byTitle = remoteTitleMatch(ownerId, title, index);
            } catch (LedgerAccessException e) {
                log.warn("Title lookup for device item {} failed: {}", item.getId(), e.getMessage());
                return Resolution.lookupFailed();
            }
        }
        if (byTitle != null) return new Resolution(byTitle, MatchKind.TITLE);

        return Resolution.none();
    }

    private LedgerTaskDocument remoteTitleMatch(String ownerId, String title, LedgerIndex index) {
        List<LedgerTaskDocument> candidates = ledgerGateway.findByTitleWords(ownerId, title);
        for (LedgerTaskDocument candidate : candidates) {
            if (candidate.markedDuplicate() || !candidate.effectiveStatus().isOpen()) continue;
            if (title.equals(TitleNormalizer.normalize(candidate.getTitle()))) index.register(candidate);
        }
        return index.byNormalizedTitle(title);
    }

    private Optional<LedgerTaskDocument> pointLookup(String ownerId, String ref, String rawId) {
        if (ref != null) {
            Optional<LedgerTaskDocument> found = HumanRefGenerator.looksLikeHumanRef(ref)
                    ? ledgerGateway.findByHumanRef(ownerId, ref)
                    : ledgerGateway.findById(ownerId, ref);
            if (found.isPresent()) return found;
        }
        return rawId != null ? ledgerGateway.findById(ownerId, rawId) : Optional.empty();
    }

    /** Like {@link LedgerIndex#survivorOf}, fetching the survivor when the pass has not loaded it. */
    private LedgerTaskDocument survivorOf(String ownerId, LedgerIndex index, LedgerTaskDocument task) {
        LedgerTaskDocument survivor = index.survivorOf(task);
        if (survivor != null || !task.markedDuplicate()) return survivor;
        Optional<LedgerTaskDocument> fetched = ledgerGateway.findById(ownerId, task.getDuplicateOf());
        if (fetched.isEmpty()) return null;
        index.register(fetched.get());
        // the duplicate was registered before its survivor was known
        index.register(task);
        return index.survivorOf(task);
    }
}
