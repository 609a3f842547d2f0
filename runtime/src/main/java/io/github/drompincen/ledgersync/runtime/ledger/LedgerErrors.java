package io.github.drompincen.ledgersync.runtime.ledger;

import com.mongodb.MongoException;
import io.github.drompincen.ledgersync.protocol.api.SyncErrorKind;
import org.springframework.dao.PermissionDeniedDataAccessException;

import java.util.Locale;

/** Maps Spring/Mongo exceptions onto {@link SyncErrorKind}; anything unrecognized is treated as transient. */
public final class LedgerErrors {

    static final int UNAUTHORIZED = 13;
    static final int INDEX_NOT_FOUND = 27;
    static final int NO_QUERY_EXECUTION_PLANS = 291;

    private LedgerErrors() {}

    public static LedgerAccessException translate(String context, RuntimeException e) {
        if (e instanceof LedgerAccessException lae) return lae;
        return new LedgerAccessException(classify(e), context + ": " + e.getMessage(), e);
    }

    public static SyncErrorKind classify(Throwable e) {
        if (e instanceof PermissionDeniedDataAccessException) return SyncErrorKind.PERMISSION_DENIED;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof MongoException mongo) {
                int code = mongo.getCode();
                if (code == UNAUTHORIZED) return SyncErrorKind.PERMISSION_DENIED;
                if (code == INDEX_NOT_FOUND || code == NO_QUERY_EXECUTION_PLANS) return SyncErrorKind.MISSING_INDEX;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("not authorized") || lower.contains("permission")) return SyncErrorKind.PERMISSION_DENIED;
                if (lower.contains("hint provided does not correspond to an existing index")) return SyncErrorKind.MISSING_INDEX;
            }
        }
        return SyncErrorKind.TRANSIENT_IO;
    }
}
