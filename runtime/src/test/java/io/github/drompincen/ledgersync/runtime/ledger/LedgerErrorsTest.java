package io.github.drompincen.ledgersync.runtime.ledger;

import com.mongodb.MongoException;
import io.github.drompincen.ledgersync.protocol.api.SyncErrorKind;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PermissionDeniedDataAccessException;
import org.springframework.data.mongodb.UncategorizedMongoDbException;

import static org.assertj.core.api.Assertions.assertThat;

class LedgerErrorsTest {

    @Test
    void unauthorizedCodeIsPermissionDenied() {
        RuntimeException e = new UncategorizedMongoDbException("query failed", new MongoException(13, "denied"));

        assertThat(LedgerErrors.classify(e)).isEqualTo(SyncErrorKind.PERMISSION_DENIED);
    }

    @Test
    void springPermissionExceptionIsPermissionDenied() {
        assertThat(LedgerErrors.classify(new PermissionDeniedDataAccessException("no", null)))
                .isEqualTo(SyncErrorKind.PERMISSION_DENIED);
    }

    @Test
    void missingIndexCodesAreRecognised() {
        assertThat(LedgerErrors.classify(new MongoException(27, "index not found"))).isEqualTo(SyncErrorKind.MISSING_INDEX);
        assertThat(LedgerErrors.classify(new MongoException(291, "no plans"))).isEqualTo(SyncErrorKind.MISSING_INDEX);
        assertThat(LedgerErrors.classify(new RuntimeException("hint provided does not correspond to an existing index")))
                .isEqualTo(SyncErrorKind.MISSING_INDEX);
    }

    @Test
    void anythingElseIsTransient() {
        assertThat(LedgerErrors.classify(new DataAccessResourceFailureException("socket closed")))
                .isEqualTo(SyncErrorKind.TRANSIENT_IO);
    }

    @Test
    void translateKeepsContextAndPassesThroughAccessExceptions() {
        LedgerAccessException translated = LedgerErrors.translate("fetchAll", new MongoException(13, "not authorized on ledger"));
        assertThat(translated.kind()).isEqualTo(SyncErrorKind.PERMISSION_DENIED);
        assertThat(translated.getMessage()).startsWith("fetchAll: ");

        LedgerAccessException original = new LedgerAccessException(SyncErrorKind.TRANSIENT_IO, "x");
        assertThat(LedgerErrors.translate("commit", original)).isSameAs(original);
    }
}
