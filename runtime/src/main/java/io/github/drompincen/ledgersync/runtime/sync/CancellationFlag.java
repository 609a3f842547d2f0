package io.github.drompincen.ledgersync.runtime.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/** Checked by the engine between phases; a cancelled pass never commits its ledger batch. */
public class CancellationFlag {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
