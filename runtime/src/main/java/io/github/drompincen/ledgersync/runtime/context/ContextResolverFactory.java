package io.github.drompincen.ledgersync.runtime.context;

import io.github.drompincen.ledgersync.runtime.ledger.LedgerGateway;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/** Hands each pass its own {@link ContextResolver} so cached context never outlives the pass. */
@Component
public class ContextResolverFactory {

    private final LedgerGateway ledgerGateway;
    private final Executor executor;

    public ContextResolverFactory(LedgerGateway ledgerGateway, @Qualifier("contextExecutor") Executor executor) {
        this.ledgerGateway = ledgerGateway;
        this.executor = executor;
    }

    public ContextResolver newResolver() {
        return new ContextResolver(ledgerGateway, executor);
    }
}
