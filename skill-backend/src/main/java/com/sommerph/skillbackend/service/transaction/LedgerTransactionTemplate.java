package com.sommerph.skillbackend.service.transaction;

import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Runs a unit of ledger work inside a {@link LedgerTransaction}: commits and publishes its events
 * when the work returns, rolls it back and rethrows when it throws. The work is also bracketed as
 * a store unit, so a store that survives restarts can undo it if the process dies half way.
 */
@Component
@RequiredArgsConstructor
public class LedgerTransactionTemplate {

    private final EntityLockManager lockManager;
    private final LedgerStore ledgerStore;
    private final ApplicationEventPublisher eventPublisher;

    public <T> T execute(Function<LedgerTransaction, T> work) {
        LedgerTransaction tx = new LedgerTransaction(lockManager);
        List<Object> events;
        T result;
        ledgerStore.beginUnit();
        try {
            result = work.apply(tx);
            ledgerStore.commitUnit();
            events = tx.commit();
        } catch (RuntimeException | Error e) {
            tx.rollback(e);
            try {
                ledgerStore.abortUnit();
            } catch (RuntimeException abortFailure) {
                e.addSuppressed(abortFailure);
            }
            throw e;
        } finally {
            tx.releaseLocks();
        }
        events.forEach(eventPublisher::publishEvent);
        return result;
    }

}
