package com.sommerph.skillbackend.service.transaction;

import com.sommerph.skillbackend.repository.ledger.InMemoryLedgerStore;
import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LedgerTransactionTemplateTest {

    private final EntityLockManager lockManager = new EntityLockManager();
    private final LedgerStore store = new InMemoryLedgerStore();
    private final List<Object> published = new ArrayList<>();
    private final LedgerTransactionTemplate template = new LedgerTransactionTemplate(lockManager, store, published::add);

    @Test
    void publishesEventsAfterCommit() {
        String result = template.execute(tx -> {
            tx.publishOnCommit("first");
            tx.publishOnCommit("second");
            assertThat(published).isEmpty();
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(published).containsExactly("first", "second");
    }

    @Test
    void rollsBackInReverseOrderAndDropsEvents() {
        List<String> undone = new ArrayList<>();

        assertThatThrownBy(() -> template.execute(tx -> {
            tx.onRollback(() -> undone.add("a"));
            tx.onRollback(() -> undone.add("b"));
            tx.publishOnCommit("never");
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(undone).containsExactly("b", "a");
        assertThat(published).isEmpty();
    }

    @Test
    void failingUndoStepIsSuppressedAndOthersStillRun() {
        List<String> undone = new ArrayList<>();

        assertThatThrownBy(() -> template.execute(tx -> {
            tx.onRollback(() -> undone.add("a"));
            tx.onRollback(() -> {
                throw new IllegalArgumentException("undo failed");
            });
            throw new IllegalStateException("boom");
        })).satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));

        assertThat(undone).containsExactly("a");
    }

    @Test
    void holdsEntityLocksUntilCompletion() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        Thread worker = new Thread(() -> template.execute(tx -> {
            tx.lock("challenge:1");
            locked.countDown();
            try {
                finish.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        worker.start();
        assertThat(locked.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(lockManager.isLocked("challenge:1")).isTrue();

        finish.countDown();
        worker.join(5000);
        assertThat(lockManager.isLocked("challenge:1")).isFalse();
        assertThat(lockManager.size()).isZero();
    }

}
