package com.sommerph.skillbackend.repository.ledger;

import com.sommerph.skillbackend.model.credential.SolutionDigestRecord;
import com.sommerph.skillbackend.model.escrow.EscrowAccount;
import com.sommerph.skillbackend.model.escrow.Payout;
import com.sommerph.skillbackend.model.proof.Proof;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileLedgerStoreTest extends AbstractLedgerStoreTest {

    @TempDir
    Path storageDir;

    @Override
    protected LedgerStore newStore() throws Exception {
        return new JsonFileLedgerStore(storageDir.toString());
    }

    @Test
    void reopenedStoreContinuesSequencesAndKeepsIndexes() throws Exception {
        store.saveChallenge(challenge(store.nextId(LedgerTable.CHALLENGE), "carol"));
        store.saveChallenge(challenge(store.nextId(LedgerTable.CHALLENGE), "carol"));
        store.saveCredential(credential(store.nextId(LedgerTable.CREDENTIAL), "alice", "react"));
        store.creditBalance("alice@example.org", BigInteger.TEN);

        LedgerStore reopened = new JsonFileLedgerStore(storageDir.toString());

        assertThat(reopened.nextId(LedgerTable.CHALLENGE)).isEqualTo(3L);
        assertThat(reopened.nextId(LedgerTable.CREDENTIAL)).isEqualTo(2L);
        assertThat(reopened.nextId(LedgerTable.PROOF)).isEqualTo(1L);
        assertThat(reopened.loadChallengeIdsByCreator("carol")).containsExactly(1L, 2L);
        assertThat(reopened.loadCredential(1L).getSolutionDigests()).containsExactly("d1");
        assertThat(reopened.loadChallenge(2L).getCreatedAt()).isEqualTo(NOW);
        assertThat(reopened.loadBalance("alice@example.org")).isEqualTo(BigInteger.TEN);
    }

    @Test
    void writesOneFilePerRecord() {
        store.saveProof(new Proof(4L, 1L, "alice", 10, 50, "sol", "tok", true, NOW, NOW));

        assertThat(Files.exists(storageDir.resolve("proofs").resolve("4.json"))).isTrue();
        assertThat(store.loadProof(4L).isVerified()).isTrue();
    }

    @Test
    void committedUnitLeavesNoJournalBehind() throws Exception {
        store.beginUnit();
        store.saveChallenge(challenge(1L, "carol"));
        assertThat(journalFiles()).isEqualTo(1L);

        store.commitUnit();

        assertThat(journalFiles()).isZero();
        assertThat(new JsonFileLedgerStore(storageDir.toString()).loadChallenge(1L)).isNotNull();
    }

    @Test
    void unitLeftOpenIsUndoneWhenStoreIsReopened() throws Exception {
        Proof pending = new Proof(1L, 1L, "bob", 100, 80, "sol", "tok", false, NOW, null);
        store.saveChallenge(challenge(1L, "carol"));
        store.saveEscrow(new EscrowAccount(1L, BigInteger.valueOf(30), BigInteger.ZERO, 0));
        store.saveProof(pending);
        store.saveCredential(credential(1L, "bob", "go"));
        store.appendPayout(new Payout(1L, "alice", BigInteger.TEN, NOW));
        store.creditBalance("alice", BigInteger.TEN);

        // the writes of a verification, cut off before it commits
        store.beginUnit();
        Proof verified = pending.copy();
        verified.setVerified(true);
        store.saveProof(verified);
        store.saveCredential(credential(2L, "bob", "react"));
        store.appendSolutionDigest(new SolutionDigestRecord(1L, 2L, 1L, 1L, "bob", "sol", 80, NOW));
        store.saveEscrow(new EscrowAccount(1L, BigInteger.valueOf(20), BigInteger.TEN, 1));
        store.creditBalance("bob", BigInteger.TEN);
        store.appendPayout(new Payout(1L, "bob", BigInteger.TEN, NOW));

        LedgerStore reopened = new JsonFileLedgerStore(storageDir.toString());

        assertThat(reopened.loadProof(1L).isVerified()).isFalse();
        assertThat(reopened.loadCredential(2L)).isNull();
        assertThat(reopened.loadCredentialIdsByOwner("bob")).containsExactly(1L);
        assertThat(reopened.loadSolutionDigests(2L)).isEmpty();
        assertThat(reopened.loadEscrow(1L).getHeldBalance()).isEqualTo(BigInteger.valueOf(30));
        assertThat(reopened.loadPayouts(1L)).extracting(Payout::getRecipientId).containsExactly("alice");
        assertThat(reopened.loadBalance("bob")).isEqualTo(BigInteger.ZERO);
        assertThat(reopened.loadBalance("alice")).isEqualTo(BigInteger.TEN);
        assertThat(reopened.loadProofIdsBySolver("bob")).containsExactly(1L);
        assertThat(journalFiles()).isZero();
    }

    @Test
    void abortedUnitRestoresWritesTheCallerDidNotRevert() throws Exception {
        store.saveChallenge(challenge(1L, "carol"));

        store.beginUnit();
        store.saveCredential(credential(1L, "alice", "react"));
        store.deleteChallenge(1L);
        store.abortUnit();

        assertThat(store.loadCredential(1L)).isNull();
        assertThat(store.loadCredentialIdsByOwner("alice")).isEmpty();
        assertThat(store.loadChallenge(1L)).isNotNull();
        assertThat(store.loadChallengeIdsByCreator("carol")).containsExactly(1L);
        assertThat(journalFiles()).isZero();
    }

    @Test
    void nestedUnitJoinsTheOuterOne() throws Exception {
        store.beginUnit();
        store.beginUnit();
        store.saveChallenge(challenge(1L, "carol"));
        store.commitUnit();
        assertThat(journalFiles()).isEqualTo(1L);

        store.abortUnit();

        assertThat(store.loadChallenge(1L)).isNull();
        assertThat(journalFiles()).isZero();
    }

    private long journalFiles() throws Exception {
        try (Stream<Path> files = Files.list(storageDir.resolve("journal"))) {
            return files.count();
        }
    }

}
