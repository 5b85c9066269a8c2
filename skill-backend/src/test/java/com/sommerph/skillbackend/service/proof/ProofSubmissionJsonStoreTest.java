package com.sommerph.skillbackend.service.proof;

import com.sommerph.skillbackend.exception.LedgerResourceException;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.model.credential.SolutionDigestRecord;
import com.sommerph.skillbackend.model.escrow.EscrowAccount;
import com.sommerph.skillbackend.model.escrow.Payout;
import com.sommerph.skillbackend.model.escrow.PayoutPolicy;
import com.sommerph.skillbackend.model.proof.Proof;
import com.sommerph.skillbackend.model.proof.VerificationResult;
import com.sommerph.skillbackend.repository.ledger.JsonFileLedgerStore;
import com.sommerph.skillbackend.service.LedgerFixture;
import com.sommerph.skillbackend.service.verifier.NonEmptyTokenVerifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verification against the json store, including a process that dies in the middle of the
 * ledger update and a restart on the same directory.
 */
class ProofSubmissionJsonStoreTest {

    @TempDir
    Path storageDir;

    private LedgerFixture open() throws IOException {
        return new LedgerFixture(new JsonFileLedgerStore(storageDir.toString()), new NonEmptyTokenVerifier(),
                PayoutPolicy.DECREMENT);
    }

    @Test
    void verificationSurvivesRestart() throws Exception {
        LedgerFixture ledger = open();
        long challengeId = ledger.challenge("carol", "react", 10, 30);
        long proofId = ledger.proof(challengeId, "alice", 85);
        ledger.proofs.verifyProof(proofId);

        LedgerFixture restarted = open();

        assertThat(restarted.proofs.getProof(proofId).isVerified()).isTrue();
        assertThat(restarted.credentials.getCredentialsOf("alice")).containsExactly(1L);
        assertThat(restarted.credentials.getCompletionLog(0, 10)).extracting(SolutionDigestRecord::getProofId)
                .containsExactly(proofId);
        assertThat(restarted.escrow.balanceOf("alice")).isEqualTo(BigInteger.TEN);
        assertThat(restarted.escrow.getEscrow(challengeId).getHeldBalance()).isEqualTo(BigInteger.valueOf(20));
    }

    @Test
    void exhaustedEscrowRollsBackOnDisk() throws Exception {
        LedgerFixture ledger = open();
        long challengeId = ledger.challenge("carol", "react", 10, 10);
        ledger.proofs.verifyProof(ledger.proof(challengeId, "alice", 85));
        long bobProof = ledger.proof(challengeId, "bob", 95);

        assertThatThrownBy(() -> ledger.proofs.verifyProof(bobProof)).isInstanceOf(LedgerResourceException.class);

        LedgerFixture restarted = open();
        assertThat(restarted.proofs.getProof(bobProof).isVerified()).isFalse();
        assertThat(restarted.credentials.getCredentialsOf("bob")).isEmpty();
        assertThat(restarted.escrow.getPayouts(challengeId)).extracting(Payout::getRecipientId).containsExactly("alice");
        assertThat(restarted.escrow.balanceOf("bob")).isEqualTo(BigInteger.ZERO);
    }

    @Test
    void verificationCutShortByProcessDeathCanBeRetriedAfterRestart() throws Exception {
        HaltingJsonFileLedgerStore store = new HaltingJsonFileLedgerStore(storageDir.toString());
        LedgerFixture ledger = new LedgerFixture(store, new NonEmptyTokenVerifier(), PayoutPolicy.DECREMENT);
        long challengeId = ledger.challenge("carol", "react", 10, 30);
        long proofId = ledger.proof(challengeId, "bob", 95);
        store.haltOnNextCredit = true;

        assertThatThrownBy(() -> ledger.proofs.verifyProof(proofId)).isInstanceOf(ProcessHalted.class);
        // what the dead process left on disk
        assertThat(store.loadProof(proofId).isVerified()).isTrue();
        assertThat(store.loadCredentialIdsByOwner("bob")).containsExactly(1L);

        LedgerFixture restarted = open();
        assertThat(restarted.proofs.getProof(proofId).isVerified()).isFalse();
        assertThat(restarted.credentials.getCredentialsOf("bob")).isEmpty();
        assertThat(restarted.escrow.getEscrow(challengeId).getHeldBalance()).isEqualTo(BigInteger.valueOf(30));

        VerificationResult retry = restarted.proofs.verifyProof(proofId);

        assertThat(retry.isVerified()).isTrue();
        assertThat(retry.isMinted()).isTrue();
        assertThat(retry.getProficiencyLevel()).isEqualTo(10);
        Credential credential = restarted.credentials.getCredential(retry.getTokenId());
        assertThat(credential.getOwnerId()).isEqualTo("bob");
        assertThat(restarted.credentials.getCredentialsOf("bob")).containsExactly(retry.getTokenId());
        assertThat(restarted.escrow.balanceOf("bob")).isEqualTo(BigInteger.TEN);
        assertThat(restarted.escrow.getPayouts(challengeId)).hasSize(1);
        assertThat(restarted.escrow.getEscrow(challengeId).getHeldBalance()).isEqualTo(BigInteger.valueOf(20));
    }

    static class ProcessHalted extends Error {
        ProcessHalted() {
            super("process halted");
        }
    }

    /**
     * Stops the process at the next balance credit: from then on every write fails, so nothing
     * the running unit did is reverted.
     */
    static class HaltingJsonFileLedgerStore extends JsonFileLedgerStore {

        boolean haltOnNextCredit;
        private boolean halted;

        HaltingJsonFileLedgerStore(String storagePath) throws IOException {
            super(storagePath);
        }

        private void checkAlive() {
            if (halted) {
                throw new IllegalStateException("process halted");
            }
        }

        @Override
        public BigInteger creditBalance(String participantId, BigInteger amount) {
            checkAlive();
            if (haltOnNextCredit) {
                halted = true;
                throw new ProcessHalted();
            }
            return super.creditBalance(participantId, amount);
        }

        @Override
        public void saveProof(Proof proof) {
            checkAlive();
            super.saveProof(proof);
        }

        @Override
        public void saveCredential(Credential credential) {
            checkAlive();
            super.saveCredential(credential);
        }

        @Override
        public void deleteCredential(long tokenId) {
            checkAlive();
            super.deleteCredential(tokenId);
        }

        @Override
        public void deleteSolutionDigest(long recordId) {
            checkAlive();
            super.deleteSolutionDigest(recordId);
        }

        @Override
        public void saveEscrow(EscrowAccount escrow) {
            checkAlive();
            super.saveEscrow(escrow);
        }

        @Override
        public void deleteLastPayout(long challengeId) {
            checkAlive();
            super.deleteLastPayout(challengeId);
        }

        @Override
        public void abortUnit() {
            checkAlive();
            super.abortUnit();
        }

    }

}
