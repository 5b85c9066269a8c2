package com.sommerph.skillbackend.service.credential;

import com.sommerph.skillbackend.event.CredentialMintedEvent;
import com.sommerph.skillbackend.event.CredentialUpdatedEvent;
import com.sommerph.skillbackend.exception.LedgerValidationException;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.model.credential.CredentialChange;
import com.sommerph.skillbackend.model.credential.SolutionDigestRecord;
import com.sommerph.skillbackend.model.escrow.PayoutPolicy;
import com.sommerph.skillbackend.repository.ledger.InMemoryLedgerStore;
import com.sommerph.skillbackend.service.LedgerFixture;
import com.sommerph.skillbackend.service.verifier.NonEmptyTokenVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialLedgerServiceTest {

    private LedgerFixture ledger;
    private CredentialLedgerService service;

    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture(new InMemoryLedgerStore(), new NonEmptyTokenVerifier(), PayoutPolicy.DECREMENT);
        service = ledger.credentials;
    }

    @ParameterizedTest
    @CsvSource({"100,10", "90,10", "89,9", "80,9", "70,8", "65,7", "55,6", "40,5", "30,4", "20,3", "10,2", "9,1", "5,1", "0,1"})
    void mapsScoreToLevel(int score, int level) {
        assertThat(CredentialLedgerService.scoreToLevel(score)).isEqualTo(level);
    }

    @Test
    void aggregatedLevelStaysWithinBounds() {
        for (int current = 1; current <= 10; current++) {
            for (int count = 1; count <= 50; count++) {
                for (int next = 1; next <= 10; next++) {
                    assertThat(CredentialLedgerService.aggregateLevel(current, count, next)).isBetween(1, 10);
                }
            }
        }
    }

    @Test
    void firstVerifiedProofMintsCredential() {
        CredentialChange change = service.applyVerifiedProof("alice", "react", 85, "sol-1");

        Credential credential = change.getCredential();
        assertThat(change.isMinted()).isTrue();
        assertThat(credential.getTokenId()).isEqualTo(1L);
        assertThat(credential.getProficiencyLevel()).isEqualTo(9);
        assertThat(credential.getVerificationCount()).isEqualTo(1);
        assertThat(credential.getSolutionDigests()).containsExactly("sol-1");
        assertThat(ledger.eventsOf(CredentialMintedEvent.class)).hasSize(1);
    }

    @Test
    void secondVerifiedProofAveragesLevel() {
        service.applyVerifiedProof("alice", "react", 85, "sol-1");
        CredentialChange change = service.applyVerifiedProof("alice", "react", 65, "sol-2");

        Credential credential = change.getCredential();
        assertThat(change.isMinted()).isFalse();
        assertThat(change.getPreviousLevel()).isEqualTo(9);
        assertThat(credential.getTokenId()).isEqualTo(1L);
        assertThat(credential.getProficiencyLevel()).isEqualTo(8);
        assertThat(credential.getVerificationCount()).isEqualTo(2);
        assertThat(credential.getSolutionDigests()).containsExactly("sol-1", "sol-2");

        CredentialUpdatedEvent event = ledger.eventsOf(CredentialUpdatedEvent.class).get(0);
        assertThat(event.getPreviousLevel()).isEqualTo(9);
        assertThat(event.getProficiencyLevel()).isEqualTo(8);
    }

    @Test
    void keepsOneCredentialPerOwnerAndNormalizedSkill() {
        service.applyVerifiedProof("alice", "React", 50, "a");
        service.applyVerifiedProof("alice", " react ", 50, "b");
        service.applyVerifiedProof("bob", "react", 50, "c");

        assertThat(service.getCredentialsOf("alice")).hasSize(1);
        assertThat(service.findCredential("alice", "REACT").getVerificationCount()).isEqualTo(2);
        assertThat(service.getCredentialsOf("bob")).hasSize(1);
    }

    @Test
    void listsCredentialsInMintOrderRegardlessOfUpdates() {
        service.applyVerifiedProof("alice", "rust", 30, "a");
        service.applyVerifiedProof("alice", "react", 30, "b");
        service.applyVerifiedProof("alice", "go", 30, "c");
        service.applyVerifiedProof("alice", "rust", 99, "d");
        service.applyVerifiedProof("alice", "react", 99, "e");

        List<Long> ids = service.getCredentialsOf("alice");
        assertThat(ids).containsExactly(1L, 2L, 3L);
        assertThat(service.getCredentialsOf("alice")).isEqualTo(ids);
        assertThat(service.getCredentialsOf("nobody")).isEmpty();
    }

    @Test
    void recordsSolutionDigestHistory() {
        service.applyVerifiedProof("alice", "react", 85, "sol-1");
        service.applyVerifiedProof("alice", "react", 65, "sol-2");

        List<SolutionDigestRecord> history = service.getSolutionHistory(1L);
        assertThat(history).extracting(SolutionDigestRecord::getSolutionDigest).containsExactly("sol-1", "sol-2");
        assertThat(history).extracting(SolutionDigestRecord::getScore).containsExactly(85, 65);
    }

    @Test
    void pagesCompletionLogAcrossOwnersOldestFirst() {
        service.applyVerifiedProof("alice", "react", 85, "sol-1");
        service.applyVerifiedProof("bob", "go", 40, "sol-2");
        service.applyVerifiedProof("alice", "react", 65, "sol-3");

        assertThat(service.getCompletionLog(0, 2)).extracting(SolutionDigestRecord::getSolverId)
                .containsExactly("alice", "bob");
        assertThat(service.getCompletionLog(1, 2)).extracting(SolutionDigestRecord::getSolutionDigest)
                .containsExactly("sol-3");
        assertThat(service.getCompletionLog(2, 2)).isEmpty();
    }

    @Test
    void rejectsInvalidCompletionLogPage() {
        assertThatThrownBy(() -> service.getCompletionLog(-1, 10)).isInstanceOf(LedgerValidationException.class);
        assertThatThrownBy(() -> service.getCompletionLog(0, 0)).isInstanceOf(LedgerValidationException.class);
        assertThatThrownBy(() -> service.getCompletionLog(0, CredentialLedgerService.MAX_PAGE_SIZE + 1))
                .isInstanceOf(LedgerValidationException.class);
    }

    @Test
    void rejectsScoreAboveHundred() {
        assertThatThrownBy(() -> service.applyVerifiedProof("alice", "react", 101, "x"))
                .isInstanceOf(LedgerValidationException.class);
        assertThat(service.getCredentialsOf("alice")).isEmpty();
    }

}
