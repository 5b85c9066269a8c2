package com.sommerph.skillbackend.service.proof;

import com.sommerph.skillbackend.event.ProofRejectedEvent;
import com.sommerph.skillbackend.event.ProofSubmittedEvent;
import com.sommerph.skillbackend.event.ProofVerifiedEvent;
import com.sommerph.skillbackend.exception.LedgerStateException;
import com.sommerph.skillbackend.exception.LedgerValidationException;
import com.sommerph.skillbackend.model.challenge.Challenge;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.model.credential.CredentialChange;
import com.sommerph.skillbackend.model.escrow.Payout;
import com.sommerph.skillbackend.model.proof.Proof;
import com.sommerph.skillbackend.model.proof.VerificationResult;
import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import com.sommerph.skillbackend.repository.ledger.LedgerTable;
import com.sommerph.skillbackend.service.credential.CredentialLedgerService;
import com.sommerph.skillbackend.service.escrow.EscrowPayoutService;
import com.sommerph.skillbackend.service.transaction.EntityLockManager;
import com.sommerph.skillbackend.service.transaction.LedgerTransaction;
import com.sommerph.skillbackend.service.transaction.LedgerTransactionTemplate;
import com.sommerph.skillbackend.service.verifier.ProofVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static com.sommerph.skillbackend.service.transaction.EntityLockManager.challengeKey;
import static com.sommerph.skillbackend.service.transaction.EntityLockManager.proofKey;

/**
 * Records solver submissions and drives their verification.
 * <p>
 * Verification holds the proof's lock from the already-verified check to the end of the ledger
 * update, so concurrent attempts on one proof run one after the other and only the first can
 * succeed. The oracle is consulted before anything is written. Marking the proof verified,
 * updating the credential and releasing escrow then happen in a single ledger transaction: if
 * any step fails, all of them are undone and the proof can be verified again later.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProofSubmissionService {

    private final LedgerStore ledgerStore;
    private final ProofVerifier proofVerifier;
    private final CredentialLedgerService credentialLedgerService;
    private final EscrowPayoutService escrowPayoutService;
    private final EntityLockManager lockManager;
    private final LedgerTransactionTemplate transactionTemplate;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public long submitProof(long challengeId, String solverId, long completionTime, int score,
                            String solutionDigest, String externalProofToken) {
        log.info("Submit proof for challenge {} by solver: {} (completion time: {}s, score: {})",
                challengeId, solverId, completionTime, score);
        if (solverId == null || solverId.isBlank()) {
            throw new LedgerValidationException("Solver must not be blank");
        }
        if (solutionDigest == null || solutionDigest.isBlank()) {
            throw new LedgerValidationException("Solution digest must not be blank");
        }
        return transactionTemplate.execute(tx -> {
            tx.lock(challengeKey(challengeId));
            Challenge challenge = ledgerStore.loadChallenge(challengeId);
            if (challenge == null || !challenge.isActive()) {
                throw new LedgerStateException("Challenge not active: " + challengeId);
            }
            if (completionTime > challenge.getTimeLimit()) {
                throw new LedgerStateException("Time limit exceeded: completed in " + completionTime
                        + "s, limit " + challenge.getTimeLimit() + "s");
            }
            if (completionTime < 0) {
                throw new LedgerValidationException("Completion time must not be negative, was " + completionTime);
            }
            if (score < 0 || score > 100) {
                throw new LedgerValidationException("Score must be between 0 and 100, was " + score);
            }
            long proofId = ledgerStore.nextId(LedgerTable.PROOF);
            Proof proof = new Proof(proofId, challengeId, solverId, completionTime, score, solutionDigest,
                    externalProofToken, false, Instant.now(clock), null);
            ledgerStore.saveProof(proof);
            tx.onRollback(() -> ledgerStore.deleteProof(proofId));
            tx.publishOnCommit(new ProofSubmittedEvent(proofId, challengeId, solverId, score));
            return proofId;
        });
    }

    /**
     * Verifies a pending proof against the oracle and, on success, applies it to the solver's
     * credential and pays the challenge reward.
     *
     * @return the outcome; {@link VerificationResult#isVerified()} is false when the oracle rejected the proof
     * @throws LedgerStateException if the proof does not exist or is already verified
     */
    public VerificationResult verifyProof(long proofId) {
        log.info("Verify proof {}", proofId);
        return lockManager.withLock(proofKey(proofId), () -> {
            Proof proof = ledgerStore.loadProof(proofId);
            if (proof == null) {
                throw new LedgerStateException("Proof not found: " + proofId);
            }
            if (proof.isVerified()) {
                throw new LedgerStateException("Proof already verified: " + proofId);
            }

            if (!proofVerifier.verify(proof.getExternalProofToken())) {
                eventPublisher.publishEvent(new ProofRejectedEvent(proofId, proof.getChallengeId(), proof.getSolverId()));
                return VerificationResult.rejected(proofId);
            }
            return transactionTemplate.execute(tx -> applyVerification(tx, proof));
        });
    }

    private VerificationResult applyVerification(LedgerTransaction tx, Proof proof) {
        long proofId = proof.getId();
        tx.lock(challengeKey(proof.getChallengeId()));
        Challenge challenge = ledgerStore.loadChallenge(proof.getChallengeId());
        if (challenge == null) {
            throw new LedgerStateException("Challenge of proof " + proofId + " not found: " + proof.getChallengeId());
        }

        Proof verified = proof.copy();
        verified.setVerified(true);
        verified.setVerifiedAt(Instant.now(clock));
        ledgerStore.saveProof(verified);
        tx.onRollback(() -> ledgerStore.saveProof(proof));

        CredentialChange change = credentialLedgerService.applyVerifiedProof(tx, proof.getSolverId(),
                challenge.getChallengeType(), proof.getScore(), proof.getSolutionDigest(), proofId, challenge.getId());
        Payout payout = escrowPayoutService.release(tx, challenge.getId(), proof.getSolverId());

        Credential credential = change.getCredential();
        tx.publishOnCommit(new ProofVerifiedEvent(proofId, challenge.getId(), proof.getSolverId(),
                credential.getTokenId(), payout.getAmount()));
        return new VerificationResult(proofId, true, credential.getTokenId(), change.isMinted(),
                credential.getProficiencyLevel(), credential.getVerificationCount(), payout.getAmount());
    }

    public Proof getProof(long proofId) {
        return ledgerStore.loadProof(proofId);
    }

    public List<Long> getProofsOf(String solverId) {
        return ledgerStore.loadProofIdsBySolver(solverId);
    }

}
