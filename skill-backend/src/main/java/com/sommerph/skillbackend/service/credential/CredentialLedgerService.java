package com.sommerph.skillbackend.service.credential;

import com.sommerph.skillbackend.event.CredentialMintedEvent;
import com.sommerph.skillbackend.event.CredentialUpdatedEvent;
import com.sommerph.skillbackend.exception.LedgerValidationException;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.model.credential.CredentialChange;
import com.sommerph.skillbackend.model.credential.SolutionDigestRecord;
import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import com.sommerph.skillbackend.repository.ledger.LedgerTable;
import com.sommerph.skillbackend.service.transaction.LedgerTransaction;
import com.sommerph.skillbackend.service.transaction.LedgerTransactionTemplate;
import com.sommerph.skillbackend.util.SkillTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.sommerph.skillbackend.service.transaction.EntityLockManager.credentialKey;

/**
 * Owns skill credentials. There is at most one credential per owner and skill type; each verified
 * proof either mints it or folds the proof's level into its running proficiency average.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialLedgerService {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 10;
    public static final int MAX_PAGE_SIZE = 500;

    private final LedgerStore ledgerStore;
    private final LedgerTransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Maps a 0..100 score onto a proficiency level: 90 and above is 10, then one level per
     * ten points down to 1 for scores below 10.
     */
    public static int scoreToLevel(int score) {
        if (score >= 90) {
            return MAX_LEVEL;
        }
        return Math.max(MIN_LEVEL, score / 10 + 1);
    }

    /**
     * Weighted average of the current level (weighted by its verification count) and a new level,
     * rounded down. Stays in 1..10 whenever both levels do.
     */
    public static int aggregateLevel(int currentLevel, int verificationCount, int newLevel) {
        long total = (long) currentLevel * verificationCount + newLevel;
        return (int) Math.floorDiv(total, (long) verificationCount + 1);
    }

    public CredentialChange applyVerifiedProof(String ownerId, String skillType, int score, String solutionDigest) {
        return transactionTemplate.execute(tx ->
                applyVerifiedProof(tx, ownerId, skillType, score, solutionDigest, 0L, 0L));
    }

    public CredentialChange applyVerifiedProof(LedgerTransaction tx, String ownerId, String skillType, int score,
                                               String solutionDigest, long proofId, long challengeId) {
        log.info("Apply verified proof for owner: {} (skill: {}, score: {})", ownerId, skillType, score);
        if (ownerId == null || ownerId.isBlank()) {
            throw new LedgerValidationException("Owner must not be blank");
        }
        if (skillType == null || skillType.isBlank()) {
            throw new LedgerValidationException("Skill type must not be blank");
        }
        if (score < 0 || score > 100) {
            throw new LedgerValidationException("Score must be between 0 and 100, was " + score);
        }
        String skill = SkillTypes.normalize(skillType);
        tx.lock(credentialKey(ownerId, skill));

        int level = scoreToLevel(score);
        Instant now = Instant.now(clock);
        long existingId = ledgerStore.findCredentialId(ownerId, skill);
        CredentialChange change;
        if (existingId == 0L) {
            long tokenId = ledgerStore.nextId(LedgerTable.CREDENTIAL);
            List<String> digests = new ArrayList<>();
            digests.add(solutionDigest);
            Credential minted = new Credential(tokenId, ownerId, skill, level, 1, now, now, digests);
            ledgerStore.saveCredential(minted);
            tx.onRollback(() -> ledgerStore.deleteCredential(tokenId));
            tx.publishOnCommit(new CredentialMintedEvent(tokenId, ownerId, skill, level));
            change = new CredentialChange(minted, true, 0);
        } else {
            Credential current = ledgerStore.loadCredential(existingId);
            Credential updated = current.copy();
            updated.setProficiencyLevel(aggregateLevel(current.getProficiencyLevel(), current.getVerificationCount(), level));
            updated.setVerificationCount(current.getVerificationCount() + 1);
            updated.setUpdatedAt(now);
            updated.addSolutionDigest(solutionDigest);
            ledgerStore.saveCredential(updated);
            tx.onRollback(() -> ledgerStore.saveCredential(current));
            tx.publishOnCommit(new CredentialUpdatedEvent(existingId, ownerId, skill, current.getProficiencyLevel(),
                    updated.getProficiencyLevel(), updated.getVerificationCount()));
            change = new CredentialChange(updated, false, current.getProficiencyLevel());
        }

        long recordId = ledgerStore.nextId(LedgerTable.SOLUTION_DIGEST);
        ledgerStore.appendSolutionDigest(new SolutionDigestRecord(recordId, change.getCredential().getTokenId(),
                proofId, challengeId, ownerId, solutionDigest, score, now));
        tx.onRollback(() -> ledgerStore.deleteSolutionDigest(recordId));
        return change;
    }

    /**
     * Token ids owned by {@code ownerId}, in the order they were minted.
     */
    public List<Long> getCredentialsOf(String ownerId) {
        return ledgerStore.loadCredentialIdsByOwner(ownerId);
    }

    public Credential getCredential(long tokenId) {
        return ledgerStore.loadCredential(tokenId);
    }

    public Credential findCredential(String ownerId, String skillType) {
        long tokenId = ledgerStore.findCredentialId(ownerId, SkillTypes.normalize(skillType));
        return tokenId == 0L ? null : ledgerStore.loadCredential(tokenId);
    }

    public List<SolutionDigestRecord> getSolutionHistory(long tokenId) {
        return ledgerStore.loadSolutionDigests(tokenId);
    }

    /**
     * One page of the completion log: every applied verified proof across all credentials, oldest first.
     *
     * @throws LedgerValidationException if page is negative or size is outside 1..{@value #MAX_PAGE_SIZE}
     */
    public List<SolutionDigestRecord> getCompletionLog(int page, int size) {
        if (page < 0) {
            throw new LedgerValidationException("Page must not be negative, was " + page);
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new LedgerValidationException("Page size must be between 1 and " + MAX_PAGE_SIZE + ", was " + size);
        }
        return ledgerStore.loadSolutionDigestPage(Math.multiplyExact(page, size), size);
    }

}
