package com.sommerph.skillbackend.service.challenge;

import com.sommerph.skillbackend.event.ChallengeCreatedEvent;
import com.sommerph.skillbackend.event.ChallengeDeactivatedEvent;
import com.sommerph.skillbackend.exception.LedgerAuthorizationException;
import com.sommerph.skillbackend.exception.LedgerResourceException;
import com.sommerph.skillbackend.exception.LedgerValidationException;
import com.sommerph.skillbackend.model.challenge.Challenge;
import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import com.sommerph.skillbackend.repository.ledger.LedgerTable;
import com.sommerph.skillbackend.service.escrow.EscrowPayoutService;
import com.sommerph.skillbackend.service.transaction.LedgerTransactionTemplate;
import com.sommerph.skillbackend.util.SkillTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static com.sommerph.skillbackend.service.transaction.EntityLockManager.challengeKey;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChallengeRegistryService {

    public static final int MIN_DIFFICULTY = 1;
    public static final int MAX_DIFFICULTY = 10;

    private final LedgerStore ledgerStore;
    private final EscrowPayoutService escrowPayoutService;
    private final LedgerTransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Registers an active challenge and escrows {@code fundsProvided} against it.
     *
     * @return the new challenge id, starting at 1
     * @throws LedgerValidationException if difficulty is outside 1..10, the time limit is not positive,
     *                                   the type or creator is blank or the reward is negative
     * @throws LedgerResourceException   if the funds provided do not cover the reward
     */
    public long createChallenge(String creatorId, String challengeType, int difficulty, long timeLimit,
                                BigInteger rewardAmount, BigInteger fundsProvided, String contentDigest) {
        log.info("Create challenge for creator: {} (type: {}, difficulty: {}, time limit: {}s, reward: {})",
                creatorId, challengeType, difficulty, timeLimit, rewardAmount);
        if (creatorId == null || creatorId.isBlank()) {
            throw new LedgerValidationException("Creator must not be blank");
        }
        if (challengeType == null || challengeType.isBlank()) {
            throw new LedgerValidationException("Challenge type must not be blank");
        }
        if (difficulty < MIN_DIFFICULTY || difficulty > MAX_DIFFICULTY) {
            throw new LedgerValidationException("Difficulty must be between " + MIN_DIFFICULTY + " and "
                    + MAX_DIFFICULTY + ", was " + difficulty);
        }
        if (timeLimit <= 0) {
            throw new LedgerValidationException("Time limit must be positive, was " + timeLimit);
        }
        if (rewardAmount == null || rewardAmount.signum() < 0) {
            throw new LedgerValidationException("Reward amount must not be negative");
        }
        BigInteger funds = fundsProvided == null ? BigInteger.ZERO : fundsProvided;
        if (funds.compareTo(rewardAmount) < 0) {
            throw new LedgerResourceException("Insufficient funding: provided " + funds + ", reward " + rewardAmount);
        }

        String skillType = SkillTypes.normalize(challengeType);
        return transactionTemplate.execute(tx -> {
            long challengeId = ledgerStore.nextId(LedgerTable.CHALLENGE);
            tx.lock(challengeKey(challengeId));
            Challenge challenge = new Challenge(challengeId, skillType, difficulty, timeLimit, rewardAmount,
                    true, creatorId, contentDigest, Instant.now(clock));
            ledgerStore.saveChallenge(challenge);
            tx.onRollback(() -> ledgerStore.deleteChallenge(challengeId));
            escrowPayoutService.openEscrow(tx, challengeId, funds);
            tx.publishOnCommit(new ChallengeCreatedEvent(challengeId, creatorId, skillType, rewardAmount, funds));
            return challengeId;
        });
    }

    /**
     * Deactivates a challenge for good. Repeating the call as creator is a no-op.
     *
     * @throws LedgerAuthorizationException if the caller did not create the challenge,
     *                                      or the challenge does not exist
     */
    public Challenge deactivateChallenge(long challengeId, String callerId) {
        log.info("Deactivate challenge {} on behalf of {}", challengeId, callerId);
        return transactionTemplate.execute(tx -> {
            tx.lock(challengeKey(challengeId));
            Challenge challenge = ledgerStore.loadChallenge(challengeId);
            if (challenge == null || !challenge.getCreatorId().equals(callerId)) {
                throw new LedgerAuthorizationException("Only the creator may deactivate challenge " + challengeId);
            }
            if (!challenge.isActive()) {
                log.info("Challenge {} already inactive", challengeId);
                return challenge;
            }
            Challenge deactivated = challenge.copy();
            deactivated.setActive(false);
            ledgerStore.saveChallenge(deactivated);
            tx.onRollback(() -> ledgerStore.saveChallenge(challenge));
            tx.publishOnCommit(new ChallengeDeactivatedEvent(challengeId, callerId));
            return deactivated;
        });
    }

    public Challenge getChallenge(long challengeId) {
        return ledgerStore.loadChallenge(challengeId);
    }

    public List<Long> getChallengesOf(String creatorId) {
        return ledgerStore.loadChallengeIdsByCreator(creatorId);
    }

}
