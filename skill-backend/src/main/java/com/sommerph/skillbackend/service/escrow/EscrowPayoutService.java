package com.sommerph.skillbackend.service.escrow;

import com.sommerph.skillbackend.config.LedgerProperties;
import com.sommerph.skillbackend.event.EscrowReleasedEvent;
import com.sommerph.skillbackend.exception.LedgerResourceException;
import com.sommerph.skillbackend.exception.LedgerValidationException;
import com.sommerph.skillbackend.model.challenge.Challenge;
import com.sommerph.skillbackend.model.escrow.EscrowAccount;
import com.sommerph.skillbackend.model.escrow.Payout;
import com.sommerph.skillbackend.model.escrow.PayoutPolicy;
import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import com.sommerph.skillbackend.service.transaction.LedgerTransaction;
import com.sommerph.skillbackend.service.transaction.LedgerTransactionTemplate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static com.sommerph.skillbackend.service.transaction.EntityLockManager.challengeKey;

/**
 * Holds the funds a creator puts up for a challenge and pays rewards out of them. How repeated
 * payouts against one challenge are handled depends on the configured {@link PayoutPolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscrowPayoutService {

    private final LedgerStore ledgerStore;
    private final LedgerTransactionTemplate transactionTemplate;
    private final LedgerProperties properties;
    private final Clock clock;

    public void openEscrow(LedgerTransaction tx, long challengeId, BigInteger fundsProvided) {
        log.info("Open escrow for challenge {} with {}", challengeId, fundsProvided);
        tx.lock(challengeKey(challengeId));
        ledgerStore.saveEscrow(new EscrowAccount(challengeId, fundsProvided, BigInteger.ZERO, 0));
        tx.onRollback(() -> ledgerStore.deleteEscrow(challengeId));
    }

    public Payout release(long challengeId, String recipientId) {
        return transactionTemplate.execute(tx -> release(tx, challengeId, recipientId));
    }

    /**
     * Pays the challenge reward to {@code recipientId} as part of {@code tx}. A zero reward, or a
     * repeat payout under {@link PayoutPolicy#ONCE_PER_CHALLENGE}, yields a zero payout and
     * changes nothing.
     *
     * @throws LedgerResourceException if the challenge holds no escrow or too little of it
     */
    public Payout release(LedgerTransaction tx, long challengeId, String recipientId) {
        log.info("Release reward of challenge {} to {}", challengeId, recipientId);
        if (recipientId == null || recipientId.isBlank()) {
            throw new LedgerValidationException("Recipient must not be blank");
        }
        tx.lock(challengeKey(challengeId));
        Challenge challenge = ledgerStore.loadChallenge(challengeId);
        EscrowAccount escrow = ledgerStore.loadEscrow(challengeId);
        if (challenge == null || escrow == null) {
            throw new LedgerResourceException("No escrow held for challenge: " + challengeId);
        }
        Instant now = Instant.now(clock);
        BigInteger reward = challenge.getRewardAmount();
        if (reward.signum() <= 0) {
            log.info("Challenge {} carries no reward, nothing to release", challengeId);
            return Payout.none(challengeId, recipientId, now);
        }

        PayoutPolicy policy = properties.getEscrow().getPayoutPolicy();
        if (policy == PayoutPolicy.ONCE_PER_CHALLENGE && escrow.getPayoutCount() > 0) {
            log.info("Reward of challenge {} already paid once, nothing to release", challengeId);
            return Payout.none(challengeId, recipientId, now);
        }
        if (escrow.getHeldBalance().compareTo(reward) < 0) {
            throw new LedgerResourceException("Insufficient escrow for challenge " + challengeId
                    + ": held " + escrow.getHeldBalance() + ", reward " + reward);
        }

        EscrowAccount updated = escrow.copy();
        if (policy != PayoutPolicy.UNBOUNDED) {
            updated.setHeldBalance(escrow.getHeldBalance().subtract(reward));
        }
        updated.setTotalPaidOut(escrow.getTotalPaidOut().add(reward));
        updated.setPayoutCount(escrow.getPayoutCount() + 1);
        ledgerStore.saveEscrow(updated);
        tx.onRollback(() -> ledgerStore.saveEscrow(escrow));

        ledgerStore.creditBalance(recipientId, reward);
        tx.onRollback(() -> ledgerStore.creditBalance(recipientId, reward.negate()));

        Payout payout = new Payout(challengeId, recipientId, reward, now);
        ledgerStore.appendPayout(payout);
        tx.onRollback(() -> ledgerStore.deleteLastPayout(challengeId));

        tx.publishOnCommit(new EscrowReleasedEvent(challengeId, recipientId, reward, updated.getHeldBalance()));
        return payout;
    }

    public EscrowAccount getEscrow(long challengeId) {
        return ledgerStore.loadEscrow(challengeId);
    }

    public List<Payout> getPayouts(long challengeId) {
        return ledgerStore.loadPayouts(challengeId);
    }

    public BigInteger balanceOf(String participantId) {
        return ledgerStore.loadBalance(participantId);
    }

}
