package com.sommerph.skillbackend.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes every committed ledger event to the application log. Events are only published
 * after the surrounding ledger transaction has committed.
 */
@Slf4j
@Component
public class LedgerEventListener {

    @EventListener
    public void onChallengeCreated(ChallengeCreatedEvent event) {
        log.info("Challenge {} created by {} (type: {}, reward: {}, escrowed: {})",
                event.getChallengeId(), event.getCreatorId(), event.getChallengeType(),
                event.getRewardAmount(), event.getEscrowedAmount());
    }

    @EventListener
    public void onChallengeDeactivated(ChallengeDeactivatedEvent event) {
        log.info("Challenge {} deactivated by {}", event.getChallengeId(), event.getCreatorId());
    }

    @EventListener
    public void onProofSubmitted(ProofSubmittedEvent event) {
        log.info("Proof {} submitted by {} for challenge {} with score {}",
                event.getProofId(), event.getSolverId(), event.getChallengeId(), event.getScore());
    }

    @EventListener
    public void onProofRejected(ProofRejectedEvent event) {
        log.warn("Verification failed for proof {} of solver {} (challenge {})",
                event.getProofId(), event.getSolverId(), event.getChallengeId());
    }

    @EventListener
    public void onProofVerified(ProofVerifiedEvent event) {
        log.info("Proof {} verified for solver {} (challenge {}, credential {}, payout {})",
                event.getProofId(), event.getSolverId(), event.getChallengeId(),
                event.getTokenId(), event.getPayoutAmount());
    }

    @EventListener
    public void onCredentialMinted(CredentialMintedEvent event) {
        log.info("Credential {} minted for {} (skill: {}, level: {})",
                event.getTokenId(), event.getOwnerId(), event.getSkillType(), event.getProficiencyLevel());
    }

    @EventListener
    public void onCredentialUpdated(CredentialUpdatedEvent event) {
        log.info("Credential {} of {} updated (skill: {}, level: {} -> {}, verifications: {})",
                event.getTokenId(), event.getOwnerId(), event.getSkillType(),
                event.getPreviousLevel(), event.getProficiencyLevel(), event.getVerificationCount());
    }

    @EventListener
    public void onEscrowReleased(EscrowReleasedEvent event) {
        log.info("Released {} from challenge {} escrow to {} (remaining: {})",
                event.getAmount(), event.getChallengeId(), event.getRecipientId(), event.getRemainingBalance());
    }

    @EventListener
    public void onAccountDerived(AccountDerivedEvent event) {
        log.info("Derived account {} for credential {} of {}",
                event.getAccount().getAccount(), event.getAccount().getTokenId(), event.getAccount().getOwnerId());
    }

}
