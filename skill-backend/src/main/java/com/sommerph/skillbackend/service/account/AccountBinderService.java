package com.sommerph.skillbackend.service.account;

import com.sommerph.skillbackend.event.AccountDerivedEvent;
import com.sommerph.skillbackend.exception.LedgerAuthorizationException;
import com.sommerph.skillbackend.model.account.BoundAccount;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.repository.ledger.LedgerStore;
import com.sommerph.skillbackend.util.DigestUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Derives an auxiliary account identifier for a credential on request of its owner.
 * <p>
 * The account is the low 20 bytes of Keccak-256 over the token id and the derivation time in
 * nanoseconds. It is therefore not a stable per-token account: each derivation yields a new value.
 * No linkage between account and credential is stored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountBinderService {

    private final LedgerStore ledgerStore;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public BoundAccount deriveAccount(long tokenId, String requesterId) {
        log.info("Derive account for credential {} on behalf of {}", tokenId, requesterId);
        Credential credential = ledgerStore.loadCredential(tokenId);
        if (credential == null || !credential.getOwnerId().equals(requesterId)) {
            throw new LedgerAuthorizationException("Only the owner may derive an account for credential " + tokenId);
        }
        Instant now = Instant.now(clock);
        long nanos = TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
        String account = DigestUtils.toAddress(DigestUtils.keccak256(DigestUtils.packLongs(tokenId, nanos)));
        BoundAccount bound = new BoundAccount(tokenId, requesterId, account, now);
        eventPublisher.publishEvent(new AccountDerivedEvent(bound));
        return bound;
    }

}
