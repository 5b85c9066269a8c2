package com.sommerph.skillbackend.repository.ledger;

import com.sommerph.skillbackend.model.challenge.Challenge;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.model.credential.SolutionDigestRecord;
import com.sommerph.skillbackend.model.escrow.EscrowAccount;
import com.sommerph.skillbackend.model.escrow.Payout;
import com.sommerph.skillbackend.model.proof.Proof;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final Map<LedgerTable, AtomicLong> sequences = new EnumMap<>(LedgerTable.class);

    // Tables
    private final Map<Long, Challenge> challengeStore = new ConcurrentHashMap<>();
    private final Map<Long, Proof> proofStore = new ConcurrentHashMap<>();
    private final Map<Long, Credential> credentialStore = new ConcurrentHashMap<>();
    private final Map<Long, SolutionDigestRecord> solutionDigestStore = new ConcurrentHashMap<>();
    private final Map<Long, EscrowAccount> escrowStore = new ConcurrentHashMap<>();
    private final Map<Long, List<Payout>> payoutStore = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> balanceStore = new ConcurrentHashMap<>();

    // Indexes
    private final Map<String, List<Long>> challengesByCreator = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> proofsBySolver = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> credentialsByOwner = new ConcurrentHashMap<>();
    private final Map<String, Long> credentialsBySkill = new ConcurrentHashMap<>();

    public InMemoryLedgerStore() {
        for (LedgerTable table : LedgerTable.values()) {
            sequences.put(table, new AtomicLong());
        }
    }

    @Override
    public long nextId(LedgerTable table) {
        return sequences.get(table).incrementAndGet();
    }

    // Challenges

    @Override
    public void saveChallenge(Challenge challenge) {
        log.debug("Save challenge {}", challenge.getId());
        if (challengeStore.put(challenge.getId(), challenge.copy()) == null) {
            index(challengesByCreator, challenge.getCreatorId(), challenge.getId());
        }
    }

    @Override
    public Challenge loadChallenge(long challengeId) {
        Challenge challenge = challengeStore.get(challengeId);
        return challenge == null ? null : challenge.copy();
    }

    @Override
    public void deleteChallenge(long challengeId) {
        Challenge removed = challengeStore.remove(challengeId);
        if (removed != null) {
            unindex(challengesByCreator, removed.getCreatorId(), challengeId);
        }
    }

    @Override
    public List<Long> loadChallengeIdsByCreator(String creatorId) {
        return List.copyOf(challengesByCreator.getOrDefault(creatorId, List.of()));
    }

    // Proofs

    @Override
    public void saveProof(Proof proof) {
        log.debug("Save proof {}", proof.getId());
        if (proofStore.put(proof.getId(), proof.copy()) == null) {
            index(proofsBySolver, proof.getSolverId(), proof.getId());
        }
    }

    @Override
    public Proof loadProof(long proofId) {
        Proof proof = proofStore.get(proofId);
        return proof == null ? null : proof.copy();
    }

    @Override
    public void deleteProof(long proofId) {
        Proof removed = proofStore.remove(proofId);
        if (removed != null) {
            unindex(proofsBySolver, removed.getSolverId(), proofId);
        }
    }

    @Override
    public List<Long> loadProofIdsBySolver(String solverId) {
        return List.copyOf(proofsBySolver.getOrDefault(solverId, List.of()));
    }

    // Credentials

    @Override
    public void saveCredential(Credential credential) {
        log.debug("Save credential {}", credential.getTokenId());
        if (credentialStore.put(credential.getTokenId(), credential.copy()) == null) {
            index(credentialsByOwner, credential.getOwnerId(), credential.getTokenId());
            credentialsBySkill.put(skillKey(credential.getOwnerId(), credential.getSkillType()), credential.getTokenId());
        }
    }

    @Override
    public Credential loadCredential(long tokenId) {
        Credential credential = credentialStore.get(tokenId);
        return credential == null ? null : credential.copy();
    }

    @Override
    public void deleteCredential(long tokenId) {
        Credential removed = credentialStore.remove(tokenId);
        if (removed != null) {
            unindex(credentialsByOwner, removed.getOwnerId(), tokenId);
            credentialsBySkill.remove(skillKey(removed.getOwnerId(), removed.getSkillType()), tokenId);
        }
    }

    @Override
    public long findCredentialId(String ownerId, String skillType) {
        return credentialsBySkill.getOrDefault(skillKey(ownerId, skillType), 0L);
    }

    @Override
    public List<Long> loadCredentialIdsByOwner(String ownerId) {
        return List.copyOf(credentialsByOwner.getOrDefault(ownerId, List.of()));
    }

    // Solution digest audit log

    @Override
    public void appendSolutionDigest(SolutionDigestRecord record) {
        solutionDigestStore.put(record.getId(), record);
    }

    @Override
    public void deleteSolutionDigest(long recordId) {
        solutionDigestStore.remove(recordId);
    }

    @Override
    public List<SolutionDigestRecord> loadSolutionDigests(long tokenId) {
        return solutionDigestStore.values().stream()
                .filter(record -> record.getTokenId() == tokenId)
                .sorted((a, b) -> Long.compare(a.getId(), b.getId()))
                .toList();
    }

    @Override
    public List<SolutionDigestRecord> loadSolutionDigestPage(int offset, int limit) {
        return solutionDigestStore.values().stream()
                .sorted((a, b) -> Long.compare(a.getId(), b.getId()))
                .skip(offset)
                .limit(limit)
                .toList();
    }

    // Escrow

    @Override
    public void saveEscrow(EscrowAccount escrow) {
        escrowStore.put(escrow.getChallengeId(), escrow.copy());
    }

    @Override
    public EscrowAccount loadEscrow(long challengeId) {
        EscrowAccount escrow = escrowStore.get(challengeId);
        return escrow == null ? null : escrow.copy();
    }

    @Override
    public void deleteEscrow(long challengeId) {
        escrowStore.remove(challengeId);
    }

    @Override
    public void appendPayout(Payout payout) {
        payoutStore.computeIfAbsent(payout.getChallengeId(), id -> new CopyOnWriteArrayList<>()).add(payout);
    }

    @Override
    public void deleteLastPayout(long challengeId) {
        List<Payout> payouts = payoutStore.get(challengeId);
        if (payouts != null && !payouts.isEmpty()) {
            payouts.remove(payouts.size() - 1);
        }
    }

    @Override
    public List<Payout> loadPayouts(long challengeId) {
        return new ArrayList<>(payoutStore.getOrDefault(challengeId, List.of()));
    }

    // Balances

    @Override
    public BigInteger creditBalance(String participantId, BigInteger amount) {
        return balanceStore.merge(participantId, amount, BigInteger::add);
    }

    @Override
    public BigInteger loadBalance(String participantId) {
        return balanceStore.getOrDefault(participantId, BigInteger.ZERO);
    }

    private static void index(Map<String, List<Long>> index, String key, long id) {
        index.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(id);
    }

    private static void unindex(Map<String, List<Long>> index, String key, long id) {
        List<Long> ids = index.get(key);
        if (ids != null) {
            ids.remove(Long.valueOf(id));
        }
    }

    private static String skillKey(String ownerId, String skillType) {
        return ownerId + '\u0000' + skillType;
    }

}
