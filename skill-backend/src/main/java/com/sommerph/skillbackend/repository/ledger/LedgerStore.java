package com.sommerph.skillbackend.repository.ledger;

import com.sommerph.skillbackend.model.challenge.Challenge;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.model.credential.SolutionDigestRecord;
import com.sommerph.skillbackend.model.escrow.EscrowAccount;
import com.sommerph.skillbackend.model.escrow.Payout;
import com.sommerph.skillbackend.model.proof.Proof;

import java.math.BigInteger;
import java.util.List;

/**
 * Persistent ledger state. Loads return detached copies (or {@code null} when absent), so callers
 * must save a record for a change to become visible. Saving a record for the first time appends
 * its id to the matching insertion-ordered index.
 * <p>
 * Implementations only guarantee that single calls are thread-safe; multi-record consistency
 * is the caller's job.
 */
public interface LedgerStore {

    // Single authority for ids, strictly increasing per table
    long nextId(LedgerTable table);

    // Challenges, indexed by creator
    void saveChallenge(Challenge challenge);
    Challenge loadChallenge(long challengeId);
    void deleteChallenge(long challengeId);
    List<Long> loadChallengeIdsByCreator(String creatorId);

    // Proofs, indexed by solver
    void saveProof(Proof proof);
    Proof loadProof(long proofId);
    void deleteProof(long proofId);
    List<Long> loadProofIdsBySolver(String solverId);

    // Credentials, indexed by owner and unique per (owner, skill type)
    void saveCredential(Credential credential);
    Credential loadCredential(long tokenId);
    void deleteCredential(long tokenId);
    long findCredentialId(String ownerId, String skillType);
    List<Long> loadCredentialIdsByOwner(String ownerId);

    // Solution digest audit log
    void appendSolutionDigest(SolutionDigestRecord record);
    void deleteSolutionDigest(long recordId);
    List<SolutionDigestRecord> loadSolutionDigests(long tokenId);
    // All records in id order, i.e. in order of completion
    List<SolutionDigestRecord> loadSolutionDigestPage(int offset, int limit);

    // Escrow
    void saveEscrow(EscrowAccount escrow);
    EscrowAccount loadEscrow(long challengeId);
    void deleteEscrow(long challengeId);
    void appendPayout(Payout payout);
    void deleteLastPayout(long challengeId);
    List<Payout> loadPayouts(long challengeId);

    // Participant balances, credited atomically
    BigInteger creditBalance(String participantId, BigInteger amount);
    BigInteger loadBalance(String participantId);

    /**
     * Marks the start of an atomic unit of writes on the calling thread. A store that outlives the
     * process must undo the writes of a unit that was neither committed nor aborted when it is
     * opened again. Units begun while one is open on the same thread join it.
     */
    default void beginUnit() {
    }

    default void commitUnit() {
    }

    // Called after the caller has reverted the unit's writes
    default void abortUnit() {
    }

}
