package com.sommerph.skillbackend.repository.ledger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sommerph.skillbackend.exception.LedgerStorageException;
import com.sommerph.skillbackend.model.challenge.Challenge;
import com.sommerph.skillbackend.model.credential.Credential;
import com.sommerph.skillbackend.model.credential.SolutionDigestRecord;
import com.sommerph.skillbackend.model.escrow.EscrowAccount;
import com.sommerph.skillbackend.model.escrow.Payout;
import com.sommerph.skillbackend.model.proof.Proof;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Keeps one JSON file per record below the storage directory:
 * <pre>
 *   challenges/&lt;id&gt;.json         proofs/&lt;id&gt;.json
 *   credentials/&lt;id&gt;.json        solution-digests/&lt;id&gt;.json
 *   escrow/&lt;challengeId&gt;.json    payouts/&lt;challengeId&gt;.json
 *   balances/&lt;participant&gt;.json  indexes/{creators,solvers,owners}/&lt;participant&gt;.json
 * </pre>
 * Files are replaced atomically, so readers never see a half written record. Id sequences are
 * reseeded from the highest id found on disk when the store is opened.
 * <p>
 * Writes made inside a unit are journaled ahead of time under {@code journal/}: the previous
 * content of every record file and every id added to or removed from an index. Committing drops the journal.
 * A journal still present when the store is opened belongs to a unit that never finished; it is
 * replayed backwards and the balances are recomputed from the payouts. Balances are a running sum
 * of payouts and are not journaled themselves.
 */
@Slf4j
public class JsonFileLedgerStore implements LedgerStore {

    private static final TypeReference<List<Long>> ID_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Payout>> PAYOUT_LIST = new TypeReference<>() {};
    private static final TypeReference<List<JournalEntry>> JOURNAL = new TypeReference<>() {};

    private final Path storageDir;
    private final ObjectMapper mapper;
    private final Map<LedgerTable, AtomicLong> sequences = new EnumMap<>(LedgerTable.class);
    private final ThreadLocal<UnitJournal> currentUnit = new ThreadLocal<>();

    public JsonFileLedgerStore(String storagePath) throws IOException {
        this.storageDir = Paths.get(storagePath);
        for (String dir : List.of("challenges", "proofs", "credentials", "solution-digests", "escrow",
                "payouts", "balances", "indexes/creators", "indexes/solvers", "indexes/owners", "journal")) {
            Files.createDirectories(storageDir.resolve(dir));
        }
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        recoverUnfinishedUnits();

        sequences.put(LedgerTable.CHALLENGE, new AtomicLong(highestId("challenges")));
        sequences.put(LedgerTable.PROOF, new AtomicLong(highestId("proofs")));
        sequences.put(LedgerTable.CREDENTIAL, new AtomicLong(highestId("credentials")));
        sequences.put(LedgerTable.SOLUTION_DIGEST, new AtomicLong(highestId("solution-digests")));
        log.info("Opened json ledger store at {} (sequences: {})", storageDir, sequences);
    }

    @Override
    public long nextId(LedgerTable table) {
        return sequences.get(table).incrementAndGet();
    }

    // Challenges

    @Override
    public synchronized void saveChallenge(Challenge challenge) {
        Path path = recordPath("challenges", challenge.getId());
        boolean created = !Files.exists(path);
        writeRecord(path, challenge);
        if (created) {
            appendIndex("creators", challenge.getCreatorId(), challenge.getId());
        }
    }

    @Override
    public Challenge loadChallenge(long challengeId) {
        return readIfExists(recordPath("challenges", challengeId), Challenge.class);
    }

    @Override
    public synchronized void deleteChallenge(long challengeId) {
        Challenge challenge = loadChallenge(challengeId);
        if (challenge != null) {
            deleteRecord(recordPath("challenges", challengeId));
            removeIndex("creators", challenge.getCreatorId(), challengeId);
        }
    }

    @Override
    public List<Long> loadChallengeIdsByCreator(String creatorId) {
        return loadIndex("creators", creatorId);
    }

    // Proofs

    @Override
    public synchronized void saveProof(Proof proof) {
        Path path = recordPath("proofs", proof.getId());
        boolean created = !Files.exists(path);
        writeRecord(path, proof);
        if (created) {
            appendIndex("solvers", proof.getSolverId(), proof.getId());
        }
    }

    @Override
    public Proof loadProof(long proofId) {
        return readIfExists(recordPath("proofs", proofId), Proof.class);
    }

    @Override
    public synchronized void deleteProof(long proofId) {
        Proof proof = loadProof(proofId);
        if (proof != null) {
            deleteRecord(recordPath("proofs", proofId));
            removeIndex("solvers", proof.getSolverId(), proofId);
        }
    }

    @Override
    public List<Long> loadProofIdsBySolver(String solverId) {
        return loadIndex("solvers", solverId);
    }

    // Credentials

    @Override
    public synchronized void saveCredential(Credential credential) {
        Path path = recordPath("credentials", credential.getTokenId());
        boolean created = !Files.exists(path);
        writeRecord(path, credential);
        if (created) {
            appendIndex("owners", credential.getOwnerId(), credential.getTokenId());
        }
    }

    @Override
    public Credential loadCredential(long tokenId) {
        return readIfExists(recordPath("credentials", tokenId), Credential.class);
    }

    @Override
    public synchronized void deleteCredential(long tokenId) {
        Credential credential = loadCredential(tokenId);
        if (credential != null) {
            deleteRecord(recordPath("credentials", tokenId));
            removeIndex("owners", credential.getOwnerId(), tokenId);
        }
    }

    @Override
    public long findCredentialId(String ownerId, String skillType) {
        for (Long tokenId : loadCredentialIdsByOwner(ownerId)) {
            Credential credential = loadCredential(tokenId);
            if (credential != null && credential.getSkillType().equals(skillType)) {
                return tokenId;
            }
        }
        return 0L;
    }

    @Override
    public List<Long> loadCredentialIdsByOwner(String ownerId) {
        return loadIndex("owners", ownerId);
    }

    // Solution digest audit log

    @Override
    public void appendSolutionDigest(SolutionDigestRecord record) {
        writeRecord(recordPath("solution-digests", record.getId()), record);
    }

    @Override
    public void deleteSolutionDigest(long recordId) {
        deleteRecord(recordPath("solution-digests", recordId));
    }

    @Override
    public List<SolutionDigestRecord> loadSolutionDigests(long tokenId) {
        return listSolutionDigests().stream()
                .filter(record -> record.getTokenId() == tokenId)
                .toList();
    }

    @Override
    public List<SolutionDigestRecord> loadSolutionDigestPage(int offset, int limit) {
        return listSolutionDigests().stream()
                .skip(offset)
                .limit(limit)
                .toList();
    }

    private List<SolutionDigestRecord> listSolutionDigests() {
        try (Stream<Path> files = Files.list(storageDir.resolve("solution-digests"))) {
            return files.filter(path -> path.getFileName().toString().endsWith(".json"))
                    .map(path -> readFromFile(path, SolutionDigestRecord.class))
                    .sorted(Comparator.comparingLong(SolutionDigestRecord::getId))
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list solution digests", e);
            throw new LedgerStorageException("Failed to list solution digests", e);
        }
    }

    // Escrow

    @Override
    public void saveEscrow(EscrowAccount escrow) {
        writeRecord(recordPath("escrow", escrow.getChallengeId()), escrow);
    }

    @Override
    public EscrowAccount loadEscrow(long challengeId) {
        return readIfExists(recordPath("escrow", challengeId), EscrowAccount.class);
    }

    @Override
    public void deleteEscrow(long challengeId) {
        deleteRecord(recordPath("escrow", challengeId));
    }

    @Override
    public synchronized void appendPayout(Payout payout) {
        List<Payout> payouts = loadPayouts(payout.getChallengeId());
        payouts.add(payout);
        writeRecord(recordPath("payouts", payout.getChallengeId()), payouts);
    }

    @Override
    public synchronized void deleteLastPayout(long challengeId) {
        List<Payout> payouts = loadPayouts(challengeId);
        if (!payouts.isEmpty()) {
            payouts.remove(payouts.size() - 1);
            writeRecord(recordPath("payouts", challengeId), payouts);
        }
    }

    @Override
    public List<Payout> loadPayouts(long challengeId) {
        Path path = recordPath("payouts", challengeId);
        if (!Files.exists(path)) {
            return new ArrayList<>();
        }
        return new ArrayList<>(readFromFile(path, PAYOUT_LIST));
    }

    // Balances

    @Override
    public synchronized BigInteger creditBalance(String participantId, BigInteger amount) {
        BigInteger updated = loadBalance(participantId).add(amount);
        writeToFile(participantPath("balances", participantId), updated);
        return updated;
    }

    @Override
    public BigInteger loadBalance(String participantId) {
        BigInteger balance = readIfExists(participantPath("balances", participantId), BigInteger.class);
        return balance == null ? BigInteger.ZERO : balance;
    }

    // Units

    @Override
    public void beginUnit() {
        UnitJournal unit = currentUnit.get();
        if (unit != null) {
            unit.depth++;
            return;
        }
        currentUnit.set(new UnitJournal(storageDir.resolve("journal").resolve(UUID.randomUUID() + ".json")));
    }

    @Override
    public void commitUnit() {
        UnitJournal unit = currentUnit.get();
        if (unit == null) {
            throw new IllegalStateException("No unit open on this thread");
        }
        if (unit.depth > 1) {
            unit.depth--;
            return;
        }
        deleteFile(unit.file);
        currentUnit.remove();
    }

    /**
     * Replays the journal of the open unit before dropping it. The caller has normally reverted
     * every write already, so this only repairs what its own undo steps failed to restore.
     */
    @Override
    public synchronized void abortUnit() {
        UnitJournal unit = currentUnit.get();
        if (unit == null) {
            return;
        }
        if (unit.depth > 1) {
            unit.depth--;
            return;
        }
        try {
            replay(unit.entries);
            deleteFile(unit.file);
        } finally {
            currentUnit.remove();
        }
    }

    private void recoverUnfinishedUnits() throws IOException {
        List<Path> journals;
        try (Stream<Path> files = Files.list(storageDir.resolve("journal"))) {
            journals = files.filter(path -> path.getFileName().toString().endsWith(".json")).toList();
        }
        if (journals.isEmpty()) {
            return;
        }
        for (Path journal : journals) {
            List<JournalEntry> entries = readFromFile(journal, JOURNAL);
            log.warn("Undoing unfinished ledger unit {} ({} journaled writes)", journal.getFileName(), entries.size());
            replay(entries);
            deleteFile(journal);
        }
        rebuildBalances();
    }

    private void replay(List<JournalEntry> entries) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            JournalEntry entry = entries.get(i);
            Path path = storageDir.resolve(entry.getFile());
            switch (entry.getKind()) {
                case BEFORE_IMAGE -> {
                    if (entry.getContent() == null) {
                        deleteFile(path);
                    } else {
                        writeStringToFile(path, entry.getContent());
                    }
                }
                case INDEX_APPEND -> removeIndexEntry(path, entry.getId());
                case INDEX_REMOVE -> restoreIndexEntry(path, entry.getId());
            }
        }
    }

    private void rebuildBalances() throws IOException {
        Map<String, BigInteger> balances = new HashMap<>();
        try (Stream<Path> files = Files.list(storageDir.resolve("payouts"))) {
            files.filter(path -> path.getFileName().toString().matches("\\d+\\.json"))
                    .flatMap(path -> readFromFile(path, PAYOUT_LIST).stream())
                    .forEach(payout -> balances.merge(payout.getRecipientId(), payout.getAmount(), BigInteger::add));
        }
        try (Stream<Path> files = Files.list(storageDir.resolve("balances"))) {
            files.forEach(this::deleteFile);
        }
        balances.forEach((participantId, balance) -> writeToFile(participantPath("balances", participantId), balance));
        log.info("Recomputed {} balances from payouts", balances.size());
    }

    private void writeRecord(Path path, Object data) {
        captureBeforeImage(path);
        writeToFile(path, data);
    }

    private void deleteRecord(Path path) {
        captureBeforeImage(path);
        deleteFile(path);
    }

    private void captureBeforeImage(Path path) {
        UnitJournal unit = currentUnit.get();
        if (unit == null) {
            return;
        }
        String file = storageDir.relativize(path).toString();
        if (unit.captured.add(file)) {
            String content = Files.exists(path) ? readStringFromFile(path) : null;
            appendJournal(unit, JournalEntry.beforeImage(file, content));
        }
    }

    private void appendJournal(UnitJournal unit, JournalEntry entry) {
        unit.entries.add(entry);
        writeToFile(unit.file, unit.entries);
    }

    // Index helpers, callers hold the store monitor

    private void appendIndex(String index, String participantId, long id) {
        Path path = participantPath("indexes/" + index, participantId);
        UnitJournal unit = currentUnit.get();
        if (unit != null) {
            appendJournal(unit, JournalEntry.indexAppend(storageDir.relativize(path).toString(), id));
        }
        List<Long> ids = new ArrayList<>(loadIndex(index, participantId));
        ids.add(id);
        writeToFile(path, ids);
    }

    private void removeIndex(String index, String participantId, long id) {
        Path path = participantPath("indexes/" + index, participantId);
        UnitJournal unit = currentUnit.get();
        if (unit != null && loadIndex(index, participantId).contains(id)) {
            appendJournal(unit, JournalEntry.indexRemove(storageDir.relativize(path).toString(), id));
        }
        removeIndexEntry(path, id);
    }

    // Ids are indexed in increasing order, so the sorted position is the original one
    private void restoreIndexEntry(Path path, long id) {
        List<Long> ids = Files.exists(path) ? new ArrayList<>(readFromFile(path, ID_LIST)) : new ArrayList<>();
        if (!ids.contains(id)) {
            int position = 0;
            while (position < ids.size() && ids.get(position) < id) {
                position++;
            }
            ids.add(position, id);
            writeToFile(path, ids);
        }
    }

    private void removeIndexEntry(Path path, long id) {
        if (!Files.exists(path)) {
            return;
        }
        List<Long> ids = new ArrayList<>(readFromFile(path, ID_LIST));
        if (ids.remove(Long.valueOf(id))) {
            writeToFile(path, ids);
        }
    }

    private List<Long> loadIndex(String index, String participantId) {
        Path path = participantPath("indexes/" + index, participantId);
        if (!Files.exists(path)) {
            return List.of();
        }
        return List.copyOf(readFromFile(path, ID_LIST));
    }

    // File IO helpers

    private Path recordPath(String dir, long id) {
        return storageDir.resolve(dir).resolve(id + ".json");
    }

    private Path participantPath(String dir, String participantId) {
        return storageDir.resolve(dir).resolve(URLEncoder.encode(participantId, StandardCharsets.UTF_8) + ".json");
    }

    private void writeToFile(Path path, Object data) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), data);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote file: {}", path);
        } catch (IOException e) {
            log.error("Failed to write file: {}", path, e);
            throw new LedgerStorageException("Failed to write file: " + path, e);
        }
    }

    private void writeStringToFile(Path path, String content) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Restored file: {}", path);
        } catch (IOException e) {
            log.error("Failed to restore file: {}", path, e);
            throw new LedgerStorageException("Failed to restore file: " + path, e);
        }
    }

    private String readStringFromFile(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read file: {}", path, e);
            throw new LedgerStorageException("Failed to read file: " + path, e);
        }
    }

    private <T> T readIfExists(Path path, Class<T> clazz) {
        return Files.exists(path) ? readFromFile(path, clazz) : null;
    }

    private <T> T readFromFile(Path path, Class<T> clazz) {
        try {
            return mapper.readValue(path.toFile(), clazz);
        } catch (IOException e) {
            log.error("Failed to read file: {}", path, e);
            throw new LedgerStorageException("Failed to read file: " + path, e);
        }
    }

    private <T> T readFromFile(Path path, TypeReference<T> type) {
        try {
            return mapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            log.error("Failed to read file: {}", path, e);
            throw new LedgerStorageException("Failed to read file: " + path, e);
        }
    }

    private void deleteFile(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.error("Failed to delete file: {}", path, e);
            throw new LedgerStorageException("Failed to delete file: " + path, e);
        }
    }

    private long highestId(String dir) throws IOException {
        try (Stream<Path> files = Files.list(storageDir.resolve(dir))) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.matches("\\d+\\.json"))
                    .mapToLong(name -> Long.parseLong(name.substring(0, name.length() - ".json".length())))
                    .max()
                    .orElse(0L);
        }
    }

    // Confined to the thread that began the unit
    private static final class UnitJournal {
        private final Path file;
        private final List<JournalEntry> entries = new ArrayList<>();
        private final Set<String> captured = new HashSet<>();
        private int depth = 1;

        private UnitJournal(Path file) {
            this.file = file;
        }
    }

}
