package com.sommerph.skillbackend.service.transaction;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One reentrant lock per ledger entity. Locks are always taken in the order
 * proof, challenge, credential, which keeps nested acquisition deadlock free.
 * <p>
 * An entry only lives while some thread holds or waits for its lock; the last
 * {@link #unlock(String)} removes it.
 */
@Component
public class EntityLockManager {

    private final Map<String, EntityLock> locks = new ConcurrentHashMap<>();

    public void lock(String key) {
        EntityLock entry = locks.compute(key, (k, existing) -> {
            EntityLock lock = existing == null ? new EntityLock() : existing;
            lock.users++;
            return lock;
        });
        entry.lock.lock();
    }

    public void unlock(String key) {
        EntityLock entry = locks.get(key);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            throw new IllegalMonitorStateException("Lock not held: " + key);
        }
        entry.lock.unlock();
        locks.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
    }

    public <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }

    public boolean isLocked(String key) {
        EntityLock entry = locks.get(key);
        return entry != null && entry.lock.isLocked();
    }

    public int size() {
        return locks.size();
    }

    public static String proofKey(long proofId) {
        return "proof:" + proofId;
    }

    public static String challengeKey(long challengeId) {
        return "challenge:" + challengeId;
    }

    // skillType must already be normalized
    public static String credentialKey(String ownerId, String skillType) {
        return "credential:" + ownerId + '\u0000' + skillType;
    }

    // users is only read and written inside compute on the owning map entry
    private static final class EntityLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

}
