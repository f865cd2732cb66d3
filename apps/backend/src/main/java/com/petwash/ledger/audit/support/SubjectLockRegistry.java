package com.petwash.ledger.audit.support;

import com.petwash.ledger.audit.exception.AuditConcurrencyConflictException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per subject, created on demand and dropped once nobody holds or waits for it.
 * Different subjects never contend.
 */
@Component
public class SubjectLockRegistry {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        int users; // guarded by the map's per-key compute
    }

    /** Held lock; close from the acquiring thread. */
    public interface SubjectLock extends AutoCloseable {
        @Override
        void close();
    }

    public SubjectLock acquire(String subjectId, Duration timeout) {
        Entry entry = locks.compute(subjectId, (k, v) -> {
            Entry e = (v == null) ? new Entry() : v;
            e.users++;
            return e;
        });

        boolean locked;
        try {
            locked = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            release(subjectId);
            Thread.currentThread().interrupt();
            throw new AuditConcurrencyConflictException(subjectId,
                    "Interrupted while waiting for the chain lock of subject " + subjectId, e);
        }
        if (!locked) {
            release(subjectId);
            throw new AuditConcurrencyConflictException(subjectId,
                    "Timed out after " + timeout.toMillis() + "ms waiting for the chain lock of subject " + subjectId);
        }
        return () -> {
            entry.lock.unlock();
            release(subjectId);
        };
    }

    /** Subjects with a lock entry right now. */
    public int activeSubjects() {
        return locks.size();
    }

    private void release(String subjectId) {
        locks.computeIfPresent(subjectId, (k, v) -> --v.users == 0 ? null : v);
    }
}
