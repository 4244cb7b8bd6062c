package retrain.orchestrator.scheduler;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-job mutual exclusion shared by the ticker and the API service.
 * Every read-decide-write of a job's state happens under its lock, so a tick
 * and a manual retry never both act on the same observed state.
 */
public final class JobLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String jobId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(jobId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String jobId, Runnable action) {
        withLock(jobId, () -> {
            action.run();
            return null;
        });
    }

    /** Drop the lock of a deleted job, unless someone holds or waits for it */
    public void forget(String jobId) {
        locks.computeIfPresent(jobId, (id, lock) -> lock.isLocked() || lock.hasQueuedThreads() ? lock : null);
    }

    boolean isTracked(String jobId) {
        return locks.containsKey(jobId);
    }
}
