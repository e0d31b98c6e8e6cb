package me.ymssd.tsync.queue;

import com.google.common.base.Preconditions;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import me.ymssd.tsync.SyncAbortedException;

/**
 * Rendezvous point for a fixed number of workers that any of them can abort. The lock and
 * condition are shared with subclasses, which use them for their own signalling.
 *
 * @author denghui
 * @create 2018/10/10
 */
@Slf4j
public class AbortableBarrier {

    protected final ReentrantLock lock = new ReentrantLock();
    protected final Condition cond = lock.newCondition();
    protected volatile boolean aborted;

    private final int workers;
    private int arrived;
    private long generation;

    public AbortableBarrier(int workers) {
        Preconditions.checkArgument(workers > 0, "workers must be positive");
        this.workers = workers;
    }

    public int getWorkers() {
        return workers;
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * Blocks until all workers have arrived. Throws {@link SyncAbortedException} if the barrier
     * is aborted before or while waiting.
     */
    public void waitAtBarrier() {
        lock.lock();
        try {
            if (aborted) {
                throw new SyncAbortedException();
            }
            long arrivedGeneration = generation;
            if (++arrived == workers) {
                arrived = 0;
                generation++;
                cond.signalAll();
                return;
            }
            while (arrivedGeneration == generation) {
                if (aborted) {
                    throw new SyncAbortedException();
                }
                awaitCond();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the barrier aborted and wakes everyone waiting on it.
     *
     * @return true for the caller that actually aborted, false if it was already aborted
     */
    public boolean abort() {
        lock.lock();
        try {
            if (aborted) {
                return false;
            }
            aborted = true;
            cond.signalAll();
            log.info("barrier aborted");
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits on the shared condition; the caller holds {@link #lock}. An interrupt aborts the run.
     */
    protected void awaitCond() {
        try {
            cond.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort();
            throw new SyncAbortedException();
        }
    }
}
