package me.ymssd.tsync.worker;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import me.ymssd.tsync.SyncAbortedException;
import me.ymssd.tsync.SyncException;
import me.ymssd.tsync.SyncMetric;
import me.ymssd.tsync.model.KeyRange;
import me.ymssd.tsync.model.KeyRangeToCheck;
import me.ymssd.tsync.queue.SyncQueue;
import me.ymssd.tsync.queue.TableJob;

/**
 * One worker thread. Claims whole tables from the queue and works through their ranges; once
 * there are no tables left to claim, borrows single ranges from tables other workers own.
 *
 * <p>A table job's lock is never held while calling into the queue.
 *
 * @author denghui
 * @create 2018/10/11
 */
@Slf4j
public class SyncWorker implements Runnable {

    private final SyncQueue syncQueue;
    private final RangeChecker rangeChecker;
    private final SyncMetric metric;
    private final long initialRowsToHash;

    public SyncWorker(SyncQueue syncQueue, RangeChecker rangeChecker, SyncMetric metric, long initialRowsToHash) {
        Preconditions.checkNotNull(syncQueue);
        Preconditions.checkNotNull(rangeChecker);
        Preconditions.checkNotNull(metric);
        Preconditions.checkArgument(initialRowsToHash > 0, "initialRowsToHash must be positive");
        this.syncQueue = syncQueue;
        this.rangeChecker = rangeChecker;
        this.metric = metric;
        this.initialRowsToHash = initialRowsToHash;
    }

    @Override
    public void run() {
        Preconditions.checkState(syncQueue.getSnapshot() != null, "snapshot must be set before workers start");
        TableJob current = null;
        try {
            syncQueue.waitAtBarrier();
            while (true) {
                TableJob tableJob = syncQueue.findTableJob();
                if (tableJob == null) {
                    break;
                }
                current = tableJob;
                if (startIfUnstarted(tableJob)) {
                    syncTable(tableJob);
                } else {
                    borrowRange(tableJob);
                }
                current = null;
            }
            log.debug("no more work");
        } catch (SyncAbortedException e) {
            if (Thread.currentThread().isInterrupted()) {
                syncQueue.abort();
            }
            log.info("worker stopped, sync aborted");
            throw e;
        } catch (RuntimeException | Error e) {
            String tableId = current == null ? null : current.getTableId();
            log.error("sync fail, table:{}", tableId, e);
            syncQueue.abort();
            throw new SyncException(tableId, e);
        }
    }

    /**
     * Jobs fresh from the unclaimed queue have never been started; anything else handed to us
     * is a table we are borrowing a range from.
     */
    private boolean startIfUnstarted(TableJob tableJob) {
        boolean offer;
        tableJob.getLock().lock();
        try {
            if (tableJob.getTimeStarted() != 0) {
                return false;
            }
            tableJob.markStarted();
            if (tableJob.isSubdividable()) {
                tableJob.getRangesToCheck().add(new KeyRangeToCheck(
                    KeyRange.wholeTable(), KeyRangeToCheck.UNKNOWN_ROW_COUNT, initialRowsToHash, 0));
            } else {
                tableJob.getRangesToRetrieve().addLast(KeyRange.wholeTable());
            }
            offer = tableJob.isNotifyWhenWorkCouldBeShared() && tableJob.haveWorkToShare();
        } finally {
            tableJob.getLock().unlock();
        }
        log.info("sync table:{}, subdividable:{}", tableJob.getTableId(), tableJob.isSubdividable());
        if (offer) {
            syncQueue.haveWorkToShare(tableJob);
        }
        return true;
    }

    private void syncTable(TableJob tableJob) {
        while (true) {
            checkAborted();

            KeyRange toRetrieve = null;
            KeyRangeToCheck toCheck = null;
            tableJob.getLock().lock();
            try {
                toRetrieve = tableJob.getRangesToRetrieve().pollFirst();
                if (toRetrieve != null) {
                    tableJob.rowsCommandIssued();
                } else {
                    toCheck = tableJob.getRangesToCheck().poll();
                    if (toCheck != null) {
                        tableJob.hashCommandIssued();
                    } else if (tableJob.outstandingHashCommands() > 0) {
                        awaitBorrowedTask(tableJob);
                        continue;
                    } else {
                        tableJob.markFinished();
                        break;
                    }
                }
            } finally {
                tableJob.getLock().unlock();
            }

            if (toRetrieve != null) {
                retrieve(tableJob, toRetrieve);
            } else {
                check(tableJob, toCheck);
            }
        }

        syncQueue.completedTable(tableJob);
        metric.getTablesCompleted().incrementAndGet();
        log.info("finished table:{}, hashCommands:{}, rowsCommands:{}, took:{}ms", tableJob.getTableId(),
            tableJob.getHashCommands(), tableJob.getRowsCommands(),
            tableJob.getTimeFinished() - tableJob.getTimeStarted());
    }

    private void borrowRange(TableJob tableJob) {
        KeyRangeToCheck range;
        tableJob.getLock().lock();
        try {
            range = tableJob.getRangesToCheck().poll();
            if (range == null) {
                // drained by its owner or another borrower since the queue handed it out
                return;
            }
            tableJob.hashCommandIssued();
        } finally {
            tableJob.getLock().unlock();
        }
        metric.getRangesBorrowed().incrementAndGet();
        log.debug("borrowed range:{} from table:{}", range.getKeyRange(), tableJob.getTableId());
        check(tableJob, range);
    }

    private void check(TableJob tableJob, KeyRangeToCheck range) {
        CheckResult result = rangeChecker.check(tableJob, range, syncQueue.getSnapshot());
        metric.getHashCommands().incrementAndGet();

        boolean offer;
        tableJob.getLock().lock();
        try {
            tableJob.hashCommandCompleted();
            boolean hadWorkToShare = tableJob.haveWorkToShare();
            switch (result.getOutcome()) {
                case SUBDIVIDE:
                    tableJob.getRangesToCheck().addAll(result.getChildren());
                    break;
                case RETRIEVE:
                    tableJob.getRangesToRetrieve().addLast(result.getRangeToRetrieve());
                    break;
                default:
                    break;
            }
            offer = !hadWorkToShare && tableJob.haveWorkToShare() && tableJob.isNotifyWhenWorkCouldBeShared();
            // the owner may be waiting for us to finish before it can complete the table
            tableJob.getBorrowedTaskCompleted().signalAll();
        } finally {
            tableJob.getLock().unlock();
        }

        if (offer) {
            syncQueue.haveWorkToShare(tableJob);
        }
    }

    private void retrieve(TableJob tableJob, KeyRange range) {
        long rows = rangeChecker.retrieve(tableJob, range, syncQueue.getSnapshot());
        metric.getRowsCommands().incrementAndGet();
        metric.getRowsRetrieved().addAndGet(rows);
        log.debug("retrieved {} rows, range:{}, table:{}", rows, range, tableJob.getTableId());
    }

    /**
     * Caller holds the table job's lock. Abort signals the condition under the same lock after
     * setting the flag, so checking the flag here cannot miss the wakeup.
     */
    private void awaitBorrowedTask(TableJob tableJob) {
        checkAborted();
        try {
            tableJob.getBorrowedTaskCompleted().await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncAbortedException();
        }
    }

    private void checkAborted() {
        if (syncQueue.isAborted()) {
            throw new SyncAbortedException();
        }
    }
}
