package me.ymssd.tsync.queue;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import me.ymssd.tsync.SyncAbortedException;
import me.ymssd.tsync.schema.Table;

/**
 * Hands tables out to workers. Each table is claimed by exactly one worker; once there are no
 * unclaimed tables left, idle workers borrow single ranges from tables that other workers are
 * still processing.
 *
 * <p>Lock order is always the queue lock before a table job's lock.
 *
 * @author denghui
 * @create 2018/10/10
 */
@Slf4j
public class SyncQueue extends AbortableBarrier {

    private final Deque<TableJob> tablesToProcess = new ArrayDeque<>();
    private final Set<TableJob> tablesBeingProcessed = new LinkedHashSet<>();
    private final Set<TableJob> tablesWithWorkToShare = new LinkedHashSet<>();
    private boolean sharingWork;

    private volatile String snapshot;

    public SyncQueue(int workers) {
        super(workers);
    }

    public String getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(String snapshot) {
        this.snapshot = snapshot;
    }

    public void enqueueTablesToProcess(List<Table> tables) {
        Preconditions.checkNotNull(tables);
        lock.lock();
        try {
            for (Table table : tables) {
                tablesToProcess.addLast(new TableJob(table));
            }
            log.info("enqueued {} tables", tables.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Finds the next piece of work for the calling worker.
     *
     * <p>While unclaimed tables remain, returns the next one and the caller owns it until it
     * reports it with {@link #completedTable}. After that, blocks until some claimed table has
     * a range ready to check and returns that table; the caller should take one range from it.
     *
     * @return the table to work on, or null once every table has been completed
     * @throws SyncAbortedException if the run has been aborted
     */
    public TableJob findTableJob() {
        lock.lock();
        try {
            if (aborted) {
                throw new SyncAbortedException();
            }

            TableJob tableJob = tablesToProcess.pollFirst();
            if (tableJob == null) {
                if (!sharingWork) {
                    startSharingWork();
                }
                return borrowWork();
            }
            tablesBeingProcessed.add(tableJob);
            log.debug("claimed table:{}", tableJob.getTableId());
            return tableJob;
        } finally {
            lock.unlock();
        }
    }

    public void completedTable(TableJob tableJob) {
        lock.lock();
        try {
            tablesWithWorkToShare.remove(tableJob);
            tablesBeingProcessed.remove(tableJob);
            log.debug("completed table:{}", tableJob.getTableId());

            if (finished()) {
                // wake workers waiting in borrowWork so they see there is nothing left
                cond.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Tells borrowers the table now has ranges ready to check. Only needed once the table's
     * {@code notifyWhenWorkCouldBeShared} flag is set.
     */
    public void haveWorkToShare(TableJob tableJob) {
        lock.lock();
        try {
            if (!tablesBeingProcessed.contains(tableJob)) {
                log.debug("ignoring work offered by unclaimed table:{}", tableJob.getTableId());
                return;
            }
            tablesWithWorkToShare.add(tableJob);
            cond.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean abort() {
        boolean result = super.abort();

        lock.lock();
        try {
            for (TableJob tableJob : tablesBeingProcessed) {
                tableJob.getLock().lock();
                try {
                    tableJob.getBorrowedTaskCompleted().signalAll();
                } finally {
                    tableJob.getLock().unlock();
                }
            }
            cond.signalAll();
        } finally {
            lock.unlock();
        }
        return result;
    }

    public boolean isSharingWork() {
        lock.lock();
        try {
            return sharingWork;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFinished() {
        lock.lock();
        try {
            return finished();
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            return tablesToProcess.size();
        } finally {
            lock.unlock();
        }
    }

    boolean isPending(TableJob tableJob) {
        lock.lock();
        try {
            return tablesToProcess.contains(tableJob);
        } finally {
            lock.unlock();
        }
    }

    boolean isBeingProcessed(TableJob tableJob) {
        lock.lock();
        try {
            return tablesBeingProcessed.contains(tableJob);
        } finally {
            lock.unlock();
        }
    }

    boolean isSharing(TableJob tableJob) {
        lock.lock();
        try {
            return tablesWithWorkToShare.contains(tableJob);
        } finally {
            lock.unlock();
        }
    }

    boolean shareableSubsetOfClaimed() {
        lock.lock();
        try {
            return tablesBeingProcessed.containsAll(tablesWithWorkToShare);
        } finally {
            lock.unlock();
        }
    }

    private boolean finished() {
        return tablesToProcess.isEmpty() && tablesBeingProcessed.isEmpty();
    }

    private void startSharingWork() {
        sharingWork = true;
        for (TableJob tableJob : tablesToProcess) {
            startSharingWorkIn(tableJob);
        }
        for (TableJob tableJob : tablesBeingProcessed) {
            startSharingWorkIn(tableJob);
        }
        log.info("started sharing work, {} tables have ranges ready", tablesWithWorkToShare.size());
    }

    private void startSharingWorkIn(TableJob tableJob) {
        tableJob.getLock().lock();
        try {
            tableJob.setNotifyWhenWorkCouldBeShared(true);

            // it may already have ranges ready, in which case nobody is going to offer them
            if (tableJob.haveWorkToShare()) {
                tablesWithWorkToShare.add(tableJob);
            }
        } finally {
            tableJob.getLock().unlock();
        }
    }

    private TableJob borrowWork() {
        while (true) {
            if (finished()) {
                return null;
            }
            if (aborted) {
                throw new SyncAbortedException();
            }

            // drained tables are dropped as we pass them; the one we return stays listed so
            // other borrowers can keep taking ranges from it
            Iterator<TableJob> it = tablesWithWorkToShare.iterator();
            while (it.hasNext()) {
                TableJob tableJob = it.next();

                tableJob.getLock().lock();
                try {
                    if (tableJob.haveWorkToShare()) {
                        return tableJob;
                    }
                } finally {
                    tableJob.getLock().unlock();
                }
                it.remove();
            }

            awaitCond();
        }
    }
}
