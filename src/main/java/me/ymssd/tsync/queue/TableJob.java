package me.ymssd.tsync.queue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.Getter;
import lombok.Setter;
import me.ymssd.tsync.model.KeyRange;
import me.ymssd.tsync.model.KeyRangeToCheck;
import me.ymssd.tsync.schema.Subdivision;
import me.ymssd.tsync.schema.Table;

/**
 * Work state of one table. Everything except the final fields is guarded by {@link #lock},
 * which is shared by the worker that claimed the table and any worker borrowing ranges from it.
 * Equality is identity.
 *
 * @author denghui
 * @create 2018/10/10
 */
@Getter
public class TableJob {

    private final Table table;
    private final String tableId;
    private final boolean subdividable;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition borrowedTaskCompleted = lock.newCondition();

    private final Deque<KeyRange> rangesToRetrieve = new ArrayDeque<>();
    private final PriorityQueue<KeyRangeToCheck> rangesToCheck =
        new PriorityQueue<>(KeyRangeToCheck.LOWER_PRIORITY.reversed());
    @Setter
    private boolean notifyWhenWorkCouldBeShared;

    private long timeStarted;
    private long timeFinished;

    private long hashCommands;
    private long hashCommandsCompleted;
    private long rowsCommands;

    public TableJob(Table table) {
        this.table = table;
        this.tableId = table.idFromName();
        this.subdividable = Subdivision.primaryKeySubdividable(table);
    }

    public boolean haveWorkToShare() {
        return !rangesToCheck.isEmpty();
    }

    public void markStarted() {
        timeStarted = System.currentTimeMillis();
    }

    public void markFinished() {
        timeFinished = System.currentTimeMillis();
    }

    public void hashCommandIssued() {
        hashCommands++;
    }

    public void hashCommandCompleted() {
        if (hashCommandsCompleted >= hashCommands) {
            throw new IllegalStateException("more hash commands completed than issued for " + tableId);
        }
        hashCommandsCompleted++;
    }

    public void rowsCommandIssued() {
        rowsCommands++;
    }

    public long outstandingHashCommands() {
        return hashCommands - hashCommandsCompleted;
    }

    public boolean hasNoRangesLeft() {
        return rangesToRetrieve.isEmpty() && rangesToCheck.isEmpty() && outstandingHashCommands() == 0;
    }

    @Override
    public String toString() {
        return "TableJob(" + tableId + ")";
    }
}
