package me.ymssd.tsync.worker;

import me.ymssd.tsync.model.KeyRange;
import me.ymssd.tsync.model.KeyRangeToCheck;
import me.ymssd.tsync.queue.TableJob;

/**
 * Talks to the two databases on behalf of a worker. Implementations must be safe to call from
 * several workers at once, including for ranges of the same table.
 *
 * @author denghui
 * @create 2018/10/11
 */
public interface RangeChecker {

    /**
     * Hashes up to {@code range.getRowsToHash()} rows of the range at both ends and compares them.
     */
    CheckResult check(TableJob tableJob, KeyRangeToCheck range, String snapshot);

    /**
     * Retrieves the rows of a range that is known to differ.
     *
     * @return number of rows retrieved
     */
    long retrieve(TableJob tableJob, KeyRange range, String snapshot);
}
