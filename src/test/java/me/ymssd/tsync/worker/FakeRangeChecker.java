package me.ymssd.tsync.worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiPredicate;
import me.ymssd.tsync.model.ColumnValues;
import me.ymssd.tsync.model.KeyRange;
import me.ymssd.tsync.model.KeyRangeToCheck;
import me.ymssd.tsync.queue.TableJob;

/**
 * Pretends every table is keyed by 1..rows. Ranges of at most {@code leafRows} rows are compared
 * directly; larger ones are split in half. A leaf differs if it contains one of the differing keys.
 */
public class FakeRangeChecker implements RangeChecker {

    private final long defaultRows;
    private final long leafRows;
    private final long delayMillis;
    private final Map<String, Long> rowsByTable = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> differingKeys = new ConcurrentHashMap<>();

    private final Map<String, AtomicInteger> leafChecks = new ConcurrentHashMap<>();
    private final List<String> retrieved = new CopyOnWriteArrayList<>();
    private final Set<String> snapshots = ConcurrentHashMap.newKeySet();
    private final AtomicInteger checks = new AtomicInteger();
    private volatile BiPredicate<TableJob, KeyRangeToCheck> failWhen = (job, range) -> false;

    public FakeRangeChecker(long defaultRows, long leafRows, long delayMillis) {
        this.defaultRows = defaultRows;
        this.leafRows = leafRows;
        this.delayMillis = delayMillis;
    }

    public FakeRangeChecker withRows(String tableId, long rows) {
        rowsByTable.put(tableId, rows);
        return this;
    }

    public FakeRangeChecker withDifferingKeys(String tableId, Long... keys) {
        differingKeys.computeIfAbsent(tableId, k -> ConcurrentHashMap.newKeySet()).addAll(List.of(keys));
        return this;
    }

    public FakeRangeChecker failWhen(BiPredicate<TableJob, KeyRangeToCheck> failWhen) {
        this.failWhen = failWhen;
        return this;
    }

    @Override
    public CheckResult check(TableJob tableJob, KeyRangeToCheck range, String snapshot) {
        checks.incrementAndGet();
        snapshots.add(snapshot);
        pause();
        if (failWhen.test(tableJob, range)) {
            throw new IllegalStateException("unexpected response checking " + range.getKeyRange());
        }

        String tableId = tableJob.getTableId();
        long lo = lower(range.getKeyRange());
        long hi = upper(tableId, range.getKeyRange());
        if (hi - lo <= leafRows) {
            leafChecks.computeIfAbsent(tableId + ":" + lo + "-" + hi, k -> new AtomicInteger()).incrementAndGet();
            return differs(tableId, lo, hi) ? CheckResult.retrieve(range.getKeyRange()) : CheckResult.matched();
        }

        long mid = lo + (hi - lo) / 2;
        List<KeyRangeToCheck> children = new ArrayList<>();
        children.add(new KeyRangeToCheck(new KeyRange(range.getKeyRange().getPrevKey(), key(mid)),
            mid - lo, range.getRowsToHash(), hi - lo));
        children.add(new KeyRangeToCheck(new KeyRange(key(mid), range.getKeyRange().getLastKey()),
            hi - mid, range.getRowsToHash(), hi - lo));
        return CheckResult.subdivide(children);
    }

    @Override
    public long retrieve(TableJob tableJob, KeyRange range, String snapshot) {
        snapshots.add(snapshot);
        String tableId = tableJob.getTableId();
        long lo = lower(range);
        long hi = upper(tableId, range);
        retrieved.add(tableId + ":" + lo + "-" + hi);
        return hi - lo;
    }

    public int getChecks() {
        return checks.get();
    }

    public Set<String> getSnapshots() {
        return snapshots;
    }

    public List<String> getRetrieved() {
        List<String> sorted = new ArrayList<>(retrieved);
        Collections.sort(sorted);
        return sorted;
    }

    /**
     * Leaves checked for a table, mapped to how many times each was checked.
     */
    public Map<String, Integer> getLeafChecks(String tableId) {
        Map<String, Integer> result = new ConcurrentHashMap<>();
        leafChecks.forEach((leaf, count) -> {
            if (leaf.startsWith(tableId + ":")) {
                result.put(leaf.substring(tableId.length() + 1), count.get());
            }
        });
        return result;
    }

    /**
     * Whether the leaves checked for a table cover 0..rows exactly once, without gaps or overlaps.
     */
    public boolean leavesTileTable(String tableId) {
        List<long[]> leaves = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : getLeafChecks(tableId).entrySet()) {
            if (entry.getValue() != 1) {
                return false;
            }
            String[] bounds = entry.getKey().split("-");
            leaves.add(new long[] {Long.parseLong(bounds[0]), Long.parseLong(bounds[1])});
        }
        leaves.sort((a, b) -> Long.compare(a[0], b[0]));
        long next = 0;
        for (long[] leaf : leaves) {
            if (leaf[0] != next) {
                return false;
            }
            next = leaf[1];
        }
        return next == rowsOf(tableId);
    }

    public long rowsOf(String tableId) {
        return rowsByTable.getOrDefault(tableId, defaultRows);
    }

    private boolean differs(String tableId, long lo, long hi) {
        for (long key : differingKeys.getOrDefault(tableId, Set.of())) {
            if (key > lo && key <= hi) {
                return true;
            }
        }
        return false;
    }

    private long lower(KeyRange range) {
        return range.isFromStart() ? 0 : Long.parseLong(range.getPrevKey().get(0));
    }

    private long upper(String tableId, KeyRange range) {
        return range.isToEnd() ? rowsOf(tableId) : Long.parseLong(range.getLastKey().get(0));
    }

    private static ColumnValues key(long value) {
        return ColumnValues.of(String.valueOf(value));
    }

    private void pause() {
        if (delayMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }
}
