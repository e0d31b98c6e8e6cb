package me.ymssd.tsync.model;

import com.google.common.base.Preconditions;
import java.util.Comparator;
import lombok.Value;

/**
 * A key range waiting to be hashed and compared.
 *
 * @author denghui
 * @create 2018/10/8
 */
@Value
public class KeyRangeToCheck {

    public static final long UNKNOWN_ROW_COUNT = Long.MAX_VALUE;

    /**
     * Orders ranges by ascending priority; reverse it to take the most urgent range first.
     */
    public static final Comparator<KeyRangeToCheck> LOWER_PRIORITY =
        Comparator.comparingLong(KeyRangeToCheck::getPriority);

    private KeyRange keyRange;
    private long estimatedRowsInRange;
    private long rowsToHash;
    private long priority;

    public KeyRangeToCheck(KeyRange keyRange, long estimatedRowsInRange, long rowsToHash, long priority) {
        Preconditions.checkNotNull(keyRange);
        Preconditions.checkArgument(estimatedRowsInRange >= 0, "estimatedRowsInRange < 0");
        Preconditions.checkArgument(rowsToHash > 0, "rowsToHash must be positive");
        this.keyRange = keyRange;
        this.estimatedRowsInRange = estimatedRowsInRange;
        this.rowsToHash = rowsToHash;
        this.priority = priority;
    }

    public KeyRangeToCheck(ColumnValues prevKey, ColumnValues lastKey, long estimatedRowsInRange,
        long rowsToHash, long priority) {
        this(new KeyRange(prevKey, lastKey), estimatedRowsInRange, rowsToHash, priority);
    }

    public boolean isRowCountKnown() {
        return estimatedRowsInRange != UNKNOWN_ROW_COUNT;
    }
}
