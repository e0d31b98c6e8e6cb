package me.ymssd.tsync.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Contiguous slice of a table ordered by primary key: rows with key greater than
 * {@code prevKey} and less than or equal to {@code lastKey}.
 *
 * @author denghui
 * @create 2018/10/8
 */
@Value
public class KeyRange {

    private ImmutableList<String> prevKey;
    private ImmutableList<String> lastKey;

    public KeyRange(List<String> prevKey, List<String> lastKey) {
        Preconditions.checkNotNull(prevKey);
        Preconditions.checkNotNull(lastKey);
        this.prevKey = ImmutableList.copyOf(prevKey);
        this.lastKey = ImmutableList.copyOf(lastKey);
    }

    public static KeyRange wholeTable() {
        return new KeyRange(ImmutableList.of(), ImmutableList.of());
    }

    public boolean isFromStart() {
        return prevKey.isEmpty();
    }

    public boolean isToEnd() {
        return lastKey.isEmpty();
    }

    @Override
    public String toString() {
        return "(" + (isFromStart() ? "-inf" : prevKey) + ", " + (isToEnd() ? "+inf" : lastKey) + "]";
    }
}
