package me.ymssd.tsync.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;

/**
 * Values of a composite primary key, in primary key column order. Empty means "no key",
 * i.e. the start or the end of the table depending on which side of a range it is on.
 *
 * @author denghui
 * @create 2018/10/8
 */
public class ColumnValues extends ArrayList<String> {

    public ColumnValues() {
        super();
    }

    public ColumnValues(Collection<String> values) {
        super(values);
    }

    public static ColumnValues of(String... values) {
        return new ColumnValues(Arrays.asList(values));
    }
}
