package me.ymssd.tsync.schema;

import java.util.List;

/**
 * @author denghui
 * @create 2018/10/9
 */
public final class Subdivision {

    private Subdivision() {
    }

    /**
     * A table's key space can be subdivided when it has a primary key whose leading column
     * has a type we can pick split points in.
     */
    public static boolean primaryKeySubdividable(Table table) {
        List<Column> primaryKey = table.getPrimaryKey();
        return !primaryKey.isEmpty() && primaryKey.get(0).getColumnType().isSubdividable();
    }
}
