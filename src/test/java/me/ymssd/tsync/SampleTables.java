package me.ymssd.tsync;

import me.ymssd.tsync.schema.Column;
import me.ymssd.tsync.schema.ColumnType;
import me.ymssd.tsync.schema.Table;

/**
 * Catalog fixtures shared by tests.
 */
public final class SampleTables {

    private SampleTables() {
    }

    public static Table keyedByInt(String name) {
        return new Table("public", name)
            .addPrimaryKeyColumn(new Column("id", ColumnType.SINT))
            .addColumn(new Column("payload", ColumnType.TEXT));
    }

    public static Table keyedByBlob(String name) {
        return new Table("public", name)
            .addPrimaryKeyColumn(new Column("digest", ColumnType.BLOB))
            .addColumn(new Column("payload", ColumnType.TEXT));
    }

    public static Table withoutPrimaryKey(String name) {
        return new Table("public", name)
            .addColumn(new Column("payload", ColumnType.TEXT));
    }
}
