package me.ymssd.tsync.schema;

/**
 * @author denghui
 * @create 2018/10/9
 */
public enum ColumnType {
    SINT(true),
    UINT(true),
    DECIMAL(true),
    REAL(false),
    BOOL(false),
    DATE(false),
    TIME(false),
    DATETIME(false),
    TEXT(true),
    BLOB(false),
    UNKNOWN(false);

    private final boolean subdividable;

    ColumnType(boolean subdividable) {
        this.subdividable = subdividable;
    }

    /**
     * Whether a key space ordered by this type can be split at arbitrary interior values.
     */
    public boolean isSubdividable() {
        return subdividable;
    }
}
