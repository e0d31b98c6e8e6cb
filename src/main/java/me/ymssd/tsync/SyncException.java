package me.ymssd.tsync;

import lombok.Getter;

/**
 * A synchronization run failed.
 *
 * @author denghui
 * @create 2018/10/10
 */
@Getter
public class SyncException extends RuntimeException {

    private final String tableId;

    public SyncException(String tableId, Throwable cause) {
        super(tableId == null ? "sync failed" : "sync of table " + tableId + " failed", cause);
        this.tableId = tableId;
    }
}
