package me.ymssd.tsync;

/**
 * Raised at a check point once the run has been aborted.
 *
 * @author denghui
 * @create 2018/10/10
 */
public class SyncAbortedException extends RuntimeException {

    public SyncAbortedException() {
        super("sync aborted");
    }
}
