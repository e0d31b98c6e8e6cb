package me.ymssd.tsync;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import me.ymssd.tsync.config.SyncConfig;
import me.ymssd.tsync.queue.SyncQueue;
import me.ymssd.tsync.schema.Table;
import me.ymssd.tsync.worker.RangeChecker;
import me.ymssd.tsync.worker.SyncWorker;
import org.apache.commons.lang.StringUtils;

/**
 * Runs one synchronization: queues the selected tables and works through them with a fixed
 * pool of workers.
 *
 * @author denghui
 * @create 2018/10/12
 */
@Slf4j
public class TableSync {

    private final SyncConfig syncConfig;
    private final RangeChecker rangeChecker;
    @Getter
    private final SyncQueue syncQueue;
    @Getter
    private final SyncMetric metric;

    public TableSync(SyncConfig syncConfig, RangeChecker rangeChecker) {
        Preconditions.checkNotNull(syncConfig);
        Preconditions.checkNotNull(rangeChecker);
        Preconditions.checkArgument(syncConfig.getWorkers() > 0, "workers must be positive");
        Preconditions.checkArgument(syncConfig.getInitialRowsToHash() > 0, "initialRowsToHash must be positive");
        this.syncConfig = syncConfig;
        this.rangeChecker = rangeChecker;
        this.syncQueue = new SyncQueue(syncConfig.getWorkers());
        this.metric = new SyncMetric();
    }

    public SyncMetric run(List<Table> tables) {
        Preconditions.checkNotNull(tables);
        List<Table> selected = tables.stream()
            .filter(syncConfig::isSelected)
            .collect(Collectors.toList());
        log.info("syncing {} of {} tables with {} workers", selected.size(), tables.size(), syncConfig.getWorkers());

        metric.setStartTime(System.currentTimeMillis());
        String snapshot = syncConfig.getSnapshot();
        if (StringUtils.isBlank(snapshot)) {
            snapshot = "snapshot-" + metric.getStartTime();
        }
        syncQueue.setSnapshot(snapshot);
        syncQueue.enqueueTablesToProcess(selected);

        ThreadFactoryBuilder builder = new ThreadFactoryBuilder();
        builder.setNameFormat("sync-worker-%d");
        ExecutorService workerExecutor = Executors.newFixedThreadPool(syncConfig.getWorkers(), builder.build());
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < syncConfig.getWorkers(); i++) {
                SyncWorker worker = new SyncWorker(syncQueue, rangeChecker, metric, syncConfig.getInitialRowsToHash());
                futures.add(CompletableFuture.runAsync(worker, workerExecutor));
            }
            RuntimeException failure = awaitWorkers(futures);
            if (failure != null) {
                throw failure;
            }
        } finally {
            workerExecutor.shutdown();
            metric.setEndTime(System.currentTimeMillis());
            metric.printMetric();
        }
        return metric;
    }

    public boolean abort() {
        return syncQueue.abort();
    }

    /**
     * Waits for every worker and picks the failure to report: the error that made a worker abort
     * the run wins over the cancellations it caused in the others.
     */
    private RuntimeException awaitWorkers(List<CompletableFuture<Void>> futures) {
        RuntimeException failure = null;
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException
                    ? (RuntimeException) e.getCause() : new SyncException(null, e.getCause());
                if (failure == null || (failure instanceof SyncAbortedException && !(cause instanceof SyncAbortedException))) {
                    failure = cause;
                }
            }
        }
        return failure;
    }
}
