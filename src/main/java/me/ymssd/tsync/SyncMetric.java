package me.ymssd.tsync;

import static java.time.Instant.ofEpochMilli;
import static java.time.LocalDateTime.ofInstant;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

/**
 * @author denghui
 * @create 2018/10/12
 */
@Data
@Slf4j
public class SyncMetric {
    private static final DateTimeFormatter YMDHMS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private long startTime;
    private long endTime;
    private AtomicLong tablesCompleted = new AtomicLong(0);
    private AtomicLong hashCommands = new AtomicLong(0);
    private AtomicLong rangesBorrowed = new AtomicLong(0);
    private AtomicLong rowsCommands = new AtomicLong(0);
    private AtomicLong rowsRetrieved = new AtomicLong(0);

    public void printMetric() {
        ZoneId zoneId = ZoneId.systemDefault();
        log.info("-->startTime:{}", YMDHMS.format(ofInstant(ofEpochMilli(startTime), zoneId)));
        log.info("-->endTime:{}", YMDHMS.format(ofInstant(ofEpochMilli(endTime), zoneId)));
        log.info("-->tablesCompleted:{}", tablesCompleted);
        log.info("-->hashCommands:{}", hashCommands);
        log.info("-->rangesBorrowed:{}", rangesBorrowed);
        log.info("-->rowsCommands:{}", rowsCommands);
        log.info("-->rowsRetrieved:{}", rowsRetrieved);
    }
}
