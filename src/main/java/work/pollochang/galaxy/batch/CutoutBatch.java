package work.pollochang.galaxy.batch;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.GalaxyFetcher;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.GalaxyRecord;
import work.pollochang.galaxy.report.BatchResult;
import work.pollochang.galaxy.report.CutoutSummary;
import work.pollochang.galaxy.report.GalaxyRecordWriter;
import work.pollochang.galaxy.report.RowReport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 批次的第二階段：對解析階段找到的每一列抓取多波段裁切並輸出。
 * 單一星系失敗只記錄，不中止批次。
 */
@Setter
@Slf4j
public class CutoutBatch {

    private final GalaxyFetcher fetcher;
    private final GalaxyRecordWriter writer;

    private Set<Band> bands = EnumSet.allOf(Band.class);
    private int workerCount = 4;
    private Duration timeOut = Duration.ofHours(24);
    private ProgressListener progressListener = ProgressListener.NONE;

    public CutoutBatch(GalaxyFetcher fetcher, GalaxyRecordWriter writer) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
    }

    public CutoutSummary execute(BatchResult resolved) {
        List<RowReport> found = resolved.rows().stream().filter(RowReport::isFound).collect(Collectors.toList());
        int total = found.size();
        if (total == 0) {
            log.info("沒有找到任何星系，略過影像抓取。");
            return new CutoutSummary(0, 0, 0);
        }

        AtomicInteger processed = new AtomicInteger(0);
        int succeeded = 0;
        int poolSize = Math.max(1, Math.min(workerCount, total));
        log.info("影像抓取開始: {} 個星系, 波段 {}, {} 條執行緒", total, bands, poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<Boolean>> futures = new ArrayList<>(total);
            for (RowReport row : found) {
                futures.add(executor.submit(() -> fetchRow(row, processed, total)));
            }

            long deadline = System.nanoTime() + timeOut.toNanos();
            for (int i = 0; i < total; i++) {
                if (await(found.get(i), futures.get(i), deadline)) {
                    succeeded++;
                }
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    log.warn("執行緒池等待逾時，部分任務可能未完成。");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error("執行緒池被中斷。", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        CutoutSummary summary = new CutoutSummary(total, succeeded, total - succeeded);
        log.info("影像抓取結果 -> 總計: {}, 成功: {}, 失敗: {}", summary.attempted(), summary.succeeded(), summary.failed());
        return summary;
    }

    private boolean fetchRow(RowReport row, AtomicInteger processed, int total) {
        long objectId = row.objectId().getAsLong();
        try {
            GalaxyRecord record = fetcher.fetch(objectId, bands);
            writer.write(record);
            return true;
        } catch (RuntimeException e) {
            log.warn("第 {} 列 objid={} - 影像抓取失敗: {}", row.index(), objectId, e.getMessage());
            return false;
        } finally {
            progressListener.onProgress(processed.incrementAndGet(), total);
        }
    }

    private boolean await(RowReport row, Future<Boolean> future, long deadline) {
        long remaining = Math.max(0, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("第 {} 列 - 超過批次時間上限 {}", row.index(), timeOut);
            return false;
        } catch (ExecutionException e) {
            log.error("第 {} 列 - 任務異常結束", row.index(), e.getCause());
            return false;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
