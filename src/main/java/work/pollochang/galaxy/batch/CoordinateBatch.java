package work.pollochang.galaxy.batch;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.cache.CachedResolution;
import work.pollochang.galaxy.cache.CoordinateKey;
import work.pollochang.galaxy.catalog.CatalogResolver;
import work.pollochang.galaxy.catalog.Target;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.exception.InvalidInputException;
import work.pollochang.galaxy.exception.TransportException;
import work.pollochang.galaxy.report.BatchResult;
import work.pollochang.galaxy.report.ResolutionStatus;
import work.pollochang.galaxy.report.RowReport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 批次將座標解析為物件編號。
 * <p>
 * 每一列各自在固定大小的執行緒池中解析，結果依輸入列序號存放；任何一列失敗只記錄在該列，不影響其他列。
 * 執行緒池在 {@link #execute} 內建立並在回傳前關閉。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Setter
@Slf4j
public class CoordinateBatch {

    private final CatalogResolver resolver;

    private double maxSearchRadius = Target.DEFAULT_MAX_RADIUS_ARCMIN;
    private int workerCount = 16;
    private Duration timeOut = Duration.ofHours(24);
    private ProgressListener progressListener = ProgressListener.NONE;
    /** 座標解析快取，null 表示不使用 */
    private Map<CoordinateKey, CachedResolution> cache;

    public CoordinateBatch(CatalogResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public BatchResult execute(List<SkyCoordinate> coordinates) {
        Objects.requireNonNull(coordinates, "coordinates must not be null");
        if (!(maxSearchRadius > 0)) {
            throw new InvalidInputException("最大搜尋半徑必須大於 0: " + maxSearchRadius);
        }
        if (workerCount < 1) {
            throw new InvalidInputException("執行緒數量必須至少為 1: " + workerCount);
        }

        int total = coordinates.size();
        RowReport[] slots = new RowReport[total];
        AtomicInteger processed = new AtomicInteger(0);

        int poolSize = Math.max(1, Math.min(workerCount, total));
        log.info("座標批次開始: {} 列, 最大搜尋半徑 {}', {} 條執行緒", total, maxSearchRadius, poolSize);

        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Future<RowReport>> futures = new ArrayList<>(total);
            for (int i = 0; i < total; i++) {
                final int index = i;
                final SkyCoordinate coordinate = coordinates.get(i);
                futures.add(executor.submit(() -> resolveRow(index, coordinate, processed, total)));
            }
            log.info("所有任務已提交，等待處理完成...");

            long deadline = System.nanoTime() + timeOut.toNanos();
            for (int i = 0; i < total; i++) {
                slots[i] = await(i, coordinates.get(i), futures.get(i), deadline);
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

        BatchResult result = new BatchResult(Arrays.asList(slots));
        report(result);
        return result;
    }

    private RowReport resolveRow(int index, SkyCoordinate coordinate, AtomicInteger processed, int total) {
        try {
            CoordinateKey key = new CoordinateKey(coordinate.ra(), coordinate.dec(), maxSearchRadius);
            CachedResolution cached = cache == null ? null : cache.get(key);

            OptionalLong objectId;
            if (cached != null) {
                log.debug("第 {} 列 ({}, {}) - 使用快取", index, coordinate.ra(), coordinate.dec());
                objectId = cached.toOptional();
            } else {
                objectId = resolver.resolveNearest(coordinate.ra(), coordinate.dec(), maxSearchRadius);
                if (cache != null) {
                    cache.put(key, CachedResolution.of(objectId));
                }
            }

            if (objectId.isPresent()) {
                return RowReport.found(index, coordinate, objectId.getAsLong());
            }
            return RowReport.notFound(index, coordinate);
        } catch (TransportException e) {
            log.warn("第 {} 列 ({}, {}) - 網路錯誤: {}", index, coordinate.ra(), coordinate.dec(), e.getMessage());
            return RowReport.failed(index, coordinate, ResolutionStatus.FAILED_TRANSPORT, e.getMessage());
        } catch (RuntimeException e) {
            log.error("第 {} 列 ({}, {}) - 處理時發生未知錯誤", index, coordinate.ra(), coordinate.dec(), e);
            return RowReport.failed(index, coordinate, ResolutionStatus.FAILED_UNKNOWN, String.valueOf(e.getMessage()));
        } finally {
            progressListener.onProgress(processed.incrementAndGet(), total);
        }
    }

    private RowReport await(int index, SkyCoordinate coordinate, Future<RowReport> future, long deadline) {
        long remaining = Math.max(0, deadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("第 {} 列 ({}, {}) - 超過批次時間上限 {}", index, coordinate.ra(), coordinate.dec(), timeOut);
            return RowReport.failed(index, coordinate, ResolutionStatus.FAILED_TIMEOUT, "超過批次時間上限 " + timeOut);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("第 {} 列 ({}, {}) - 任務異常結束", index, coordinate.ra(), coordinate.dec(), cause);
            return RowReport.failed(index, coordinate, ResolutionStatus.FAILED_UNKNOWN, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return RowReport.failed(index, coordinate, ResolutionStatus.FAILED_UNKNOWN, "被中斷");
        }
    }

    private void report(BatchResult result) {
        Map<ResolutionStatus, Long> counts = result.countsByStatus();
        long failed = counts.entrySet().stream()
                .filter(e -> e.getKey().isFailure())
                .mapToLong(Map.Entry::getValue)
                .sum();
        log.info("========================================座標解析報告========================================");
        log.info(" 總計: {}, 找到: {}, 無星系: {}, 失敗: {}",
                result.total(), result.foundCount(), counts.get(ResolutionStatus.NOT_FOUND), failed);
        counts.forEach((status, count) -> {
            if (status.isFailure() && count > 0) {
                log.info(" {}: {}", status.getDescription(), count);
            }
        });
        log.info("========================================座標解析報告========================================");
    }
}
