package work.pollochang.galaxy.imaging;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.BandImage;
import work.pollochang.galaxy.core.BandOutcome;
import work.pollochang.galaxy.core.CutoutGeometry;
import work.pollochang.galaxy.core.CutoutSpec;
import work.pollochang.galaxy.core.ImagingDescriptor;
import work.pollochang.galaxy.tools.ImageTools;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 同時抓取多個波段的 frame 並裁切。
 * <p>
 * 每次呼叫建立自己的執行緒池 (最多 5 條)，回傳前一定關閉並等待所有執行緒結束。
 * 結果依波段存放，輸出順序固定為 u,g,r,i,z，與完成先後無關。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class MultiBandFetcher {

    static final int MAX_WORKERS = 5;

    private final FrameSource frameSource;
    private final Duration timeout;

    /**
     * @param frameSource frame 來源
     * @param timeout     整個多波段抓取的時間上限，超過的波段記為失敗
     */
    public MultiBandFetcher(FrameSource frameSource, Duration timeout) {
        this.frameSource = Objects.requireNonNull(frameSource, "frameSource must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    public List<BandOutcome> fetch(ImagingDescriptor descriptor) {
        return fetch(descriptor, EnumSet.allOf(Band.class));
    }

    /**
     * 抓取指定波段。
     *
     * @param descriptor 成像資訊
     * @param bands      要抓的波段
     * @return 每個波段一筆結果，依 u,g,r,i,z 排序
     */
    public List<BandOutcome> fetch(ImagingDescriptor descriptor, Set<Band> bands) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("bands must not be empty");
        }
        Set<Band> ordered = EnumSet.copyOf(bands);

        int workers = Math.min(MAX_WORKERS, ordered.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        Map<Band, Future<BandImage>> futures = new EnumMap<>(Band.class);
        Map<Band, BandOutcome> outcomes = new EnumMap<>(Band.class);
        try {
            for (Band band : ordered) {
                futures.put(band, executor.submit(() -> fetchBand(descriptor, band)));
            }

            long deadline = System.nanoTime() + timeout.toNanos();
            for (Map.Entry<Band, Future<BandImage>> entry : futures.entrySet()) {
                Band band = entry.getKey();
                outcomes.put(band, await(descriptor, band, entry.getValue(), deadline));
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("objid={} - 波段執行緒池等待逾時，強制中止。", descriptor.objectId());
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        List<BandOutcome> result = new ArrayList<>(outcomes.values());
        long failed = result.stream().filter(o -> !o.succeeded()).count();
        log.info("objid={} - 波段抓取完成: {} 成功, {} 失敗", descriptor.objectId(), result.size() - failed, failed);
        return result;
    }

    private BandOutcome await(ImagingDescriptor descriptor, Band band, Future<BandImage> future, long deadline) {
        long remaining = Math.max(0, deadline - System.nanoTime());
        try {
            return BandOutcome.success(future.get(remaining, TimeUnit.NANOSECONDS));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("objid={} {} - 波段抓取失敗: {}", descriptor.objectId(), band, cause.getMessage());
            return BandOutcome.failure(band, cause.getMessage());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("objid={} {} - 波段抓取逾時 ({})", descriptor.objectId(), band, timeout);
            return BandOutcome.failure(band, "逾時 " + timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return BandOutcome.failure(band, "被中斷");
        }
    }

    private BandImage fetchBand(ImagingDescriptor descriptor, Band band) {
        Frame frame = frameSource.load(descriptor, band);
        CutoutSpec spec = CutoutGeometry.compute(descriptor.ra(), descriptor.dec(), descriptor.angularSize(), frame.transform());
        float[][] pixels = ImageTools.crop(frame.pixels(), spec);
        log.debug("objid={} {} - 裁切 {} -> {}x{}", descriptor.objectId(), band, spec,
                pixels.length == 0 ? 0 : pixels[0].length, pixels.length);
        return new BandImage(band, spec, pixels);
    }
}
