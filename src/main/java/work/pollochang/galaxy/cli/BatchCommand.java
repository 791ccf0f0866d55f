package work.pollochang.galaxy.cli;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import work.pollochang.galaxy.batch.BatchInputReader;
import work.pollochang.galaxy.batch.BatchResultWriter;
import work.pollochang.galaxy.batch.CoordinateBatch;
import work.pollochang.galaxy.batch.CutoutBatch;
import work.pollochang.galaxy.batch.LoggingProgressReporter;
import work.pollochang.galaxy.batch.ProgressListener;
import work.pollochang.galaxy.cache.CachedResolution;
import work.pollochang.galaxy.cache.CoordinateKey;
import work.pollochang.galaxy.cache.H2ResolutionCache;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.exception.InvalidInputException;
import work.pollochang.galaxy.report.BatchResult;
import work.pollochang.galaxy.report.GalaxyRecordWriter;
import work.pollochang.galaxy.tools.FileTools;

import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "batch", mixinStandardHelpOptions = true, description = "批次將 CSV 中的座標解析為最近的星系，可選擇一併下載影像。")
public class BatchCommand implements Callable<Integer> {

    static final String RESULT_FILE = "batch-result.csv";

    @Mixin
    private ServiceOptions services;

    @Option(names = {"-f", "--file"}, required = true, description = "含座標的 CSV 檔案 (需有標題列)。")
    private File inputFile;

    @Option(names = {"-o", "--output-dir"}, required = true, description = "結果輸出目錄。")
    private File outputDir;

    @Option(names = {"--ra-column"}, defaultValue = "ra", description = "赤經欄位名稱 (預設: ra)。")
    private String raColumn;

    @Option(names = {"--dec-column"}, defaultValue = "dec", description = "赤緯欄位名稱 (預設: dec)。")
    private String decColumn;

    @Option(names = {"-r", "--max-radius"}, defaultValue = "8.0", description = "最大搜尋半徑(角分) (預設: 8.0)。")
    private double maxRadius;

    @Option(names = {"-w", "--workers"}, defaultValue = "16", description = "座標解析的執行緒數量 (預設: 16)。")
    private int workers;

    @Option(names = {"--progress"}, description = "每完成 10% 記錄一次進度。")
    private boolean progress;

    @Option(names = {"--fetch-images"}, description = "解析後一併下載找到的星系影像。")
    private boolean fetchImages;

    @Option(names = {"--image-workers"}, defaultValue = "4", description = "下載影像時同時處理的星系數 (預設: 4)。")
    private int imageWorkers;

    @Option(names = {"-b", "--bands"}, defaultValue = "ugriz", description = "下載影像時的波段 (預設: ugriz)。")
    private String bands;

    @Option(names = {"--cache-db"}, description = "H2 座標解析快取資料庫的檔案路徑，不指定則不使用快取。")
    private File cacheDb;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "設定執行時間超時(小時) (預設: 24 小時)。")
    private long timeOutHr;

    @Override
    public Integer call() {
        // 所有輸入檢查在任何網路請求之前完成
        Set<Band> selection = Band.parseSelection(bands);
        if (!(maxRadius > 0)) {
            throw new InvalidInputException("最大搜尋半徑必須大於 0: " + maxRadius);
        }
        if (workers < 1 || imageWorkers < 1) {
            throw new InvalidInputException("執行緒數量必須至少為 1: --workers=" + workers + ", --image-workers=" + imageWorkers);
        }
        if (timeOutHr < 1) {
            throw new InvalidInputException("超時時間必須至少為 1 小時: --timeOut=" + timeOutHr);
        }
        List<SkyCoordinate> coordinates = new BatchInputReader(raColumn, decColumn).read(inputFile.toPath());

        log.info("========================================批次程式參數設定========================================");
        log.info("座標檔案: {} ({} 列)", inputFile.getAbsolutePath(), coordinates.size());
        log.info("座標欄位: {} / {}", raColumn, decColumn);
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("最大搜尋半徑: {}'", maxRadius);
        log.info("解析執行緒數量: {}", workers);
        log.info("下載影像: {}", fetchImages ? "是, 波段 " + selection : "否");
        log.info("解析快取資料庫: {}", cacheDb == null ? "不使用" : cacheDb.getAbsolutePath());
        log.info("設定超時執行時間: {} 小時", timeOutHr);
        services.logSettings();
        log.info("========================================批次程式參數設定========================================");

        Path outputPath = outputDir.toPath();
        FileTools.ensureDirectoryExists(outputPath);
        Duration timeOut = Duration.ofHours(timeOutHr);

        CoordinateBatch coordinateBatch = new CoordinateBatch(services.resolver());
        coordinateBatch.setMaxSearchRadius(maxRadius);
        coordinateBatch.setWorkerCount(workers);
        coordinateBatch.setTimeOut(timeOut);
        coordinateBatch.setProgressListener(progressListener());

        BatchResult result;
        if (cacheDb == null) {
            result = coordinateBatch.execute(coordinates);
        } else {
            try (H2ResolutionCache h2 = new H2ResolutionCache(cacheDb.toPath())) {
                h2.initSchema();
                Map<CoordinateKey, CachedResolution> cache = h2.loadAllToMap();
                coordinateBatch.setCache(cache);
                result = coordinateBatch.execute(coordinates);
                h2.saveAllFromMap(cache);
            }
        }

        Path resultFile = outputPath.resolve(RESULT_FILE);
        new BatchResultWriter().write(result, resultFile);

        if (fetchImages) {
            CutoutBatch cutoutBatch = new CutoutBatch(services.galaxyFetcher(), new GalaxyRecordWriter(outputPath));
            cutoutBatch.setBands(selection);
            cutoutBatch.setWorkerCount(imageWorkers);
            cutoutBatch.setTimeOut(timeOut);
            cutoutBatch.setProgressListener(progressListener());
            cutoutBatch.execute(result);
        }
        return 0;
    }

    private ProgressListener progressListener() {
        return progress ? new LoggingProgressReporter() : ProgressListener.NONE;
    }
}
