package work.pollochang.galaxy.cli;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine.Option;
import work.pollochang.galaxy.GalaxyFetcher;
import work.pollochang.galaxy.catalog.CatalogResolver;
import work.pollochang.galaxy.catalog.CatalogService;
import work.pollochang.galaxy.catalog.ImagingMetadataFetcher;
import work.pollochang.galaxy.catalog.SkyServerCatalogService;
import work.pollochang.galaxy.imaging.MultiBandFetcher;
import work.pollochang.galaxy.imaging.PreviewFetcher;
import work.pollochang.galaxy.imaging.SdssFrameArchive;
import work.pollochang.galaxy.tools.HttpFetcher;

import java.time.Duration;

/**
 * 各子命令共用的遠端服務設定，並負責組裝服務物件。
 */
@Slf4j
public class ServiceOptions {

    @Option(names = {"--catalog-url"}, defaultValue = SkyServerCatalogService.DEFAULT_BASE_URL,
            description = "SkyServer 目錄查詢服務位址 (預設: ${DEFAULT-VALUE})。")
    private String catalogUrl;

    @Option(names = {"--frame-url"}, defaultValue = SdssFrameArchive.DEFAULT_BASE_URL,
            description = "SDSS frame 檔案庫位址 (預設: ${DEFAULT-VALUE})。")
    private String frameUrl;

    @Option(names = {"--rerun"}, defaultValue = "301", description = "frame 的 rerun 編號 (預設: 301)。")
    private int rerun;

    @Option(names = {"--preview-url"}, defaultValue = PreviewFetcher.DEFAULT_BASE_URL,
            description = "預覽圖服務位址 (預設: ${DEFAULT-VALUE})。")
    private String previewUrl;

    @Option(names = {"--no-preview"}, description = "不下載預覽圖。")
    private boolean noPreview;

    @Option(names = {"--connect-timeout"}, defaultValue = "10", description = "HTTP 連線逾時(秒) (預設: 10)。")
    private long connectTimeoutSec;

    @Option(names = {"--read-timeout"}, defaultValue = "60", description = "HTTP 讀取逾時(秒) (預設: 60)。")
    private long readTimeoutSec;

    @Option(names = {"--retry-attempts"}, defaultValue = "3", description = "HTTP 請求最多嘗試次數 (預設: 3)。")
    private int retryAttempts;

    @Option(names = {"--retry-wait"}, defaultValue = "500", description = "HTTP 重試間隔(毫秒) (預設: 500)。")
    private long retryWaitMs;

    @Option(names = {"--band-timeout"}, defaultValue = "300", description = "單一星系多波段抓取的時間上限(秒) (預設: 300)。")
    private long bandTimeoutSec;

    private HttpFetcher http;

    public HttpFetcher httpFetcher() {
        if (http == null) {
            http = new HttpFetcher(Duration.ofSeconds(connectTimeoutSec), Duration.ofSeconds(readTimeoutSec),
                    retryAttempts, Duration.ofMillis(retryWaitMs));
        }
        return http;
    }

    public CatalogService catalogService() {
        return new SkyServerCatalogService(catalogUrl, httpFetcher());
    }

    public CatalogResolver resolver() {
        return new CatalogResolver(catalogService());
    }

    public GalaxyFetcher galaxyFetcher() {
        CatalogService catalog = catalogService();
        PreviewFetcher previewFetcher = noPreview ? null : new PreviewFetcher(previewUrl, httpFetcher());
        MultiBandFetcher multiBandFetcher = new MultiBandFetcher(
                new SdssFrameArchive(frameUrl, rerun, httpFetcher()), Duration.ofSeconds(bandTimeoutSec));
        return new GalaxyFetcher(new CatalogResolver(catalog), new ImagingMetadataFetcher(catalog),
                previewFetcher, multiBandFetcher);
    }

    public void logSettings() {
        log.info("目錄服務: {}", catalogUrl);
        log.info("frame 檔案庫: {} (rerun {})", frameUrl, rerun);
        log.info("預覽圖服務: {}", noPreview ? "不下載" : previewUrl);
        log.info("HTTP 逾時: 連線 {} 秒, 讀取 {} 秒, 最多嘗試 {} 次", connectTimeoutSec, readTimeoutSec, retryAttempts);
        log.info("多波段抓取時間上限: {} 秒", bandTimeoutSec);
    }
}
