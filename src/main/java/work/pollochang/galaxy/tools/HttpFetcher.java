package work.pollochang.galaxy.tools;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.exception.TransportException;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Duration;

/**
 * HTTP GET 下載工具，所有連線都有連線/讀取逾時，失敗時以 resilience4j 重試。
 */
@Slf4j
public class HttpFetcher {

    private final int connectTimeoutMs;
    private final int readTimeoutMs;
    private final Retry retry;

    /**
     * @param connectTimeout 連線逾時
     * @param readTimeout    讀取逾時
     * @param maxAttempts    最多嘗試次數 (含第一次)
     * @param retryWait      重試間隔
     */
    public HttpFetcher(Duration connectTimeout, Duration readTimeout, int maxAttempts, Duration retryWait) {
        this.connectTimeoutMs = (int) connectTimeout.toMillis();
        this.readTimeoutMs = (int) readTimeout.toMillis();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(Math.max(1, maxAttempts))
                .waitDuration(retryWait)
                .retryOnException(HttpFetcher::isRetryable)
                .build();
        this.retry = Retry.of("http-fetcher", config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("HTTP 請求失敗，第 {} 次重試: {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "-" : event.getLastThrowable().getMessage()));
    }

    /**
     * 下載整個回應內容。
     *
     * @param url 目標網址
     * @return 回應位元組
     * @throws TransportException 重試用盡後仍失敗
     */
    public byte[] get(String url) {
        try {
            return retry.executeCallable(() -> getOnce(url));
        } catch (HttpStatusException e) {
            throw new TransportException("HTTP " + e.getStatus() + ": " + url, e);
        } catch (IOException e) {
            throw new TransportException("下載失敗: " + url, e);
        } catch (Exception e) {
            throw new TransportException("下載時發生未預期錯誤: " + url, e);
        }
    }

    private byte[] getOnce(String url) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) new URL(url).openConnection();
        connection.setRequestMethod("GET");
        connection.setConnectTimeout(connectTimeoutMs);
        connection.setReadTimeout(readTimeoutMs);
        try {
            int status = connection.getResponseCode();
            if (status != HttpURLConnection.HTTP_OK) {
                throw new HttpStatusException(status, url);
            }
            try (InputStream in = connection.getInputStream()) {
                byte[] body = in.readAllBytes();
                log.debug("{} - 下載完成 ({})", url, FileTools.formatFileSize(body.length));
                return body;
            }
        } finally {
            connection.disconnect();
        }
    }

    /**
     * 4xx 回應重試也不會成功，其餘 I/O 錯誤都重試。
     */
    static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof HttpStatusException) {
            return ((HttpStatusException) throwable).getStatus() >= 500;
        }
        return throwable instanceof IOException;
    }

    /**
     * 非 200 回應。
     */
    public static class HttpStatusException extends IOException {
        private final int status;

        public HttpStatusException(int status, String url) {
            super("HTTP " + status + " - " + url);
            this.status = status;
        }

        public int getStatus() {
            return status;
        }
    }
}
