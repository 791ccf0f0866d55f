package work.pollochang.galaxy.tools;

import org.junit.jupiter.api.Test;
import work.pollochang.galaxy.exception.TransportException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpFetcherTest {

    @Test
    void testIsRetryable() {
        assertTrue(HttpFetcher.isRetryable(new HttpFetcher.HttpStatusException(503, "u")));
        assertTrue(HttpFetcher.isRetryable(new SocketTimeoutException("read timed out")));
        assertTrue(HttpFetcher.isRetryable(new IOException("reset")));
        assertFalse(HttpFetcher.isRetryable(new HttpFetcher.HttpStatusException(404, "u")));
        assertFalse(HttpFetcher.isRetryable(new IllegalStateException("bug")));
    }

    @Test
    void testUnreachableHost_ShouldSurfaceAsTransportException() {
        HttpFetcher http = new HttpFetcher(Duration.ofMillis(500), Duration.ofMillis(500), 2, Duration.ofMillis(10));

        TransportException e = assertThrows(TransportException.class, () -> http.get("http://127.0.0.1:1/nothing"));
        assertTrue(e.getMessage().contains("127.0.0.1:1"));
    }
}
