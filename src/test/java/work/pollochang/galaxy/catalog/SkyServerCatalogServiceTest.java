package work.pollochang.galaxy.catalog;

import org.junit.jupiter.api.Test;
import work.pollochang.galaxy.exception.TransportException;
import work.pollochang.galaxy.tools.HttpFetcher;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SkyServerCatalogServiceTest {

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testParseRows() {
        List<CatalogRow> rows = SkyServerCatalogService.parseRows(bytes(
                "[{\"TableName\":\"Table1\",\"Rows\":["
                        + "{\"objid\":1237648720693755918,\"run\":756,\"camcol\":3,\"field\":206,"
                        + "\"ra\":10.5,\"dec\":-0.25,\"petroRad_r\":12.3}]}]"));

        assertEquals(1, rows.size());
        CatalogRow row = rows.get(0);
        assertEquals(1237648720693755918L, row.getLong("objid"));
        assertEquals(756, row.getInt("RUN"));
        assertEquals(12.3, row.getDouble("petrorad_r"), 1e-12);
    }

    @Test
    void testParseRows_NoRows() {
        List<CatalogRow> rows = SkyServerCatalogService.parseRows(bytes("[{\"TableName\":\"Table1\",\"Rows\":[]}]"));

        assertTrue(rows.isEmpty());
    }

    @Test
    void testParseRows_ErrorPage_ShouldThrow() {
        assertThrows(TransportException.class,
                () -> SkyServerCatalogService.parseRows(bytes("<html>SQL error</html>")));
        assertThrows(TransportException.class,
                () -> SkyServerCatalogService.parseRows(bytes("{\"error\":\"bad\"}")));
    }

    @Test
    void testMissingColumn_ShouldThrow() {
        CatalogRow row = SkyServerCatalogService.parseRows(bytes("[{\"Rows\":[{\"objid\":1}]}]")).get(0);

        assertThrows(TransportException.class, () -> row.getInt("run"));
    }

    @Test
    void testRun_ShouldCallSqlSearchEndpoint() {
        AtomicReference<String> requested = new AtomicReference<>();
        HttpFetcher http = new HttpFetcher(Duration.ofSeconds(1), Duration.ofSeconds(1), 1, Duration.ofMillis(1)) {
            @Override
            public byte[] get(String url) {
                requested.set(url);
                return bytes("[{\"TableName\":\"Table1\",\"Rows\":[{\"objid\":42}]}]");
            }
        };
        SkyServerCatalogService service = new SkyServerCatalogService("https://example.org/ws/", http);

        List<CatalogRow> rows = service.run(CatalogQuery.byObjectId(42L));

        assertEquals(42L, rows.get(0).getLong("objid"));
        assertTrue(requested.get().startsWith("https://example.org/ws/SearchTools/SqlSearch?cmd=SELECT+TOP+1"));
        assertTrue(requested.get().endsWith("&format=json"));
    }
}
