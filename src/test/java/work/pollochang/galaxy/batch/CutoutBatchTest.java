package work.pollochang.galaxy.batch;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.galaxy.GalaxyFetcher;
import work.pollochang.galaxy.StubSky;
import work.pollochang.galaxy.catalog.CatalogResolver;
import work.pollochang.galaxy.catalog.ImagingMetadataFetcher;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.SkyCoordinate;
import work.pollochang.galaxy.imaging.MultiBandFetcher;
import work.pollochang.galaxy.report.BatchResult;
import work.pollochang.galaxy.report.CutoutSummary;
import work.pollochang.galaxy.report.GalaxyRecordWriter;
import work.pollochang.galaxy.report.ResolutionStatus;
import work.pollochang.galaxy.report.RowReport;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CutoutBatchTest {

    @Test
    void testOnlyFoundRowsAreFetched_FailuresAreCounted(@TempDir Path tempDir) {
        StubSky sky = new StubSky(Set.of(), Set.of(), Set.of(1002L));
        GalaxyFetcher fetcher = new GalaxyFetcher(new CatalogResolver(sky), new ImagingMetadataFetcher(sky), null,
                new MultiBandFetcher(sky, Duration.ofSeconds(10)));
        SkyCoordinate c = new SkyCoordinate(10, 20);
        BatchResult resolved = new BatchResult(List.of(
                RowReport.found(0, c, 1001L),
                RowReport.notFound(1, c),
                RowReport.found(2, c, 1002L),
                RowReport.failed(3, c, ResolutionStatus.FAILED_TRANSPORT, "HTTP 503")));

        CutoutBatch batch = new CutoutBatch(fetcher, new GalaxyRecordWriter(tempDir));
        batch.setBands(EnumSet.of(Band.G, Band.R));
        batch.setWorkerCount(2);
        CutoutSummary summary = batch.execute(resolved);

        assertEquals(new CutoutSummary(2, 1, 1), summary);
        assertTrue(Files.exists(tempDir.resolve("1001").resolve("g.fits")));
        assertTrue(Files.exists(tempDir.resolve("1001").resolve("r.fits")));
        assertFalse(Files.exists(tempDir.resolve("1001").resolve("u.fits")));
        assertTrue(Files.exists(tempDir.resolve("1001").resolve("info.txt")));
        assertFalse(Files.exists(tempDir.resolve("1002")));
    }

    @Test
    void testNothingFound_ShouldDoNothing(@TempDir Path tempDir) {
        StubSky sky = new StubSky();
        GalaxyFetcher fetcher = new GalaxyFetcher(new CatalogResolver(sky), new ImagingMetadataFetcher(sky), null,
                new MultiBandFetcher(sky, Duration.ofSeconds(10)));
        BatchResult resolved = new BatchResult(List.of(RowReport.notFound(0, new SkyCoordinate(1, 2))));

        CutoutSummary summary = new CutoutBatch(fetcher, new GalaxyRecordWriter(tempDir)).execute(resolved);

        assertEquals(new CutoutSummary(0, 0, 0), summary);
        assertTrue(sky.queries.isEmpty());
    }
}
