package work.pollochang.galaxy;

import org.junit.jupiter.api.Test;
import work.pollochang.galaxy.catalog.CatalogResolver;
import work.pollochang.galaxy.catalog.ImagingMetadataFetcher;
import work.pollochang.galaxy.catalog.SearchConstraints;
import work.pollochang.galaxy.catalog.SkyWindow;
import work.pollochang.galaxy.catalog.Target;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.BandImage;
import work.pollochang.galaxy.core.GalaxyRecord;
import work.pollochang.galaxy.exception.NotFoundException;
import work.pollochang.galaxy.exception.TransportException;
import work.pollochang.galaxy.imaging.FrameSource;
import work.pollochang.galaxy.imaging.MultiBandFetcher;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GalaxyFetcherTest {

    private static GalaxyFetcher fetcher(StubSky sky, FrameSource frames) {
        return new GalaxyFetcher(new CatalogResolver(sky), new ImagingMetadataFetcher(sky), null,
                new MultiBandFetcher(frames, Duration.ofSeconds(10)));
    }

    @Test
    void testFetchByCoordinate() {
        StubSky sky = new StubSky();

        GalaxyRecord record = fetcher(sky, sky).fetch(Target.ofCoordinate(12.3, 20), EnumSet.allOf(Band.class));

        assertEquals(1012L, record.objectId());
        assertEquals(5, record.bands().size());
        BandImage r = record.band(Band.R).orElseThrow();
        assertEquals(100, r.width());
        assertEquals(50, r.cutout().minX());
        assertTrue(record.preview().isEmpty());
    }

    @Test
    void testFetchByObjectId_ShouldSkipSearch() {
        StubSky sky = new StubSky();

        GalaxyRecord record = fetcher(sky, sky).fetch(Target.ofObjectId(77L), EnumSet.of(Band.G));

        assertEquals(77L, record.objectId());
        assertEquals(0, sky.nearbyQueryCount());
        assertEquals(1, record.bands().size());
    }

    @Test
    void testFetchRandom() {
        StubSky sky = new StubSky();
        Target target = Target.random(SearchConstraints.defaults(new SkyWindow(100, 110, 0, 10)));

        assertEquals(4242L, fetcher(sky, sky).fetch(target).objectId());
    }

    @Test
    void testNoGalaxyNearCoordinate_ShouldThrowNotFound() {
        StubSky sky = new StubSky(Set.of(5), Set.of(), Set.of());

        assertThrows(NotFoundException.class, () -> fetcher(sky, sky).fetch(Target.ofCoordinate(5.5, 20)));
    }

    @Test
    void testFailingBand_ShouldFailTarget() {
        StubSky sky = new StubSky();
        FrameSource frames = (descriptor, band) -> {
            if (band == Band.U) {
                throw new TransportException("HTTP 404: frame-u");
            }
            return sky.load(descriptor, band);
        };

        assertThrows(TransportException.class, () -> fetcher(sky, frames).fetch(Target.ofObjectId(1L)));
    }
}
