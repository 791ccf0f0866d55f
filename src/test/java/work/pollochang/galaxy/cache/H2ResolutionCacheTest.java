package work.pollochang.galaxy.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;

class H2ResolutionCacheTest {

    @Test
    void testSaveAndReload(@TempDir Path tempDir) {
        Path db = tempDir.resolve("resolution-cache");
        Map<CoordinateKey, CachedResolution> saved = new HashMap<>();
        saved.put(new CoordinateKey(83.63, 22.01, 8), CachedResolution.of(OptionalLong.of(1237648720693755918L)));
        saved.put(new CoordinateKey(10.0, -5.5, 8), CachedResolution.of(OptionalLong.empty()));

        try (H2ResolutionCache cache = new H2ResolutionCache(db)) {
            cache.initSchema();
            assertTrue(cache.loadAllToMap().isEmpty());
            cache.saveAllFromMap(saved);
        }

        try (H2ResolutionCache cache = new H2ResolutionCache(db)) {
            cache.initSchema();
            Map<CoordinateKey, CachedResolution> loaded = cache.loadAllToMap();

            assertEquals(saved, loaded);
            assertEquals(OptionalLong.empty(), loaded.get(new CoordinateKey(10.0, -5.5, 8)).toOptional());
        }
    }

    @Test
    void testSaveTwice_ShouldUpdateInPlace(@TempDir Path tempDir) {
        Path db = tempDir.resolve("resolution-cache");
        CoordinateKey key = new CoordinateKey(1, 2, 4);

        try (H2ResolutionCache cache = new H2ResolutionCache(db)) {
            cache.initSchema();
            cache.saveAllFromMap(Map.of(key, CachedResolution.of(OptionalLong.empty())));
            cache.saveAllFromMap(Map.of(key, CachedResolution.of(OptionalLong.of(9L))));

            Map<CoordinateKey, CachedResolution> loaded = cache.loadAllToMap();
            assertEquals(1, loaded.size());
            assertEquals(OptionalLong.of(9L), loaded.get(key).toOptional());
        }
    }
}
