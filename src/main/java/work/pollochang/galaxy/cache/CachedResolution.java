package work.pollochang.galaxy.cache;

import java.util.OptionalLong;

/**
 * 快取的 Value：座標解析結果，找不到也會被快取。
 */
public record CachedResolution(boolean found, long objectId) {

    public static CachedResolution of(OptionalLong objectId) {
        return objectId.isPresent() ? new CachedResolution(true, objectId.getAsLong()) : new CachedResolution(false, 0L);
    }

    public OptionalLong toOptional() {
        return found ? OptionalLong.of(objectId) : OptionalLong.empty();
    }
}
