package work.pollochang.galaxy.catalog;

import java.util.Objects;

/**
 * 隨機挑選星系時的品質條件。
 * @param window 搜尋範圍
 * @param requireClean 是否要求 clean 旗標
 * @param minAngularSize r 波段 Petrosian 半徑下限 (角秒)
 * @param requireValidErrors 是否要求 Petrosian 半徑誤差為正值
 */
public record SearchConstraints(SkyWindow window, boolean requireClean, double minAngularSize, boolean requireValidErrors) {

    public SearchConstraints {
        Objects.requireNonNull(window, "window must not be null");
    }

    public static SearchConstraints defaults(SkyWindow window) {
        return new SearchConstraints(window, true, 5.0, true);
    }
}
