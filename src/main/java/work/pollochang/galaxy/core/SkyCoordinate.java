package work.pollochang.galaxy.core;

/**
 * 天球座標 (度)。
 */
public record SkyCoordinate(double ra, double dec) {

    /**
     * ra 必須落在 [0, 360)，dec 必須落在 [-90, 90]。NaN 一律視為無效。
     */
    public static boolean isValid(double ra, double dec) {
        return ra >= 0 && ra < 360 && dec >= -90 && dec <= 90;
    }
}
