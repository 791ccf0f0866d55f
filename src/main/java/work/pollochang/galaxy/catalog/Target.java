package work.pollochang.galaxy.catalog;

import java.util.Objects;

/**
 * 要解析的目標：明確的物件編號、隨機條件，或座標加最大搜尋半徑。
 */
public record Target(Kind kind, long objectId, double ra, double dec, double maxRadiusArcmin,
                     SearchConstraints constraints) {

    public static final double DEFAULT_MAX_RADIUS_ARCMIN = 8.0;

    public enum Kind { OBJECT_ID, RANDOM, COORDINATE }

    public static Target ofObjectId(long objectId) {
        return new Target(Kind.OBJECT_ID, objectId, Double.NaN, Double.NaN, Double.NaN, null);
    }

    public static Target random(SearchConstraints constraints) {
        Objects.requireNonNull(constraints, "constraints must not be null");
        return new Target(Kind.RANDOM, 0L, Double.NaN, Double.NaN, Double.NaN, constraints);
    }

    public static Target ofCoordinate(double ra, double dec) {
        return ofCoordinate(ra, dec, DEFAULT_MAX_RADIUS_ARCMIN);
    }

    public static Target ofCoordinate(double ra, double dec, double maxRadiusArcmin) {
        return new Target(Kind.COORDINATE, 0L, ra, dec, maxRadiusArcmin, null);
    }

    @Override
    public String toString() {
        switch (kind) {
            case OBJECT_ID:
                return "objid " + objectId;
            case COORDINATE:
                return String.format("(%.5f, %.5f) r<=%s'", ra, dec, maxRadiusArcmin);
            default:
                return "random " + constraints.window();
        }
    }
}
