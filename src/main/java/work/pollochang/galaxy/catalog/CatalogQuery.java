package work.pollochang.galaxy.catalog;

/**
 * 參數化的目錄查詢。查詢字串的組成交給 {@link CatalogService} 的實作。
 */
public record CatalogQuery(Kind kind, long objectId, double ra, double dec, double radiusArcmin,
                           SearchConstraints constraints) {

    public enum Kind {
        /** 依物件編號取成像資訊 */
        OBJECT_ID,
        /** 指定半徑內距離最近的星系 */
        NEARBY,
        /** 隨機挑一個符合條件的星系 */
        CONSTRAINED_RANDOM
    }

    public static CatalogQuery byObjectId(long objectId) {
        return new CatalogQuery(Kind.OBJECT_ID, objectId, Double.NaN, Double.NaN, Double.NaN, null);
    }

    public static CatalogQuery nearby(double ra, double dec, double radiusArcmin) {
        return new CatalogQuery(Kind.NEARBY, 0L, ra, dec, radiusArcmin, null);
    }

    public static CatalogQuery constrainedRandom(SearchConstraints constraints) {
        return new CatalogQuery(Kind.CONSTRAINED_RANDOM, 0L, Double.NaN, Double.NaN, Double.NaN, constraints);
    }
}
