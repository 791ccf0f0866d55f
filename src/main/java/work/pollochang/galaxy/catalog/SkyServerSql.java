package work.pollochang.galaxy.catalog;

import java.util.Locale;

/**
 * 將 {@link CatalogQuery} 轉成 SkyServer 的 SQL。
 */
public final class SkyServerSql {

    private SkyServerSql() {}

    public static String render(CatalogQuery query) {
        switch (query.kind()) {
            case OBJECT_ID:
                return "SELECT TOP 1 g.objid, g.run, g.camcol, g.field, g.ra, g.dec, g.petroRad_r "
                        + "FROM Galaxy AS g WHERE g.objid = " + query.objectId();
            case NEARBY:
                return String.format(Locale.ROOT,
                        "SELECT TOP 1 g.objid, n.distance "
                                + "FROM dbo.fGetNearbyObjEq(%.8f, %.8f, %s) AS n "
                                + "JOIN Galaxy AS g ON g.objid = n.objid "
                                + "ORDER BY n.distance",
                        query.ra(), query.dec(), format(query.radiusArcmin()));
            case CONSTRAINED_RANDOM:
                return renderRandom(query.constraints());
            default:
                throw new IllegalArgumentException("不支援的查詢類型: " + query.kind());
        }
    }

    private static String renderRandom(SearchConstraints c) {
        SkyWindow w = c.window();
        StringBuilder sql = new StringBuilder(String.format(Locale.ROOT,
                "SELECT TOP 1 g.objid FROM Galaxy AS g "
                        + "WHERE g.ra BETWEEN %s AND %s AND g.dec BETWEEN %s AND %s",
                format(w.raMin()), format(w.raMax()), format(w.decMin()), format(w.decMax())));
        if (c.requireClean()) {
            sql.append(" AND g.clean = 1");
        }
        if (c.minAngularSize() > 0) {
            sql.append(" AND g.petroRad_r > ").append(format(c.minAngularSize()));
        }
        if (c.requireValidErrors()) {
            sql.append(" AND g.petroRadErr_r > 0");
        }
        sql.append(" ORDER BY NEWID()");
        return sql.toString();
    }

    // 整數不帶小數點，其餘保留必要位數
    private static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
