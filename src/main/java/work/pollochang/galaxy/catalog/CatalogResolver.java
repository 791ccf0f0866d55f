package work.pollochang.galaxy.catalog;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.exception.InvalidInputException;
import work.pollochang.galaxy.exception.NotFoundException;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * 將目標解析為目錄物件編號。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class CatalogResolver {

    /** 座標搜尋的起始半徑 (角分) */
    static final double INITIAL_RADIUS_ARCMIN = 1.0;

    private final CatalogService catalog;

    public CatalogResolver(CatalogService catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * 依目標類型解析。座標找不到時以 {@link NotFoundException} 中止。
     */
    public long resolve(Target target) {
        Objects.requireNonNull(target, "target must not be null");
        switch (target.kind()) {
            case OBJECT_ID:
                return target.objectId();
            case RANDOM:
                return resolveByConstraints(target.constraints());
            case COORDINATE:
                return resolveNearest(target.ra(), target.dec(), target.maxRadiusArcmin())
                        .orElseThrow(() -> new NotFoundException(target + " - 搜尋半徑內沒有星系"));
            default:
                throw new IllegalArgumentException("不支援的目標類型: " + target.kind());
        }
    }

    /**
     * 隨機挑一個符合品質條件的星系。
     *
     * @throws NotFoundException 範圍內沒有符合條件的星系
     */
    public long resolveByConstraints(SearchConstraints constraints) {
        List<CatalogRow> rows = catalog.run(CatalogQuery.constrainedRandom(constraints));
        if (rows.isEmpty()) {
            throw new NotFoundException("範圍 " + constraints.window() + " 內沒有符合條件的星系");
        }
        long objectId = rows.get(0).getLong("objid");
        log.info("隨機挑選星系 objid={} ({})", objectId, constraints.window());
        return objectId;
    }

    /**
     * 逐步擴大半徑搜尋最近的星系。
     * <p>
     * 從 1 角分開始，沒有結果就加倍，直到半徑不小於 maxRadius；若最後查過的半徑不等於 maxRadius，
     * 再以 maxRadius 查一次。回傳的是「最小足夠半徑」內最近的星系，不一定是 maxRadius 內全域最近的。
     * 查詢次數上限為 ceil(log2(maxRadius)) + 1，且至少一次。
     *
     * @param ra        赤經 (度)
     * @param dec       赤緯 (度)
     * @param maxRadius 最大搜尋半徑 (角分)，必須大於 0
     * @return 物件編號；找不到時為 empty
     * @throws InvalidInputException maxRadius 不大於 0
     */
    public OptionalLong resolveNearest(double ra, double dec, double maxRadius) {
        if (!(maxRadius > 0)) {
            throw new InvalidInputException("最大搜尋半徑必須大於 0: " + maxRadius);
        }

        double radius = INITIAL_RADIUS_ARCMIN;
        double lastQueried = Double.NaN;
        while (radius < maxRadius) {
            OptionalLong hit = queryNearest(ra, dec, radius);
            lastQueried = radius;
            if (hit.isPresent()) {
                return hit;
            }
            radius *= 2;
        }

        if (lastQueried != maxRadius) {
            return queryNearest(ra, dec, maxRadius);
        }
        return OptionalLong.empty();
    }

    private OptionalLong queryNearest(double ra, double dec, double radius) {
        List<CatalogRow> rows = catalog.run(CatalogQuery.nearby(ra, dec, radius));
        if (rows.isEmpty()) {
            log.debug("({}, {}) - 半徑 {}' 內沒有星系", ra, dec, radius);
            return OptionalLong.empty();
        }
        long objectId = rows.get(0).getLong("objid");
        log.debug("({}, {}) - 半徑 {}' 找到 objid={}", ra, dec, radius, objectId);
        return OptionalLong.of(objectId);
    }
}
