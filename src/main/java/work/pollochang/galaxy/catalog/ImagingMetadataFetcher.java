package work.pollochang.galaxy.catalog;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.core.ImagingDescriptor;
import work.pollochang.galaxy.exception.NotFoundException;

import java.util.List;
import java.util.Objects;

/**
 * 依物件編號取得 run / camcol / field 與位置、大小。
 */
@Slf4j
public class ImagingMetadataFetcher {

    private final CatalogService catalog;

    public ImagingMetadataFetcher(CatalogService catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
    }

    /**
     * @throws NotFoundException 目錄中沒有此編號
     */
    public ImagingDescriptor resolve(long objectId) {
        List<CatalogRow> rows = catalog.run(CatalogQuery.byObjectId(objectId));
        if (rows.isEmpty()) {
            throw new NotFoundException("目錄中找不到 objid=" + objectId);
        }
        CatalogRow row = rows.get(0);
        ImagingDescriptor descriptor = new ImagingDescriptor(
                objectId,
                row.getInt("run"),
                row.getInt("camcol"),
                row.getInt("field"),
                row.getDouble("ra"),
                row.getDouble("dec"),
                row.getDouble("petroRad_r")
        );
        log.debug("objid={} - 成像資訊: {}", objectId, descriptor);
        return descriptor;
    }
}
