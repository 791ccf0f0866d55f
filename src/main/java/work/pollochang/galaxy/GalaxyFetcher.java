package work.pollochang.galaxy;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.catalog.CatalogResolver;
import work.pollochang.galaxy.catalog.ImagingMetadataFetcher;
import work.pollochang.galaxy.catalog.Target;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.BandOutcome;
import work.pollochang.galaxy.core.GalaxyRecord;
import work.pollochang.galaxy.core.ImagingDescriptor;
import work.pollochang.galaxy.imaging.MultiBandFetcher;
import work.pollochang.galaxy.imaging.PreviewFetcher;

import java.awt.image.BufferedImage;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 單一目標的完整流程：解析目標 -> 成像資訊 -> 預覽圖 + 多波段裁切 -> {@link GalaxyRecord}。
 */
@Slf4j
public class GalaxyFetcher {

    private final CatalogResolver resolver;
    private final ImagingMetadataFetcher metadataFetcher;
    private final PreviewFetcher previewFetcher;
    private final MultiBandFetcher multiBandFetcher;

    /**
     * @param previewFetcher 可為 null，表示不抓預覽圖
     */
    public GalaxyFetcher(CatalogResolver resolver, ImagingMetadataFetcher metadataFetcher,
                         PreviewFetcher previewFetcher, MultiBandFetcher multiBandFetcher) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.metadataFetcher = Objects.requireNonNull(metadataFetcher, "metadataFetcher must not be null");
        this.previewFetcher = previewFetcher;
        this.multiBandFetcher = Objects.requireNonNull(multiBandFetcher, "multiBandFetcher must not be null");
    }

    public GalaxyRecord fetch(Target target) {
        return fetch(target, EnumSet.allOf(Band.class));
    }

    /**
     * @throws work.pollochang.galaxy.exception.NotFoundException 目標無法解析
     * @throws work.pollochang.galaxy.exception.TransportException 任一波段抓取失敗
     */
    public GalaxyRecord fetch(Target target, Set<Band> bands) {
        log.info("{} - 開始處理", target);
        long objectId = resolver.resolve(target);
        return fetch(objectId, bands);
    }

    public GalaxyRecord fetch(long objectId, Set<Band> bands) {
        ImagingDescriptor descriptor = metadataFetcher.resolve(objectId);

        BufferedImage preview = previewFetcher == null ? null : previewFetcher.fetch(descriptor).orElse(null);
        List<BandOutcome> outcomes = multiBandFetcher.fetch(descriptor, bands);

        GalaxyRecord record = GalaxyRecord.assemble(descriptor, preview, outcomes);
        log.info("objid={} - 處理成功 (run={}, camcol={}, field={}, 波段 {} 個)",
                objectId, descriptor.run(), descriptor.camcol(), descriptor.field(), record.bands().size());
        return record;
    }
}
