package work.pollochang.galaxy.core;

import work.pollochang.galaxy.exception.TransportException;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 一個星系的完整裁切結果。
 * <p>
 * 只能透過 {@link #assemble} 建立，建立後不可變；波段依 u,g,r,i,z 排序。
 */
public final class GalaxyRecord {

    private final ImagingDescriptor descriptor;
    private final BufferedImage preview;
    private final List<BandImage> bands;

    private GalaxyRecord(ImagingDescriptor descriptor, BufferedImage preview, List<BandImage> bands) {
        this.descriptor = descriptor;
        this.preview = preview;
        this.bands = bands;
    }

    /**
     * 由各波段結果組出紀錄。任何一個波段失敗都視為整個目標抓取失敗。
     *
     * @param descriptor 成像資訊
     * @param preview    預覽圖，可為 null
     * @param outcomes   各波段結果
     * @return 完整紀錄
     * @throws TransportException 有波段失敗
     */
    public static GalaxyRecord assemble(ImagingDescriptor descriptor, BufferedImage preview, List<BandOutcome> outcomes) {
        Objects.requireNonNull(descriptor, "descriptor must not be null");
        Objects.requireNonNull(outcomes, "outcomes must not be null");

        List<BandOutcome> failed = outcomes.stream().filter(o -> !o.succeeded()).collect(Collectors.toList());
        if (!failed.isEmpty()) {
            String detail = failed.stream()
                    .map(o -> o.band() + ": " + o.failure())
                    .collect(Collectors.joining("; "));
            throw new TransportException("objid " + descriptor.objectId() + " 波段抓取失敗 -> " + detail);
        }

        List<BandImage> ordered = new ArrayList<>(outcomes.size());
        outcomes.stream()
                .map(BandOutcome::image)
                .sorted((a, b) -> a.band().compareTo(b.band()))
                .forEach(ordered::add);
        return new GalaxyRecord(descriptor, preview, Collections.unmodifiableList(ordered));
    }

    public long objectId() { return descriptor.objectId(); }
    public double ra() { return descriptor.ra(); }
    public double dec() { return descriptor.dec(); }
    public ImagingDescriptor descriptor() { return descriptor; }
    public Optional<BufferedImage> preview() { return Optional.ofNullable(preview); }
    public List<BandImage> bands() { return bands; }

    public Optional<BandImage> band(Band band) {
        return bands.stream().filter(b -> b.band() == band).findFirst();
    }

    /**
     * 文字摘要，欄位對齊方便終端機閱讀。
     */
    public String info() {
        return String.format("Name: %40.35s%n", "SDSS " + descriptor.objectId())
                + String.format("Frame: %39s%n", descriptor.run() + "/" + descriptor.camcol() + "/" + descriptor.field())
                + String.format("Size: %40.2f%n", descriptor.angularSize())
                + String.format("RA: %42.5f%n", descriptor.ra())
                + String.format("DEC: %41.5f%n", descriptor.dec())
                + String.format("Bands: %39s%n", bands.stream().map(b -> b.band().toString()).collect(Collectors.joining()));
    }
}
