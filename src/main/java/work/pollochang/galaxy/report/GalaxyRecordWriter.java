package work.pollochang.galaxy.report;

import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import work.pollochang.galaxy.core.BandImage;
import work.pollochang.galaxy.core.CutoutSpec;
import work.pollochang.galaxy.core.GalaxyRecord;
import work.pollochang.galaxy.core.ImagingDescriptor;
import work.pollochang.galaxy.tools.FileTools;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * 將 {@link GalaxyRecord} 寫到 {@code <輸出目錄>/<objid>/}：
 * 各波段 {@code <band>.fits}、{@code preview.jpg} 與 {@code info.txt}。
 */
@Slf4j
public class GalaxyRecordWriter {

    private final Path outputDir;

    public GalaxyRecordWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    /**
     * @return 該星系的輸出目錄
     */
    public Path write(GalaxyRecord record) {
        Path galaxyDir = outputDir.resolve(Long.toString(record.objectId()));
        FileTools.ensureDirectoryExists(galaxyDir);

        for (BandImage image : record.bands()) {
            if (image.width() == 0 || image.height() == 0) {
                log.warn("objid={} {} - 裁切框完全落在 frame 外，不輸出", record.objectId(), image.band());
                continue;
            }
            writeFits(record.descriptor(), image, galaxyDir.resolve(image.band() + ".fits"));
        }

        Optional<BufferedImage> preview = record.preview();
        if (preview.isPresent()) {
            Path previewFile = galaxyDir.resolve("preview.jpg");
            try {
                if (!ImageIO.write(preview.get(), "jpg", previewFile.toFile())) {
                    // 沒有可處理此影像類型的 JPEG 編碼器 (例如含 alpha 通道)
                    Files.deleteIfExists(previewFile);
                    log.warn("objid={} - 無法以 JPEG 編碼預覽圖 (type={})，不輸出 preview.jpg",
                            record.objectId(), preview.get().getType());
                }
            } catch (IOException e) {
                throw new UncheckedIOException("無法寫入預覽圖: " + previewFile, e);
            }
        }

        Path infoFile = galaxyDir.resolve("info.txt");
        try {
            Files.writeString(infoFile, record.info(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("無法寫入: " + infoFile, e);
        }

        log.info("objid={} - 輸出完成 -> {}", record.objectId(), galaxyDir);
        return galaxyDir;
    }

    static void writeFits(ImagingDescriptor descriptor, BandImage image, Path file) {
        CutoutSpec spec = image.cutout();
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = FitsFactory.hduFactory(image.pixels());
            Header header = hdu.getHeader();
            header.addValue("OBJID", Long.toString(descriptor.objectId()), "SDSS object id");
            header.addValue("BAND", image.band().toString(), "SDSS filter");
            header.addValue("RUN", descriptor.run(), "SDSS run");
            header.addValue("CAMCOL", descriptor.camcol(), "SDSS camera column");
            header.addValue("FIELD", descriptor.field(), "SDSS field");
            header.addValue("CUTXMIN", spec.minX(), "cutout min x in frame pixels");
            header.addValue("CUTXMAX", spec.maxX(), "cutout max x in frame pixels");
            header.addValue("CUTYMIN", spec.minY(), "cutout min y in frame pixels");
            header.addValue("CUTYMAX", spec.maxY(), "cutout max y in frame pixels");
            fits.addHDU(hdu);
            fits.write(file.toFile());
        } catch (FitsException e) {
            throw new IllegalStateException("無法建立 FITS: " + file, e);
        } catch (IOException e) {
            throw new UncheckedIOException("無法寫入 FITS: " + file, e);
        }
    }
}
