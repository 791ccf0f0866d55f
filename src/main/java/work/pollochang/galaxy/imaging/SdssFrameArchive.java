package work.pollochang.galaxy.imaging;

import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import work.pollochang.galaxy.core.Band;
import work.pollochang.galaxy.core.ImagingDescriptor;
import work.pollochang.galaxy.exception.TransportException;
import work.pollochang.galaxy.tools.FileTools;
import work.pollochang.galaxy.tools.HttpFetcher;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * SDSS Science Archive Server 上的 corrected frame (frame-*.fits.bz2)。
 */
@Slf4j
public class SdssFrameArchive implements FrameSource {

    public static final String DEFAULT_BASE_URL = "https://data.sdss.org/sas/dr17/eboss/photoObj/frames";
    public static final int DEFAULT_RERUN = 301;

    private final String baseUrl;
    private final int rerun;
    private final HttpFetcher http;

    public SdssFrameArchive(String baseUrl, int rerun, HttpFetcher http) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.rerun = rerun;
        this.http = http;
    }

    /**
     * frame 網址完全由 (run, camcol, field, band) 決定。
     */
    public String frameUrl(ImagingDescriptor d, Band band) {
        return String.format(Locale.ROOT, "%s/%d/%d/%d/frame-%s-%06d-%d-%04d.fits.bz2",
                baseUrl, rerun, d.run(), d.camcol(), band, d.run(), d.camcol(), d.field());
    }

    @Override
    public Frame load(ImagingDescriptor descriptor, Band band) {
        String url = frameUrl(descriptor, band);
        byte[] compressed = http.get(url);
        log.debug("objid={} {} - frame 已下載 ({})", descriptor.objectId(), band, FileTools.formatFileSize(compressed.length));
        return decode(compressed, url);
    }

    static Frame decode(byte[] compressed, String source) {
        try (InputStream in = new BZip2CompressorInputStream(new ByteArrayInputStream(compressed));
             Fits fits = new Fits(in)) {
            BasicHDU<?> hdu = fits.readHDU();
            if (hdu == null) {
                throw new TransportException(source + " - FITS 檔沒有 HDU");
            }
            float[][] pixels = toFloatImage(hdu.getKernel(), source);
            TanWcs transform = buildTransform(hdu.getHeader(), source);
            return new Frame(pixels, transform);
        } catch (IOException | FitsException e) {
            throw new TransportException(source + " - 無法解碼 FITS", e);
        }
    }

    /**
     * 建立座標轉換。header 修正訊息只在這裡以 debug 記錄後丟棄，不往外傳遞。
     */
    static TanWcs buildTransform(Header header, String source) {
        WcsFixups fixups = new WcsFixups();
        TanWcs wcs = TanWcs.fromHeader(header, fixups);
        if (!fixups.isEmpty()) {
            log.debug("{} - 已忽略 {} 筆 WCS 修正: {}", source, fixups.messages().size(), fixups.messages());
        }
        return wcs;
    }

    static float[][] toFloatImage(Object kernel, String source) {
        if (kernel instanceof float[][]) {
            return (float[][]) kernel;
        }
        if (kernel instanceof double[][]) {
            double[][] data = (double[][]) kernel;
            float[][] out = new float[data.length][];
            for (int y = 0; y < data.length; y++) {
                out[y] = new float[data[y].length];
                for (int x = 0; x < data[y].length; x++) {
                    out[y][x] = (float) data[y][x];
                }
            }
            return out;
        }
        if (kernel instanceof int[][]) {
            int[][] data = (int[][]) kernel;
            float[][] out = new float[data.length][];
            for (int y = 0; y < data.length; y++) {
                out[y] = new float[data[y].length];
                for (int x = 0; x < data[y].length; x++) {
                    out[y][x] = data[y][x];
                }
            }
            return out;
        }
        if (kernel instanceof short[][]) {
            short[][] data = (short[][]) kernel;
            float[][] out = new float[data.length][];
            for (int y = 0; y < data.length; y++) {
                out[y] = new float[data[y].length];
                for (int x = 0; x < data[y].length; x++) {
                    out[y][x] = data[y][x];
                }
            }
            return out;
        }
        throw new TransportException(source + " - 不支援的影像資料型別: "
                + (kernel == null ? "null" : kernel.getClass().getSimpleName()));
    }
}
