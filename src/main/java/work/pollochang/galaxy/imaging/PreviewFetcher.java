package work.pollochang.galaxy.imaging;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.galaxy.core.ImagingDescriptor;
import work.pollochang.galaxy.tools.HttpFetcher;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;

/**
 * 從 SkyServer ImgCutout 取得 256x256 的彩色預覽圖，僅供檢視。
 * 失敗時只記錄警告並回傳 empty，不影響波段裁切。
 */
@Slf4j
public class PreviewFetcher {

    public static final String DEFAULT_BASE_URL = "https://skyserver.sdss.org/dr17/SkyServerWS/ImgCutout/getjpeg";
    public static final int SIZE = 256;

    static {
        ImageIO.setUseCache(false);
    }

    private final String baseUrl;
    private final HttpFetcher http;

    public PreviewFetcher(String baseUrl, HttpFetcher http) {
        this.baseUrl = baseUrl;
        this.http = http;
    }

    /**
     * 每像素角秒數，使預覽圖涵蓋與裁切相同的 1.25 倍範圍。
     */
    public static double pixelScale(double angularSize) {
        return 2 * 1.25 * angularSize / SIZE;
    }

    public String previewUrl(double ra, double dec, double angularSize) {
        return String.format(Locale.ROOT, "%s?ra=%s&dec=%s&scale=%s&width=%d&height=%d",
                baseUrl, ra, dec, pixelScale(angularSize), SIZE, SIZE);
    }

    public Optional<BufferedImage> fetch(ImagingDescriptor descriptor) {
        String url = previewUrl(descriptor.ra(), descriptor.dec(), descriptor.angularSize());
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(http.get(url)));
            if (image == null) {
                log.warn("objid={} - 預覽圖無法解碼: {}", descriptor.objectId(), url);
                return Optional.empty();
            }
            return Optional.of(image);
        } catch (IOException | RuntimeException e) {
            log.warn("objid={} - 預覽圖取得失敗，略過: {}", descriptor.objectId(), e.getMessage());
            return Optional.empty();
        }
    }
}
