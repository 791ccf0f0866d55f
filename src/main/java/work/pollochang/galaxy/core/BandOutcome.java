package work.pollochang.galaxy.core;

import java.util.Objects;

/**
 * 單一波段抓取的結果：成功時帶影像，失敗時帶原因。
 */
public record BandOutcome(Band band, BandImage image, String failure) {

    public static BandOutcome success(BandImage image) {
        Objects.requireNonNull(image, "image must not be null");
        return new BandOutcome(image.band(), image, null);
    }

    public static BandOutcome failure(Band band, String reason) {
        return new BandOutcome(band, null, reason);
    }

    public boolean succeeded() {
        return image != null;
    }
}
