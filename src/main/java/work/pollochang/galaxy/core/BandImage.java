package work.pollochang.galaxy.core;

import java.util.Objects;

/**
 * 單一波段的裁切結果。pixels 以 [y][x] 排列。
 * <p>
 * 建構時與 {@link #pixels()} 皆回傳深複本，呼叫端修改陣列不會影響已儲存的像素。
 */
public record BandImage(Band band, CutoutSpec cutout, float[][] pixels) {

    public BandImage {
        Objects.requireNonNull(band, "band must not be null");
        Objects.requireNonNull(cutout, "cutout must not be null");
        Objects.requireNonNull(pixels, "pixels must not be null");
        pixels = copy(pixels);
    }

    @Override
    public float[][] pixels() {
        return copy(pixels);
    }

    public int width() {
        return pixels.length == 0 ? 0 : pixels[0].length;
    }

    public int height() {
        return pixels.length;
    }

    private static float[][] copy(float[][] source) {
        float[][] result = new float[source.length][];
        for (int y = 0; y < source.length; y++) {
            result[y] = source[y].clone();
        }
        return result;
    }
}
