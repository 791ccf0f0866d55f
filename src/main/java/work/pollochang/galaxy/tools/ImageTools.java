package work.pollochang.galaxy.tools;

import work.pollochang.galaxy.core.CutoutSpec;

import java.util.Objects;

public class ImageTools {

    private ImageTools() {}

    /**
     * 依裁切框擷取子陣列，超出 frame 的部分直接截掉，不補值也不報錯。
     * 完全落在 frame 外時回傳空陣列。
     *
     * @param pixels 原始影像，[y][x]
     * @param spec   裁切框
     * @return 裁切後影像，[y][x]
     */
    public static float[][] crop(float[][] pixels, CutoutSpec spec) {
        Objects.requireNonNull(pixels, "pixels must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        int frameHeight = pixels.length;
        int frameWidth = frameHeight == 0 ? 0 : pixels[0].length;

        int x0 = clamp(spec.minX(), frameWidth);
        int x1 = clamp(spec.maxX(), frameWidth);
        int y0 = clamp(spec.minY(), frameHeight);
        int y1 = clamp(spec.maxY(), frameHeight);

        if (x1 <= x0 || y1 <= y0) {
            return new float[0][0];
        }

        float[][] cropped = new float[y1 - y0][];
        for (int y = y0; y < y1; y++) {
            float[] row = new float[x1 - x0];
            System.arraycopy(pixels[y], x0, row, 0, row.length);
            cropped[y - y0] = row;
        }
        return cropped;
    }

    private static int clamp(int value, int upper) {
        return Math.max(0, Math.min(value, upper));
    }
}
