package work.pollochang.galaxy.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * 由目標的天球位置與角大小推算像素裁切框。
 * <p>
 * 不會依照 frame 的實際尺寸裁剪邊界，超出範圍的部分由 {@link work.pollochang.galaxy.tools.ImageTools#crop}
 * 靜默截斷。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class CutoutGeometry {

    /** 在估計範圍外再留 25% 邊界 */
    static final double SAFETY_MARGIN = 1.25;
    /** 裁切半徑進位到 10 像素 */
    static final int ROUNDING_STEP = 10;

    private CutoutGeometry() {}

    /**
     * 計算裁切框。
     *
     * @param ra          中心赤經 (度)
     * @param dec         中心赤緯 (度)
     * @param angularSize 角大小 (角秒)
     * @param transform   該 frame 的天球轉像素座標
     * @return 像素裁切框
     */
    public static CutoutSpec compute(double ra, double dec, double angularSize, WorldToPixel transform) {
        Objects.requireNonNull(transform, "transform must not be null");

        PixelCoordinate center = transform.toPixel(ra, dec);
        double offsetDeg = angularSize / 3600.0;
        PixelCoordinate edge = transform.toPixel(ra + offsetDeg, dec + offsetDeg);

        double radiusPx = Math.max(Math.abs(center.x() - edge.x()), Math.abs(center.y() - edge.y()));
        int radius = cutoutRadius(radiusPx);

        CutoutSpec spec = new CutoutSpec(
                (int) (center.x() - radius),
                (int) (center.x() + radius),
                (int) (center.y() - radius),
                (int) (center.y() + radius)
        );
        log.debug("中心 ({}, {}) 估計半徑 {} px -> 裁切半徑 {} px, {}",
                String.format("%.2f", center.x()), String.format("%.2f", center.y()),
                String.format("%.2f", radiusPx), radius, spec);
        return spec;
    }

    /**
     * 估計半徑加上安全邊界後進位到 10 像素；結果至少為 10，裁切框永不為空。
     */
    public static int cutoutRadius(double radiusPx) {
        int radius = (int) Math.ceil(SAFETY_MARGIN * radiusPx / ROUNDING_STEP) * ROUNDING_STEP;
        return Math.max(ROUNDING_STEP, radius);
    }
}
