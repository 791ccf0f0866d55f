package work.pollochang.galaxy.core;

/**
 * 天球座標 (度) 轉像素座標，每張 frame 各有一個。
 */
@FunctionalInterface
public interface WorldToPixel {

    PixelCoordinate toPixel(double ra, double dec);
}
