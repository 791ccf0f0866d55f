package work.pollochang.galaxy.core;

/**
 * 影像平面上的像素座標 (0 起算)。
 */
public record PixelCoordinate(double x, double y) {}
