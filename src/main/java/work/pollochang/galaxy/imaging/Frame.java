package work.pollochang.galaxy.imaging;

import work.pollochang.galaxy.core.WorldToPixel;

/**
 * 一張已解碼的 frame：像素陣列 ([y][x]) 與它的座標轉換。
 */
public record Frame(float[][] pixels, WorldToPixel transform) {}
