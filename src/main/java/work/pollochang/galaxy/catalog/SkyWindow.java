package work.pollochang.galaxy.catalog;

/**
 * 赤經/赤緯範圍 (度)。
 */
public record SkyWindow(double raMin, double raMax, double decMin, double decMax) {}
