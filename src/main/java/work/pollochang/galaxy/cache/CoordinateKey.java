package work.pollochang.galaxy.cache;

/**
 * 快取的 Key：座標與最大搜尋半徑。相同的 Key 在同一份目錄下一定得到相同結果。
 */
public record CoordinateKey(double ra, double dec, double maxRadius) {}
