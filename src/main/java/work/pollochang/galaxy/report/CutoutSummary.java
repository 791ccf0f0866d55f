package work.pollochang.galaxy.report;

/**
 * 影像抓取階段的統計。
 * @param attempted 嘗試抓取的星系數 (解析階段找到的列)
 * @param succeeded 成功輸出的星系數
 * @param failed 失敗的星系數
 */
public record CutoutSummary(int attempted, int succeeded, int failed) {}
