package work.pollochang.galaxy.report;

import work.pollochang.galaxy.core.SkyCoordinate;

import java.util.OptionalLong;

/**
 * 批次中一列的解析結果。
 * @param index 輸入列序號 (0 起算)
 * @param coordinate 輸入座標
 * @param status 結果
 * @param objectId 找到時的物件編號
 * @param message 失敗原因，其他情況為 null
 */
public record RowReport(int index, SkyCoordinate coordinate, ResolutionStatus status, OptionalLong objectId, String message) {

    public static RowReport found(int index, SkyCoordinate coordinate, long objectId) {
        return new RowReport(index, coordinate, ResolutionStatus.FOUND, OptionalLong.of(objectId), null);
    }

    public static RowReport notFound(int index, SkyCoordinate coordinate) {
        return new RowReport(index, coordinate, ResolutionStatus.NOT_FOUND, OptionalLong.empty(), null);
    }

    public static RowReport failed(int index, SkyCoordinate coordinate, ResolutionStatus status, String message) {
        return new RowReport(index, coordinate, status, OptionalLong.empty(), message);
    }

    public boolean isFound() {
        return status == ResolutionStatus.FOUND;
    }
}
