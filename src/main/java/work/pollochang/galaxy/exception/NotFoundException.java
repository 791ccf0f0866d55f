package work.pollochang.galaxy.exception;

/**
 * 目錄查詢沒有任何符合的資料列。
 * <p>
 * 單一目標查詢時為錯誤；座標搜尋時會轉換成「找不到」標記，不會拋出。
 */
public class NotFoundException extends GalaxyCutoutException {

    public NotFoundException(String message) {
        super(message);
    }
}
