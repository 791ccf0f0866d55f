package work.pollochang.galaxy.exception;

/**
 * 輸入參數不合法（波段、批次輸入檔、搜尋半徑）。一律在任何網路呼叫之前拋出。
 */
public class InvalidInputException extends GalaxyCutoutException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
