package work.pollochang.galaxy.exception;

/**
 * 對目錄、影像檔案庫或預覽服務的網路 / I/O 失敗（含逾時與無法解析的回應）。
 */
public class TransportException extends GalaxyCutoutException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
