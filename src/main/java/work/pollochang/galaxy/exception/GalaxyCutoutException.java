package work.pollochang.galaxy.exception;

/**
 * 所有星系裁切流程例外的共同父類別。
 */
public class GalaxyCutoutException extends RuntimeException {

    public GalaxyCutoutException(String message) {
        super(message);
    }

    public GalaxyCutoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
