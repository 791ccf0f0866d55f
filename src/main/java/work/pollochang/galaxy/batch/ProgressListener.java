package work.pollochang.galaxy.batch;

/**
 * 批次進度通知。由工作執行緒呼叫，實作不可阻塞。
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total) -> { };

    void onProgress(int processed, int total);
}
