package work.pollochang.galaxy.batch;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * 每完成一定百分比就記錄一行進度。
 */
@Slf4j
public class LoggingProgressReporter implements ProgressListener {

    private final int stepPercent;
    private final AtomicInteger lastReportedStep = new AtomicInteger(-1);

    public LoggingProgressReporter() {
        this(10);
    }

    public LoggingProgressReporter(int stepPercent) {
        this.stepPercent = Math.max(1, stepPercent);
    }

    @Override
    public void onProgress(int processed, int total) {
        if (total <= 0) {
            return;
        }
        int step = (processed * 100 / total) / stepPercent;
        int previous = lastReportedStep.get();
        if (step > previous && lastReportedStep.compareAndSet(previous, step)) {
            log.info("進度: {}/{} ({}%)", processed, total, processed * 100 / total);
        }
    }
}
