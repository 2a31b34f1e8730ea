package com.autotune.runner;

import com.autotune.evaluator.EvaluationPhase;
import com.autotune.evaluator.ProgressListener;
import com.autotune.runlog.TestRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reports evaluation progress to the application log. */
final class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onProgress(int completed, long total, TestRecord record) {
        log.info("Progress | completed={} | total={} | testId={} | status={}",
                completed, total, record.getTestId(), record.getOutcome().status());
    }

    @Override
    public void onPhase(int testId, EvaluationPhase phase, int percent) {
        log.debug("Phase | testId={} | phase={} | percent={}", testId, phase, percent);
    }
}
