package ai.deadwood;

import java.util.concurrent.TimeUnit;

/** Identity and timing of one orchestrator run. */
record AnalysisRun(String id, long startNanos) {

    static AnalysisRun start(String kind, long sequence) {
        return new AnalysisRun(kind + "-" + sequence, System.nanoTime());
    }

    long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
