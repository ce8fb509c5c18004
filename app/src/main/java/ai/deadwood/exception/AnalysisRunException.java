package ai.deadwood.exception;

/** A run-level failure: the run ended in FAILED and produced no aggregate. */
public class AnalysisRunException extends RuntimeException {
    public AnalysisRunException(String message) {
        super(message);
    }

    public AnalysisRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
