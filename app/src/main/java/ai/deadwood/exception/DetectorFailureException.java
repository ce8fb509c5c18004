package ai.deadwood.exception;

import ai.deadwood.model.Finding;
import java.util.List;

/**
 * One or more detectors threw while analyzing a file. The findings the other detectors produced are kept so the file
 * result can still carry them.
 */
public class DetectorFailureException extends RuntimeException {
    private final String filePath;
    private final List<String> failedDetectors;
    private final List<Finding> partialFindings;

    public DetectorFailureException(
            String filePath, List<String> failedDetectors, List<Finding> partialFindings, Throwable cause) {
        super("Detector(s) %s failed on %s: %s".formatted(failedDetectors, filePath, cause.getMessage()), cause);
        this.filePath = filePath;
        this.failedDetectors = List.copyOf(failedDetectors);
        this.partialFindings = List.copyOf(partialFindings);
    }

    public String getFilePath() {
        return filePath;
    }

    public List<String> getFailedDetectors() {
        return failedDetectors;
    }

    public List<Finding> getPartialFindings() {
        return partialFindings;
    }
}
