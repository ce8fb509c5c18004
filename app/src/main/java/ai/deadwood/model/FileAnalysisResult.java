package ai.deadwood.model;

import java.util.List;
import org.jetbrains.annotations.Nullable;

public record FileAnalysisResult(
        String filePath, List<Finding> findings, long analysisTimeMs, boolean success, @Nullable String error) {

    public FileAnalysisResult {
        findings = List.copyOf(findings);
    }

    public static FileAnalysisResult success(String filePath, List<Finding> findings, long analysisTimeMs) {
        return new FileAnalysisResult(filePath, findings, analysisTimeMs, true, null);
    }

    /** A failed file still carries whatever findings were produced before or beside the failure. */
    public static FileAnalysisResult failure(
            String filePath, List<Finding> partialFindings, long analysisTimeMs, String error) {
        return new FileAnalysisResult(filePath, partialFindings, analysisTimeMs, false, error);
    }
}
