package ai.deadwood.model;

import ai.deadwood.scope.AffectedSet;
import java.util.List;

public record IncrementalAnalysisResult(
        ChangeSet changeSet, AffectedSet affectedSet, List<FileAnalysisResult> fileResults, Summary summary) {

    public IncrementalAnalysisResult {
        fileResults = List.copyOf(fileResults);
    }

    public record Summary(
            int totalModules,
            int analyzedModules,
            int skippedModules,
            int analyzedFiles,
            int totalIssues,
            int failedFiles) {}

    public List<Finding> allFindings() {
        return fileResults.stream().flatMap(r -> r.findings().stream()).toList();
    }
}
