package ai.deadwood.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record WorkspaceAnalysisResult(
        List<FileAnalysisResult> fileResults,
        int totalFiles,
        int totalIssues,
        int failedFiles,
        Map<FindingKind, Integer> issuesByType,
        Map<Certainty, Integer> issuesByCertainty,
        long totalTimeMs) {

    public WorkspaceAnalysisResult {
        fileResults = List.copyOf(fileResults);
        issuesByType = Map.copyOf(issuesByType);
        issuesByCertainty = Map.copyOf(issuesByCertainty);
    }

    /** Folds per-file results. Counts do not depend on completion order; file results are sorted by path. */
    public static WorkspaceAnalysisResult aggregate(Collection<FileAnalysisResult> results, long totalTimeMs) {
        var byType = new EnumMap<FindingKind, Integer>(FindingKind.class);
        var byCertainty = new EnumMap<Certainty, Integer>(Certainty.class);
        int issues = 0;
        int failed = 0;
        for (var result : results) {
            if (!result.success()) {
                failed++;
            }
            for (var finding : result.findings()) {
                issues++;
                byType.merge(finding.kind(), 1, Integer::sum);
                byCertainty.merge(finding.certainty(), 1, Integer::sum);
            }
        }
        var sorted = results.stream()
                .sorted(Comparator.comparing(FileAnalysisResult::filePath))
                .toList();
        return new WorkspaceAnalysisResult(
                sorted, results.size(), issues, failed, byType, byCertainty, totalTimeMs);
    }

    public List<Finding> allFindings() {
        return fileResults.stream().flatMap(r -> r.findings().stream()).toList();
    }

    public int issuesOf(FindingKind kind) {
        return issuesByType.getOrDefault(kind, 0);
    }
}
