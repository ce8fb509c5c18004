package ai.deadwood.pool;

import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.model.FileAnalysisResult;
import ai.deadwood.model.FindingKind;
import java.util.EnumSet;
import java.util.Set;

/**
 * One file's analysis, as handed to the pool.
 *
 * @param detectors the detector kinds the work will run, for logging and stats
 */
public record AnalysisTask(String taskId, ProjectFile file, Set<FindingKind> detectors, Work work) {

    /** The body of a task. May throw anything; the pool turns it into a failed future. */
    @FunctionalInterface
    public interface Work {
        FileAnalysisResult run() throws Exception;
    }

    public AnalysisTask {
        detectors = detectors.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(detectors));
    }
}
