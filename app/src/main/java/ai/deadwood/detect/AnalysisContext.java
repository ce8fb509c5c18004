package ai.deadwood.detect;

import ai.deadwood.classify.AnalysisScope;
import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.graph.Cycle;
import ai.deadwood.graph.DependencyGraph;
import java.util.List;

/**
 * Immutable snapshot handed to every detector call. Rebuilt by the orchestrator between passes, never mutated while
 * tasks are running.
 */
public record AnalysisContext(
        AnalysisConfig config, AnalysisScope.Kind scope, DependencyGraph graph, ReferenceIndex references) {

    /** Context for analyzing one file with nothing known about the rest of the workspace. */
    public static AnalysisContext fileOnly(AnalysisConfig config, DependencyGraph graph) {
        return new AnalysisContext(config, AnalysisScope.Kind.FILE, graph, ReferenceIndex.empty());
    }

    public List<Cycle> cycles() {
        return graph.cycles();
    }

    public boolean isWorkspace() {
        return scope == AnalysisScope.Kind.WORKSPACE;
    }
}
