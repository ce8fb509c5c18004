package ai.deadwood.detect;

import ai.deadwood.analyzer.Declaration;
import ai.deadwood.analyzer.FunctionMetrics;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.config.ComplexityThresholds;
import ai.deadwood.model.Candidate;
import ai.deadwood.model.FindingKind;
import ai.deadwood.model.SourceLocation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Callables whose provider-measured metrics exceed any configured threshold. One candidate per callable. */
public final class ComplexityDetector implements Detector {

    @Override
    public FindingKind kind() {
        return FindingKind.HIGH_COMPLEXITY;
    }

    @Override
    public List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx) {
        var thresholds = ctx.config().complexity();
        var candidates = new ArrayList<Candidate>();
        for (var decl : tree.declarations()) {
            var metrics = decl.metrics();
            if (!decl.kind().isCallable() || metrics == null) {
                continue;
            }
            var exceeded = exceeded(metrics, thresholds);
            if (!exceeded.isEmpty()) {
                candidates.add(candidate(tree, decl, exceeded));
            }
        }
        return candidates;
    }

    /** Metric tag to description, for every threshold exceeded. */
    private static Map<String, String> exceeded(FunctionMetrics m, ComplexityThresholds t) {
        var result = new LinkedHashMap<String, String>();
        if (m.cyclomaticComplexity() > t.cyclomatic()) {
            result.put(
                    "cyclomatic", "cyclomatic complexity %d > %d".formatted(m.cyclomaticComplexity(), t.cyclomatic()));
        }
        if (m.maxNestingDepth() > t.nesting()) {
            result.put("nesting", "nesting depth %d > %d".formatted(m.maxNestingDepth(), t.nesting()));
        }
        if (m.parameterCount() > t.parameters()) {
            result.put("parameters", "%d parameters > %d".formatted(m.parameterCount(), t.parameters()));
        }
        if (m.linesOfCode() > t.linesOfCode()) {
            result.put("lines", "%d lines > %d".formatted(m.linesOfCode(), t.linesOfCode()));
        }
        return result;
    }

    private Candidate candidate(SyntaxTree tree, Declaration decl, Map<String, String> exceeded) {
        var name = decl.owner() == null ? decl.name() : decl.owner() + "." + decl.name();
        return new Candidate(
                kind(),
                name,
                List.of(SourceLocation.of(tree.file(), decl.range())),
                decl.site(tree.file()),
                Set.of(),
                exceeded.keySet(),
                "'%s' is too complex: %s".formatted(name, String.join(", ", exceeded.values())),
                "Split '%s' into smaller functions".formatted(name));
    }
}
