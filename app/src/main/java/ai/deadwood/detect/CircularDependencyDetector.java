package ai.deadwood.detect;

import ai.deadwood.analyzer.ImportDeclaration;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.graph.Cycle;
import ai.deadwood.model.Candidate;
import ai.deadwood.model.FindingKind;
import ai.deadwood.model.SourceLocation;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reports each dependency cycle once, from the file the cycle starts at (its smallest node), anchored on the import
 * that leads to the next node.
 */
public final class CircularDependencyDetector implements Detector {

    @Override
    public FindingKind kind() {
        return FindingKind.CIRCULAR_DEPENDENCY;
    }

    @Override
    public List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx) {
        var path = tree.file().path();
        var candidates = new ArrayList<Candidate>();
        for (var cycle : ctx.cycles()) {
            if (!cycle.start().equals(path)) {
                continue;
            }
            candidates.add(candidate(tree, cycle));
        }
        return candidates;
    }

    private Candidate candidate(SyntaxTree tree, Cycle cycle) {
        var nodes = cycle.nodes();
        var next = nodes.get(1 % nodes.size());
        var locations = new ArrayList<SourceLocation>();
        tree.imports().stream()
                .filter(imp -> imp.target().map(f -> f.path().equals(next)).orElse(false))
                .findFirst()
                .map(ImportDeclaration::range)
                .ifPresentOrElse(
                        range -> locations.add(SourceLocation.of(tree.file(), range)),
                        () -> locations.add(SourceLocation.fileStart(tree.file().path())));
        for (var node : nodes.subList(1, nodes.size())) {
            locations.add(SourceLocation.fileStart(node));
        }

        Set<String> tags = new HashSet<>();
        tags.add("length:" + cycle.length());
        if (cycle.isDirect()) {
            tags.add("direct");
        }
        if (cycle.isSelfImport()) {
            tags.add("self-import");
        }
        return new Candidate(
                kind(),
                cycle.describe(),
                locations,
                null,
                Set.of(),
                tags,
                cycle.isSelfImport()
                        ? "'%s' imports itself".formatted(cycle.start())
                        : "Circular dependency: " + cycle.describe(),
                "Move the shared code into a module that both sides can import");
    }
}
