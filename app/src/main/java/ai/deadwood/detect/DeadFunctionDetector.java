package ai.deadwood.detect;

import ai.deadwood.analyzer.Declaration;
import ai.deadwood.analyzer.DeclarationKind;
import ai.deadwood.analyzer.DeclarationModifier;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.model.Candidate;
import ai.deadwood.model.FindingKind;
import ai.deadwood.model.SourceLocation;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;

/**
 * Functions and methods never referenced in their own file. Exported ones are still reported; the classifier decides
 * from workspace references whether anything else calls them.
 */
public final class DeadFunctionDetector implements Detector {

    @Override
    public FindingKind kind() {
        return FindingKind.DEAD_FUNCTION;
    }

    @Override
    public List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx) {
        var exportSpecifiers = SymbolUses.exportSpecifierNames(tree);
        var candidates = new ArrayList<Candidate>();
        for (var decl : tree.declarations()) {
            if (decl.kind() != DeclarationKind.FUNCTION && decl.kind() != DeclarationKind.METHOD) {
                continue;
            }
            if (decl.has(DeclarationModifier.AMBIENT) || SymbolUses.isCallableReferenced(tree, decl)) {
                continue;
            }
            boolean exported = SymbolUses.isExported(tree, decl, exportSpecifiers);
            candidates.add(candidate(tree, decl, exported));
        }
        return candidates;
    }

    private Candidate candidate(SyntaxTree tree, Declaration decl, boolean exported) {
        var traits = EnumSet.noneOf(Candidate.Trait.class);
        var tags = new HashSet<String>();
        boolean method = decl.kind() == DeclarationKind.METHOD;
        if (method) {
            traits.add(Candidate.Trait.METHOD);
            tags.add("method");
        }
        if (decl.has(DeclarationModifier.STATIC)) {
            tags.add("static");
        }
        if (exported) {
            traits.add(Candidate.Trait.EXPORTED);
            tags.add("exported");
        }
        if (decl.has(DeclarationModifier.DECORATED)) {
            traits.add(Candidate.Trait.DECORATED);
            tags.add("decorated");
        }
        var reason = method
                ? "Method '%s.%s' is never called".formatted(decl.owner(), decl.name())
                : "Function '%s' is never called".formatted(decl.name());
        return new Candidate(
                kind(),
                decl.name(),
                List.of(SourceLocation.of(tree.file(), decl.range())),
                decl.site(tree.file()),
                traits,
                tags,
                reason,
                "Remove '%s' and any code only it uses".formatted(decl.name()));
    }
}
