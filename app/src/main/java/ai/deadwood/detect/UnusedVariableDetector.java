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
import java.util.List;
import java.util.Set;

/**
 * Variables, parameters and catch bindings that are never read. Rest parameters and exported variables are skipped.
 * Parameters are reported but never safely removable, since callers pass them positionally.
 */
public final class UnusedVariableDetector implements Detector {
    private static final Set<DeclarationKind> KINDS =
            EnumSet.of(DeclarationKind.VARIABLE, DeclarationKind.PARAMETER, DeclarationKind.CATCH_VARIABLE);

    @Override
    public FindingKind kind() {
        return FindingKind.UNUSED_VARIABLE;
    }

    @Override
    public List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx) {
        var exportSpecifiers = SymbolUses.exportSpecifierNames(tree);
        var candidates = new ArrayList<Candidate>();
        for (var decl : tree.declarations()) {
            if (!KINDS.contains(decl.kind()) || decl.has(DeclarationModifier.AMBIENT)) {
                continue;
            }
            if (SymbolUses.isExported(tree, decl, exportSpecifiers)) {
                continue;
            }
            if (SymbolUses.isUsed(tree, decl.name())) {
                continue;
            }
            candidates.add(candidate(tree, decl));
        }
        return candidates;
    }

    private Candidate candidate(SyntaxTree tree, Declaration decl) {
        boolean parameter = decl.kind() == DeclarationKind.PARAMETER;
        var traits = parameter ? EnumSet.of(Candidate.Trait.PARAMETER) : EnumSet.noneOf(Candidate.Trait.class);
        var what = switch (decl.kind()) {
            case PARAMETER -> "Parameter";
            case CATCH_VARIABLE -> "Caught exception";
            default -> "Variable";
        };
        var reason = decl.owner() == null
                ? "%s '%s' is declared but never read".formatted(what, decl.name())
                : "%s '%s' in '%s' is declared but never read".formatted(what, decl.name(), decl.owner());
        var fix = parameter
                ? "Rename to '_%s' to mark it intentionally unused".formatted(decl.name())
                : "Remove the declaration of '%s'".formatted(decl.name());
        return new Candidate(
                kind(),
                decl.name(),
                List.of(SourceLocation.of(tree.file(), decl.range())),
                decl.site(tree.file()),
                traits,
                parameter ? Set.of("parameter") : Set.of(),
                reason,
                fix);
    }
}
