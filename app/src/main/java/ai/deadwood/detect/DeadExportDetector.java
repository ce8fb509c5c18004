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
import java.util.regex.Pattern;

/**
 * Top-level exports. Whether another file uses them is decided by the classifier against the workspace reference
 * index. Package entry files ({@code index}, {@code main}, {@code lib}, {@code types}) export a public surface and are
 * skipped, as are callables with no local reference, which the dead-function detector already reports.
 */
public final class DeadExportDetector implements Detector {
    private static final Pattern ENTRY_FILE = Pattern.compile("(index|main|lib|types)\\.(ts|tsx|js|jsx|mjs|cjs)");

    @Override
    public FindingKind kind() {
        return FindingKind.DEAD_EXPORT;
    }

    @Override
    public List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx) {
        if (isEntryFile(tree)) {
            return List.of();
        }
        var exportSpecifiers = SymbolUses.exportSpecifierNames(tree);
        var candidates = new ArrayList<Candidate>();
        for (var decl : tree.topLevelDeclarations()) {
            if (decl.has(DeclarationModifier.AMBIENT) || !SymbolUses.isExported(tree, decl, exportSpecifiers)) {
                continue;
            }
            if (decl.kind().isCallable() && !SymbolUses.isCallableReferenced(tree, decl)) {
                continue;
            }
            candidates.add(candidate(tree, decl));
        }
        return candidates;
    }

    static boolean isEntryFile(SyntaxTree tree) {
        return ENTRY_FILE.matcher(tree.file().getFileName()).matches();
    }

    private Candidate candidate(SyntaxTree tree, Declaration decl) {
        var traits = EnumSet.of(Candidate.Trait.EXPORTED);
        if (decl.has(DeclarationModifier.DECORATED)) {
            traits.add(Candidate.Trait.DECORATED);
        }
        var tags = decl.has(DeclarationModifier.DEFAULT_EXPORT) ? Set.of("default-export") : Set.<String>of();
        return new Candidate(
                kind(),
                decl.name(),
                List.of(SourceLocation.of(tree.file(), decl.range())),
                decl.site(tree.file()),
                traits,
                tags,
                "%s '%s' is exported but no other file imports it".formatted(describe(decl.kind()), decl.name()),
                "Remove the export modifier from '%s'".formatted(decl.name()));
    }

    private static String describe(DeclarationKind kind) {
        return switch (kind) {
            case FUNCTION -> "Function";
            case CLASS -> "Class";
            case INTERFACE -> "Interface";
            case TYPE_ALIAS -> "Type";
            case ENUM -> "Enum";
            default -> "Symbol";
        };
    }
}
