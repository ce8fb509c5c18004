package ai.deadwood.detect;

import ai.deadwood.analyzer.ImportBinding;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.model.Candidate;
import ai.deadwood.model.FindingKind;
import ai.deadwood.model.SourceLocation;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/** Import bindings whose local name is never read. Side-effect imports introduce no names and are never reported. */
public final class UnusedImportDetector implements Detector {

    @Override
    public FindingKind kind() {
        return FindingKind.UNUSED_IMPORT;
    }

    @Override
    public List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx) {
        var candidates = new ArrayList<Candidate>();
        for (var imp : tree.imports()) {
            if (imp.isSideEffect()) {
                continue;
            }
            var unused = imp.bindings().stream()
                    .filter(b -> !SymbolUses.isUsed(tree, b.localName()))
                    .toList();
            boolean wholeStatement = unused.size() == imp.bindings().size();
            for (var binding : unused) {
                var traits = EnumSet.noneOf(Candidate.Trait.class);
                var tags = new HashSet<String>();
                if (imp.typeOnly() || binding.typeOnly()) {
                    traits.add(Candidate.Trait.TYPE_ONLY);
                    tags.add("type-only");
                }
                tags.add(binding.kind().name().toLowerCase(Locale.ROOT) + "-import");
                var fix = wholeStatement
                        ? "Remove the import statement for '%s'".formatted(imp.moduleSpecifier())
                        : "Remove '%s' from the import of '%s'".formatted(binding.localName(), imp.moduleSpecifier());
                candidates.add(new Candidate(
                        kind(),
                        binding.localName(),
                        List.of(SourceLocation.of(tree.file(), binding.range())),
                        null,
                        traits,
                        tags,
                        describe(binding, imp.moduleSpecifier()),
                        fix));
            }
        }
        return candidates;
    }

    private static String describe(ImportBinding binding, String specifier) {
        return switch (binding.kind()) {
            case DEFAULT -> "Default import '%s' from '%s' is never used".formatted(binding.localName(), specifier);
            case NAMESPACE -> "Namespace import '%s' of '%s' is never used".formatted(binding.localName(), specifier);
            case NAMED -> "'%s' is imported from '%s' but never used".formatted(binding.localName(), specifier);
        };
    }
}
