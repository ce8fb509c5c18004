package ai.deadwood.detect;

import ai.deadwood.analyzer.Declaration;
import ai.deadwood.analyzer.DeclarationKind;
import ai.deadwood.analyzer.DeclarationModifier;
import ai.deadwood.analyzer.Identifier;
import ai.deadwood.analyzer.SyntaxTree;
import java.util.Set;
import java.util.stream.Collectors;

/** Name-based use checks within one file. */
final class SymbolUses {
    private SymbolUses() {}

    /** Any read of {@code name}: a plain reference, or the receiver of a property access such as {@code name.x}. */
    static boolean isUsed(SyntaxTree tree, String name) {
        for (var id : tree.identifiers()) {
            if (id.role() == Identifier.Role.REFERENCE && id.name().equals(name)) {
                return true;
            }
            if (id.role() == Identifier.Role.EXPORT_SPECIFIER && id.name().equals(name)) {
                return true;
            }
            if (id.role() == Identifier.Role.PROPERTY && name.equals(id.qualifier())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a callable is referenced in its own file. Functions need a plain reference; static methods a
     * {@code Owner.name} access; other methods any property access with that name.
     */
    static boolean isCallableReferenced(SyntaxTree tree, Declaration callable) {
        var name = callable.name();
        for (var id : tree.identifiers()) {
            if (!id.name().equals(name)) {
                continue;
            }
            switch (id.role()) {
                case REFERENCE -> {
                    if (callable.kind() != DeclarationKind.METHOD) {
                        return true;
                    }
                }
                case PROPERTY -> {
                    if (callable.kind() != DeclarationKind.METHOD) {
                        continue;
                    }
                    if (!callable.has(DeclarationModifier.STATIC)) {
                        return true;
                    }
                    if (callable.owner() != null && callable.owner().equals(id.qualifier())) {
                        return true;
                    }
                }
                default -> {}
            }
        }
        return false;
    }

    static Set<String> exportSpecifierNames(SyntaxTree tree) {
        return tree.identifiers().stream()
                .filter(id -> id.role() == Identifier.Role.EXPORT_SPECIFIER)
                .map(Identifier::name)
                .collect(Collectors.toSet());
    }

    /** Exported by a modifier, by an {@code export { name }} clause, or as a member of an exported class. */
    static boolean isExported(SyntaxTree tree, Declaration decl, Set<String> exportSpecifiers) {
        if (decl.isExported()) {
            return true;
        }
        if (decl.isTopLevel()) {
            return exportSpecifiers.contains(decl.name());
        }
        var owner = decl.owner();
        if (decl.kind() == DeclarationKind.METHOD && owner != null) {
            return tree.findTopLevel(owner)
                    .map(cls -> cls.isExported() || exportSpecifiers.contains(cls.name()))
                    .orElse(false);
        }
        return false;
    }
}
