package ai.deadwood.analyzer;

import java.util.EnumSet;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A named declaration in a file.
 *
 * @param owner the enclosing class for methods, the enclosing callable for parameters and locals, or null at top level
 * @param metrics present for callables when the provider measures them
 */
public record Declaration(
        String name,
        DeclarationKind kind,
        Set<DeclarationModifier> modifiers,
        @Nullable String owner,
        Range range,
        @Nullable FunctionMetrics metrics) {

    public Declaration {
        modifiers = modifiers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(modifiers));
    }

    public boolean has(DeclarationModifier modifier) {
        return modifiers.contains(modifier);
    }

    public boolean isExported() {
        return has(DeclarationModifier.EXPORTED) || has(DeclarationModifier.DEFAULT_EXPORT);
    }

    public boolean isTopLevel() {
        return owner == null;
    }

    public DeclarationSite site(ProjectFile file) {
        return new DeclarationSite(file, name, range);
    }
}
