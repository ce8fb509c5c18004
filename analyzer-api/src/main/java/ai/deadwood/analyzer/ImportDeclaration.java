package ai.deadwood.analyzer;

import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * An import statement as seen by the provider.
 *
 * @param moduleSpecifier the raw specifier text, e.g. {@code ./util} or {@code react}
 * @param resolvedFile the workspace file the specifier resolves to, or null for external packages and unresolvable
 *     specifiers
 * @param bindings local names introduced; empty for side-effect imports
 */
public record ImportDeclaration(
        String moduleSpecifier,
        @Nullable ProjectFile resolvedFile,
        List<ImportBinding> bindings,
        boolean typeOnly,
        Range range) {

    public ImportDeclaration {
        bindings = List.copyOf(bindings);
    }

    /** A side-effect import ({@code import 'polyfill'}) introduces no names and is never reported as unused. */
    public boolean isSideEffect() {
        return bindings.isEmpty();
    }

    public Optional<ProjectFile> target() {
        return Optional.ofNullable(resolvedFile);
    }
}
