package ai.deadwood.analyzer;

import java.util.List;
import java.util.Optional;

/**
 * The provider's parse of one file, flattened to what dead-code analysis needs. All lists are in source order, which is
 * the traversal order detectors report in.
 *
 * @param text the full file text; ignore directives are read from it
 */
public record SyntaxTree(
        ProjectFile file,
        String text,
        List<ImportDeclaration> imports,
        List<Declaration> declarations,
        List<Identifier> identifiers) {

    public SyntaxTree {
        imports = List.copyOf(imports);
        declarations = List.copyOf(declarations);
        identifiers = List.copyOf(identifiers);
    }

    public List<Declaration> topLevelDeclarations() {
        return declarations.stream().filter(Declaration::isTopLevel).toList();
    }

    public Optional<Declaration> findTopLevel(String name) {
        return declarations.stream()
                .filter(d -> d.isTopLevel() && d.name().equals(name))
                .findFirst();
    }

    /** Workspace files this file imports, in import order, without duplicates. */
    public List<ProjectFile> importedFiles() {
        return imports.stream()
                .map(ImportDeclaration::resolvedFile)
                .filter(f -> f != null)
                .distinct()
                .toList();
    }
}
