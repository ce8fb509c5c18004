package ai.deadwood.analyzer;

/** Where a symbol is declared. Resolution may land in any workspace file. */
public record DeclarationSite(ProjectFile file, String name, Range range) {}
