package ai.deadwood.analyzer;

import java.util.List;

/**
 * External parser and symbol resolver. The engine never parses source itself; everything it knows about a file comes
 * through this interface.
 *
 * <p>Implementations must be safe to call from several worker threads at once. Each call to {@link #parse} returns a
 * tree that is owned by the caller.
 */
public interface SymbolProvider {

    /** Whether this provider understands the file at all. Unsupported files are skipped during workspace scans. */
    boolean supports(ProjectFile file);

    SyntaxTree parse(ProjectFile file) throws SourceParseException;

    /**
     * Resolves an identifier occurrence in {@code tree} to the declaration(s) it refers to. Sites may be in other files.
     * An empty list means the provider could not resolve it, which callers treat as "unknown", not "unreferenced".
     */
    List<DeclarationSite> resolveSymbol(SyntaxTree tree, Identifier node);
}
