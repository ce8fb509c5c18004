package ai.deadwood.detect;

import ai.deadwood.analyzer.DeclarationModifier;
import ai.deadwood.analyzer.DeclarationSite;
import ai.deadwood.analyzer.Identifier;
import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.SymbolProvider;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.classify.ExternalReferences;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * Workspace-wide record of which declarations are referenced from which files.
 *
 * <p>Each file contributes what it references: symbols the provider resolved into other files, names it imports from
 * workspace files, namespace and default imports, and names the provider could not resolve. Unresolved names are
 * matched by name alone, so an unresolvable reference keeps a same-named export alive rather than reporting it dead.
 *
 * <p>Snapshots are immutable; {@link #withFile} and {@link #withoutFile} return new indexes sharing the untouched
 * contributions.
 */
public final class ReferenceIndex implements ExternalReferences {
    private static final Logger logger = LogManager.getLogger(ReferenceIndex.class);

    private static final ReferenceIndex EMPTY = new ReferenceIndex(HashTreePMap.empty());

    /** A declaration identified by file and name. */
    record SymbolKey(ProjectFile file, String name) {}

    /** What one file references in others. */
    public record Contribution(
            ProjectFile file,
            Set<SymbolKey> resolved,
            Set<SymbolKey> imported,
            Set<ProjectFile> namespaceImported,
            Set<ProjectFile> defaultImported,
            Set<String> defaultExports,
            Set<String> unresolvedNames) {}

    private final PMap<ProjectFile, Contribution> contributions;

    // aggregated views, derived from contributions
    private final Map<SymbolKey, Set<ProjectFile>> referencedBy = new HashMap<>();
    private final Map<String, Set<ProjectFile>> unresolvedBy = new HashMap<>();
    private final Set<ProjectFile> namespaceTargets = new HashSet<>();
    private final Set<ProjectFile> defaultTargets = new HashSet<>();

    private ReferenceIndex(PMap<ProjectFile, Contribution> contributions) {
        this.contributions = contributions;
        for (var c : contributions.values()) {
            for (var key : c.resolved()) {
                referencedBy.computeIfAbsent(key, k -> new HashSet<>()).add(c.file());
            }
            for (var key : c.imported()) {
                referencedBy.computeIfAbsent(key, k -> new HashSet<>()).add(c.file());
            }
            for (var name : c.unresolvedNames()) {
                unresolvedBy.computeIfAbsent(name, k -> new HashSet<>()).add(c.file());
            }
            namespaceTargets.addAll(c.namespaceImported());
            defaultTargets.addAll(c.defaultImported());
        }
    }

    public static ReferenceIndex empty() {
        return EMPTY;
    }

    public static ReferenceIndex of(Collection<Contribution> contributions) {
        var map = new HashMap<ProjectFile, Contribution>();
        contributions.forEach(c -> map.put(c.file(), c));
        return new ReferenceIndex(HashTreePMap.from(map));
    }

    public static ReferenceIndex build(Collection<SyntaxTree> trees, SymbolProvider provider) {
        var index = of(trees.stream().map(t -> contributionOf(t, provider)).toList());
        logger.debug("Reference index built over {} file(s)", trees.size());
        return index;
    }

    /** Computes one file's contribution. Safe to call concurrently for different trees. */
    public static Contribution contributionOf(SyntaxTree tree, SymbolProvider provider) {
        var file = tree.file();
        var resolved = new HashSet<SymbolKey>();
        var imported = new HashSet<SymbolKey>();
        var namespaceImported = new HashSet<ProjectFile>();
        var defaultImported = new HashSet<ProjectFile>();
        var unresolved = new HashSet<String>();

        for (var imp : tree.imports()) {
            var target = imp.resolvedFile();
            if (target == null || target.equals(file)) {
                continue;
            }
            for (var binding : imp.bindings()) {
                switch (binding.kind()) {
                    case NAMESPACE -> namespaceImported.add(target);
                    case DEFAULT -> defaultImported.add(target);
                    case NAMED -> imported.add(new SymbolKey(target, binding.importedName()));
                }
            }
        }

        for (var id : tree.identifiers()) {
            if (id.role() != Identifier.Role.REFERENCE && id.role() != Identifier.Role.PROPERTY) {
                continue;
            }
            var sites = provider.resolveSymbol(tree, id);
            if (sites.isEmpty()) {
                unresolved.add(id.name());
                continue;
            }
            for (var site : sites) {
                if (!site.file().equals(file)) {
                    resolved.add(new SymbolKey(site.file(), site.name()));
                }
            }
        }

        var defaultExports = new HashSet<String>();
        for (var decl : tree.declarations()) {
            if (decl.has(DeclarationModifier.DEFAULT_EXPORT)) {
                defaultExports.add(decl.name());
            }
        }

        return new Contribution(
                file,
                Set.copyOf(resolved),
                Set.copyOf(imported),
                Set.copyOf(namespaceImported),
                Set.copyOf(defaultImported),
                Set.copyOf(defaultExports),
                Set.copyOf(unresolved));
    }

    public ReferenceIndex withFile(Contribution contribution) {
        return new ReferenceIndex(contributions.plus(contribution.file(), contribution));
    }

    public ReferenceIndex withoutFile(ProjectFile file) {
        return contributions.containsKey(file) ? new ReferenceIndex(contributions.minus(file)) : this;
    }

    public int size() {
        return contributions.size();
    }

    /**
     * Other files whose references decide whether the named declarations of {@code file} are used: files referencing
     * them by resolved symbol or named import, and files with an unresolved reference to any of the names.
     */
    public Set<ProjectFile> referrersOf(ProjectFile file, Collection<String> names) {
        var result = new HashSet<ProjectFile>();
        for (var name : names) {
            result.addAll(referencedBy.getOrDefault(new SymbolKey(file, name), Set.of()));
            result.addAll(unresolvedBy.getOrDefault(name, Set.of()));
        }
        result.remove(file);
        return result;
    }

    @Override
    public boolean isReferencedOutside(DeclarationSite site) {
        var file = site.file();
        var name = site.name();

        if (namespaceTargets.contains(file)) {
            return true;
        }
        var own = contributions.get(file);
        if (defaultTargets.contains(file) && own != null && own.defaultExports().contains(name)) {
            return true;
        }
        if (hasOtherFile(referencedBy.get(new SymbolKey(file, name)), file)) {
            return true;
        }
        return hasOtherFile(unresolvedBy.get(name), file);
    }

    private static boolean hasOtherFile(@Nullable Set<ProjectFile> files, ProjectFile self) {
        if (files == null) {
            return false;
        }
        return files.size() > 1 || (files.size() == 1 && !files.contains(self));
    }
}
