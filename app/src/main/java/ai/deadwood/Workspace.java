package ai.deadwood;

import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.SymbolProvider;
import ai.deadwood.cache.HashSource;
import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.model.SourceUnit;
import ai.deadwood.util.ContentHashes;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * The files under analysis: discovery under the root, and the registry of source units with their content hashes.
 * The registry is the hash source result caches validate against.
 */
public final class Workspace implements HashSource {
    private static final Logger logger = LogManager.getLogger(Workspace.class);

    private static final Set<String> SKIPPED_DIRS = Set.of("node_modules", ".git");

    public enum Change {
        ADDED,
        MODIFIED,
        REMOVED,
        UNCHANGED
    }

    private final Path root;
    private final SymbolProvider provider;
    private volatile PMap<String, SourceUnit> units = HashTreePMap.empty();

    public Workspace(Path root, SymbolProvider provider) {
        this.root = root.toAbsolutePath().normalize();
        this.provider = provider;
    }

    public Path root() {
        return root;
    }

    public ProjectFile file(String relativePath) {
        return new ProjectFile(root, relativePath);
    }

    /** Every analyzable file under the root, sorted by path. */
    public List<ProjectFile> discover(AnalysisConfig config) {
        var ignores = IgnoreMatcher.of(config.ignorePatterns());
        var found = new ArrayList<ProjectFile>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    var name = dir.getFileName();
                    if (!dir.equals(root) && name != null && SKIPPED_DIRS.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        var pf = new ProjectFile(root, root.relativize(file));
                        if (isAnalyzable(pf, ignores)) {
                            found.add(pf);
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan workspace " + root, e);
        }
        found.sort(null);
        logger.debug("Discovered {} analyzable file(s) under {}", found.size(), root);
        return found;
    }

    public boolean isAnalyzable(ProjectFile file, AnalysisConfig config) {
        return isAnalyzable(file, IgnoreMatcher.of(config.ignorePatterns()));
    }

    private boolean isAnalyzable(ProjectFile file, IgnoreMatcher ignores) {
        var path = file.path();
        if (path.endsWith(".d.ts") || ignores.matches(path)) {
            return false;
        }
        for (var part : file.getRelPath()) {
            if (SKIPPED_DIRS.contains(part.toString())) {
                return false;
            }
        }
        return provider.supports(file);
    }

    /** Replaces the registry with freshly hashed units for {@code files}. Unreadable files are left out. */
    public List<ProjectFile> registerAll(Collection<ProjectFile> files) {
        var fresh = new HashMap<String, SourceUnit>();
        var registered = new ArrayList<ProjectFile>();
        for (var file : files) {
            try {
                fresh.put(file.path(), new SourceUnit(file, ContentHashes.sha256(file.absPath())));
                registered.add(file);
            } catch (IOException e) {
                logger.warn("Could not read {}: {}", file, e.getMessage());
            }
        }
        units = HashTreePMap.from(fresh);
        return registered;
    }

    /** Re-reads one file and updates its unit. */
    public Change refresh(String path, AnalysisConfig config) {
        var file = file(path);
        var previous = units.get(file.path());
        if (!Files.isRegularFile(file.absPath()) || !isAnalyzable(file, config)) {
            if (previous != null) {
                units = units.minus(file.path());
                return Change.REMOVED;
            }
            return Change.UNCHANGED;
        }

        String hash;
        try {
            hash = ContentHashes.sha256(file.absPath());
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", file, e.getMessage());
            if (previous != null) {
                units = units.minus(file.path());
                return Change.REMOVED;
            }
            return Change.UNCHANGED;
        }

        if (previous != null && previous.contentHash().equals(hash)) {
            return Change.UNCHANGED;
        }
        units = units.plus(file.path(), new SourceUnit(file, hash));
        return previous == null ? Change.ADDED : Change.MODIFIED;
    }

    public Optional<SourceUnit> unit(String path) {
        return Optional.ofNullable(units.get(path));
    }

    public List<String> paths() {
        return units.keySet().stream().sorted().toList();
    }

    public boolean contains(String path) {
        return units.containsKey(path);
    }

    @Override
    public @Nullable String currentHash(String path) {
        var unit = units.get(path);
        return unit == null ? null : unit.contentHash();
    }

    /** Glob ignore patterns; a leading {@code **}{@code /} also matches at the top level. */
    private record IgnoreMatcher(List<PathMatcher> matchers) {
        static IgnoreMatcher of(List<String> patterns) {
            var fs = FileSystems.getDefault();
            var matchers = new ArrayList<PathMatcher>();
            for (var pattern : patterns) {
                matchers.add(fs.getPathMatcher("glob:" + pattern));
                if (pattern.startsWith("**/")) {
                    matchers.add(fs.getPathMatcher("glob:" + pattern.substring(3)));
                }
            }
            return new IgnoreMatcher(List.copyOf(matchers));
        }

        boolean matches(String path) {
            var p = Path.of(path);
            return matchers.stream().anyMatch(m -> m.matches(p));
        }
    }
}
