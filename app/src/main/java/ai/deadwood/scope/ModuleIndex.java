package ai.deadwood.scope;

import ai.deadwood.graph.DependencyGraph;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/** The workspace's module structure: named boundaries and the files each one owns. */
public final class ModuleIndex {

    public enum Kind {
        /** Every source file is its own module. */
        PER_FILE,
        /** Modules are detected packages. */
        PACKAGES
    }

    private final Kind kind;
    private final List<ModuleBoundary> boundaries;
    private final Map<String, ModuleBoundary> byRoot = new HashMap<>();
    private final PMap<String, List<String>> filesByModule;

    private ModuleIndex(Kind kind, List<ModuleBoundary> boundaries, Collection<String> files) {
        this.kind = kind;
        // deepest first so the first owner found is the longest prefix
        this.boundaries = boundaries.stream()
                .sorted(Comparator.comparingInt(ModuleBoundary::depth).reversed())
                .toList();
        for (var b : this.boundaries) {
            byRoot.putIfAbsent(b.root(), b);
        }
        var grouped = new TreeMap<String, List<String>>();
        for (var b : boundaries) {
            grouped.put(b.id(), new ArrayList<>());
        }
        for (var file : files) {
            moduleOf(file).ifPresent(module -> grouped.get(module).add(file));
        }
        grouped.values().forEach(list -> list.sort(null));
        var immutable = new HashMap<String, List<String>>();
        grouped.forEach((k, v) -> immutable.put(k, List.copyOf(v)));
        this.filesByModule = HashTreePMap.from(immutable);
    }

    public static ModuleIndex perFile(Collection<String> files) {
        var boundaries = files.stream().map(f -> new ModuleBoundary(f, f)).toList();
        return new ModuleIndex(Kind.PER_FILE, boundaries, files);
    }

    public static ModuleIndex ofPackages(List<ModuleBoundary> boundaries, Collection<String> files) {
        return new ModuleIndex(Kind.PACKAGES, boundaries, files);
    }

    public Kind kind() {
        return kind;
    }

    public List<ModuleBoundary> boundaries() {
        return boundaries;
    }

    /** Module ids, sorted. */
    public List<String> moduleIds() {
        return filesByModule.keySet().stream().sorted().toList();
    }

    public int size() {
        return filesByModule.size();
    }

    /** Owning module by longest component-wise prefix match, or empty if the path is outside every boundary. */
    public Optional<String> moduleOf(String path) {
        var exact = byRoot.get(path);
        if (exact != null) {
            return Optional.of(exact.id());
        }
        for (var boundary : boundaries) {
            if (boundary.owns(path)) {
                return Optional.of(boundary.id());
            }
        }
        return Optional.empty();
    }

    public List<String> filesOf(String module) {
        return filesByModule.getOrDefault(module, List.of());
    }

    /** The file graph collapsed onto this index's modules. */
    public DependencyGraph lift(DependencyGraph fileGraph) {
        return fileGraph.liftTo(path -> moduleOf(path).orElse(null));
    }

    /**
     * Boundaries of both indexes, with files re-assigned. Used while a change is being resolved, so that modules
     * which existed before or after the change are both known.
     */
    public ModuleIndex union(ModuleIndex other, Collection<String> files) {
        var merged = new LinkedHashMap<String, ModuleBoundary>();
        boundaries.forEach(b -> merged.put(b.id(), b));
        other.boundaries.forEach(b -> merged.putIfAbsent(b.id(), b));
        return new ModuleIndex(kind, List.copyOf(merged.values()), files);
    }

    @Override
    public String toString() {
        return "ModuleIndex{" + kind + ", modules=" + filesByModule.size() + "}";
    }
}
