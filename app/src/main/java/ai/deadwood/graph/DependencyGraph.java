package ai.deadwood.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.HashTreePSet;
import org.pcollections.PMap;
import org.pcollections.PSet;

/**
 * Immutable directed "imports" graph over module identifiers.
 *
 * <p>Nodes live in an arena: each identifier gets an integer handle (its index in sorted order) and edges are stored as
 * forward and reverse adjacency arrays indexed by handle. The persistent adjacency map the arena is derived from is
 * kept so that incremental edits share structure with the previous snapshot.
 */
public final class DependencyGraph {
    private static final DependencyGraph EMPTY = new DependencyGraph(HashTreePMap.empty());

    private final PMap<String, PSet<String>> adjacency;
    private final List<String> nodes;
    private final Map<String, Integer> handles;
    private final int[][] forward;
    private final int[][] reverse;
    private final int edgeCount;

    private volatile @Nullable List<Cycle> cycles;

    DependencyGraph(PMap<String, PSet<String>> adjacency) {
        this.adjacency = adjacency;
        this.nodes = List.copyOf(new TreeSet<>(adjacency.keySet()));
        this.handles = new HashMap<>(nodes.size() * 2);
        for (int i = 0; i < nodes.size(); i++) {
            handles.put(nodes.get(i), i);
        }

        var out = new ArrayList<List<Integer>>(nodes.size());
        var in = new ArrayList<List<Integer>>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            out.add(new ArrayList<>());
            in.add(new ArrayList<>());
        }
        int edges = 0;
        for (int from = 0; from < nodes.size(); from++) {
            for (var target : new TreeSet<>(adjacency.get(nodes.get(from)))) {
                Integer to = handles.get(target);
                assert to != null : "edge target " + target + " is not a node";
                out.get(from).add(to);
                in.get(to).add(from);
                edges++;
            }
        }
        this.forward = toArrays(out);
        this.reverse = toArrays(in);
        this.edgeCount = edges;
    }

    public static DependencyGraph empty() {
        return EMPTY;
    }

    public static DependencyGraphBuilder builder() {
        return new DependencyGraphBuilder(HashTreePMap.empty());
    }

    /** A builder seeded with this graph's nodes and edges. */
    public DependencyGraphBuilder toBuilder() {
        return new DependencyGraphBuilder(adjacency);
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    /** Node identifiers in handle order (sorted). */
    public List<String> nodes() {
        return nodes;
    }

    public boolean contains(String node) {
        return handles.containsKey(node);
    }

    /** @return the handle for a node, or -1 if the node is absent */
    public int handleOf(String node) {
        return handles.getOrDefault(node, -1);
    }

    public String nodeAt(int handle) {
        return nodes.get(handle);
    }

    int[] forward(int handle) {
        return forward[handle];
    }

    int[] reverse(int handle) {
        return reverse[handle];
    }

    public boolean hasEdge(String from, String to) {
        var targets = adjacency.get(from);
        return targets != null && targets.contains(to);
    }

    /** Modules {@code node} imports. */
    public Set<String> dependenciesOf(String node) {
        return collect(node, forward);
    }

    /** Modules that import {@code node}. */
    public Set<String> dependentsOf(String node) {
        return collect(node, reverse);
    }

    private Set<String> collect(String node, int[][] lists) {
        int h = handleOf(node);
        if (h < 0) {
            return Set.of();
        }
        var result = new LinkedHashSet<String>();
        for (int other : lists[h]) {
            result.add(nodes.get(other));
        }
        return result;
    }

    /** Cycles found by {@link CycleDetector}, computed once per snapshot. */
    public List<Cycle> cycles() {
        var local = cycles;
        if (local == null) {
            local = CycleDetector.findCycles(this);
            cycles = local;
        }
        return local;
    }

    public List<Cycle> cyclesContaining(String node) {
        return cycles().stream().filter(c -> c.contains(node)).toList();
    }

    /** Replaces the outgoing edges of {@code node}, adding the node and any targets if needed. */
    public DependencyGraph withFileUpdated(String node, Collection<String> imports) {
        return toBuilder().replaceEdges(node, imports).build();
    }

    /** Drops the node and every edge into or out of it. */
    public DependencyGraph withFileRemoved(String node) {
        return toBuilder().removeNode(node).build();
    }

    /** Every node and edge of both graphs. */
    public DependencyGraph union(DependencyGraph other) {
        var builder = toBuilder();
        for (var entry : other.adjacency.entrySet()) {
            builder.addNode(entry.getKey());
            for (var target : entry.getValue()) {
                builder.addEdge(entry.getKey(), target);
            }
        }
        return builder.build();
    }

    /**
     * Collapses nodes into their owners. Nodes without an owner are dropped, as are edges that stay inside one owner.
     */
    public DependencyGraph liftTo(Function<String, @Nullable String> owner) {
        var builder = builder();
        for (var node : nodes) {
            var from = owner.apply(node);
            if (from == null) {
                continue;
            }
            builder.addNode(from);
            for (var target : adjacency.get(node)) {
                var to = owner.apply(target);
                if (to != null && !to.equals(from)) {
                    builder.addEdge(from, to);
                }
            }
        }
        return builder.build();
    }

    PMap<String, PSet<String>> adjacency() {
        return adjacency;
    }

    static PSet<String> noEdges() {
        return HashTreePSet.empty();
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        var result = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            result[i] = lists.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    @Override
    public String toString() {
        return "DependencyGraph{nodes=" + nodes.size() + ", edges=" + edgeCount + "}";
    }
}
