package ai.deadwood.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Tarjan's strongly-connected-components algorithm over forward edges, iterative so deep import chains cannot overflow
 * the stack.
 *
 * <p>Each component with more than one node yields one cycle covering the whole component. Every pair of modules
 * importing each other also yields a direct cycle, even inside a larger component, and a node that imports itself
 * yields a one-node cycle. Cycles are deduplicated by node set and returned sorted by their walk.
 */
public final class CycleDetector {
    private static final Logger logger = LogManager.getLogger(CycleDetector.class);

    private CycleDetector() {}

    public static List<Cycle> findCycles(DependencyGraph graph) {
        var cycles = new ArrayList<Cycle>();
        var seen = new HashSet<SortedSet<String>>();
        for (var component : stronglyConnectedComponents(graph)) {
            if (component.length > 1) {
                addIfNew(cycles, seen, walkComponent(graph, component));
            }
        }
        for (int h = 0; h < graph.size(); h++) {
            if (hasSelfEdge(graph, h)) {
                addIfNew(cycles, seen, new Cycle(List.of(graph.nodeAt(h))));
            }
            // direct pairs nested inside a larger component
            for (int w : graph.forward(h)) {
                if (w > h && hasEdge(graph, w, h)) {
                    addIfNew(cycles, seen, new Cycle(List.of(graph.nodeAt(h), graph.nodeAt(w))));
                }
            }
        }
        cycles.sort(Comparator.comparing(c -> String.join("\u0000", c.nodes())));
        if (!cycles.isEmpty()) {
            logger.debug("Found {} dependency cycle(s) in {}", cycles.size(), graph);
        }
        return Collections.unmodifiableList(cycles);
    }

    private static void addIfNew(List<Cycle> cycles, Set<SortedSet<String>> seen, Cycle cycle) {
        if (seen.add(cycle.nodeSet())) {
            cycles.add(cycle);
        }
    }

    /** Components as sorted handle arrays, in the order Tarjan completes them. */
    public static List<int[]> stronglyConnectedComponents(DependencyGraph graph) {
        int n = graph.size();
        var index = new int[n];
        var lowLink = new int[n];
        Arrays.fill(index, -1);
        var onStack = new BitSet(n);
        var stack = new ArrayDeque<Integer>();
        var components = new ArrayList<int[]>();
        int nextIndex = 0;

        // explicit call stack: node handle and position in its adjacency list
        var callNode = new int[n];
        var callEdge = new int[n];

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) {
                continue;
            }
            int depth = 0;
            callNode[0] = root;
            callEdge[0] = 0;
            index[root] = lowLink[root] = nextIndex++;
            stack.push(root);
            onStack.set(root);

            while (depth >= 0) {
                int v = callNode[depth];
                int[] edges = graph.forward(v);
                if (callEdge[depth] < edges.length) {
                    int w = edges[callEdge[depth]++];
                    if (index[w] < 0) {
                        index[w] = lowLink[w] = nextIndex++;
                        stack.push(w);
                        onStack.set(w);
                        depth++;
                        callNode[depth] = w;
                        callEdge[depth] = 0;
                    } else if (onStack.get(w)) {
                        lowLink[v] = Math.min(lowLink[v], index[w]);
                    }
                    continue;
                }

                if (lowLink[v] == index[v]) {
                    var members = new ArrayList<Integer>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack.clear(w);
                        members.add(w);
                    } while (w != v);
                    components.add(members.stream().mapToInt(Integer::intValue).sorted().toArray());
                }
                depth--;
                if (depth >= 0) {
                    int parent = callNode[depth];
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
            }
        }
        return components;
    }

    /**
     * Builds a closed walk through every member: start at the smallest member, go to each remaining member in sorted
     * order by the shortest path inside the component, then return to the start.
     */
    private static Cycle walkComponent(DependencyGraph graph, int[] members) {
        var inComponent = new BitSet(graph.size());
        for (int m : members) {
            inComponent.set(m);
        }
        var visited = new BitSet(graph.size());
        var walk = new ArrayList<Integer>();
        int start = members[0];
        int current = start;
        walk.add(start);
        visited.set(start);

        for (int target : members) {
            if (visited.get(target)) {
                continue;
            }
            for (int step : shortestPath(graph, inComponent, current, target)) {
                walk.add(step);
                visited.set(step);
            }
            current = target;
        }
        var back = shortestPath(graph, inComponent, current, start);
        walk.addAll(back.subList(0, back.size() - 1));

        return new Cycle(walk.stream().map(graph::nodeAt).toList());
    }

    /** BFS restricted to the component. Returns the path excluding {@code from} and including {@code to}. */
    private static List<Integer> shortestPath(DependencyGraph graph, BitSet inComponent, int from, int to) {
        var parent = new int[graph.size()];
        Arrays.fill(parent, -1);
        parent[from] = from;
        var queue = new ArrayDeque<Integer>();
        queue.add(from);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            if (v == to) {
                break;
            }
            for (int w : graph.forward(v)) {
                if (inComponent.get(w) && parent[w] < 0) {
                    parent[w] = v;
                    queue.add(w);
                }
            }
        }
        var path = new ArrayList<Integer>();
        int v = to;
        do {
            path.add(v);
            v = parent[v];
        } while (v != from);
        Collections.reverse(path);
        return path;
    }

    private static boolean hasSelfEdge(DependencyGraph graph, int handle) {
        return hasEdge(graph, handle, handle);
    }

    private static boolean hasEdge(DependencyGraph graph, int from, int to) {
        for (int w : graph.forward(from)) {
            if (w == to) {
                return true;
            }
        }
        return false;
    }
}
