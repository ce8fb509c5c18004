package ai.deadwood.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A closed walk through the dependency graph: each node imports the next and the last imports the first. The walk is
 * stored without repeating the first node at the end, rotated so it starts at its lexicographically smallest node.
 */
public record Cycle(List<String> nodes) {

    public Cycle {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Empty cycle");
        }
        nodes = List.copyOf(rotateToSmallest(nodes));
    }

    /** A two-module cycle, A imports B and B imports A. */
    public boolean isDirect() {
        return nodes.size() == 2;
    }

    public boolean isSelfImport() {
        return nodes.size() == 1;
    }

    public int length() {
        return nodes.size();
    }

    public String start() {
        return nodes.get(0);
    }

    /** Identity used for deduplication. */
    public SortedSet<String> nodeSet() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(nodes));
    }

    public boolean contains(String node) {
        return nodes.contains(node);
    }

    /** Renders as {@code a.ts -> b.ts -> a.ts}. */
    public String describe() {
        return String.join(" -> ", nodes) + " -> " + nodes.get(0);
    }

    private static List<String> rotateToSmallest(List<String> walk) {
        int min = 0;
        for (int i = 1; i < walk.size(); i++) {
            if (walk.get(i).compareTo(walk.get(min)) < 0) {
                min = i;
            }
        }
        if (min == 0) {
            return walk;
        }
        var rotated = new ArrayList<String>(walk.size());
        rotated.addAll(walk.subList(min, walk.size()));
        rotated.addAll(walk.subList(0, min));
        return rotated;
    }
}
