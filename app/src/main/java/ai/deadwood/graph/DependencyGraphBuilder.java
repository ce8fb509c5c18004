package ai.deadwood.graph;

import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.SourceParseException;
import ai.deadwood.analyzer.SymbolProvider;
import ai.deadwood.analyzer.SyntaxTree;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pcollections.PMap;
import org.pcollections.PSet;

/**
 * Accumulates nodes and edges into a persistent adjacency map. Each {@link #build()} yields an independent immutable
 * {@link DependencyGraph}; the builder can keep going afterwards.
 */
public final class DependencyGraphBuilder {
    private static final Logger logger = LogManager.getLogger(DependencyGraphBuilder.class);

    private PMap<String, PSet<String>> adjacency;

    DependencyGraphBuilder(PMap<String, PSet<String>> adjacency) {
        this.adjacency = adjacency;
    }

    /**
     * Parses every file and registers an edge for each import that resolves to a workspace file. A file that fails to
     * parse stays in the graph with no outgoing edges.
     */
    public static DependencyGraph build(Collection<ProjectFile> files, SymbolProvider provider) {
        var trees = new HashMap<ProjectFile, SyntaxTree>();
        for (var file : files) {
            try {
                trees.put(file, provider.parse(file));
            } catch (SourceParseException e) {
                logger.warn("Could not read imports of {}: {}", file, e.getMessage());
            }
        }
        var graph = fromParsed(files, trees);
        logger.debug("Built {}", graph);
        return graph;
    }

    /** Graph over {@code files} from already parsed trees. Files without a tree are nodes with no outgoing edges. */
    public static DependencyGraph fromParsed(Collection<ProjectFile> files, Map<ProjectFile, SyntaxTree> trees) {
        var builder = DependencyGraph.builder();
        for (var file : files) {
            var tree = trees.get(file);
            if (tree != null) {
                builder.addFile(tree);
            } else {
                builder.addNode(file.path());
            }
        }
        return builder.build();
    }

    public static DependencyGraph fromTrees(Collection<SyntaxTree> trees) {
        var builder = DependencyGraph.builder();
        trees.forEach(builder::addFile);
        return builder.build();
    }

    public DependencyGraphBuilder addFile(SyntaxTree tree) {
        var from = tree.file().path();
        addNode(from);
        for (var target : tree.importedFiles()) {
            addEdge(from, target.path());
        }
        return this;
    }

    public DependencyGraphBuilder addNode(String node) {
        if (!adjacency.containsKey(node)) {
            adjacency = adjacency.plus(node, DependencyGraph.noEdges());
        }
        return this;
    }

    public DependencyGraphBuilder addEdge(String from, String to) {
        addNode(to);
        var targets = adjacency.get(from);
        adjacency = adjacency.plus(from, (targets == null ? DependencyGraph.noEdges() : targets).plus(to));
        return this;
    }

    public DependencyGraphBuilder replaceEdges(String from, Collection<String> targets) {
        adjacency = adjacency.plus(from, DependencyGraph.noEdges());
        for (var to : targets) {
            addEdge(from, to);
        }
        return this;
    }

    public DependencyGraphBuilder removeNode(String node) {
        adjacency = adjacency.minus(node);
        for (var entry : adjacency.entrySet()) {
            if (entry.getValue().contains(node)) {
                adjacency = adjacency.plus(entry.getKey(), entry.getValue().minus(node));
            }
        }
        return this;
    }

    public DependencyGraph build() {
        return new DependencyGraph(adjacency);
    }
}
