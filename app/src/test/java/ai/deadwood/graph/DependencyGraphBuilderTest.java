package ai.deadwood.graph;

import static org.junit.jupiter.api.Assertions.*;

import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.testutil.TestWorkspace;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DependencyGraphBuilderTest {
    @TempDir
    Path tempDir;

    private TestWorkspace ws;

    @BeforeEach
    void setUp() {
        ws = new TestWorkspace(tempDir);
    }

    private List<ProjectFile> files(String... paths) {
        return List.of(paths).stream().map(p -> new ProjectFile(ws.root(), p)).toList();
    }

    @Test
    void buildRegistersForwardAndReverseEdgesForWorkspaceImports() {
        ws.file("a.ts").importFrom("./b", "b.ts", "x").importFrom("lodash", null, "debounce");
        ws.file("b.ts").importFrom("./c", "c.ts", "y");
        ws.file("c.ts").importFrom("./a", "a.ts", "z");

        var graph = DependencyGraphBuilder.build(files("a.ts", "b.ts", "c.ts"), ws.provider());

        assertEquals(List.of("a.ts", "b.ts", "c.ts"), graph.nodes());
        assertEquals(3, graph.edgeCount());
        assertEquals(Set.of("b.ts"), graph.dependenciesOf("a.ts"));
        assertEquals(Set.of("a.ts"), graph.dependentsOf("b.ts"));
        assertEquals(1, graph.cycles().size());
        assertEquals(List.of("a.ts", "b.ts", "c.ts"), graph.cycles().get(0).nodes());
    }

    @Test
    void fileThatFailsToParseStaysAsANodeWithoutEdges() {
        ws.file("a.ts").importFrom("./broken", "broken.ts", "x");
        ws.file("broken.ts").importFrom("./a", "a.ts", "y").failParse();

        var graph = DependencyGraphBuilder.build(files("a.ts", "broken.ts"), ws.provider());

        assertTrue(graph.contains("broken.ts"));
        assertTrue(graph.dependenciesOf("broken.ts").isEmpty());
        assertEquals(Set.of("a.ts"), graph.dependentsOf("broken.ts"));
        assertTrue(graph.cycles().isEmpty());
    }

    @Test
    void fromTreesMatchesBuild() throws Exception {
        ws.file("a.ts").importFrom("./b", "b.ts", "x");
        ws.file("b.ts").importFrom("./a", "a.ts", "y");
        var a = ws.provider().parse(new ProjectFile(ws.root(), "a.ts"));
        var b = ws.provider().parse(new ProjectFile(ws.root(), "b.ts"));

        var fromTrees = DependencyGraphBuilder.fromTrees(List.of(a, b));
        var built = DependencyGraphBuilder.build(files("a.ts", "b.ts"), ws.provider());

        assertEquals(built.nodes(), fromTrees.nodes());
        assertTrue(fromTrees.hasEdge("a.ts", "b.ts"));
        assertTrue(fromTrees.hasEdge("b.ts", "a.ts"));
        assertEquals(built.cycles(), fromTrees.cycles());
    }
}
