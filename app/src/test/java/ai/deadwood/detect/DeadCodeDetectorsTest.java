package ai.deadwood.detect;

import static org.junit.jupiter.api.Assertions.*;

import ai.deadwood.analyzer.DeclarationModifier;
import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.classify.AnalysisScope;
import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.graph.DependencyGraph;
import ai.deadwood.graph.DependencyGraphBuilder;
import ai.deadwood.model.Certainty;
import ai.deadwood.model.Finding;
import ai.deadwood.model.FindingKind;
import ai.deadwood.testutil.TestWorkspace;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Dead functions and dead exports, in single-file and workspace scope. */
class DeadCodeDetectorsTest {
    @TempDir
    Path tempDir;

    private TestWorkspace ws;
    private final DetectorRegistry registry =
            DetectorRegistry.of(new DeadFunctionDetector(), new DeadExportDetector());

    @BeforeEach
    void setUp() {
        ws = new TestWorkspace(tempDir);
    }

    private ProjectFile file(String path) {
        return new ProjectFile(ws.root(), path);
    }

    private List<Finding> analyzeFile(String path) throws Exception {
        var ctx = AnalysisContext.fileOnly(AnalysisConfig.defaults(), DependencyGraph.empty());
        return new FileAnalyzer(ws.provider(), registry, ctx, Map.of()).analyze(file(path)).findings();
    }

    /** Parses every given file and analyzes {@code path} with workspace-wide references. */
    private List<Finding> analyzeWorkspace(String path, String... allPaths) throws Exception {
        var trees = new ArrayList<SyntaxTree>();
        for (var p : allPaths) {
            trees.add(ws.provider().parse(file(p)));
        }
        var ctx = new AnalysisContext(
                AnalysisConfig.defaults(),
                AnalysisScope.Kind.WORKSPACE,
                DependencyGraphBuilder.fromTrees(trees),
                ReferenceIndex.build(trees, ws.provider()));
        return new FileAnalyzer(ws.provider(), registry, ctx, Map.of()).analyze(file(path)).findings();
    }

    private static Finding only(List<Finding> findings, String name) {
        var matching = findings.stream().filter(f -> f.symbolName().equals(name)).toList();
        assertEquals(1, matching.size(), "findings for " + name + ": " + findings);
        return matching.get(0);
    }

    @Test
    void uncalledFunctionIsMediumInFileScopeAndHighInWorkspaceScope() throws Exception {
        ws.file("a.ts").function("helper").function("used").ref("used");

        var inFile = analyzeFile("a.ts");
        assertEquals(1, inFile.size());
        assertEquals(Certainty.MEDIUM, only(inFile, "helper").certainty());

        var inWorkspace = analyzeWorkspace("a.ts", "a.ts");
        assertEquals(Certainty.HIGH, only(inWorkspace, "helper").certainty());
        assertFalse(only(inWorkspace, "helper").safeFixAvailable());
    }

    @Test
    void exportedFunctionIsNotJudgedFromOneFile() throws Exception {
        ws.file("lib/util.ts").function("format", DeclarationModifier.EXPORTED);

        assertTrue(analyzeFile("lib/util.ts").isEmpty());
    }

    @Test
    void exportedFunctionImportedElsewhereIsAlive() throws Exception {
        ws.file("util.ts").function("format", DeclarationModifier.EXPORTED).function("orphan", DeclarationModifier.EXPORTED);
        ws.file("app.ts").importFrom("./util", "util.ts", "format").ref("format");

        var findings = analyzeWorkspace("util.ts", "util.ts", "app.ts");

        assertEquals(1, findings.size());
        var orphan = only(findings, "orphan");
        assertEquals(FindingKind.DEAD_FUNCTION, orphan.kind());
        assertEquals(Certainty.HIGH, orphan.certainty());
        assertTrue(orphan.tags().contains("exported"));
    }

    @Test
    void methodCalledThroughAnyReceiverIsAlive() throws Exception {
        ws.file("a.ts")
                .classDecl("Service")
                .method("Service", "start")
                .method("Service", "load")
                .method("Service", "unusedHelper")
                .member("load")
                .ref("Service");

        var findings = analyzeFile("a.ts");

        assertEquals(1, findings.size());
        assertEquals("unusedHelper", findings.get(0).symbolName());
        assertTrue(findings.get(0).tags().contains("method"));
    }

    @Test
    void staticMethodNeedsItsOwnClassAsReceiver() throws Exception {
        ws.file("a.ts")
                .classDecl("Factory")
                .method("Factory", "create", DeclarationModifier.STATIC)
                .method("Factory", "build", DeclarationModifier.STATIC)
                .prop("Factory", "create")
                .prop("other", "build");

        var findings = analyzeFile("a.ts");

        assertEquals(1, findings.size());
        var build = findings.get(0);
        assertEquals("build", build.symbolName());
        assertTrue(build.tags().contains("static"));
    }

    @Test
    void frameworkNamesAreExcludedOrReduced() throws Exception {
        ws.file("a.ts")
                .classDecl("Widget")
                .ref("Widget")
                .method("Widget", "componentDidMount")
                .method("Widget", "handleClick")
                .method("Widget", "refresh", DeclarationModifier.DECORATED);

        var findings = analyzeWorkspace("a.ts", "a.ts");

        assertEquals(2, findings.size());
        assertEquals(Certainty.LOW, only(findings, "handleClick").certainty());
        assertEquals(Certainty.LOW, only(findings, "refresh").certainty());
        assertTrue(only(findings, "refresh").tags().contains("framework:decorated"));
    }

    @Test
    void unimportedExportIsReportedInWorkspaceScope() throws Exception {
        ws.file("config.ts")
                .variable("API_URL", DeclarationModifier.EXPORTED)
                .variable("TIMEOUT", DeclarationModifier.EXPORTED);
        ws.file("app.ts").importFrom("./config", "config.ts", "API_URL").ref("API_URL");

        var findings = analyzeWorkspace("config.ts", "config.ts", "app.ts");

        assertEquals(1, findings.size());
        var timeout = only(findings, "TIMEOUT");
        assertEquals(FindingKind.DEAD_EXPORT, timeout.kind());
        assertEquals(Certainty.HIGH, timeout.certainty());
        assertFalse(timeout.safeFixAvailable());
    }

    @Test
    void namespaceImportKeepsEveryExportAlive() throws Exception {
        ws.file("config.ts").variable("A", DeclarationModifier.EXPORTED).variable("B", DeclarationModifier.EXPORTED);
        ws.file("app.ts").importNamespace("./config", "config.ts", "cfg").prop("cfg", "A");

        assertTrue(analyzeWorkspace("config.ts", "config.ts", "app.ts").isEmpty());
    }

    @Test
    void defaultImportKeepsTheDefaultExportAlive() throws Exception {
        ws.file("widget.ts").classDecl("Widget", DeclarationModifier.DEFAULT_EXPORT);
        ws.file("app.ts").importDefault("./widget", "widget.ts", "W").ref("W");
        ws.file("orphan.ts").classDecl("Orphan", DeclarationModifier.DEFAULT_EXPORT);

        assertTrue(analyzeWorkspace("widget.ts", "widget.ts", "app.ts", "orphan.ts").isEmpty());
        var orphan = only(analyzeWorkspace("orphan.ts", "widget.ts", "app.ts", "orphan.ts"), "Orphan");
        assertTrue(orphan.tags().contains("default-export"));
    }

    @Test
    void unresolvedReferenceKeepsSameNamedExportAlive() throws Exception {
        ws.file("config.ts").variable("settings", DeclarationModifier.EXPORTED);
        // the provider cannot resolve this reference, so only its name is known
        ws.file("app.ts").ref("settings");

        assertTrue(analyzeWorkspace("config.ts", "config.ts", "app.ts").isEmpty());
    }

    @Test
    void entryFilesExportAPublicSurface() throws Exception {
        ws.file("src/index.ts").variable("VERSION", DeclarationModifier.EXPORTED);

        assertTrue(analyzeWorkspace("src/index.ts", "src/index.ts").isEmpty());
    }
}
