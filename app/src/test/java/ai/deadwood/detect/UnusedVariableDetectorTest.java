package ai.deadwood.detect;

import static org.junit.jupiter.api.Assertions.*;

import ai.deadwood.analyzer.DeclarationKind;
import ai.deadwood.analyzer.DeclarationModifier;
import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.graph.DependencyGraph;
import ai.deadwood.model.Certainty;
import ai.deadwood.model.Finding;
import ai.deadwood.testutil.TestWorkspace;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UnusedVariableDetectorTest {
    @TempDir
    Path tempDir;

    private TestWorkspace ws;

    @BeforeEach
    void setUp() {
        ws = new TestWorkspace(tempDir);
    }

    private List<Finding> analyze(String path, AnalysisConfig config) throws Exception {
        var ctx = AnalysisContext.fileOnly(config, DependencyGraph.empty());
        var analyzer = new FileAnalyzer(ws.provider(), DetectorRegistry.of(new UnusedVariableDetector()), ctx, Map.of());
        return analyzer.analyze(new ProjectFile(ws.root(), path)).findings();
    }

    private List<Finding> analyze(String path) throws Exception {
        return analyze(path, AnalysisConfig.defaults());
    }

    @Test
    void unreadVariableIsSafelyRemovable() throws Exception {
        ws.file("a.ts").variable("used").variable("unused").ref("used");

        var findings = analyze("a.ts");

        assertEquals(1, findings.size());
        assertEquals("unused", findings.get(0).symbolName());
        assertEquals(Certainty.HIGH, findings.get(0).certainty());
        assertTrue(findings.get(0).safeFixAvailable());
        assertEquals(2, findings.get(0).primaryLocation().startLine());
    }

    @Test
    void unusedParameterHasNoSafeFix() throws Exception {
        ws.file("a.ts").function("compute").parameter("compute", "input").ref("compute");

        var findings = analyze("a.ts");

        assertEquals(1, findings.size());
        var finding = findings.get(0);
        assertFalse(finding.safeFixAvailable());
        assertTrue(finding.tags().contains("parameter"));
        assertEquals("Rename to '_input' to mark it intentionally unused", finding.suggestedFix());
    }

    @Test
    void restParametersAndExportedVariablesAreSkipped() throws Exception {
        ws.file("a.ts")
                .restParameter("log", "args")
                .variable("VERSION", DeclarationModifier.EXPORTED)
                .variable("LOCAL")
                .exportSpecifier("LOCAL");

        assertTrue(analyze("a.ts").isEmpty());
    }

    @Test
    void ambientDeclarationsAreSkipped() throws Exception {
        ws.file("a.ts").declare("process", DeclarationKind.VARIABLE, null, null, DeclarationModifier.AMBIENT);

        assertTrue(analyze("a.ts").isEmpty());
    }

    @Test
    void catchVariablesAreChecked() throws Exception {
        ws.file("a.ts").declare("err", DeclarationKind.CATCH_VARIABLE, "load", null);

        var findings = analyze("a.ts");

        assertEquals(1, findings.size());
        assertTrue(findings.get(0).reason().startsWith("Caught exception 'err'"));
    }

    @Test
    void underscorePrefixFollowsConfiguration() throws Exception {
        ws.file("a.ts").variable("_ignored");

        assertTrue(analyze("a.ts").isEmpty());
        assertEquals(1, analyze("a.ts", AnalysisConfig.defaults().withUnderscoreConvention(false)).size());
    }
}
