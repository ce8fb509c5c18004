package ai.deadwood;

import static org.junit.jupiter.api.Assertions.*;

import ai.deadwood.analyzer.DeclarationModifier;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.cache.CacheStats;
import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.config.EngineSettings;
import ai.deadwood.config.ProjectConfig;
import ai.deadwood.detect.AnalysisContext;
import ai.deadwood.detect.Detector;
import ai.deadwood.detect.DetectorRegistry;
import ai.deadwood.exception.AnalysisRunException;
import ai.deadwood.model.Candidate;
import ai.deadwood.model.Certainty;
import ai.deadwood.model.ChangeSet;
import ai.deadwood.model.FileAnalysisResult;
import ai.deadwood.model.Finding;
import ai.deadwood.model.FindingKind;
import ai.deadwood.scope.ModuleIndex;
import ai.deadwood.testutil.TestWorkspace;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkspaceOrchestratorTest {
    @TempDir
    Path tempDir;

    private TestWorkspace ws;
    private WorkspaceOrchestrator orchestrator;

    private static final ProjectConfig CONFIG = new ProjectConfig(
            AnalysisConfig.defaults(),
            EngineSettings.defaults().withWorkerCount(2).withErrorCooldown(Duration.ofMillis(20)));

    @BeforeEach
    void setUp() {
        ws = new TestWorkspace(tempDir);
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    private WorkspaceOrchestrator open(DetectorRegistry registry) {
        orchestrator = new WorkspaceOrchestrator(ws.root(), ws.provider(), CONFIG, registry);
        return orchestrator;
    }

    private WorkspaceOrchestrator open() {
        return open(DetectorRegistry.defaults());
    }

    /** util.ts with one dead helper, app.ts with one unused import, and a cycle between a.ts and b.ts. */
    private void writeSample() {
        ws.file("util.ts")
                .function("format", DeclarationModifier.EXPORTED)
                .function("unusedHelper");
        ws.file("app.ts")
                .importFrom("./util", "util.ts", "format")
                .importFrom("lodash", null, "debounce")
                .ref("format");
        ws.file("a.ts")
                .importFrom("./b", "b.ts", "fromB")
                .ref("fromB")
                .variable("fromA", DeclarationModifier.EXPORTED);
        ws.file("b.ts")
                .importFrom("./a", "a.ts", "fromA")
                .ref("fromA")
                .variable("fromB", DeclarationModifier.EXPORTED);
    }

    /** b.ts imports a.ts, c.ts imports b.ts, d.ts stands alone. */
    private void writeChain() {
        ws.file("a.ts").variable("shared", DeclarationModifier.EXPORTED);
        ws.file("b.ts")
                .importFrom("./a", "a.ts", "shared")
                .ref("shared")
                .variable("fromB", DeclarationModifier.EXPORTED);
        ws.file("c.ts").importFrom("./b", "b.ts", "fromB").ref("fromB");
        ws.file("d.ts").variable("alone").ref("alone");
    }

    private static List<String> paths(List<FileAnalysisResult> results) {
        return results.stream().map(FileAnalysisResult::filePath).toList();
    }

    @Test
    void workspaceRunReportsEveryKindOfIssue() {
        writeSample();

        var result = open().analyzeWorkspace();

        assertEquals(4, result.totalFiles());
        assertEquals(0, result.failedFiles());
        assertEquals(List.of("a.ts", "app.ts", "b.ts", "util.ts"), paths(result.fileResults()));
        assertEquals(3, result.totalIssues());
        assertEquals(1, result.issuesOf(FindingKind.DEAD_FUNCTION));
        assertEquals(1, result.issuesOf(FindingKind.UNUSED_IMPORT));
        assertEquals(1, result.issuesOf(FindingKind.CIRCULAR_DEPENDENCY));
        assertEquals(3, result.issuesByCertainty().get(Certainty.HIGH));

        var cycle = result.allFindings().stream()
                .filter(f -> f.kind() == FindingKind.CIRCULAR_DEPENDENCY)
                .findFirst()
                .orElseThrow();
        assertEquals("a.ts", cycle.filePath());
        assertTrue(cycle.tags().contains("direct"));
        assertEquals(RunState.DONE, orchestrator.state());
    }

    @Test
    void repeatedRunsYieldIdenticalIdsFromCache() {
        writeSample();
        open();

        var first = orchestrator.analyzeWorkspace().allFindings().stream().map(Finding::id).toList();
        long hitsBefore = orchestrator.getCacheStats().hits();
        var second = orchestrator.analyzeWorkspace().allFindings().stream().map(Finding::id).toList();

        assertEquals(first, second);
        assertEquals(hitsBefore + 4, orchestrator.getCacheStats().hits());
    }

    @Test
    void detectorFailureOnOneFileDoesNotFailTheRun() {
        for (int i = 0; i < 9; i++) {
            ws.file("f" + i + ".ts").variable("v" + i);
        }
        ws.file("x.ts").variable("vx");
        Detector exploding = new Detector() {
            @Override
            public FindingKind kind() {
                return FindingKind.DEAD_EXPORT;
            }

            @Override
            public List<Candidate> analyze(SyntaxTree tree, AnalysisContext ctx) {
                if (tree.file().path().equals("x.ts")) {
                    throw new IllegalStateException("cannot handle x.ts");
                }
                return List.of();
            }
        };

        var result = open(DetectorRegistry.defaults().with(exploding)).analyzeWorkspace();

        assertEquals(10, result.totalFiles());
        assertEquals(1, result.failedFiles());
        assertEquals(9, result.fileResults().stream().filter(FileAnalysisResult::success).count());
        var failed = result.fileResults().stream().filter(r -> !r.success()).findFirst().orElseThrow();
        assertEquals("x.ts", failed.filePath());
        assertNotNull(failed.error());
        assertTrue(failed.error().contains("cannot handle x.ts"));
        // the other detectors' findings survive
        assertEquals(List.of("vx"), failed.findings().stream().map(Finding::symbolName).toList());
        assertEquals(RunState.DONE, orchestrator.state());
    }

    @Test
    void parseFailureIsReportedPerFile() {
        writeSample();
        ws.file("broken.ts").failParse();

        var result = open().analyzeWorkspace();

        assertEquals(5, result.totalFiles());
        assertEquals(1, result.failedFiles());
        var broken = result.fileResults().stream()
                .filter(r -> r.filePath().equals("broken.ts"))
                .findFirst()
                .orElseThrow();
        assertFalse(broken.success());
        assertTrue(broken.error().contains("unexpected token"));
    }

    @Test
    void incrementalRunCoversTransitiveDependents() {
        writeChain();
        open().analyzeWorkspace();

        ws.touch("a.ts");
        var result = orchestrator.analyzeIncremental(ChangeSet.of("a.ts"));

        var affected = result.affectedSet();
        assertEquals(List.of("a.ts"), affected.directlyAffected());
        assertEquals(List.of("b.ts", "c.ts"), affected.indirectlyAffected());
        assertEquals(List.of("a.ts", "b.ts", "c.ts"), affected.chains().get("c.ts"));
        assertEquals(List.of("a.ts", "b.ts", "c.ts"), paths(result.fileResults()));

        var summary = result.summary();
        assertEquals(4, summary.totalModules());
        assertEquals(3, summary.analyzedModules());
        assertEquals(1, summary.skippedModules());
        assertEquals(3, summary.analyzedFiles());
    }

    @Test
    void incrementalRunOnAFreshOrchestratorScansFirst() {
        writeChain();

        var result = open().analyzeIncremental(ChangeSet.of("b.ts"));

        assertEquals(List.of("b.ts"), result.affectedSet().directlyAffected());
        assertEquals(List.of("c.ts"), result.affectedSet().indirectlyAffected());
        assertEquals(List.of("b.ts", "c.ts"), paths(result.fileResults()));
    }

    @Test
    void deletedFileStillPullsInItsFormerDependents() {
        writeChain();
        open().analyzeWorkspace();

        ws.delete("b.ts");
        var result = orchestrator.analyzeIncremental(ChangeSet.of("b.ts"));

        assertEquals(List.of("b.ts"), result.affectedSet().directlyAffected());
        assertTrue(result.affectedSet().contains("c.ts"));
        assertEquals(List.of("c.ts"), paths(result.fileResults()));
        assertFalse(orchestrator.workspace().contains("b.ts"));
    }

    @Test
    void addedFileIsAnalyzed() {
        writeChain();
        open().analyzeWorkspace();

        ws.file("e.ts").importFrom("./a", "a.ts", "shared").ref("shared");
        var result = orchestrator.analyzeIncremental(ChangeSet.of("e.ts"));

        assertEquals(List.of("e.ts"), result.affectedSet().directlyAffected());
        assertEquals(List.of("e.ts"), paths(result.fileResults()));
        assertEquals(5, result.summary().totalModules());
    }

    @Test
    void repeatedCommitIsServedFromCache() {
        writeChain();
        open();

        var first = orchestrator.analyzeCommit(ChangeSet.of("a.ts"));
        CacheStats before = orchestrator.getCacheStats();
        var second = orchestrator.analyzeCommit(ChangeSet.of("a.ts"));
        CacheStats after = orchestrator.getCacheStats();

        assertEquals(before.hits() + 1, after.hits());
        assertEquals(before.misses(), after.misses());
        assertEquals(first.fileResults(), second.fileResults());
        assertEquals(first.affectedSet(), second.affectedSet());
        assertNotEquals(first.changeSet().changeId(), second.changeSet().changeId());
    }

    @Test
    void commitCacheMissesAfterContentChange() {
        writeChain();
        open();
        orchestrator.analyzeCommit(ChangeSet.of("a.ts"));
        long misses = orchestrator.getCacheStats().misses();

        ws.touch("a.ts");
        orchestrator.analyzeCommit(ChangeSet.of("a.ts"));

        assertTrue(orchestrator.getCacheStats().misses() > misses);
    }

    @Test
    void singleFileAnalysisDoesNotJudgeExports() {
        writeSample();

        var result = open().analyzeFile("util.ts");

        assertTrue(result.success());
        assertEquals(1, result.findings().size());
        var helper = result.findings().get(0);
        assertEquals("unusedHelper", helper.symbolName());
        assertEquals(Certainty.MEDIUM, helper.certainty());
    }

    @Test
    void singleFileAnalysisOfMissingFileFails() {
        writeSample();

        var result = open().analyzeFile("nope.ts");

        assertFalse(result.success());
        assertEquals("File not found or not analyzable", result.error());
        assertEquals(RunState.DONE, orchestrator.state());
    }

    @Test
    void singleFileRunKeepsTheWorkspaceSnapshotCurrent() {
        ws.file("app.ts").importFrom("lodash", null, "debounce");
        var orchestrator = open();
        assertEquals(1, orchestrator.analyzeWorkspace().issuesOf(FindingKind.UNUSED_IMPORT));

        ws.file("app.ts", "export const ready = true;\n");
        assertTrue(orchestrator.analyzeFile("app.ts").findings().isEmpty());

        var incremental = orchestrator.analyzeIncremental(ChangeSet.of("app.ts"));
        assertEquals(List.of("app.ts"), paths(incremental.fileResults()));
        assertTrue(incremental.allFindings().isEmpty());
        assertEquals(0, orchestrator.analyzeWorkspace().totalIssues());
    }

    @Test
    void cachedRunMatchesAFreshRunAfterANameOnlyReferrerChanges() {
        ws.file("util.ts").function("foo", DeclarationModifier.EXPORTED);
        ws.file("other.ts").ref("foo");
        var orchestrator = open();
        assertEquals(0, orchestrator.analyzeWorkspace().totalIssues());

        ws.file("other.ts", "// no longer mentions foo\n");
        var cached = ids(orchestrator.analyzeWorkspace().allFindings());
        orchestrator.clearCache();
        var fresh = ids(orchestrator.analyzeWorkspace().allFindings());

        assertEquals(List.of("dead-function:util.ts:foo:1"), fresh);
        assertEquals(fresh, cached);
    }

    private static List<String> ids(List<Finding> findings) {
        return findings.stream().map(Finding::id).sorted().toList();
    }

    @Test
    void listenersSeeEveryTransition() {
        writeSample();
        var seen = new ArrayList<String>();
        open().addListener((runId, from, to) -> seen.add(from + "->" + to));

        orchestrator.analyzeWorkspace();

        assertEquals(
                List.of("IDLE->SCANNING", "SCANNING->SCHEDULING", "SCHEDULING->AGGREGATING", "AGGREGATING->DONE"),
                seen);
    }

    @Test
    void runAfterCloseFails() {
        writeSample();
        open().close();

        assertThrows(AnalysisRunException.class, () -> orchestrator.analyzeWorkspace());
        assertEquals(RunState.FAILED, orchestrator.state());
    }

    @Test
    void packagesBecomeModules() {
        ws.write("packages/core/package.json", "{\"name\": \"@demo/core\"}");
        ws.write("packages/app/package.json", "{\"name\": \"@demo/app\"}");
        ws.write("packages/docs/package.json", "{}");
        ws.file("packages/core/util.ts").variable("x", DeclarationModifier.EXPORTED);
        ws.file("packages/app/main.ts")
                .importFrom("../core/util", "packages/core/util.ts", "x")
                .ref("x");
        ws.file("packages/docs/notes.ts").variable("n").ref("n");
        open();

        var modules = orchestrator.detectModuleStructure();
        assertEquals(ModuleIndex.Kind.PACKAGES, modules.kind());
        assertEquals(List.of("@demo/app", "@demo/core", "docs"), modules.moduleIds());

        var result = orchestrator.analyzeIncremental(ChangeSet.of("packages/core/util.ts"));

        assertEquals(List.of("@demo/core"), result.affectedSet().directlyAffected());
        assertEquals(List.of("@demo/app"), result.affectedSet().indirectlyAffected());
        assertEquals(3, result.summary().totalModules());
        assertEquals(1, result.summary().skippedModules());
        assertEquals(List.of("packages/app/main.ts", "packages/core/util.ts"), paths(result.fileResults()));
    }

    @Test
    void ignorePatternsExcludeFiles() {
        writeSample();
        ws.file("generated/schema.ts").variable("unused");
        var config = AnalysisConfig.defaults().withIgnorePatterns(List.of("generated/**"));

        var result = open().analyzeWorkspace(config);

        assertEquals(4, result.totalFiles());
    }

    @Test
    void clearingTheCacheResetsStatistics() {
        writeSample();
        open().analyzeWorkspace();
        assertTrue(orchestrator.getCacheStats().totalEntries() > 0);
        assertTrue(orchestrator.invalidate(List.of("util.ts")) > 0);

        orchestrator.clearCache();

        assertEquals(CacheStats.EMPTY, orchestrator.getCacheStats());
    }
}
