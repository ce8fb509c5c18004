package ai.deadwood;

import ai.deadwood.analyzer.Declaration;
import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.SourceParseException;
import ai.deadwood.analyzer.SymbolProvider;
import ai.deadwood.analyzer.SyntaxTree;
import ai.deadwood.cache.CacheStats;
import ai.deadwood.cache.CacheStore;
import ai.deadwood.cache.InMemoryCacheStore;
import ai.deadwood.cache.ResultCache;
import ai.deadwood.classify.AnalysisScope;
import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.config.EngineSettings;
import ai.deadwood.config.ProjectConfig;
import ai.deadwood.detect.AnalysisContext;
import ai.deadwood.detect.DetectorRegistry;
import ai.deadwood.detect.FileAnalyzer;
import ai.deadwood.detect.ReferenceIndex;
import ai.deadwood.exception.AnalysisRunException;
import ai.deadwood.exception.DetectorFailureException;
import ai.deadwood.exception.GlobalExceptionHandler;
import ai.deadwood.exception.ScopeResolutionException;
import ai.deadwood.exception.WorkerPoolShutdownException;
import ai.deadwood.graph.Cycle;
import ai.deadwood.graph.DependencyGraph;
import ai.deadwood.graph.DependencyGraphBuilder;
import ai.deadwood.model.ChangeSet;
import ai.deadwood.model.FileAnalysisResult;
import ai.deadwood.model.IncrementalAnalysisResult;
import ai.deadwood.model.WorkspaceAnalysisResult;
import ai.deadwood.pool.AnalysisTask;
import ai.deadwood.pool.PoolStats;
import ai.deadwood.pool.WorkerPool;
import ai.deadwood.scope.ChangeScopeResolver;
import ai.deadwood.scope.ModuleIndex;
import ai.deadwood.scope.ModuleStructureDetector;
import ai.deadwood.util.ExecutorServiceUtil;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;

/**
 * Entry point of the engine. Drives full, incremental and single-file runs through
 * {@code SCANNING -> SCHEDULING -> AGGREGATING -> DONE}, or {@code FAILED} when the run cannot complete.
 *
 * <p>Runs are serialized. Between runs the orchestrator is the only writer of the workspace snapshot (parsed trees,
 * dependency graph, reference index, module structure); during a run workers only read it.
 *
 * <p>A file whose parse or detectors fail is reported with {@code success=false} and does not fail the run. Scope
 * resolution failures and pool shutdown do, surfacing as {@link AnalysisRunException}.
 */
public final class WorkspaceOrchestrator implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(WorkspaceOrchestrator.class);

    private final Workspace workspace;
    private final SymbolProvider provider;
    private final DetectorRegistry registry;
    private final ProjectConfig projectConfig;
    private final WorkerPool pool;
    private final ExecutorService scanExecutor;
    private final ResultCache<FileAnalysisResult> fileCache;
    private final ResultCache<IncrementalAnalysisResult> commitCache;
    private final ReentrantLock runLock = new ReentrantLock();
    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong runSequence = new AtomicLong();

    // workspace snapshot; replaced only while holding runLock
    private PMap<ProjectFile, SyntaxTree> trees = HashTreePMap.empty();
    private DependencyGraph graph = DependencyGraph.empty();
    private ReferenceIndex references = ReferenceIndex.empty();
    private @Nullable ModuleIndex moduleIndex;
    private boolean scanned;

    private volatile RunState state = RunState.IDLE;

    /** Reads {@code deadwood.json} from the root, if present, and uses the default detectors and in-memory caches. */
    public WorkspaceOrchestrator(Path root, SymbolProvider provider) {
        this(root, provider, ProjectConfig.load(root.toAbsolutePath().normalize()), DetectorRegistry.defaults());
    }

    public WorkspaceOrchestrator(
            Path root, SymbolProvider provider, ProjectConfig projectConfig, DetectorRegistry registry) {
        this(
                root,
                provider,
                projectConfig,
                registry,
                new InMemoryCacheStore<>(),
                new InMemoryCacheStore<>(),
                Clock.systemUTC());
    }

    public WorkspaceOrchestrator(
            Path root,
            SymbolProvider provider,
            ProjectConfig projectConfig,
            DetectorRegistry registry,
            CacheStore<FileAnalysisResult> fileStore,
            CacheStore<IncrementalAnalysisResult> commitStore,
            Clock clock) {
        this.workspace = new Workspace(root, provider);
        this.provider = provider;
        this.registry = registry;
        this.projectConfig = projectConfig;
        EngineSettings engine = projectConfig.engine();
        this.pool = new WorkerPool(engine);
        this.scanExecutor = ExecutorServiceUtil.newFixedThreadExecutor(engine.workerCount(), "deadwood-scan-");
        this.fileCache =
                new ResultCache<>("file", fileStore, workspace, clock, engine.cacheTtl(), engine.cacheMaxEntries());
        this.commitCache = new ResultCache<>(
                "commit", commitStore, workspace, clock, engine.commitCacheTtl(), engine.cacheMaxEntries());
    }

    public Workspace workspace() {
        return workspace;
    }

    public RunState state() {
        return state;
    }

    public ProjectConfig config() {
        return projectConfig;
    }

    public void addListener(RunListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RunListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // public operations
    // ---------------------------------------------------------------------------------------------------------------

    public WorkspaceAnalysisResult analyzeWorkspace() {
        return analyzeWorkspace(projectConfig.analysis());
    }

    /** Scans the whole workspace and analyzes every file in it. */
    public WorkspaceAnalysisResult analyzeWorkspace(AnalysisConfig config) {
        return exclusive("workspace", run -> {
            transition(run, RunState.SCANNING);
            var files = scan(config);
            var ctx = new AnalysisContext(config, AnalysisScope.Kind.WORKSPACE, graph, references);

            transition(run, RunState.SCHEDULING);
            var futures = schedule(run, files, ctx);

            transition(run, RunState.AGGREGATING);
            var result = WorkspaceAnalysisResult.aggregate(await(futures), run.elapsedMs());

            transition(run, RunState.DONE);
            logger.info(
                    "Analyzed {} file(s) in {} ms: {} issue(s), {} failed file(s)",
                    result.totalFiles(),
                    result.totalTimeMs(),
                    result.totalIssues(),
                    result.failedFiles());
            return result;
        });
    }

    public FileAnalysisResult analyzeFile(String path) {
        return analyzeFile(path, projectConfig.analysis());
    }

    /**
     * Analyzes one file in isolation. Nothing is assumed about other files, so exported symbols are never reported and
     * unexported dead code is only medium certainty.
     */
    public FileAnalysisResult analyzeFile(String path, AnalysisConfig config) {
        return exclusive("file", run -> {
            transition(run, RunState.SCANNING);
            var file = workspace.file(path);
            var change = workspace.refresh(file.path(), config);
            if (scanned) {
                if (applyChange(file, change)) {
                    moduleIndex = ModuleStructureDetector.detect(workspace.root(), workspace.paths());
                }
            } else if (change != Workspace.Change.UNCHANGED) {
                fileCache.invalidate(List.of(file.path()));
            }
            var ctx = AnalysisContext.fileOnly(config, scanned ? graph : DependencyGraph.empty());

            transition(run, RunState.SCHEDULING);
            List<CompletableFuture<FileAnalysisResult>> futures;
            if (workspace.contains(file.path())) {
                futures = schedule(run, List.of(file), ctx);
            } else {
                futures = List.of(CompletableFuture.completedFuture(
                        FileAnalysisResult.failure(file.path(), List.of(), 0, "File not found or not analyzable")));
            }

            transition(run, RunState.AGGREGATING);
            var result = await(futures).get(0);

            transition(run, RunState.DONE);
            return result;
        });
    }

    public IncrementalAnalysisResult analyzeIncremental(ChangeSet changeSet) {
        return analyzeIncremental(changeSet, projectConfig.analysis());
    }

    /**
     * Re-analyzes the modules affected by a change set: the modules owning the changed files and everything that
     * transitively depends on them. The first call on a fresh orchestrator scans the workspace to establish the graph
     * and module structure.
     */
    public IncrementalAnalysisResult analyzeIncremental(ChangeSet changeSet, AnalysisConfig config) {
        return exclusive("incremental", run -> {
            transition(run, RunState.SCANNING);
            var before = refresh(changeSet, config);
            return runIncremental(run, changeSet, config, before);
        });
    }

    public IncrementalAnalysisResult analyzeCommit(ChangeSet changeSet) {
        return analyzeCommit(changeSet, projectConfig.analysis());
    }

    /**
     * Like {@link #analyzeIncremental}, but the whole result is cached under the content hashes of the changed files.
     * A repeated call with unchanged files is served from the cache without scheduling anything.
     */
    public IncrementalAnalysisResult analyzeCommit(ChangeSet changeSet, AnalysisConfig config) {
        return exclusive("commit", run -> {
            transition(run, RunState.SCANNING);
            var before = refresh(changeSet, config);
            var key = commitCache.keyFor("commit#" + config.fingerprint(), changeSet.files());

            var cached = commitCache.get(key);
            if (cached.isPresent()) {
                transition(run, RunState.SCHEDULING);
                transition(run, RunState.AGGREGATING);
                var hit = cached.get();
                transition(run, RunState.DONE);
                logger.info("Commit {} served from cache", changeSet.changeId());
                return new IncrementalAnalysisResult(changeSet, hit.affectedSet(), hit.fileResults(), hit.summary());
            }

            var result = runIncremental(run, changeSet, config, before);
            var dependsOn = new LinkedHashSet<>(changeSet.files());
            result.fileResults().forEach(r -> dependsOn.add(r.filePath()));
            commitCache.set(key, result, dependsOn);
            return result;
        });
    }

    /** Combined statistics of the per-file and commit caches. */
    public CacheStats getCacheStats() {
        return fileCache.stats().combine(commitCache.stats());
    }

    public PoolStats getPoolStats() {
        return pool.stats();
    }

    /** Detects the module structure from the current files, replacing any previously established one. */
    public ModuleIndex detectModuleStructure() {
        runLock.lock();
        try {
            if (!scanned) {
                workspace.registerAll(workspace.discover(projectConfig.analysis()));
            }
            var index = ModuleStructureDetector.detect(workspace.root(), workspace.paths());
            moduleIndex = index;
            logger.info("Module structure: {}", index);
            return index;
        } finally {
            runLock.unlock();
        }
    }

    /** Drops cached results that depend on any of the paths. */
    public int invalidate(Collection<String> paths) {
        return fileCache.invalidate(paths) + commitCache.invalidate(paths);
    }

    public void clearCache() {
        fileCache.clear();
        commitCache.clear();
    }

    @Override
    public void close() {
        pool.close();
        scanExecutor.shutdownNow();
    }

    // ---------------------------------------------------------------------------------------------------------------
    // run plumbing
    // ---------------------------------------------------------------------------------------------------------------

    private <T> T exclusive(String kind, Function<AnalysisRun, T> body) {
        runLock.lock();
        var run = AnalysisRun.start(kind, runSequence.incrementAndGet());
        try {
            return body.apply(run);
        } catch (AnalysisRunException e) {
            fail(run, e);
            throw e;
        } catch (RuntimeException e) {
            fail(run, e);
            throw new AnalysisRunException("Run %s failed: %s".formatted(run.id(), e.getMessage()), e);
        } finally {
            runLock.unlock();
        }
    }

    private void fail(AnalysisRun run, RuntimeException e) {
        logger.error("Run {} failed after {} ms", run.id(), run.elapsedMs(), e);
        if (state.canTransitionTo(RunState.FAILED)) {
            transition(run, RunState.FAILED);
        }
    }

    private void transition(AnalysisRun run, RunState next) {
        var from = state;
        if (!from.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal run state transition %s -> %s".formatted(from, next));
        }
        state = next;
        logger.debug("Run {}: {} -> {}", run.id(), from, next);
        for (var listener : listeners) {
            try {
                listener.onTransition(run.id(), from, next);
            } catch (RuntimeException e) {
                logger.warn("Run listener failed on {} -> {}", from, next, e);
            }
        }
    }

    /** Full scan: discovers and hashes files, parses them, and rebuilds graph, reference index and modules. */
    private List<ProjectFile> scan(AnalysisConfig config) {
        var files = workspace.registerAll(workspace.discover(config));

        var localTrees = new ConcurrentHashMap<ProjectFile, SyntaxTree>();
        var localContributions = new ConcurrentHashMap<ProjectFile, ReferenceIndex.Contribution>();
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (var file : files) {
            var future = CompletableFuture.runAsync(
                            () -> {
                                var tree = parseOrNull(file);
                                if (tree != null) {
                                    localTrees.put(file, tree);
                                    localContributions.put(file, ReferenceIndex.contributionOf(tree, provider));
                                }
                            },
                            scanExecutor)
                    .whenComplete((ignored, ex) -> {
                        if (ex != null) {
                            var cause = ex instanceof CompletionException ce && ce.getCause() != null
                                    ? ce.getCause()
                                    : ex;
                            logger.error("Runtime error scanning {}: {}", file, cause.getMessage(), cause);
                        }
                    })
                    .exceptionally(ex -> null); // logged above; the file's task reports the failure
            futures.add(future);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        trees = HashTreePMap.from(localTrees);
        graph = DependencyGraphBuilder.fromParsed(files, localTrees);
        references = ReferenceIndex.of(localContributions.values());
        moduleIndex = ModuleStructureDetector.detect(workspace.root(), workspace.paths());
        scanned = true;
        logger.debug(
                "Scanned {} file(s): {} parsed, {}, {} cycle(s), {}",
                files.size(),
                localTrees.size(),
                graph,
                graph.cycles().size(),
                moduleIndex);
        return files;
    }

    private @Nullable SyntaxTree parseOrNull(ProjectFile file) {
        try {
            return provider.parse(file);
        } catch (SourceParseException e) {
            logger.warn("Parse failed for {}: {}", file, e.getMessage());
            return null;
        }
    }

    /** Graph and module structure as they were before a refresh. */
    private record Snapshot(DependencyGraph graph, @Nullable ModuleIndex moduleIndex) {}

    /**
     * Brings the snapshot up to date with the files of a change set. Scans the whole workspace instead if it has never
     * been scanned.
     */
    private Snapshot refresh(ChangeSet changeSet, AnalysisConfig config) {
        if (!scanned) {
            scan(config);
            return new Snapshot(graph, moduleIndex);
        }

        var before = new Snapshot(graph, moduleIndex);
        boolean membershipChanged = false;
        for (var path : changeSet.files()) {
            if (path.endsWith(ModuleStructureDetector.MANIFEST)) {
                membershipChanged = true;
            }
            var change = workspace.refresh(path, config);
            membershipChanged |= applyChange(workspace.file(path), change);
        }
        if (membershipChanged || moduleIndex == null) {
            moduleIndex = ModuleStructureDetector.detect(workspace.root(), workspace.paths());
        }
        return before;
    }

    /**
     * Brings trees, graph and reference index in line with one refreshed file and drops cached results depending on it.
     *
     * @return true if the file joined or left the workspace
     */
    private boolean applyChange(ProjectFile file, Workspace.Change change) {
        switch (change) {
            case ADDED, MODIFIED -> reparse(file);
            case REMOVED -> {
                trees = trees.minus(file);
                graph = graph.withFileRemoved(file.path());
                references = references.withoutFile(file);
            }
            case UNCHANGED -> {
                return false;
            }
        }
        logger.debug("{}: {}", file, change);
        fileCache.invalidate(List.of(file.path()));
        return change != Workspace.Change.MODIFIED;
    }

    private void reparse(ProjectFile file) {
        var tree = parseOrNull(file);
        if (tree == null) {
            trees = trees.minus(file);
            graph = graph.withFileUpdated(file.path(), List.of());
            references = references.withoutFile(file);
            return;
        }
        trees = trees.plus(file, tree);
        graph = graph.withFileUpdated(
                file.path(), tree.importedFiles().stream().map(ProjectFile::path).toList());
        references = references.withFile(ReferenceIndex.contributionOf(tree, provider));
    }

    private IncrementalAnalysisResult runIncremental(
            AnalysisRun run, ChangeSet changeSet, AnalysisConfig config, Snapshot before) {
        var current = moduleIndex;
        if (current == null) {
            throw new ScopeResolutionException("Module structure not detected");
        }
        // edges and modules from before the change keep dependents of deleted files in scope
        var resolutionGraph = before.graph().union(graph);
        var resolutionIndex = before.moduleIndex() == null
                ? current
                : before.moduleIndex().union(current, workspace.paths());
        var affected = ChangeScopeResolver.resolveAffected(changeSet.files(), resolutionGraph, resolutionIndex);

        var toAnalyze = new TreeSet<String>();
        ChangeScopeResolver.filesToAnalyze(affected, current).values().forEach(toAnalyze::addAll);
        var files = toAnalyze.stream()
                .filter(workspace::contains)
                .map(workspace::file)
                .toList();

        transition(run, RunState.SCHEDULING);
        var ctx = new AnalysisContext(config, AnalysisScope.Kind.WORKSPACE, graph, references);
        var futures = schedule(run, files, ctx);

        transition(run, RunState.AGGREGATING);
        var results = await(futures);
        var aggregate = WorkspaceAnalysisResult.aggregate(results, run.elapsedMs());
        int analyzedModules = affected.allAffected().size();
        var summary = new IncrementalAnalysisResult.Summary(
                current.size(),
                analyzedModules,
                Math.max(0, current.size() - analyzedModules),
                files.size(),
                aggregate.totalIssues(),
                aggregate.failedFiles());

        transition(run, RunState.DONE);
        logger.info(
                "Change {}: {} module(s) affected, {} file(s) analyzed, {} issue(s)",
                changeSet.changeId(),
                analyzedModules,
                files.size(),
                aggregate.totalIssues());
        return new IncrementalAnalysisResult(changeSet, affected, aggregate.fileResults(), summary);
    }

    // ---------------------------------------------------------------------------------------------------------------
    // scheduling
    // ---------------------------------------------------------------------------------------------------------------

    private List<CompletableFuture<FileAnalysisResult>> schedule(
            AnalysisRun run, List<ProjectFile> files, AnalysisContext ctx) {
        var analyzer = new FileAnalyzer(provider, registry, ctx, ctx.isWorkspace() ? trees : Map.of());
        var detectors = ctx.config().enabledDetectors();
        var futures = new ArrayList<CompletableFuture<FileAnalysisResult>>(files.size());
        int fromCache = 0;
        for (var file : files) {
            var dependsOn = dependencyScope(file, ctx);
            var key = fileCache.keyFor(cacheScope(file, ctx), dependsOn);
            var cached = fileCache.get(key);
            if (cached.isPresent()) {
                futures.add(CompletableFuture.completedFuture(cached.get()));
                fromCache++;
                continue;
            }
            long submitted = System.nanoTime();
            var task = new AnalysisTask(run.id() + ":" + file.path(), file, detectors, () -> analyzer.analyze(file));
            futures.add(pool.executeTask(task).handle((result, ex) -> {
                if (ex == null) {
                    fileCache.set(key, result, dependsOn);
                    return result;
                }
                return failedResult(file, ex, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submitted));
            }));
        }
        logger.debug("Run {} scheduled {} file(s), {} served from cache", run.id(), files.size(), fromCache);
        return futures;
    }

    /** Converts a task failure into a failed file result, except pool shutdown, which fails the run. */
    private static FileAnalysisResult failedResult(ProjectFile file, Throwable ex, long elapsedMs) {
        var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof WorkerPoolShutdownException) {
            throw new CompletionException(cause);
        }
        if (cause instanceof DetectorFailureException dfe) {
            return FileAnalysisResult.failure(file.path(), dfe.getPartialFindings(), elapsedMs, dfe.getMessage());
        }
        if (cause instanceof Error) {
            GlobalExceptionHandler.handle(Thread.currentThread(), cause);
        }
        return FileAnalysisResult.failure(file.path(), List.of(), elapsedMs, String.valueOf(cause.getMessage()));
    }

    /**
     * Files whose content a file's findings depend on: itself, its imports, its importers, its cycle peers, and every
     * file that references one of its declarations, including references matched by name only.
     */
    private Set<String> dependencyScope(ProjectFile file, AnalysisContext ctx) {
        var path = file.path();
        var scope = new TreeSet<String>();
        scope.add(path);
        if (ctx.isWorkspace()) {
            scope.addAll(ctx.graph().dependenciesOf(path));
            scope.addAll(ctx.graph().dependentsOf(path));
            ctx.graph().cyclesContaining(path).forEach(c -> scope.addAll(c.nodes()));
            var tree = trees.get(file);
            if (tree != null) {
                var names = tree.declarations().stream().map(Declaration::name).collect(Collectors.toSet());
                ctx.references().referrersOf(file, names).forEach(f -> scope.add(f.path()));
            }
        }
        return scope;
    }

    private static String cacheScope(ProjectFile file, AnalysisContext ctx) {
        var path = file.path();
        var cycles = ctx.isWorkspace()
                ? ctx.graph().cyclesContaining(path).stream().map(Cycle::describe).collect(Collectors.joining(";"))
                : "";
        return ctx.scope().name().toLowerCase(Locale.ROOT) + ":" + path + "#" + ctx.config().fingerprint() + "#" + cycles;
    }

    private static List<FileAnalysisResult> await(List<CompletableFuture<FileAnalysisResult>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof WorkerPoolShutdownException wpse) {
                throw new AnalysisRunException("Worker pool shut down during the run", wpse);
            }
            throw new AnalysisRunException("Scheduling failed: " + cause.getMessage(), cause);
        }
        var results = new ArrayList<FileAnalysisResult>(futures.size());
        futures.forEach(f -> results.add(f.join()));
        return results;
    }
}
