package ai.deadwood.scope;

import ai.deadwood.exception.ScopeResolutionException;
import ai.deadwood.graph.DependencyGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Computes which modules need re-analysis after a set of files changed: the modules owning the changed files, plus
 * every module that transitively depends on one of them.
 */
public final class ChangeScopeResolver {
    private static final Logger logger = LogManager.getLogger(ChangeScopeResolver.class);

    private ChangeScopeResolver() {}

    /**
     * @param fileGraph the file-level dependency graph; it is lifted onto the index's modules
     * @throws ScopeResolutionException if no module structure has been established
     */
    public static AffectedSet resolveAffected(
            Collection<String> changedFiles, DependencyGraph fileGraph, @Nullable ModuleIndex moduleIndex) {
        if (moduleIndex == null) {
            throw new ScopeResolutionException("Module structure not detected");
        }

        var direct = new LinkedHashSet<String>();
        for (var file : changedFiles) {
            var module = moduleIndex.moduleOf(file);
            if (module.isPresent()) {
                direct.add(module.get());
            } else {
                logger.debug("Changed file {} is outside every module, ignoring", file);
            }
        }

        var moduleGraph = moduleIndex.lift(fileGraph);
        var chains = new HashMap<String, List<String>>();
        var queue = new ArrayDeque<String>();
        for (var module : direct) {
            chains.put(module, List.of(module));
            queue.add(module);
        }

        var indirect = new ArrayList<String>();
        while (!queue.isEmpty()) {
            var module = queue.poll();
            // sorted for a deterministic visiting order
            for (var dependent : new TreeSet<>(moduleGraph.dependentsOf(module))) {
                if (chains.containsKey(dependent)) {
                    continue;
                }
                var chain = new ArrayList<>(chains.get(module));
                chain.add(dependent);
                chains.put(dependent, List.copyOf(chain));
                indirect.add(dependent);
                queue.add(dependent);
            }
        }

        var affected = AffectedSet.of(List.copyOf(direct), indirect, chains);
        logger.debug(
                "{} changed file(s) affect {} module(s): {} direct, {} indirect",
                changedFiles.size(),
                affected.allAffected().size(),
                direct.size(),
                indirect.size());
        return affected;
    }

    public static Map<String, List<String>> filesToAnalyze(AffectedSet affected, ModuleIndex moduleIndex) {
        var result = new HashMap<String, List<String>>();
        for (var module : affected.allAffected()) {
            result.put(module, moduleIndex.filesOf(module));
        }
        return result;
    }
}
