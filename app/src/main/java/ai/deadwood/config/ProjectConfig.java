package ai.deadwood.config;

import ai.deadwood.exception.ConfigurationException;
import ai.deadwood.model.FindingKind;
import ai.deadwood.util.Json;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Workspace configuration, read from {@value #FILE_NAME} at the workspace root. Values present in the file are applied
 * over the defaults; anything missing keeps its default.
 *
 * <pre>{@code
 * {
 *   "analysis": {
 *     "detectors": { "high-complexity": false },
 *     "ignorePatterns": ["generated/**"],
 *     "underscoreConvention": true,
 *     "frameworkPatterns": true,
 *     "complexity": { "cyclomatic": 10, "nesting": 4, "parameters": 5, "linesOfCode": 50 }
 *   },
 *   "engine": { "workers": 4, "taskTimeoutMs": 0, "cacheTtlMs": 3600000, "cacheMaxEntries": 10000 }
 * }
 * }</pre>
 */
public record ProjectConfig(AnalysisConfig analysis, EngineSettings engine) {
    private static final Logger logger = LogManager.getLogger(ProjectConfig.class);

    public static final String FILE_NAME = "deadwood.json";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("analysis", "engine");
    private static final Set<String> ANALYSIS_KEYS =
            Set.of("detectors", "ignorePatterns", "underscoreConvention", "frameworkPatterns", "complexity");
    private static final Set<String> ENGINE_KEYS = Set.of(
            "workers",
            "errorCooldownMs",
            "taskTimeoutMs",
            "shutdownTimeoutMs",
            "cacheTtlMs",
            "cacheMaxEntries",
            "commitCacheTtlMs");

    public static ProjectConfig defaults() {
        return new ProjectConfig(AnalysisConfig.defaults(), EngineSettings.defaults());
    }

    /** Reads the workspace config, or returns defaults when the file does not exist. */
    public static ProjectConfig load(Path workspaceRoot) {
        var file = workspaceRoot.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            logger.debug("No {} in {}, using defaults", FILE_NAME, workspaceRoot);
            return defaults();
        }
        try {
            return fromJson(Json.readTree(file));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + file, e);
        }
    }

    public static ProjectConfig fromJson(String json) {
        try {
            return fromJson(Json.readTree(json));
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration", e);
        }
    }

    static ProjectConfig fromJson(JsonNode root) {
        if (!root.isObject()) {
            throw new ConfigurationException("Configuration must be a JSON object");
        }
        warnUnknown(root, TOP_LEVEL_KEYS, "");
        try {
            var analysis = root.has("analysis") ? readAnalysis(root.get("analysis")) : AnalysisConfig.defaults();
            var engine = root.has("engine") ? readEngine(root.get("engine")) : EngineSettings.defaults();
            return new ProjectConfig(analysis, engine);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static AnalysisConfig readAnalysis(JsonNode node) {
        warnUnknown(node, ANALYSIS_KEYS, "analysis.");
        var defaults = AnalysisConfig.defaults();

        Set<FindingKind> enabled = EnumSet.copyOf(defaults.enabledDetectors());
        var detectors = node.path("detectors");
        detectors.fieldNames().forEachRemaining(name -> FindingKind.fromId(name)
                .ifPresentOrElse(
                        kind -> {
                            if (detectors.get(name).asBoolean(true)) {
                                enabled.add(kind);
                            } else {
                                enabled.remove(kind);
                            }
                        },
                        () -> logger.warn("Ignoring unknown detector '{}' in {}", name, FILE_NAME)));

        List<String> ignorePatterns = defaults.ignorePatterns();
        if (node.path("ignorePatterns").isArray()) {
            var patterns = new ArrayList<>(AnalysisConfig.DEFAULT_IGNORE_PATTERNS);
            node.get("ignorePatterns").forEach(p -> patterns.add(p.asText()));
            ignorePatterns = patterns;
        }

        var complexityNode = node.path("complexity");
        var base = defaults.complexity();
        var complexity = new ComplexityThresholds(
                complexityNode.path("cyclomatic").asInt(base.cyclomatic()),
                complexityNode.path("nesting").asInt(base.nesting()),
                complexityNode.path("parameters").asInt(base.parameters()),
                complexityNode.path("linesOfCode").asInt(base.linesOfCode()));

        return new AnalysisConfig(
                enabled,
                ignorePatterns,
                node.path("underscoreConvention").asBoolean(defaults.underscoreConvention()),
                node.path("frameworkPatterns").asBoolean(defaults.frameworkPatterns()),
                complexity);
    }

    private static EngineSettings readEngine(JsonNode node) {
        warnUnknown(node, ENGINE_KEYS, "engine.");
        var d = EngineSettings.defaults();
        return new EngineSettings(
                node.path("workers").asInt(d.workerCount()),
                millis(node, "errorCooldownMs", d.errorCooldown()),
                millis(node, "taskTimeoutMs", d.taskTimeout()),
                millis(node, "shutdownTimeoutMs", d.shutdownTimeout()),
                millis(node, "cacheTtlMs", d.cacheTtl()),
                node.path("cacheMaxEntries").asInt(d.cacheMaxEntries()),
                millis(node, "commitCacheTtlMs", d.commitCacheTtl()));
    }

    private static Duration millis(JsonNode node, String field, Duration fallback) {
        var value = node.get(field);
        return value == null || !value.canConvertToLong() ? fallback : Duration.ofMillis(value.asLong());
    }

    private static void warnUnknown(JsonNode node, Set<String> known, String prefix) {
        node.fieldNames().forEachRemaining(name -> {
            if (!known.contains(name)) {
                logger.warn("Ignoring unknown key '{}{}' in {}", prefix, name, FILE_NAME);
            }
        });
    }
}
