package ai.deadwood.config;

import ai.deadwood.model.FindingKind;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * What a run looks for. Part of every per-file cache key, so two runs with different configs never share results.
 *
 * @param ignorePatterns glob patterns, matched against workspace-relative paths, of files never analyzed
 * @param underscoreConvention whether names with a leading underscore are treated as intentionally unused
 * @param frameworkPatterns whether lifecycle and entry-point naming patterns are applied
 */
public record AnalysisConfig(
        Set<FindingKind> enabledDetectors,
        List<String> ignorePatterns,
        boolean underscoreConvention,
        boolean frameworkPatterns,
        ComplexityThresholds complexity) {

    public static final List<String> DEFAULT_IGNORE_PATTERNS = List.of("**/node_modules/**", "**/*.d.ts");

    public AnalysisConfig {
        enabledDetectors = enabledDetectors.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(enabledDetectors));
        ignorePatterns = List.copyOf(ignorePatterns);
    }

    public static AnalysisConfig defaults() {
        return new AnalysisConfig(
                EnumSet.allOf(FindingKind.class), DEFAULT_IGNORE_PATTERNS, true, true, ComplexityThresholds.DEFAULT);
    }

    public boolean isEnabled(FindingKind kind) {
        return enabledDetectors.contains(kind);
    }

    public AnalysisConfig withEnabledDetectors(Set<FindingKind> kinds) {
        return new AnalysisConfig(kinds, ignorePatterns, underscoreConvention, frameworkPatterns, complexity);
    }

    public AnalysisConfig withIgnorePatterns(List<String> patterns) {
        return new AnalysisConfig(enabledDetectors, patterns, underscoreConvention, frameworkPatterns, complexity);
    }

    public AnalysisConfig withUnderscoreConvention(boolean enabled) {
        return new AnalysisConfig(enabledDetectors, ignorePatterns, enabled, frameworkPatterns, complexity);
    }

    public AnalysisConfig withFrameworkPatterns(boolean enabled) {
        return new AnalysisConfig(enabledDetectors, ignorePatterns, underscoreConvention, enabled, complexity);
    }

    public AnalysisConfig withComplexity(ComplexityThresholds thresholds) {
        return new AnalysisConfig(enabledDetectors, ignorePatterns, underscoreConvention, frameworkPatterns, thresholds);
    }

    /** Stable across JVMs: detector ids are sorted, patterns keep their order. */
    public String fingerprint() {
        var detectors = enabledDetectors.stream()
                .map(FindingKind::id)
                .sorted()
                .collect(Collectors.joining(","));
        return "d=" + detectors
                + ";i=" + String.join(",", ignorePatterns)
                + ";u=" + underscoreConvention
                + ";f=" + frameworkPatterns
                + ";c=" + complexity.cyclomatic() + "/" + complexity.nesting() + "/" + complexity.parameters() + "/"
                + complexity.linesOfCode();
    }
}
