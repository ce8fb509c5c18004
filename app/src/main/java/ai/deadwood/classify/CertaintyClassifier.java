package ai.deadwood.classify;

import ai.deadwood.config.AnalysisConfig;
import ai.deadwood.model.Candidate;
import ai.deadwood.model.Candidate.Trait;
import ai.deadwood.model.Certainty;
import ai.deadwood.model.Finding;
import ai.deadwood.model.FindingKind;
import java.util.HashSet;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Turns detector candidates into findings. The result depends only on the candidate, the scope and the rules this
 * classifier was built with.
 *
 * <p>Exclusion rules are checked in order and the first that applies wins: ignore directive, leading-underscore naming
 * convention, framework naming pattern, then the default rule for the candidate's kind.
 */
public final class CertaintyClassifier {
    private final boolean underscoreConvention;
    private final FrameworkPatterns frameworkPatterns;

    public CertaintyClassifier(boolean underscoreConvention, FrameworkPatterns frameworkPatterns) {
        this.underscoreConvention = underscoreConvention;
        this.frameworkPatterns = frameworkPatterns;
    }

    public CertaintyClassifier(AnalysisConfig config) {
        this(
                config.underscoreConvention(),
                config.frameworkPatterns() ? FrameworkPatterns.defaults() : FrameworkPatterns.none());
    }

    /** @return the finding, or null when the candidate is excluded */
    public @Nullable Finding classify(Candidate candidate, AnalysisScope scope) {
        var kind = candidate.kind();

        if (scope.directives().suppresses(kind, candidate.line())) {
            return null;
        }

        if (underscoreConvention && kind.isSymbolKind() && candidate.symbolName().startsWith("_")) {
            return null;
        }

        Optional<FrameworkPatterns.Match> pattern = Optional.empty();
        if (kind == FindingKind.DEAD_FUNCTION || kind == FindingKind.DEAD_EXPORT) {
            pattern = frameworkPatterns.match(candidate.symbolName(), candidate.has(Trait.DECORATED));
            if (pattern.isPresent() && pattern.get().modifier() == FrameworkPatterns.Modifier.IGNORE) {
                return null;
            }
        }

        var verdict = defaultRule(candidate, scope);
        if (verdict == null) {
            return null;
        }

        var certainty = verdict.certainty();
        var explanation = verdict.explanation();
        var tags = new HashSet<>(candidate.tags());
        if (pattern.isPresent()) {
            certainty = Certainty.LOW;
            explanation = "Name matches the '%s' framework pattern; it may be invoked by a framework"
                    .formatted(pattern.get().ruleName());
            tags.add("framework:" + pattern.get().ruleName());
        }

        var location = candidate.primaryLocation();
        return new Finding(
                Finding.idFor(kind, location.filePath(), candidate.symbolName(), location.startLine()),
                kind,
                certainty,
                candidate.locations(),
                candidate.symbolName(),
                isSafeFix(candidate, certainty),
                tags,
                candidate.reason(),
                explanation,
                candidate.suggestedFix());
    }

    private record Verdict(Certainty certainty, String explanation) {}

    private static @Nullable Verdict defaultRule(Candidate candidate, AnalysisScope scope) {
        return switch (candidate.kind()) {
            case UNUSED_IMPORT -> new Verdict(Certainty.HIGH, "The imported name is never referenced in this file");
            case UNUSED_VARIABLE -> new Verdict(Certainty.HIGH, "The binding is never read in its file");
            case DEAD_FUNCTION, DEAD_EXPORT -> classifyUnreferenced(candidate, scope);
            case CIRCULAR_DEPENDENCY -> new Verdict(Certainty.HIGH, "Every module in the cycle imports the next");
            case HIGH_COMPLEXITY -> new Verdict(Certainty.MEDIUM, "Complexity exceeds the configured thresholds");
        };
    }

    private static @Nullable Verdict classifyUnreferenced(Candidate candidate, AnalysisScope scope) {
        if (!candidate.has(Trait.EXPORTED)) {
            return scope.isWorkspace()
                    ? new Verdict(Certainty.HIGH, "Not exported and never referenced")
                    : new Verdict(Certainty.MEDIUM, "Not referenced in this file; other files were not analyzed");
        }
        if (!scope.isWorkspace()) {
            // exported symbols may be used anywhere; one file alone cannot tell
            return null;
        }
        var site = candidate.site();
        if (site != null && scope.references().isReferencedOutside(site)) {
            return null;
        }
        return new Verdict(Certainty.HIGH, "Exported, but no reference found anywhere in the workspace");
    }

    private static boolean isSafeFix(Candidate candidate, Certainty certainty) {
        if (certainty != Certainty.HIGH) {
            return false;
        }
        return switch (candidate.kind()) {
            case UNUSED_IMPORT -> true;
            case UNUSED_VARIABLE -> !candidate.has(Trait.PARAMETER);
            default -> false;
        };
    }
}
