package ai.deadwood.analyzer;

/** Size and shape measurements of a callable body, as computed by the provider. */
public record FunctionMetrics(int cyclomaticComplexity, int maxNestingDepth, int parameterCount, int linesOfCode) {
    public static final FunctionMetrics TRIVIAL = new FunctionMetrics(1, 0, 0, 1);
}
