package ai.deadwood.config;

public record ComplexityThresholds(int cyclomatic, int nesting, int parameters, int linesOfCode) {
    public static final ComplexityThresholds DEFAULT = new ComplexityThresholds(10, 4, 5, 50);

    public ComplexityThresholds {
        if (cyclomatic < 1 || nesting < 1 || parameters < 1 || linesOfCode < 1) {
            throw new IllegalArgumentException("Complexity thresholds must be positive");
        }
    }
}
