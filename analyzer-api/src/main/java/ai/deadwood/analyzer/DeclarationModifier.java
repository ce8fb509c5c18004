package ai.deadwood.analyzer;

public enum DeclarationModifier {
    EXPORTED,
    DEFAULT_EXPORT,
    STATIC,
    DECORATED,
    AMBIENT
}
