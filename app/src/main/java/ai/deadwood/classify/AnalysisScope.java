package ai.deadwood.classify;

/**
 * What the classifier may assume about a candidate's surroundings.
 *
 * @param kind whether the whole workspace was analyzed or a single file in isolation
 * @param directives suppression comments of the candidate's file
 * @param references cross-file references; only meaningful in {@link Kind#WORKSPACE} scope
 */
public record AnalysisScope(Kind kind, IgnoreDirectives directives, ExternalReferences references) {

    public enum Kind {
        WORKSPACE,
        FILE
    }

    public static AnalysisScope fileOnly(IgnoreDirectives directives) {
        return new AnalysisScope(Kind.FILE, directives, ExternalReferences.NONE);
    }

    public boolean isWorkspace() {
        return kind == Kind.WORKSPACE;
    }
}
