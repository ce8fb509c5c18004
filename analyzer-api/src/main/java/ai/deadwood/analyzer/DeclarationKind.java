package ai.deadwood.analyzer;

public enum DeclarationKind {
    FUNCTION,
    METHOD,
    CONSTRUCTOR,
    CLASS,
    INTERFACE,
    TYPE_ALIAS,
    ENUM,
    VARIABLE,
    PARAMETER,
    REST_PARAMETER,
    CATCH_VARIABLE;

    public boolean isCallable() {
        return this == FUNCTION || this == METHOD || this == CONSTRUCTOR;
    }

    public boolean isParameter() {
        return this == PARAMETER || this == REST_PARAMETER;
    }
}
