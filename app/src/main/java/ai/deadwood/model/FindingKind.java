package ai.deadwood.model;

import java.util.Arrays;
import java.util.Optional;

public enum FindingKind {
    UNUSED_IMPORT("unused-import"),
    UNUSED_VARIABLE("unused-variable"),
    DEAD_FUNCTION("dead-function"),
    DEAD_EXPORT("dead-export"),
    CIRCULAR_DEPENDENCY("circular-dependency"),
    HIGH_COMPLEXITY("high-complexity");

    private final String id;

    FindingKind(String id) {
        this.id = id;
    }

    /** The kebab-case name used in finding ids, config files and ignore directives. */
    public String id() {
        return id;
    }

    /** Kinds that name a single symbol, as opposed to structural findings. */
    public boolean isSymbolKind() {
        return this != CIRCULAR_DEPENDENCY && this != HIGH_COMPLEXITY;
    }

    public static Optional<FindingKind> fromId(String id) {
        var trimmed = id.trim();
        return Arrays.stream(values()).filter(k -> k.id.equalsIgnoreCase(trimmed)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
