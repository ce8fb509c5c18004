package ai.deadwood.analyzer;

/**
 * One local name introduced by an import declaration.
 *
 * @param localName the name visible in the importing file (the alias, if any)
 * @param importedName the name exported by the target module; {@code default} or {@code *} for default and namespace
 *     bindings
 */
public record ImportBinding(String localName, String importedName, Kind kind, boolean typeOnly, Range range) {
    public enum Kind {
        DEFAULT,
        NAMESPACE,
        NAMED
    }

    public static ImportBinding named(String name, Range range) {
        return new ImportBinding(name, name, Kind.NAMED, false, range);
    }
}
