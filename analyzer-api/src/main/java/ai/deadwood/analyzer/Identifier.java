package ai.deadwood.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * An identifier occurrence, in traversal order.
 *
 * @param qualifier for {@link Role#PROPERTY} occurrences, the text of the receiver expression when it is a plain name
 *     ({@code Foo} in {@code Foo.bar()}), otherwise null
 */
public record Identifier(String name, Role role, @Nullable String qualifier, Range range) {
    public enum Role {
        /** The name node of a declaration. */
        DECLARATION,
        /** A name inside an import clause. */
        IMPORT,
        /** A value or type reference. */
        REFERENCE,
        /** The member name in a property access, {@code bar} in {@code foo.bar}. */
        PROPERTY,
        /** A name listed in an {@code export { ... }} clause. */
        EXPORT_SPECIFIER
    }

    public static Identifier reference(String name, Range range) {
        return new Identifier(name, Role.REFERENCE, null, range);
    }

    public static Identifier property(@Nullable String qualifier, String name, Range range) {
        return new Identifier(name, Role.PROPERTY, qualifier, range);
    }

    /** True for occurrences that read or mention a binding, as opposed to introducing one. */
    public boolean isUse() {
        return role == Role.REFERENCE || role == Role.EXPORT_SPECIFIER;
    }
}
