package ai.deadwood.testutil;

import ai.deadwood.analyzer.Declaration;
import ai.deadwood.analyzer.DeclarationKind;
import ai.deadwood.analyzer.DeclarationModifier;
import ai.deadwood.analyzer.FunctionMetrics;
import ai.deadwood.analyzer.Identifier;
import ai.deadwood.analyzer.ImportBinding;
import ai.deadwood.analyzer.ImportDeclaration;
import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.Range;
import ai.deadwood.analyzer.SyntaxTree;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * Fluent description of a parsed file. Every element goes on its own line, in call order, starting at line 1, so a
 * test can predict the line of anything it adds with {@link #nextLine()}.
 */
public final class TreeBuilder {
    private final Path root;
    private final String path;
    private final List<ImportDeclaration> imports = new ArrayList<>();
    private final List<Declaration> declarations = new ArrayList<>();
    private final List<Identifier> identifiers = new ArrayList<>();
    private int line = 1;
    private boolean failParse;
    private @Nullable RuntimeException parseError;

    TreeBuilder(Path root, String path) {
        this.root = root;
        this.path = path;
    }

    public String path() {
        return path;
    }

    /** Line the next element will be placed on. */
    public int nextLine() {
        return line;
    }

    /** Leaves {@code count} lines empty, e.g. for an ignore comment written into the file text. */
    public TreeBuilder skipLines(int count) {
        line += count;
        return this;
    }

    public TreeBuilder importFrom(String specifier, @Nullable String target, String... names) {
        var range = Range.line(line++);
        var bindings = Arrays.stream(names).map(n -> ImportBinding.named(n, range)).toList();
        imports.add(new ImportDeclaration(specifier, file(target), bindings, false, range));
        for (var n : names) {
            identifiers.add(new Identifier(n, Identifier.Role.IMPORT, null, range));
        }
        return this;
    }

    public TreeBuilder importAs(String specifier, @Nullable String target, String importedName, String localName) {
        var range = Range.line(line++);
        var binding = new ImportBinding(localName, importedName, ImportBinding.Kind.NAMED, false, range);
        imports.add(new ImportDeclaration(specifier, file(target), List.of(binding), false, range));
        identifiers.add(new Identifier(localName, Identifier.Role.IMPORT, null, range));
        return this;
    }

    public TreeBuilder importTypes(String specifier, @Nullable String target, String... names) {
        var range = Range.line(line++);
        var bindings = Arrays.stream(names)
                .map(n -> new ImportBinding(n, n, ImportBinding.Kind.NAMED, true, range))
                .toList();
        imports.add(new ImportDeclaration(specifier, file(target), bindings, true, range));
        return this;
    }

    public TreeBuilder importDefault(String specifier, @Nullable String target, String localName) {
        var range = Range.line(line++);
        var binding = new ImportBinding(localName, "default", ImportBinding.Kind.DEFAULT, false, range);
        imports.add(new ImportDeclaration(specifier, file(target), List.of(binding), false, range));
        return this;
    }

    public TreeBuilder importNamespace(String specifier, @Nullable String target, String localName) {
        var range = Range.line(line++);
        var binding = new ImportBinding(localName, "*", ImportBinding.Kind.NAMESPACE, false, range);
        imports.add(new ImportDeclaration(specifier, file(target), List.of(binding), false, range));
        return this;
    }

    public TreeBuilder sideEffectImport(String specifier, @Nullable String target) {
        imports.add(new ImportDeclaration(specifier, file(target), List.of(), false, Range.line(line++)));
        return this;
    }

    public TreeBuilder function(String name, DeclarationModifier... modifiers) {
        return declare(name, DeclarationKind.FUNCTION, null, null, modifiers);
    }

    public TreeBuilder function(String name, FunctionMetrics metrics, DeclarationModifier... modifiers) {
        return declare(name, DeclarationKind.FUNCTION, null, metrics, modifiers);
    }

    public TreeBuilder classDecl(String name, DeclarationModifier... modifiers) {
        return declare(name, DeclarationKind.CLASS, null, null, modifiers);
    }

    public TreeBuilder method(String owner, String name, DeclarationModifier... modifiers) {
        return declare(name, DeclarationKind.METHOD, owner, null, modifiers);
    }

    public TreeBuilder constructor(String owner) {
        return declare("constructor", DeclarationKind.CONSTRUCTOR, owner, null);
    }

    public TreeBuilder variable(String name, DeclarationModifier... modifiers) {
        return declare(name, DeclarationKind.VARIABLE, null, null, modifiers);
    }

    public TreeBuilder localVariable(String owner, String name) {
        return declare(name, DeclarationKind.VARIABLE, owner, null);
    }

    public TreeBuilder parameter(String owner, String name) {
        return declare(name, DeclarationKind.PARAMETER, owner, null);
    }

    public TreeBuilder restParameter(String owner, String name) {
        return declare(name, DeclarationKind.REST_PARAMETER, owner, null);
    }

    public TreeBuilder interfaceDecl(String name, DeclarationModifier... modifiers) {
        return declare(name, DeclarationKind.INTERFACE, null, null, modifiers);
    }

    public TreeBuilder declare(
            String name,
            DeclarationKind kind,
            @Nullable String owner,
            @Nullable FunctionMetrics metrics,
            DeclarationModifier... modifiers) {
        var range = Range.line(line++);
        Set<DeclarationModifier> mods =
                modifiers.length == 0 ? Set.of() : EnumSet.copyOf(Arrays.asList(modifiers));
        declarations.add(new Declaration(name, kind, mods, owner, range, metrics));
        identifiers.add(new Identifier(name, Identifier.Role.DECLARATION, null, range));
        return this;
    }

    /** A plain read of {@code name}. */
    public TreeBuilder ref(String name) {
        identifiers.add(Identifier.reference(name, Range.line(line++)));
        return this;
    }

    /** {@code qualifier.name}: a read of the qualifier and a property access. */
    public TreeBuilder prop(String qualifier, String name) {
        var range = Range.line(line++);
        identifiers.add(Identifier.reference(qualifier, range));
        identifiers.add(Identifier.property(qualifier, name, range));
        return this;
    }

    /** Property access on an expression that is not a plain name, such as {@code getFoo().name}. */
    public TreeBuilder member(String name) {
        identifiers.add(Identifier.property(null, name, Range.line(line++)));
        return this;
    }

    /** {@code export { name }} */
    public TreeBuilder exportSpecifier(String name) {
        identifiers.add(new Identifier(name, Identifier.Role.EXPORT_SPECIFIER, null, Range.line(line++)));
        return this;
    }

    /** The provider throws a parse exception for this file. */
    public TreeBuilder failParse() {
        this.failParse = true;
        return this;
    }

    /** The provider throws this unchecked exception while parsing. */
    public TreeBuilder crashParse(RuntimeException error) {
        this.parseError = error;
        return this;
    }

    boolean shouldFailParse() {
        return failParse;
    }

    @Nullable
    RuntimeException parseError() {
        return parseError;
    }

    SyntaxTree build(String text) {
        return new SyntaxTree(new ProjectFile(root, path), text, imports, declarations, identifiers);
    }

    private @Nullable ProjectFile file(@Nullable String target) {
        return target == null ? null : new ProjectFile(root, target);
    }
}
