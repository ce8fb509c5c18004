package ai.deadwood.testutil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Files on disk under a temp root, plus the provider describing how they parse. */
public final class TestWorkspace {
    private final Path root;
    private final TestSymbolProvider provider;

    public TestWorkspace(Path root) {
        this.root = root.toAbsolutePath().normalize();
        this.provider = new TestSymbolProvider(this.root);
    }

    public Path root() {
        return root;
    }

    public TestSymbolProvider provider() {
        return provider;
    }

    /** Writes a placeholder body for {@code path} and starts describing its parse. */
    public TreeBuilder file(String path) {
        return file(path, "// " + path + "\n");
    }

    public TreeBuilder file(String path, String text) {
        write(path, text);
        return provider.define(path);
    }

    public void write(String path, String text) {
        var file = root.resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Changes the file's bytes (and so its hash) without changing its parse. */
    public void touch(String path) {
        try {
            Files.writeString(root.resolve(path), Files.readString(root.resolve(path)) + "// edited\n");
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void delete(String path) {
        try {
            Files.deleteIfExists(root.resolve(path));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        provider.forget(path);
    }
}
