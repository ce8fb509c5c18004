package ai.deadwood.analyzer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstraction for a filename relative to the workspace root. This exists so that different file objects can be
 * meaningfully compared, unlike bare Paths which may or may not be absolute, or may be relative to the jvm working
 * directory rather than the workspace.
 */
public final class ProjectFile implements Comparable<ProjectFile> {
    private final Path root;
    private final Path relPath;

    /** root must be absolute and pre-normalized; we will normalize relPath if it is not already */
    public ProjectFile(Path root, Path relPath) {
        if (!root.isAbsolute()) {
            throw new IllegalArgumentException("Root must be absolute, got " + root);
        }
        if (!root.equals(root.normalize())) {
            throw new IllegalArgumentException("Root must be normalized, got " + root);
        }
        if (relPath.isAbsolute()) {
            throw new IllegalArgumentException("RelPath must be relative, got " + relPath);
        }
        this.root = root;
        this.relPath = relPath.normalize();
    }

    public ProjectFile(Path root, String relName) {
        this(root, Path.of(relName));
    }

    public Path getRoot() {
        return root;
    }

    public Path getRelPath() {
        return relPath;
    }

    public Path absPath() {
        return root.resolve(relPath);
    }

    /**
     * Workspace-relative path with forward slashes. Used as the stable identity of the file in findings,
     * module ids and cache keys, so it must not depend on the platform separator.
     */
    public String path() {
        return relPath.toString().replace('\\', '/');
    }

    public boolean exists() {
        return Files.exists(absPath());
    }

    public Optional<String> read() {
        try {
            return Optional.of(Files.readString(absPath()));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    public void write(String content) throws IOException {
        var parent = absPath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(absPath(), content);
    }

    /** Just the filename, no path at all */
    public String getFileName() {
        return relPath.getFileName().toString();
    }

    /**
     * Also relative (but unlike raw Path.getParent, ours returns empty path instead of null)
     */
    public Path getParent() {
        var p = relPath.getParent();
        return p == null ? Path.of("") : p;
    }

    /** return the (lowercased) extension [not including the dot] */
    public String extension() {
        var filename = getFileName();
        int lastDot = filename.lastIndexOf('.');
        if (lastDot > 0 && lastDot < filename.length() - 1) {
            return filename.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }

    @Override
    public int compareTo(ProjectFile o) {
        return path().compareTo(o.path());
    }

    @Override
    public String toString() {
        return path();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectFile projectFile)) return false;
        return Objects.equals(root, projectFile.root) && Objects.equals(relPath, projectFile.relPath);
    }

    @Override
    public int hashCode() {
        return relPath.hashCode();
    }
}
