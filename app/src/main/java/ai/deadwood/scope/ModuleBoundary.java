package ai.deadwood.scope;

import java.nio.file.Path;

/**
 * A named module owning every file under {@code root}.
 *
 * @param root workspace-relative path prefix with forward slashes; empty for the workspace root
 */
public record ModuleBoundary(String id, String root) {

    public ModuleBoundary {
        root = root.replace('\\', '/');
        if (root.endsWith("/")) {
            root = root.substring(0, root.length() - 1);
        }
    }

    /** Component-wise prefix match: {@code pkg/a} owns {@code pkg/a/x.ts} but not {@code pkg/ab/x.ts}. */
    public boolean owns(String path) {
        if (root.isEmpty()) {
            return true;
        }
        return Path.of(path).startsWith(Path.of(root));
    }

    /** Number of path components in the root; longer roots win when boundaries nest. */
    public int depth() {
        return root.isEmpty() ? 0 : Path.of(root).getNameCount();
    }
}
