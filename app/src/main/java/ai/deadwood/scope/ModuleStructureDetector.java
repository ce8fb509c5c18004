package ai.deadwood.scope;

import ai.deadwood.util.Json;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Finds package boundaries from {@code package.json} manifests. A workspace with packages below its root gets one
 * module per package (the root manifest, if any, owns whatever no package claims). Anything else is treated as one
 * module per source file.
 */
public final class ModuleStructureDetector {
    private static final Logger logger = LogManager.getLogger(ModuleStructureDetector.class);

    public static final String MANIFEST = "package.json";
    private static final Set<String> SKIPPED_DIRS = Set.of("node_modules", ".git");

    private ModuleStructureDetector() {}

    public static ModuleIndex detect(Path root, Collection<String> files) {
        var packages = findPackages(root);
        boolean nested = packages.stream().anyMatch(b -> !b.root().isEmpty());
        if (!nested) {
            logger.debug("No package structure under {}, using one module per file", root);
            return ModuleIndex.perFile(files);
        }
        var index = ModuleIndex.ofPackages(packages, files);
        logger.debug("Detected {} package(s) under {}", packages.size(), root);
        return index;
    }

    /** One boundary per manifest directory, named by the manifest's {@code name} or else the directory name. */
    public static List<ModuleBoundary> findPackages(Path root) {
        var manifests = new ArrayList<Path>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    var name = dir.getFileName();
                    if (!dir.equals(root) && name != null && SKIPPED_DIRS.contains(name.toString())) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (file.getFileName().toString().equals(MANIFEST)) {
                        manifests.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root + " for packages", e);
        }

        var boundaries = new ArrayList<ModuleBoundary>();
        var usedIds = new HashSet<String>();
        manifests.sort(null);
        for (var manifest : manifests) {
            var dir = manifest.getParent();
            var relative = root.relativize(dir).toString().replace('\\', '/');
            var id = packageName(manifest, dir, root);
            if (!usedIds.add(id)) {
                id = id + "@" + (relative.isEmpty() ? "." : relative);
                usedIds.add(id);
            }
            boundaries.add(new ModuleBoundary(id, relative));
        }
        return boundaries;
    }

    private static String packageName(Path manifest, Path dir, Path root) {
        try {
            var name = Json.readTree(manifest).path("name");
            if (name.isTextual() && !name.asText().isBlank()) {
                return name.asText();
            }
        } catch (IOException e) {
            logger.warn("Could not read {}: {}", manifest, e.getMessage());
        }
        var dirName = dir.equals(root) ? root.getFileName() : dir.getFileName();
        return dirName == null ? "." : dirName.toString();
    }
}
