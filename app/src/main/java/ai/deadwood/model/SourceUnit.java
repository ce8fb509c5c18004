package ai.deadwood.model;

import ai.deadwood.analyzer.ProjectFile;

/** A tracked workspace file and the SHA-256 of its bytes at the time it was last read. */
public record SourceUnit(ProjectFile file, String contentHash) {
    public String path() {
        return file.path();
    }
}
