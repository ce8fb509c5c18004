package ai.deadwood.model;

import ai.deadwood.analyzer.ProjectFile;
import ai.deadwood.analyzer.Range;
import org.jetbrains.annotations.Nullable;

public record SourceLocation(
        String filePath, int startLine, int startColumn, int endLine, int endColumn, @Nullable String sourceText) {

    public static SourceLocation of(ProjectFile file, Range range) {
        return new SourceLocation(
                file.path(), range.startLine(), range.startColumn(), range.endLine(), range.endColumn(), null);
    }

    public static SourceLocation of(ProjectFile file, Range range, String sourceText) {
        return new SourceLocation(
                file.path(), range.startLine(), range.startColumn(), range.endLine(), range.endColumn(), sourceText);
    }

    /** Whole-file location, used for structural findings such as cycles. */
    public static SourceLocation fileStart(String filePath) {
        return new SourceLocation(filePath, 1, 1, 1, 1, null);
    }
}
