package ai.deadwood.analyzer;

/** 1-based, inclusive source span. */
public record Range(int startLine, int startColumn, int endLine, int endColumn) {
    public Range {
        if (startLine < 1 || startColumn < 1) {
            throw new IllegalArgumentException("Range is 1-based, got " + startLine + ":" + startColumn);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException("Range ends before it starts: " + startLine + " > " + endLine);
        }
    }

    public static Range line(int line) {
        return new Range(line, 1, line, 1);
    }

    public static Range of(int line, int startColumn, int endColumn) {
        return new Range(line, startColumn, line, endColumn);
    }

    public boolean contains(int line) {
        return line >= startLine && line <= endLine;
    }
}
