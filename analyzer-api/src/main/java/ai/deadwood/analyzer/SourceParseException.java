package ai.deadwood.analyzer;

/**
 * Thrown by a {@link SymbolProvider} when a file cannot be parsed. Carries the file and the provider operation so the
 * failure can be recorded against that file alone.
 */
public class SourceParseException extends Exception {
    private final ProjectFile file;
    private final String operation;

    public SourceParseException(String message, ProjectFile file, String operation) {
        super(message);
        this.file = file;
        this.operation = operation;
    }

    public SourceParseException(String message, Throwable cause, ProjectFile file, String operation) {
        super(message, cause);
        this.file = file;
        this.operation = operation;
    }

    public ProjectFile getFile() {
        return file;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String getMessage() {
        return String.format("Parsing failed during %s for file %s: %s", operation, file, super.getMessage());
    }
}
