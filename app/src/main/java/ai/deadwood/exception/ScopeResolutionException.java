package ai.deadwood.exception;

public class ScopeResolutionException extends RuntimeException {
    public ScopeResolutionException(String message) {
        super(message);
    }

    public ScopeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
