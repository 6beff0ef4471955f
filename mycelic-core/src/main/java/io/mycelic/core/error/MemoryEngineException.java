package io.mycelic.core.error;

/**
 * Base of every failure the engine reports. Front ends map {@link #kind()} to a status code
 * or exit code.
 */
public class MemoryEngineException extends RuntimeException {
    private final ErrorKind kind;

    public MemoryEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MemoryEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
