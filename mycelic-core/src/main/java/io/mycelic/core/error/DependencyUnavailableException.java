package io.mycelic.core.error;

public class DependencyUnavailableException extends MemoryEngineException {

    public DependencyUnavailableException(String message) {
        super(ErrorKind.DEPENDENCY_UNAVAILABLE, message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(ErrorKind.DEPENDENCY_UNAVAILABLE, message, cause);
    }
}
