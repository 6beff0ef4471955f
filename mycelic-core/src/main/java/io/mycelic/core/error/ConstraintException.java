package io.mycelic.core.error;

public class ConstraintException extends MemoryEngineException {

    public ConstraintException(String message) {
        super(ErrorKind.CONSTRAINT, message);
    }

    public ConstraintException(String message, Throwable cause) {
        super(ErrorKind.CONSTRAINT, message, cause);
    }
}
