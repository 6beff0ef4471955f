package io.mycelic.core.error;

public class StorageException extends MemoryEngineException {

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }
}
