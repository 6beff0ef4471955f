package io.mycelic.core.error;

public enum ErrorKind {
    VALIDATION,
    NOT_FOUND,
    CONSTRAINT,
    DEPENDENCY_UNAVAILABLE,
    RATE_LIMITED,
    STORAGE
}
