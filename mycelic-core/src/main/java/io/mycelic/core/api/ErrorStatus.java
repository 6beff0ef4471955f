package io.mycelic.core.api;

import io.mycelic.core.error.ErrorKind;

public final class ErrorStatus {

    private ErrorStatus() {
    }

    public static int httpStatus(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> 400;
            case NOT_FOUND -> 404;
            case CONSTRAINT -> 409;
            case DEPENDENCY_UNAVAILABLE -> 503;
            case RATE_LIMITED -> 429;
            case STORAGE -> 500;
        };
    }
}
