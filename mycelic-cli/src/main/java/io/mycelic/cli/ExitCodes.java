package io.mycelic.cli;

import io.mycelic.core.error.ErrorKind;

public final class ExitCodes {
    public static final int FAILURE = 1;
    public static final int INVALID_INPUT = 2;
    public static final int NOT_FOUND = 3;
    public static final int CONFLICT = 4;
    public static final int UNAVAILABLE = 5;
    public static final int BUSY = 6;

    private ExitCodes() {
    }

    public static int of(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> INVALID_INPUT;
            case NOT_FOUND -> NOT_FOUND;
            case CONSTRAINT -> CONFLICT;
            case DEPENDENCY_UNAVAILABLE -> UNAVAILABLE;
            case RATE_LIMITED -> BUSY;
            case STORAGE -> FAILURE;
        };
    }
}
