package io.mycelic.core.api;

import io.mycelic.core.error.ErrorKind;
import java.util.Locale;

/**
 * Envelope for every REST response.
 */
public record ApiResponse(boolean success, Object data, ApiError error) {

    public static ApiResponse ok(Object data) {
        return new ApiResponse(true, data, null);
    }

    public static ApiResponse failure(String kind, String message) {
        return new ApiResponse(false, null, new ApiError(kind, message));
    }

    public static ApiResponse failure(ErrorKind kind, String message) {
        return failure(kind.name().toLowerCase(Locale.ROOT), message);
    }

    public record ApiError(String kind, String message) {
    }
}
