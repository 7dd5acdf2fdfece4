package org.showvault.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ApiError {
    SHOW_NOT_FOUND(HttpStatus.NOT_FOUND, "Show not found with ID: %s"),
    INVALID_LOCATION(HttpStatus.BAD_REQUEST, "Show location is missing or not writable: %s"),
    UNSUPPORTED_LANGUAGE(HttpStatus.BAD_REQUEST, "Language '%s' is not supported by the indexer"),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Invalid value for field '%s': %s"),
    SHOW_ALREADY_EXISTS(HttpStatus.BAD_REQUEST, "Show with ID %s already exists"),
    SHOW_BUSY(HttpStatus.CONFLICT, "Show %s is being updated by another request, try again"),
    LOCATION_CHECK_TIMEOUT(HttpStatus.GATEWAY_TIMEOUT, "Timed out checking show location: %s"),
    PERSISTENCE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to save settings for show %s: %s");

    private final HttpStatus status;
    private final String message;

    ApiError(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public APIException createException(Object... details) {
        String formattedMessage = (details.length > 0) ? String.format(message, details) : message;
        return new APIException(formattedMessage, this.status, this);
    }

    public APIException wrap(Throwable cause, Object... details) {
        APIException exception = createException(details);
        exception.initCause(cause);
        return exception;
    }
}
