package org.showvault.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class APIException extends RuntimeException {

    private final HttpStatus status;
    private final ApiError error;

    public APIException(String message, HttpStatus status, ApiError error) {
        super(message);
        this.status = status;
        this.error = error;
    }
}
