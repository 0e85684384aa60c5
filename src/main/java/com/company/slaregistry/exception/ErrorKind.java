package com.company.slaregistry.exception;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    INVALID_REFERENCE(HttpStatus.UNPROCESSABLE_ENTITY),
    SLA_NOT_ACTIVE(HttpStatus.CONFLICT),
    SLA_NOT_PAUSED(HttpStatus.CONFLICT),
    ALERT_NOT_OPEN(HttpStatus.CONFLICT),
    ALERT_NOT_RESOLVABLE(HttpStatus.CONFLICT),
    DUPLICATE_EXTERNAL_ID(HttpStatus.CONFLICT),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST),
    CAPABILITY_DENIED(HttpStatus.FORBIDDEN);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
