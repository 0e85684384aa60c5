package com.company.slaregistry.exception;

public class InvalidArgumentException extends SlaRegistryException {
    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }
}
