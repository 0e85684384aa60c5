package com.company.slaregistry.exception;

/**
 * Base for every precondition failure raised by the registry.
 * Thrown before any state change, so a caught instance means nothing was written.
 */
public abstract class SlaRegistryException extends RuntimeException {

    private final ErrorKind errorKind;

    protected SlaRegistryException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }
}
