package com.company.slaregistry.exception;

public class InvalidReferenceException extends SlaRegistryException {
    public InvalidReferenceException(String entity, Long id) {
        super(ErrorKind.INVALID_REFERENCE, entity + " does not exist: " + id);
    }

    public InvalidReferenceException(String entity, Long id, String problem) {
        super(ErrorKind.INVALID_REFERENCE, entity + " " + id + " " + problem);
    }
}
