package com.company.slaregistry.exception;

public class EntityNotFoundException extends SlaRegistryException {
    public EntityNotFoundException(String entity, Object id) {
        super(ErrorKind.NOT_FOUND, entity + " not found: " + id);
    }
}
