package com.company.slaregistry.exception;

public class DuplicateExternalIdException extends SlaRegistryException {
    public DuplicateExternalIdException(String externalId, Long existingContractId) {
        super(ErrorKind.DUPLICATE_EXTERNAL_ID,
                "External id " + externalId + " is already mapped to contract " + existingContractId);
    }
}
