package com.company.slaregistry.exception;

import com.company.slaregistry.domain.enums.SlaStatus;

public class SlaNotActiveException extends SlaRegistryException {
    public SlaNotActiveException(Long slaId, SlaStatus status) {
        super(ErrorKind.SLA_NOT_ACTIVE, "SLA " + slaId + " is not active (status: " + status + ")");
    }
}
