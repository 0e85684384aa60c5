package com.company.slaregistry.exception;

import com.company.slaregistry.domain.enums.SlaStatus;

public class SlaNotPausedException extends SlaRegistryException {
    public SlaNotPausedException(Long slaId, SlaStatus status) {
        super(ErrorKind.SLA_NOT_PAUSED, "SLA " + slaId + " is not paused (status: " + status + ")");
    }
}
