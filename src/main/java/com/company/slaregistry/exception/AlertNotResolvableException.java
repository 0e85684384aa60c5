package com.company.slaregistry.exception;

import com.company.slaregistry.domain.enums.AlertStatus;

public class AlertNotResolvableException extends SlaRegistryException {
    public AlertNotResolvableException(Long alertId, AlertStatus status) {
        super(ErrorKind.ALERT_NOT_RESOLVABLE, "Alert " + alertId + " cannot be resolved (status: " + status + ")");
    }
}
