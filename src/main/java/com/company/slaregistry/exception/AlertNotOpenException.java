package com.company.slaregistry.exception;

import com.company.slaregistry.domain.enums.AlertStatus;

public class AlertNotOpenException extends SlaRegistryException {
    public AlertNotOpenException(Long alertId, AlertStatus status) {
        super(ErrorKind.ALERT_NOT_OPEN, "Alert " + alertId + " is not open (status: " + status + ")");
    }
}
