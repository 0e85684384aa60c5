package com.company.slaregistry.exception;

public class AlertNotificationException extends RuntimeException {
    public AlertNotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
