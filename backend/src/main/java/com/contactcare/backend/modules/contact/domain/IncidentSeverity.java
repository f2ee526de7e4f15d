package com.contactcare.backend.modules.contact.domain;

public enum IncidentSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isSerious() {
        return this == HIGH || this == CRITICAL;
    }
}
