package com.contactcare.backend.modules.contact.domain;

public enum ContactSessionStatus {
    SCHEDULED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this != SCHEDULED;
    }
}
