package com.contactcare.backend.modules.contact.domain;

public enum ContactScheduleStatus {
    ACTIVE,
    SUSPENDED,
    ENDED;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
