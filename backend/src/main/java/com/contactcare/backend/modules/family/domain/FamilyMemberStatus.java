package com.contactcare.backend.modules.family.domain;

public enum FamilyMemberStatus {
    ACTIVE,
    SUSPENDED,
    RESTRICTED,
    DECEASED,
    NO_CONTACT;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
