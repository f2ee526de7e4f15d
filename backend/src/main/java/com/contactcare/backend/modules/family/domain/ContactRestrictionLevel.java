package com.contactcare.backend.modules.family.domain;

public enum ContactRestrictionLevel {
    NONE,
    SUPERVISED_ONLY,
    INDIRECT_ONLY,
    NO_CONTACT;

    public boolean permitsContact() {
        return this != NO_CONTACT;
    }
}
