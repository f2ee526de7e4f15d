package com.contactcare.backend.modules.contact.domain;

public enum ContactFrequency {
    DAILY,
    TWICE_WEEKLY,
    WEEKLY,
    FORTNIGHTLY,
    MONTHLY,
    QUARTERLY,
    ANNUALLY
}
