package com.contactcare.backend.modules.contact.presentation.dto;

final class SessionTimes {

    // HH:mm with optional seconds
    static final String PATTERN = "^([01]\\d|2[0-3]):[0-5]\\d(:[0-5]\\d)?$";

    private SessionTimes() {
    }
}
