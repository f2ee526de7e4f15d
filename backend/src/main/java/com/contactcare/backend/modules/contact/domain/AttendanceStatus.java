package com.contactcare.backend.modules.contact.domain;

public enum AttendanceStatus {
    ATTENDED,
    DID_NOT_ATTEND,
    LATE,
    LEFT_EARLY
}
