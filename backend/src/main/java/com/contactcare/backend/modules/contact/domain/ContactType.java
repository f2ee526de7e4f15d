package com.contactcare.backend.modules.contact.domain;

public enum ContactType {
    FACE_TO_FACE,
    TELEPHONE,
    VIDEO_CALL,
    LETTER,
    EMAIL,
    SOCIAL_MEDIA
}
