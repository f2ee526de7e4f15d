package com.contactcare.backend.modules.contact.domain;

public enum InteractionQuality {
    EXCELLENT,
    GOOD,
    SATISFACTORY,
    POOR,
    CONCERNING
}
