package com.contactcare.backend.modules.contact.domain;

public enum ChildEmotionalState {
    HAPPY(true),
    EXCITED(true),
    NEUTRAL(true),
    ANXIOUS(false),
    DISTRESSED(false),
    WITHDRAWN(false),
    ANGRY(false),
    CONFUSED(false);

    private final boolean positive;

    ChildEmotionalState(boolean positive) {
        this.positive = positive;
    }

    public boolean isPositive() {
        return positive;
    }
}
