package com.contactcare.backend.modules.contact.domain;

/**
 * How the child's recorded emotional state moved between arrival and departure.
 */
public enum EmotionalStateChange {
    UNKNOWN,
    NO_CHANGE,
    IMPROVED,
    DETERIORATED,
    CHANGED;

    public static EmotionalStateChange between(ChildEmotionalState before, ChildEmotionalState after) {
        if (before == null || after == null) {
            return UNKNOWN;
        }
        if (before == after) {
            return NO_CHANGE;
        }
        if (!before.isPositive() && after.isPositive()) {
            return IMPROVED;
        }
        if (before.isPositive() && !after.isPositive()) {
            return DETERIORATED;
        }
        return CHANGED;
    }
}
