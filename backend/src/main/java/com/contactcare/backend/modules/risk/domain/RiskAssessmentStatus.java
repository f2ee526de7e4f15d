package com.contactcare.backend.modules.risk.domain;

public enum RiskAssessmentStatus {
    DRAFT,
    PENDING_APPROVAL,
    APPROVED,
    REJECTED;

    public boolean isEditable() {
        return this != APPROVED;
    }

    public boolean isAwaitingDecision() {
        return this == DRAFT || this == PENDING_APPROVAL;
    }
}
