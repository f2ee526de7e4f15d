package com.contactcare.backend.modules.risk.domain;

public enum RiskLevel {
    LOW(12),
    MEDIUM(12),
    HIGH(6),
    VERY_HIGH(3),
    CRITICAL(3);

    private final int reviewMonths;

    RiskLevel(int reviewMonths) {
        this.reviewMonths = reviewMonths;
    }

    /**
     * Months until an assessment at this level has to be reviewed.
     */
    public int reviewMonths() {
        return reviewMonths;
    }
}
