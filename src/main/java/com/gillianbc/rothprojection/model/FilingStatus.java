package com.gillianbc.rothprojection.model;

public enum FilingStatus {
    SINGLE,
    MARRIED_FILING_JOINTLY,
    MARRIED_FILING_SEPARATELY,
    HEAD_OF_HOUSEHOLD,
    QUALIFYING_SURVIVING_SPOUSE;

    /**
     * IRMAA publishes three tables: joint, separate, and individual for everyone else.
     */
    public FilingStatus irmaaTable() {
        return switch (this) {
            case MARRIED_FILING_JOINTLY -> MARRIED_FILING_JOINTLY;
            case MARRIED_FILING_SEPARATELY -> MARRIED_FILING_SEPARATELY;
            default -> SINGLE;
        };
    }
}
