package com.volforecast.engine.domain.model;

public record ProposalResult(boolean accepted, String message, TuningHistoryEntry entry) {

    public static ProposalResult accepted(String message, TuningHistoryEntry entry) {
        return new ProposalResult(true, message, entry);
    }

    public static ProposalResult rejected(String message) {
        return new ProposalResult(false, message, null);
    }
}
