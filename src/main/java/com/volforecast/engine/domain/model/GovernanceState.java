package com.volforecast.engine.domain.model;

/**
 * (자산, 파라미터) 쌍의 거버넌스 상태. reason 은 INELIGIBLE 일 때, untilEpochMs 는 대기/관찰 종료 시각.
 */
public record GovernanceState(Phase phase, String reason, Long untilEpochMs) {

    public enum Phase {
        INELIGIBLE,
        ELIGIBLE,
        PROPOSED,
        OBSERVING
    }

    public static GovernanceState eligible() {
        return new GovernanceState(Phase.ELIGIBLE, null, null);
    }

    public static GovernanceState ineligible(String reason, long untilEpochMs) {
        return new GovernanceState(Phase.INELIGIBLE, reason, untilEpochMs);
    }

    public static GovernanceState observing(long untilEpochMs) {
        return new GovernanceState(Phase.OBSERVING, "관찰 기간 진행 중", untilEpochMs);
    }

    public static GovernanceState proposed() {
        return new GovernanceState(Phase.PROPOSED, null, null);
    }

    public boolean isEligible() {
        return phase == Phase.ELIGIBLE;
    }

    public boolean isObserving() {
        return phase == Phase.OBSERVING;
    }
}
