package com.volforecast.engine.domain.model;

import java.time.Duration;

public enum AssetClass {

    CRYPTO(Duration.ofHours(6), DistributionKind.STUDENT_T, false),
    COMMODITY(Duration.ofHours(12), DistributionKind.STUDENT_T, false),
    EQUITY(Duration.ofDays(2), DistributionKind.GAUSSIAN, true);

    private final Duration bootstrapLookback;
    private final DistributionKind defaultDistribution;
    private final boolean marketHoursRequired;

    AssetClass(Duration bootstrapLookback, DistributionKind defaultDistribution, boolean marketHoursRequired) {
        this.bootstrapLookback = bootstrapLookback;
        this.defaultDistribution = defaultDistribution;
        this.marketHoursRequired = marketHoursRequired;
    }

    public Duration getBootstrapLookback() {
        return bootstrapLookback;
    }

    public DistributionKind getDefaultDistribution() {
        return defaultDistribution;
    }

    public boolean isMarketHoursRequired() {
        return marketHoursRequired;
    }
}
