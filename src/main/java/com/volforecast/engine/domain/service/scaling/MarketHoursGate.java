package com.volforecast.engine.domain.service.scaling;

import com.volforecast.engine.domain.model.ScalingParameters;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

@Component
@RequiredArgsConstructor
public class MarketHoursGate {

    private final AssetParameterRegistry registry;
    private final MarketHoursProperties properties;

    public boolean shouldFlatten(String assetId, long t0EpochMs) {
        return shouldFlatten(registry.scalingParameters(assetId), t0EpochMs);
    }

    public boolean shouldFlatten(ScalingParameters scaling, long t0EpochMs) {
        if (!scaling.isMarketHoursRequired()) return false;
        return !isMarketOpen(t0EpochMs);
    }

    public boolean isMarketOpen(long epochMs) {
        ZonedDateTime utc = Instant.ofEpochMilli(epochMs).atZone(ZoneOffset.UTC);
        DayOfWeek day = utc.getDayOfWeek();
        if (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY) return false;

        LocalTime time = utc.toLocalTime();
        return !time.isBefore(properties.openTime()) && time.isBefore(properties.closeTime());
    }
}
