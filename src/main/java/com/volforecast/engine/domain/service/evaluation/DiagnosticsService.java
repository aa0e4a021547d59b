package com.volforecast.engine.domain.service.evaluation;

import com.volforecast.engine.domain.model.CrpsResult;
import com.volforecast.engine.domain.model.DiagnosticsReport;
import com.volforecast.engine.domain.repository.CrpsResultRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    private final CrpsResultRepository crpsRepository;
    private final DiagnosticsAggregator aggregator;
    private final Clock clock;

    public DiagnosticsReport diagnostics(Duration window) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("집계 구간은 양수여야 합니다: " + window);
        }
        long now = clock.millis();
        List<CrpsResult> results = crpsRepository.findByT0Between(now - window.toMillis(), now);
        return aggregator.aggregate(results, window);
    }
}
