package com.volforecast.engine.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.volforecast.engine.domain.exception.InvalidObservationException;
import com.volforecast.engine.domain.service.volatility.VolatilityStateStore;
import com.volforecast.engine.infra.disruptor.event.PriceTickEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 연속된 가격을 로그수익률로 바꿔 변동성 상태에 반영한다. 거부된 관측은 이 틱만 버린다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VolatilityUpdateHandler implements EventHandler<PriceTickEvent> {

    private final VolatilityStateStore stateStore;
    private final MeterRegistry meterRegistry;

    private Timer e2eLatencyTimer;
    private Counter processedCounter;

    @PostConstruct
    void initMetrics() {
        e2eLatencyTimer = Timer.builder("disruptor.tick.e2e_latency")
                .description("End-to-end tick latency (publish → volatility update)")
                .register(meterRegistry);
        processedCounter = Counter.builder("disruptor.ticks.processed")
                .description("Ticks applied to the volatility state")
                .register(meterRegistry);
    }

    @Override
    public void onEvent(PriceTickEvent event, long sequence, boolean endOfBatch) {
        if (event.getAssetId() == null) return;

        try {
            stateStore.observePrice(event.getAssetId(), event.getPrice(), event.getTimestampMs());
            processedCounter.increment();
        } catch (InvalidObservationException e) {
            log.debug("[Disruptor] 틱 거부: asset={}, reason={}", event.getAssetId(), e.getMessage());
        } finally {
            if (event.getIngestNanoTime() > 0) {
                e2eLatencyTimer.record(System.nanoTime() - event.getIngestNanoTime(), TimeUnit.NANOSECONDS);
            }
            event.clear();
        }
    }
}
