package com.volforecast.engine.infra.disruptor.monitor;

import com.lmax.disruptor.RingBuffer;
import com.volforecast.engine.infra.disruptor.event.PriceTickEvent;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class DisruptorMetricsCollector {

    private final RingBuffer<PriceTickEvent> tickRingBuffer;
    private final MeterRegistry meterRegistry;

    public DisruptorMetricsCollector(RingBuffer<PriceTickEvent> priceTickRingBuffer, MeterRegistry meterRegistry) {
        this.tickRingBuffer = priceTickRingBuffer;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("disruptor.ringbuffer.utilization", tickRingBuffer,
                        rb -> 1.0 - ((double) rb.remainingCapacity() / rb.getBufferSize()))
                .tag("pipeline", "tick")
                .description("Tick RingBuffer utilization (0.0~1.0)")
                .register(meterRegistry);

        Gauge.builder("disruptor.ringbuffer.remaining", tickRingBuffer,
                        rb -> (double) rb.remainingCapacity())
                .tag("pipeline", "tick")
                .description("Tick RingBuffer remaining capacity")
                .register(meterRegistry);

        log.info("[Metrics] Disruptor RingBuffer 모니터링 등록 완료");
    }

    @Scheduled(fixedRate = 30_000)
    public void logMetricsSummary() {
        long used = tickRingBuffer.getBufferSize() - tickRingBuffer.remainingCapacity();
        if (used == 0) return;

        Timer e2eTimer = meterRegistry.find("disruptor.tick.e2e_latency").timer();
        log.info("[Metrics] Tick RB: {}% ({}/{}) | e2e avg={}μs",
                String.format("%.1f", 100.0 * used / tickRingBuffer.getBufferSize()),
                used, tickRingBuffer.getBufferSize(),
                e2eTimer != null ? String.format("%.0f", e2eTimer.mean(TimeUnit.MICROSECONDS)) : "N/A");
    }
}
