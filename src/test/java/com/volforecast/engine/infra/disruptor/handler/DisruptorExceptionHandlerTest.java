package com.volforecast.engine.infra.disruptor.handler;

import com.volforecast.engine.infra.disruptor.event.PriceTickEvent;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DisruptorExceptionHandlerTest {

    @Test
    void countsFailureByCauseAndClearsEvent() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        DisruptorExceptionHandler handler = new DisruptorExceptionHandler("tick", meterRegistry);
        PriceTickEvent event = new PriceTickEvent();
        event.setAssetId("DOGE");
        event.setPrice(0.1);

        handler.handleEventException(new IllegalArgumentException("등록되지 않은 자산: DOGE"), 3L, event);

        assertThat(event.getAssetId()).isNull();
        assertThat(meterRegistry.counter("disruptor.exceptions",
                "pipeline", "tick", "cause", "IllegalArgumentException").count()).isEqualTo(1.0);
    }
}
