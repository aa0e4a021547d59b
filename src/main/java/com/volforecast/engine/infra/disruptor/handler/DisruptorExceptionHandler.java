package com.volforecast.engine.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import com.volforecast.engine.infra.disruptor.event.PriceTickEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * 틱 처리 중 예외가 난 이벤트는 비우고 버린다. 링은 멈추지 않는다.
 */
@Slf4j
public class DisruptorExceptionHandler implements ExceptionHandler<PriceTickEvent> {

    private final String pipelineName;
    private final MeterRegistry meterRegistry;

    public DisruptorExceptionHandler(String pipelineName, MeterRegistry meterRegistry) {
        this.pipelineName = pipelineName;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void handleEventException(Throwable ex, long sequence, PriceTickEvent event) {
        Counter.builder("disruptor.exceptions")
                .tag("pipeline", pipelineName)
                .tag("cause", ex.getClass().getSimpleName())
                .description("Ticks dropped after a handler exception")
                .register(meterRegistry)
                .increment();

        if (event == null) {
            log.error("[Disruptor-{}] 틱 처리 예외: seq={}", pipelineName, sequence, ex);
            return;
        }
        log.error("[Disruptor-{}] 틱 드롭: seq={}, asset={}, price={}, ts={}",
                pipelineName, sequence, event.getAssetId(), event.getPrice(), event.getTimestampMs(), ex);
        event.clear();
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Disruptor-{}] 핸들러 시작 실패", pipelineName, ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Disruptor-{}] 핸들러 종료 실패", pipelineName, ex);
    }
}
