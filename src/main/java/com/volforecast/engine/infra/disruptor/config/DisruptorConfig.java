package com.volforecast.engine.infra.disruptor.config;

import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.volforecast.engine.infra.disruptor.event.PriceTickEvent;
import com.volforecast.engine.infra.disruptor.event.PriceTickEventFactory;
import com.volforecast.engine.infra.disruptor.handler.DisruptorExceptionHandler;
import com.volforecast.engine.infra.disruptor.handler.TickHistoryHandler;
import com.volforecast.engine.infra.disruptor.handler.VolatilityUpdateHandler;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class DisruptorConfig {

    private static final int TICK_BUFFER_SIZE = 1024 * 16;

    private final TickHistoryHandler tickHistoryHandler;
    private final VolatilityUpdateHandler volatilityUpdateHandler;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<PriceTickEvent> tickDisruptor;

    @Bean
    public Disruptor<PriceTickEvent> priceTickDisruptor() {
        WaitStrategy waitStrategy = resolveWaitStrategy();

        tickDisruptor = new Disruptor<>(
                new PriceTickEventFactory(),
                TICK_BUFFER_SIZE,
                namedThreadFactory("disruptor-tick"),
                ProducerType.MULTI,
                waitStrategy
        );

        tickDisruptor.setDefaultExceptionHandler(
                new DisruptorExceptionHandler("tick", meterRegistry));

        tickDisruptor
                .handleEventsWith(tickHistoryHandler)
                .then(volatilityUpdateHandler);

        tickDisruptor.start();

        log.info("[Disruptor] Tick 파이프라인 기동: History → Volatility | size={}, wait={}",
                TICK_BUFFER_SIZE, waitStrategy.getClass().getSimpleName());

        return tickDisruptor;
    }

    @Bean
    public RingBuffer<PriceTickEvent> priceTickRingBuffer(Disruptor<PriceTickEvent> priceTickDisruptor) {
        return priceTickDisruptor.getRingBuffer();
    }

    @PreDestroy
    public void shutdown() {
        if (tickDisruptor != null) {
            tickDisruptor.shutdown();
            log.info("[Disruptor] Tick Disruptor 종료 완료");
        }
    }

    private WaitStrategy resolveWaitStrategy() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equals(profile)) {
                log.info("[Disruptor] prod 프로파일 → YieldingWaitStrategy (저지연)");
                return new YieldingWaitStrategy();
            }
        }
        log.info("[Disruptor] dev/local 프로파일 → SleepingWaitStrategy (저CPU)");
        return new SleepingWaitStrategy();
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
