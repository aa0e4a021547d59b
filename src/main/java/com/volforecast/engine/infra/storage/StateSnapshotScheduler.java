package com.volforecast.engine.infra.storage;

import com.volforecast.engine.domain.service.volatility.VolatilityStateStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class StateSnapshotScheduler {

    private final VolatilityStateStore stateStore;

    @Scheduled(fixedDelayString = "${forecast.storage.snapshot-interval-ms:60000}")
    public void snapshot() {
        stateStore.flush();
    }

    @PreDestroy
    public void flushOnShutdown() {
        int written = stateStore.flush();
        log.info("[Storage] 종료 전 스냅샷 저장: {}건", written);
    }
}
