package com.volforecast.engine.domain.service.montecarlo;

import com.volforecast.engine.domain.model.HorizonLabel;
import com.volforecast.engine.domain.model.ParameterSnapshot;
import com.volforecast.engine.domain.model.PathEnsemble;
import com.volforecast.engine.domain.model.PredictionRecord;
import com.volforecast.engine.domain.repository.PredictionRecordRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 생성된 앙상블 중 일부를 채점용으로 보관한다. (자산, 라벨)별로 t0 기준 LOW 30분, HIGH 15분에 한 건.
 * 저장은 별도 스레드에서 수행되며 실패해도 요청 결과에는 영향이 없다.
 */
@Slf4j
@Component
public class PredictionArchiver {

    private final PredictionRecordRepository repository;
    private final ArchiveProperties properties;
    private final Clock clock;
    private final Executor executor;

    private final Map<String, Long> lastArchivedT0 = new ConcurrentHashMap<>();

    @Autowired
    public PredictionArchiver(PredictionRecordRepository repository, ArchiveProperties properties, Clock clock) {
        this(repository, properties, clock, Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("prediction-archiver");
            thread.setDaemon(true);
            return thread;
        }));
    }

    PredictionArchiver(PredictionRecordRepository repository, ArchiveProperties properties,
                       Clock clock, Executor executor) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
        this.executor = executor;
    }

    /** @return 보관 대상으로 채택되었으면 true */
    public boolean offer(PathEnsemble ensemble, ParameterSnapshot parameters) {
        if (!properties.isEnabled()) return false;

        HorizonLabel label = parameters.getHorizonLabel();
        long intervalMs = (label == HorizonLabel.HIGH ? properties.getHighInterval() : properties.getLowInterval())
                .toMillis();
        String key = ensemble.getAssetId() + "|" + label;
        long t0 = ensemble.getT0EpochMs();

        AtomicBoolean sampled = new AtomicBoolean(false);
        lastArchivedT0.compute(key, (k, last) -> {
            if (last == null || Math.abs(t0 - last) >= intervalMs) {
                sampled.set(true);
                return t0;
            }
            return last;
        });
        if (!sampled.get()) return false;

        PredictionRecord record = PredictionRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .assetId(ensemble.getAssetId())
                .t0EpochMs(t0)
                .incrementSeconds(ensemble.getIncrementSeconds())
                .stepCount(ensemble.getStepCount())
                .horizonLabel(label)
                .ensemble(ensemble)
                .parameters(parameters)
                .loggedAtEpochMs(clock.millis())
                .logReason("sampled_" + label.name().toLowerCase())
                .build();

        try {
            executor.execute(() -> persist(record));
        } catch (RejectedExecutionException e) {
            log.warn("[Archive] 보관 작업 거부 (종료 중?): asset={}, t0={}", record.getAssetId(), t0);
            return false;
        }
        return true;
    }

    private void persist(PredictionRecord record) {
        try {
            repository.append(record);
            log.debug("[Archive] 예측 보관: recordId={}, asset={}, t0={}, label={}",
                    record.getRecordId(), record.getAssetId(), record.getT0EpochMs(), record.getHorizonLabel());
        } catch (RuntimeException e) {
            log.error("[Archive] 예측 보관 실패: asset={}, t0={}", record.getAssetId(), record.getT0EpochMs(), e);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Archive] 보관 작업 종료 대기 시간 초과");
                service.shutdownNow();
            }
        }
    }
}
