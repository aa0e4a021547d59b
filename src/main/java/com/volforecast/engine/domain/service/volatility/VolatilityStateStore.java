package com.volforecast.engine.domain.service.volatility;

import com.volforecast.engine.domain.exception.CorruptPersistedStateException;
import com.volforecast.engine.domain.exception.InvalidObservationException;
import com.volforecast.engine.domain.model.VolatilityState;
import com.volforecast.engine.domain.repository.VolatilityStateRepository;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 자산별 EWMA 분산 상태. variance' = lambda * variance + (1 - lambda) * r^2.
 * <p>
 * 쓰기(update, 부트스트랩, reset)는 자산별 락으로 직렬화되고, 읽기는 volatile 참조로 불변 스냅샷을 본다.
 */
@Slf4j
@Component
public class VolatilityStateStore {

    private final VolatilityStateRepository repository;
    private final VolatilityBootstrap bootstrap;
    private final AssetParameterRegistry registry;
    private final MeterRegistry meterRegistry;

    private final Map<String, AssetSlot> slots = new ConcurrentHashMap<>();

    public VolatilityStateStore(VolatilityStateRepository repository,
                                VolatilityBootstrap bootstrap,
                                AssetParameterRegistry registry,
                                MeterRegistry meterRegistry) {
        this.repository = repository;
        this.bootstrap = bootstrap;
        this.registry = registry;
        this.meterRegistry = meterRegistry;
    }

    public VolatilityState get(String assetId) {
        String asset = resolve(assetId);
        AssetSlot slot = slotOf(asset);
        VolatilityState state = slot.state;
        if (state != null) return state;

        slot.lock.lock();
        try {
            return ensureInitialized(asset, slot);
        } finally {
            slot.lock.unlock();
        }
    }

    public Optional<VolatilityState> peek(String assetId) {
        AssetSlot slot = slots.get(AssetParameterRegistry.normalize(assetId));
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.state);
    }

    public VolatilityState update(String assetId, double logReturn, long timestampMs) {
        String asset = resolve(assetId);
        if (!Double.isFinite(logReturn)) {
            throw reject(asset, "non_finite_return", "로그수익률이 유한하지 않습니다: r=" + logReturn);
        }
        AssetSlot slot = slotOf(asset);
        slot.lock.lock();
        try {
            VolatilityState current = ensureInitialized(asset, slot);
            return apply(asset, slot, current, logReturn, timestampMs, current.getLastPrice());
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * 가격 관측. 첫 가격은 기준가만 기록하고, 이후 가격은 직전 가격 대비 로그수익률로 update 한다.
     */
    public VolatilityState observePrice(String assetId, double price, long timestampMs) {
        String asset = resolve(assetId);
        if (!Double.isFinite(price) || price <= 0) {
            throw reject(asset, "invalid_price", "가격은 유한한 양수여야 합니다: price=" + price);
        }
        AssetSlot slot = slotOf(asset);
        slot.lock.lock();
        try {
            VolatilityState current = ensureInitialized(asset, slot);
            if (timestampMs < current.getLastUpdateEpochMs()) {
                throw reject(asset, "stale", "이전 관측보다 오래된 시각입니다: ts=" + timestampMs
                        + ", last=" + current.getLastUpdateEpochMs());
            }
            Double lastPrice = current.getLastPrice();
            if (lastPrice == null) {
                VolatilityState seeded = current.toBuilder()
                        .lastPrice(price)
                        .lastUpdateEpochMs(timestampMs)
                        .build();
                publish(slot, seeded);
                log.debug("[Volatility] 기준가 기록: asset={}, price={}", asset, price);
                return seeded;
            }
            double r = Math.log(price / lastPrice);
            return apply(asset, slot, current, r, timestampMs, price);
        } finally {
            slot.lock.unlock();
        }
    }

    public void reset(String assetId) {
        String asset = resolve(assetId);
        AssetSlot slot = slotOf(asset);
        slot.lock.lock();
        try {
            slot.state = null;
            slot.dirty.set(false);
            repository.delete(asset);
            log.info("[Volatility] 상태 초기화: asset={}", asset);
        } finally {
            slot.lock.unlock();
        }
    }

    /** 변경된 상태만 저장소에 기록. 반환값은 기록한 자산 수. */
    public int flush() {
        int written = 0;
        for (Map.Entry<String, AssetSlot> entry : slots.entrySet()) {
            AssetSlot slot = entry.getValue();
            slot.lock.lock();
            try {
                if (!slot.dirty.compareAndSet(true, false)) continue;

                VolatilityState state = slot.state;
                if (state == null) continue;
                repository.save(state);
                written++;
            } catch (RuntimeException e) {
                slot.dirty.set(true);
                log.error("[Volatility] 스냅샷 저장 실패: asset={}", entry.getKey(), e);
            } finally {
                slot.lock.unlock();
            }
        }
        if (written > 0) {
            log.debug("[Volatility] 스냅샷 저장: {}건", written);
        }
        return written;
    }

    private VolatilityState apply(String asset, AssetSlot slot, VolatilityState current,
                                  double r, long timestampMs, Double price) {
        if (timestampMs < current.getLastUpdateEpochMs()) {
            throw reject(asset, "stale", "이전 관측보다 오래된 시각입니다: ts=" + timestampMs
                    + ", last=" + current.getLastUpdateEpochMs());
        }
        double lambda = registry.decayLambda(asset);
        double next = lambda * current.getVarianceEstimate() + (1.0 - lambda) * r * r;
        if (!Double.isFinite(next) || next < 0) {
            throw reject(asset, "non_finite_result", "갱신 결과가 유효하지 않습니다: variance=" + next);
        }

        VolatilityState updated = current.toBuilder()
                .varianceEstimate(next)
                .decayLambda(lambda)
                .lastUpdateEpochMs(timestampMs)
                .sampleCount(current.getSampleCount() + 1)
                .lastPrice(price)
                .build();
        publish(slot, updated);
        return updated;
    }

    private VolatilityState ensureInitialized(String asset, AssetSlot slot) {
        VolatilityState state = slot.state;
        if (state != null) return state;

        VolatilityState loaded = null;
        try {
            loaded = repository.load(asset).orElse(null);
        } catch (CorruptPersistedStateException e) {
            log.warn("[Volatility] 손상된 스냅샷, 부트스트랩으로 대체: asset={}, cause={}", asset, e.getMessage());
        }
        if (loaded != null) {
            log.info("[Volatility] 스냅샷 복원: {}", loaded);
            slot.state = loaded;
            return loaded;
        }

        VolatilityState bootstrapped = bootstrap.bootstrap(asset);
        publish(slot, bootstrapped);
        return bootstrapped;
    }

    private void publish(AssetSlot slot, VolatilityState state) {
        slot.state = state;
        slot.dirty.set(true);
    }

    private InvalidObservationException reject(String asset, String reason, String message) {
        Counter.builder("forecast.volatility.rejected")
                .tag("reason", reason)
                .description("Rejected volatility observations")
                .register(meterRegistry)
                .increment();
        log.warn("[Volatility] 관측 거부: asset={}, reason={}, {}", asset, reason, message);
        return new InvalidObservationException(message);
    }

    private String resolve(String assetId) {
        registry.profile(assetId);
        return AssetParameterRegistry.normalize(assetId);
    }

    private AssetSlot slotOf(String asset) {
        return slots.computeIfAbsent(asset, k -> new AssetSlot());
    }

    static final class AssetSlot {
        final ReentrantLock lock = new ReentrantLock();
        final AtomicBoolean dirty = new AtomicBoolean();
        volatile VolatilityState state;
    }
}
