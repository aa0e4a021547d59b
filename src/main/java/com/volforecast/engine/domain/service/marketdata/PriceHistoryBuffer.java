package com.volforecast.engine.domain.service.marketdata;

import com.volforecast.engine.domain.model.PriceTick;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 자산별 최근 틱 링버퍼. 타임스탬프는 단조 증가만 허용한다 (역행 틱은 버림).
 * 쓰기는 인제스트 파이프라인 소비자 스레드 하나에서만 일어난다.
 */
@Slf4j
@Component
public class PriceHistoryBuffer {

    private final Map<String, CircularBuffer> buffers = new ConcurrentHashMap<>();
    private final int capacity;

    public PriceHistoryBuffer(MarketDataProperties properties) {
        this.capacity = properties.getHistoryCapacity();
    }

    public boolean record(String assetId, double price, long timestampMs) {
        if (assetId == null || !Double.isFinite(price) || price <= 0) return false;

        String key = assetId.toUpperCase();
        CircularBuffer buffer = buffers.computeIfAbsent(key, k -> new CircularBuffer(capacity));
        PriceTick last = buffer.latest();
        if (last != null && timestampMs < last.timestamp()) {
            log.debug("[History] 역행 틱 무시: asset={}, ts={}, last={}", key, timestampMs, last.timestamp());
            return false;
        }
        buffer.add(new PriceTick(timestampMs, price));
        return true;
    }

    public Optional<PriceTick> latest(String assetId) {
        CircularBuffer buffer = bufferOf(assetId);
        return buffer == null ? Optional.empty() : Optional.ofNullable(buffer.latest());
    }

    /** timestampMs 이하 중 가장 최근 틱. */
    public Optional<PriceTick> atOrBefore(String assetId, long timestampMs) {
        CircularBuffer buffer = bufferOf(assetId);
        return buffer == null ? Optional.empty() : Optional.ofNullable(buffer.atOrBefore(timestampMs));
    }

    private CircularBuffer bufferOf(String assetId) {
        if (assetId == null) return null;
        return buffers.get(assetId.toUpperCase());
    }

    static final class CircularBuffer {

        private final PriceTick[] elements;
        private final int mask;
        private volatile long head;
        private volatile long tail;

        CircularBuffer(int requestedCapacity) {
            int capacity = nextPowerOfTwo(requestedCapacity);
            this.elements = new PriceTick[capacity];
            this.mask = capacity - 1;
        }

        void add(PriceTick tick) {
            long t = tail;
            long h = head;
            if (t - h == elements.length) {
                head = h + 1;
            }
            elements[(int) (t & mask)] = tick;
            tail = t + 1;
        }

        PriceTick latest() {
            long t = tail;
            if (t == head) return null;
            return elements[(int) ((t - 1) & mask)];
        }

        PriceTick atOrBefore(long timestampMs) {
            long h = head;
            long t = tail;
            long idx = firstAfter(h, t, timestampMs) - 1;
            if (idx < h) return null;
            return elements[(int) (idx & mask)];
        }

        private long firstAfter(long lo, long hi, long timestampMs) {
            while (lo < hi) {
                long mid = lo + ((hi - lo) >>> 1);
                PriceTick tick = elements[(int) (mid & mask)];
                if (tick == null || tick.timestamp() <= timestampMs) {
                    lo = mid + 1;
                } else {
                    hi = mid;
                }
            }
            return lo;
        }

        private static int nextPowerOfTwo(int value) {
            if (value <= 1) return 1;
            return Integer.highestOneBit(value - 1) << 1;
        }
    }
}
