package com.volforecast.engine.infra.disruptor;

import com.lmax.disruptor.RingBuffer;
import com.volforecast.engine.domain.exception.InvalidObservationException;
import com.volforecast.engine.domain.service.AssetParameterRegistry;
import com.volforecast.engine.infra.disruptor.event.PriceTickEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class PriceTickPublisher {

    private final RingBuffer<PriceTickEvent> priceTickRingBuffer;
    private final AssetParameterRegistry registry;

    public void publish(String assetId, double price, long timestampMs) {
        registry.profile(assetId);
        if (!Double.isFinite(price) || price <= 0) {
            throw new InvalidObservationException("가격은 유한한 양수여야 합니다: price=" + price);
        }
        String asset = AssetParameterRegistry.normalize(assetId);
        priceTickRingBuffer.publishEvent((event, sequence) -> {
            event.setAssetId(asset);
            event.setPrice(price);
            event.setTimestampMs(timestampMs);
            event.setIngestNanoTime(System.nanoTime());
        });
        log.debug("[Ingest] 틱 발행: asset={}, price={}, ts={}", asset, price, timestampMs);
    }
}
