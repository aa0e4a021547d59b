package com.volforecast.engine.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.volforecast.engine.domain.service.marketdata.PriceHistoryBuffer;
import com.volforecast.engine.infra.disruptor.event.PriceTickEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TickHistoryHandler implements EventHandler<PriceTickEvent> {

    private final PriceHistoryBuffer priceHistoryBuffer;

    @Override
    public void onEvent(PriceTickEvent event, long sequence, boolean endOfBatch) {
        if (event.getAssetId() == null) return;

        boolean recorded = priceHistoryBuffer.record(event.getAssetId(), event.getPrice(), event.getTimestampMs());
        if (recorded) {
            log.debug("[History] 틱 기록: asset={}, price={}, ts={}",
                    event.getAssetId(), event.getPrice(), event.getTimestampMs());
        }
    }
}
