package com.volforecast.engine.domain.service.marketdata;

import com.volforecast.engine.domain.model.PriceTick;
import com.volforecast.engine.domain.model.RealizedPriceSeries;
import com.volforecast.engine.domain.model.SpotQuote;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 인제스트된 틱 이력으로 동작하는 기본 게이트웨이.
 * 실현가는 각 시점 이하의 가장 가까운 틱이며, 허용 오차보다 오래된 틱만 있으면 결측으로 둔다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TickHistoryMarketDataGateway implements MarketDataGateway {

    private final PriceHistoryBuffer priceHistoryBuffer;
    private final MarketDataProperties properties;

    @Override
    public Optional<SpotQuote> getSpot(String assetId) {
        return priceHistoryBuffer.latest(assetId)
                .map(tick -> new SpotQuote(assetId, tick.price(), tick.timestamp()));
    }

    @Override
    public RealizedPriceSeries getRealized(String assetId, List<Long> timestampsEpochMs) {
        long tolerance = properties.getRealizedToleranceMs();
        Map<Long, Double> prices = new HashMap<>();
        for (Long ts : timestampsEpochMs) {
            if (ts == null) continue;
            Optional<PriceTick> tick = priceHistoryBuffer.atOrBefore(assetId, ts);
            if (tick.isPresent() && ts - tick.get().timestamp() <= tolerance) {
                prices.put(ts, tick.get().price());
            }
        }
        if (prices.size() < timestampsEpochMs.size()) {
            log.debug("[MarketData] 실현가 일부 결측: asset={}, requested={}, found={}",
                    assetId, timestampsEpochMs.size(), prices.size());
        }
        return new RealizedPriceSeries(assetId, prices);
    }
}
