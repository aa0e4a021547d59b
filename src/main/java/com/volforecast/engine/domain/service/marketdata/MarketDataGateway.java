package com.volforecast.engine.domain.service.marketdata;

import com.volforecast.engine.domain.model.RealizedPriceSeries;
import com.volforecast.engine.domain.model.SpotQuote;

import java.util.List;
import java.util.Optional;

/**
 * 현재가/실현가 조회 포트. 구현체는 조회할 수 없는 시점을 결과에서 빼고 돌려준다.
 */
public interface MarketDataGateway {

    Optional<SpotQuote> getSpot(String assetId);

    RealizedPriceSeries getRealized(String assetId, List<Long> timestampsEpochMs);
}
