package com.volforecast.engine.domain.repository;

import com.volforecast.engine.domain.exception.CorruptPersistedStateException;
import com.volforecast.engine.domain.model.VolatilityState;

import java.util.Optional;

public interface VolatilityStateRepository {

    /**
     * @throws CorruptPersistedStateException 저장된 스냅샷이 읽히지 않거나 검증에 실패한 경우
     */
    Optional<VolatilityState> load(String assetId);

    void save(VolatilityState state);

    void delete(String assetId);
}
