package com.volforecast.engine.domain.repository;

import com.volforecast.engine.domain.model.PredictionRecord;

import java.util.List;

public interface PredictionRecordRepository {

    void append(PredictionRecord record);

    /** t0 가 [fromEpochMs, toEpochMs] 에 속하는 기록, t0 순. */
    List<PredictionRecord> findByT0Between(long fromEpochMs, long toEpochMs);
}
