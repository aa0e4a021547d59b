package com.volforecast.engine.domain.repository;

import com.volforecast.engine.domain.model.CrpsResult;

import java.util.List;
import java.util.Set;

public interface CrpsResultRepository {

    void appendAll(List<CrpsResult> results);

    List<CrpsResult> findByT0Between(long fromEpochMs, long toEpochMs);

    Set<String> findScoredRecordIds(long fromEpochMs, long toEpochMs);
}
