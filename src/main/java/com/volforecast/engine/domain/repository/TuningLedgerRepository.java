package com.volforecast.engine.domain.repository;

import com.volforecast.engine.domain.model.TuningHistoryEntry;

import java.util.List;

public interface TuningLedgerRepository {

    /** 엔진 최초 기동 시각. 처음 조회될 때 기록되고 이후 변하지 않는다. */
    long startedAtEpochMs();

    List<TuningHistoryEntry> findAll();

    void append(TuningHistoryEntry entry);
}
