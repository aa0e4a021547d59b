package com.volforecast.engine.support;

import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.domain.repository.TuningLedgerRepository;

import java.util.ArrayList;
import java.util.List;

public class InMemoryTuningLedgerRepository implements TuningLedgerRepository {

    private final long startedAtEpochMs;
    private final List<TuningHistoryEntry> entries = new ArrayList<>();

    public InMemoryTuningLedgerRepository(long startedAtEpochMs) {
        this.startedAtEpochMs = startedAtEpochMs;
    }

    @Override
    public long startedAtEpochMs() {
        return startedAtEpochMs;
    }

    @Override
    public synchronized List<TuningHistoryEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized void append(TuningHistoryEntry entry) {
        entries.add(entry);
    }
}
