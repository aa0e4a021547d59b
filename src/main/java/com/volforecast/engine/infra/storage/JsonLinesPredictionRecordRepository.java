package com.volforecast.engine.infra.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.volforecast.engine.domain.model.PredictionRecord;
import com.volforecast.engine.domain.repository.PredictionRecordRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class JsonLinesPredictionRecordRepository implements PredictionRecordRepository {

    private final PartitionedJsonLinesStore<PredictionRecord> store;

    public JsonLinesPredictionRecordRepository(ObjectMapper objectMapper, StorageProperties properties) {
        this.store = new PartitionedJsonLinesStore<>(objectMapper, properties.basePath(), "predictions",
                PredictionRecord.class, PredictionRecord::getT0EpochMs);
    }

    @Override
    public void append(PredictionRecord record) {
        store.appendAll(List.of(record));
    }

    @Override
    public List<PredictionRecord> findByT0Between(long fromEpochMs, long toEpochMs) {
        return store.findByT0Between(fromEpochMs, toEpochMs);
    }
}
