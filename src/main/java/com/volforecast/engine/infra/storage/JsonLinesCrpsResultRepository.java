package com.volforecast.engine.infra.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.volforecast.engine.domain.model.CrpsResult;
import com.volforecast.engine.domain.repository.CrpsResultRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Repository
public class JsonLinesCrpsResultRepository implements CrpsResultRepository {

    private final PartitionedJsonLinesStore<CrpsResult> store;

    public JsonLinesCrpsResultRepository(ObjectMapper objectMapper, StorageProperties properties) {
        this.store = new PartitionedJsonLinesStore<>(objectMapper, properties.basePath(), "crps",
                CrpsResult.class, CrpsResult::getT0EpochMs);
    }

    @Override
    public void appendAll(List<CrpsResult> results) {
        if (results.isEmpty()) return;
        store.appendAll(results);
    }

    @Override
    public List<CrpsResult> findByT0Between(long fromEpochMs, long toEpochMs) {
        return store.findByT0Between(fromEpochMs, toEpochMs);
    }

    @Override
    public Set<String> findScoredRecordIds(long fromEpochMs, long toEpochMs) {
        return store.findByT0Between(fromEpochMs, toEpochMs).stream()
                .map(CrpsResult::getRecordId)
                .collect(Collectors.toSet());
    }
}
