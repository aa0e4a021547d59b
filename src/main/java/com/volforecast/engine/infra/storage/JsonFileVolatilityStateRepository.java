package com.volforecast.engine.infra.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.volforecast.engine.domain.exception.CorruptPersistedStateException;
import com.volforecast.engine.domain.model.VolatilityState;
import com.volforecast.engine.domain.repository.VolatilityStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * state/&lt;ASSET&gt;.json 에 자산별 현재 상태 한 건.
 */
@Slf4j
@Repository
public class JsonFileVolatilityStateRepository implements VolatilityStateRepository {

    private final ObjectMapper objectMapper;
    private final Path stateDir;

    public JsonFileVolatilityStateRepository(ObjectMapper objectMapper, StorageProperties properties) {
        this.objectMapper = objectMapper;
        this.stateDir = properties.basePath().resolve("state");
    }

    @Override
    public Optional<VolatilityState> load(String assetId) {
        Path file = fileOf(assetId);
        if (!Files.exists(file)) return Optional.empty();

        VolatilityState state;
        try {
            state = objectMapper.readValue(file.toFile(), VolatilityState.class);
        } catch (IOException e) {
            throw new CorruptPersistedStateException("스냅샷을 읽을 수 없습니다: " + file, e);
        }
        validate(assetId, state, file);
        return Optional.of(state);
    }

    @Override
    public void save(VolatilityState state) {
        Path file = fileOf(state.getAssetId());
        try {
            AtomicFileWriter.write(file, objectMapper.writeValueAsBytes(state));
        } catch (IOException e) {
            log.error("[Storage] 스냅샷 저장 실패: asset={}, file={}", state.getAssetId(), file, e);
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void delete(String assetId) {
        Path file = fileOf(assetId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("[Storage] 스냅샷 삭제 실패: asset={}, file={}", assetId, file, e);
            throw new UncheckedIOException(e);
        }
    }

    private void validate(String assetId, VolatilityState state, Path file) {
        String problem = null;
        if (state == null) {
            problem = "빈 문서";
        } else if (!assetId.equalsIgnoreCase(state.getAssetId())) {
            problem = "자산 불일치: " + state.getAssetId();
        } else if (!Double.isFinite(state.getVarianceEstimate()) || state.getVarianceEstimate() < 0) {
            problem = "분산 값 오류: " + state.getVarianceEstimate();
        } else if (!(state.getDecayLambda() > 0 && state.getDecayLambda() < 1)) {
            problem = "lambda 범위 오류: " + state.getDecayLambda();
        } else if (state.getSampleCount() < 0 || state.getLastUpdateEpochMs() < 0) {
            problem = "음수 카운터";
        } else if (state.getLastPrice() != null
                && (!Double.isFinite(state.getLastPrice()) || state.getLastPrice() <= 0)) {
            problem = "직전 가격 오류: " + state.getLastPrice();
        } else if (state.getStateVersion() > VolatilityState.CURRENT_VERSION) {
            problem = "지원하지 않는 버전: " + state.getStateVersion();
        }
        if (problem != null) {
            throw new CorruptPersistedStateException("스냅샷 검증 실패 (" + file + "): " + problem);
        }
    }

    private Path fileOf(String assetId) {
        return stateDir.resolve(assetId.toUpperCase() + ".json");
    }
}
