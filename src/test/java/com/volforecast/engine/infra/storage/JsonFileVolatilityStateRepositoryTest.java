package com.volforecast.engine.infra.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.volforecast.engine.domain.exception.CorruptPersistedStateException;
import com.volforecast.engine.domain.model.VolatilityState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileVolatilityStateRepositoryTest {

    @TempDir
    Path dataDir;

    private JsonFileVolatilityStateRepository repository;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setBaseDir(dataDir.toString());
        repository = new JsonFileVolatilityStateRepository(new ObjectMapper(), properties);
    }

    @Test
    void savesAndRestoresState() {
        repository.save(VolatilityState.builder()
                .assetId("BTC")
                .varianceEstimate(2.5e-6)
                .decayLambda(0.94)
                .lastUpdateEpochMs(1_717_416_000_000L)
                .sampleCount(1234L)
                .lastPrice(65000.5)
                .build());

        VolatilityState loaded = repository.load("btc").orElseThrow();

        assertThat(Files.exists(dataDir.resolve("state").resolve("BTC.json"))).isTrue();
        assertThat(loaded.getVarianceEstimate()).isEqualTo(2.5e-6);
        assertThat(loaded.getSampleCount()).isEqualTo(1234L);
        assertThat(loaded.getLastPrice()).isEqualTo(65000.5);
        assertThat(loaded.getStateVersion()).isEqualTo(VolatilityState.CURRENT_VERSION);
    }

    @Test
    void missingFileIsEmpty() {
        assertThat(repository.load("ETH")).isEmpty();
    }

    @Test
    void unreadableFileIsCorrupt() throws Exception {
        Path file = dataDir.resolve("state").resolve("ETH.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"assetId\":\"ETH\",\"varianceEst");

        assertThatThrownBy(() -> repository.load("ETH"))
                .isInstanceOf(CorruptPersistedStateException.class);
    }

    @Test
    void invalidValuesAreCorrupt() throws Exception {
        Path file = dataDir.resolve("state").resolve("ETH.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{\"assetId\":\"ETH\",\"varianceEstimate\":-1.0,\"decayLambda\":0.94}");

        assertThatThrownBy(() -> repository.load("ETH"))
                .isInstanceOf(CorruptPersistedStateException.class)
                .hasMessageContaining("분산");
    }

    @Test
    void deleteRemovesFile() {
        repository.save(VolatilityState.builder().assetId("XAU").varianceEstimate(1e-6).decayLambda(0.97).build());

        repository.delete("XAU");

        assertThat(repository.load("XAU")).isEmpty();
    }
}
