package com.volforecast.engine.infra.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.volforecast.engine.domain.exception.CorruptPersistedStateException;
import com.volforecast.engine.domain.model.TunableParameter;
import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.support.MutableClock;
import com.volforecast.engine.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileTuningLedgerRepositoryTest {

    @TempDir
    Path dataDir;

    private StorageProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        properties = new StorageProperties();
        properties.setBaseDir(dataDir.toString());
        clock = new MutableClock(TestFixtures.MONDAY_NOON);
    }

    private JsonFileTuningLedgerRepository open() {
        JsonFileTuningLedgerRepository repository = new JsonFileTuningLedgerRepository(new ObjectMapper(), properties,
                clock);
        repository.load();
        return repository;
    }

    @Test
    void firstStartRecordsStartTimeAndSurvivesRestart() {
        JsonFileTuningLedgerRepository first = open();
        first.append(TuningHistoryEntry.builder()
                .entryId("e1").assetId("BTC").parameter(TunableParameter.DAILY_CAP)
                .oldValue(0.10).newValue(0.09).timestampEpochMs(clock.millis()).reason("long CRPS")
                .build());

        clock.advance(Duration.ofDays(3));
        JsonFileTuningLedgerRepository second = open();

        assertThat(second.startedAtEpochMs()).isEqualTo(TestFixtures.MONDAY_NOON.toEpochMilli());
        assertThat(second.findAll()).singleElement().satisfies(entry -> {
            assertThat(entry.getParameter()).isEqualTo(TunableParameter.DAILY_CAP);
            assertThat(entry.getNewValue()).isEqualTo(0.09);
            assertThat(entry.getReason()).isEqualTo("long CRPS");
        });
    }

    @Test
    void corruptLedgerFailsStartup() throws Exception {
        Path file = dataDir.resolve("governance").resolve("tuning-ledger.json");
        Files.createDirectories(file.getParent());
        Files.writeString(file, "not json");

        assertThatThrownBy(this::open).isInstanceOf(CorruptPersistedStateException.class);
    }
}
