package com.volforecast.engine.domain.service.montecarlo;

import com.volforecast.engine.domain.model.HorizonLabel;
import com.volforecast.engine.domain.model.ParameterSnapshot;
import com.volforecast.engine.domain.model.PathEnsemble;
import com.volforecast.engine.domain.model.PredictionRecord;
import com.volforecast.engine.domain.repository.PredictionRecordRepository;
import com.volforecast.engine.support.MutableClock;
import com.volforecast.engine.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PredictionArchiverTest {

    private static final long MINUTE = 60_000L;

    private PredictionRecordRepository repository;
    private ArchiveProperties properties;
    private PredictionArchiver archiver;
    private final long t0 = TestFixtures.MONDAY_NOON.toEpochMilli();

    @BeforeEach
    void setUp() {
        repository = mock(PredictionRecordRepository.class);
        properties = new ArchiveProperties();
        archiver = new PredictionArchiver(repository, properties, new MutableClock(TestFixtures.MONDAY_NOON),
                Runnable::run);
    }

    private static PathEnsemble ensemble(String asset, long t0) {
        return new PathEnsemble(asset, t0, 60, 2, 100.0, new double[][]{{100.0, 100.0}, {100.0, 101.0}});
    }

    private static ParameterSnapshot snapshot(HorizonLabel label) {
        return ParameterSnapshot.builder().horizonLabel(label).stepSigma(0.001).build();
    }

    @Test
    void archivesFirstEnsembleAndBuildsRecord() {
        boolean archived = archiver.offer(ensemble("BTC", t0), snapshot(HorizonLabel.HIGH));

        assertThat(archived).isTrue();
        ArgumentCaptor<PredictionRecord> captor = ArgumentCaptor.forClass(PredictionRecord.class);
        verify(repository).append(captor.capture());
        PredictionRecord record = captor.getValue();
        assertThat(record.getRecordId()).isNotBlank();
        assertThat(record.getAssetId()).isEqualTo("BTC");
        assertThat(record.getT0EpochMs()).isEqualTo(t0);
        assertThat(record.getStepCount()).isEqualTo(2);
        assertThat(record.getHorizonLabel()).isEqualTo(HorizonLabel.HIGH);
        assertThat(record.getLogReason()).isEqualTo("sampled_high");
        assertThat(record.getLoggedAtEpochMs()).isEqualTo(t0);
    }

    @Test
    void highFrequencySamplesEveryFifteenMinutes() {
        assertThat(archiver.offer(ensemble("BTC", t0), snapshot(HorizonLabel.HIGH))).isTrue();
        assertThat(archiver.offer(ensemble("BTC", t0 + 14 * MINUTE), snapshot(HorizonLabel.HIGH))).isFalse();
        assertThat(archiver.offer(ensemble("BTC", t0 + 15 * MINUTE), snapshot(HorizonLabel.HIGH))).isTrue();

        verify(repository, times(2)).append(any());
    }

    @Test
    void lowFrequencySamplesEveryThirtyMinutes() {
        assertThat(archiver.offer(ensemble("BTC", t0), snapshot(HorizonLabel.LOW))).isTrue();
        assertThat(archiver.offer(ensemble("BTC", t0 + 15 * MINUTE), snapshot(HorizonLabel.LOW))).isFalse();
        assertThat(archiver.offer(ensemble("BTC", t0 + 30 * MINUTE), snapshot(HorizonLabel.LOW))).isTrue();
    }

    @Test
    void samplesAssetsAndLabelsIndependently() {
        assertThat(archiver.offer(ensemble("BTC", t0), snapshot(HorizonLabel.HIGH))).isTrue();
        assertThat(archiver.offer(ensemble("BTC", t0), snapshot(HorizonLabel.LOW))).isTrue();
        assertThat(archiver.offer(ensemble("ETH", t0), snapshot(HorizonLabel.HIGH))).isTrue();
    }

    @Test
    void disabledArchiveKeepsNothing() {
        properties.setEnabled(false);

        assertThat(archiver.offer(ensemble("BTC", t0), snapshot(HorizonLabel.HIGH))).isFalse();
        verify(repository, never()).append(any());
    }

    @Test
    void persistenceFailureDoesNotPropagate() {
        doThrow(new IllegalStateException("disk full")).when(repository).append(any());
        properties.setHighInterval(Duration.ofMinutes(1));

        assertThat(archiver.offer(ensemble("BTC", t0), snapshot(HorizonLabel.HIGH))).isTrue();
    }
}
