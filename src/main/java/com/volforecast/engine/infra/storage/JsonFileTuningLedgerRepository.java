package com.volforecast.engine.infra.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.volforecast.engine.domain.exception.CorruptPersistedStateException;
import com.volforecast.engine.domain.model.TuningHistoryEntry;
import com.volforecast.engine.domain.repository.TuningLedgerRepository;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * governance/tuning-ledger.json. 추가 시마다 문서 전체를 원자적으로 다시 쓴다.
 * 파일이 손상되어 있으면 기동을 중단한다 (변경된 파라미터가 기본값으로 되돌아가면 안 됨).
 */
@Slf4j
@Repository
public class JsonFileTuningLedgerRepository implements TuningLedgerRepository {

    private final ObjectMapper objectMapper;
    private final Path ledgerFile;
    private final Clock clock;

    private LedgerDocument document;

    public JsonFileTuningLedgerRepository(ObjectMapper objectMapper, StorageProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.ledgerFile = properties.basePath().resolve("governance").resolve("tuning-ledger.json");
        this.clock = clock;
    }

    @PostConstruct
    public synchronized void load() {
        if (!Files.exists(ledgerFile)) {
            document = new LedgerDocument(clock.millis(), new ArrayList<>());
            write(document);
            log.info("[Storage] 튜닝 원장 생성: file={}, startedAt={}", ledgerFile, document.getStartedAtEpochMs());
            return;
        }
        try {
            LedgerDocument loaded = objectMapper.readValue(ledgerFile.toFile(), LedgerDocument.class);
            if (loaded == null || loaded.getStartedAtEpochMs() <= 0) {
                throw new CorruptPersistedStateException("튜닝 원장에 시작 시각이 없습니다: " + ledgerFile);
            }
            if (loaded.getEntries() == null) {
                loaded.setEntries(new ArrayList<>());
            }
            document = loaded;
        } catch (IOException e) {
            throw new CorruptPersistedStateException("튜닝 원장을 읽을 수 없습니다: " + ledgerFile, e);
        }
        log.info("[Storage] 튜닝 원장 로드: entries={}, startedAt={}",
                document.getEntries().size(), document.getStartedAtEpochMs());
    }

    @Override
    public synchronized long startedAtEpochMs() {
        ensureLoaded();
        return document.getStartedAtEpochMs();
    }

    @Override
    public synchronized List<TuningHistoryEntry> findAll() {
        ensureLoaded();
        return List.copyOf(document.getEntries());
    }

    @Override
    public synchronized void append(TuningHistoryEntry entry) {
        ensureLoaded();
        List<TuningHistoryEntry> entries = new ArrayList<>(document.getEntries());
        entries.add(entry);
        LedgerDocument next = new LedgerDocument(document.getStartedAtEpochMs(), entries);
        write(next);
        document = next;
    }

    private void ensureLoaded() {
        if (document == null) {
            load();
        }
    }

    private void write(LedgerDocument doc) {
        try {
            byte[] bytes = objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(doc);
            AtomicFileWriter.write(ledgerFile, bytes);
        } catch (IOException e) {
            log.error("[Storage] 튜닝 원장 저장 실패: file={}", ledgerFile, e);
            throw new UncheckedIOException(e);
        }
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LedgerDocument {
        private long startedAtEpochMs;
        private List<TuningHistoryEntry> entries;
    }
}
