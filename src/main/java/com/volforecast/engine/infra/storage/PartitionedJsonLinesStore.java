package com.volforecast.engine.infra.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;

/**
 * t0 의 UTC 날짜로 나눈 JSONL 파일: &lt;prefix&gt;/YYYY-MM/&lt;prefix&gt;_YYYY-MM-DD.jsonl.
 * 추가 전용이며, 읽을 때 해석할 수 없는 줄(비정상 종료로 잘린 마지막 줄 등)은 건너뛴다.
 */
@Slf4j
class PartitionedJsonLinesStore<T> {

    private final ObjectMapper objectMapper;
    private final ObjectWriter lineWriter;
    private final Path root;
    private final String prefix;
    private final Class<T> type;
    private final ToLongFunction<T> t0Extractor;

    PartitionedJsonLinesStore(ObjectMapper objectMapper, Path baseDir, String prefix,
                              Class<T> type, ToLongFunction<T> t0Extractor) {
        this.objectMapper = objectMapper;
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
        this.root = baseDir.resolve(prefix);
        this.prefix = prefix;
        this.type = type;
        this.t0Extractor = t0Extractor;
    }

    synchronized void appendAll(List<T> items) {
        Map<Path, StringBuilder> byFile = new LinkedHashMap<>();
        for (T item : items) {
            Path file = partitionOf(t0Extractor.applyAsLong(item));
            try {
                byFile.computeIfAbsent(file, f -> new StringBuilder())
                        .append(lineWriter.writeValueAsString(item))
                        .append('\n');
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        for (Map.Entry<Path, StringBuilder> entry : byFile.entrySet()) {
            Path file = entry.getKey();
            try {
                Files.createDirectories(file.getParent());
                Files.writeString(file, entry.getValue(), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            } catch (IOException e) {
                log.error("[Storage] JSONL 추가 실패: file={}", file, e);
                throw new UncheckedIOException(e);
            }
        }
    }

    synchronized List<T> findByT0Between(long fromEpochMs, long toEpochMs) {
        if (toEpochMs < fromEpochMs) return List.of();

        List<T> found = new ArrayList<>();
        LocalDate day = dateOf(fromEpochMs);
        LocalDate last = dateOf(toEpochMs);
        while (!day.isAfter(last)) {
            Path file = partitionOf(day);
            if (Files.exists(file)) {
                readInto(file, fromEpochMs, toEpochMs, found);
            }
            day = day.plusDays(1);
        }
        found.sort((a, b) -> Long.compare(t0Extractor.applyAsLong(a), t0Extractor.applyAsLong(b)));
        return found;
    }

    private void readInto(Path file, long fromEpochMs, long toEpochMs, List<T> out) {
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                T item;
                try {
                    item = objectMapper.readValue(line, type);
                } catch (JsonProcessingException e) {
                    skipped++;
                    continue;
                }
                long t0 = t0Extractor.applyAsLong(item);
                if (t0 >= fromEpochMs && t0 <= toEpochMs) {
                    out.add(item);
                }
            }
        } catch (IOException e) {
            log.error("[Storage] JSONL 읽기 실패: file={}", file, e);
            throw new UncheckedIOException(e);
        }
        if (skipped > 0) {
            log.warn("[Storage] 해석 불가 줄 건너뜀: file={}, lines={}", file, skipped);
        }
    }

    private Path partitionOf(long epochMs) {
        return partitionOf(dateOf(epochMs));
    }

    private Path partitionOf(LocalDate day) {
        String month = day.toString().substring(0, 7);
        return root.resolve(month).resolve(prefix + "_" + day + ".jsonl");
    }

    private static LocalDate dateOf(long epochMs) {
        return Instant.ofEpochMilli(epochMs).atZone(ZoneOffset.UTC).toLocalDate();
    }
}
