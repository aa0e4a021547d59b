package com.volforecast.engine.infra.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.CopyOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomicFileWriterTest {

    @TempDir
    Path dir;

    @Test
    void replacesExistingFileAndLeavesNoTempFile() throws IOException {
        Path target = dir.resolve("state/BTC.json");

        AtomicFileWriter.write(target, "{\"v\":1}".getBytes(StandardCharsets.UTF_8));
        AtomicFileWriter.write(target, "{\"v\":2}".getBytes(StandardCharsets.UTF_8));

        assertThat(Files.readString(target)).isEqualTo("{\"v\":2}");
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void fallsBackToPlainReplaceWhenAtomicMoveIsUnsupported() throws IOException {
        Path target = dir.resolve("governance/tuning-ledger.json");
        Files.createDirectories(target.getParent());
        Files.writeString(target, "old");
        List<List<CopyOption>> attempts = new ArrayList<>();

        AtomicFileWriter.write(target, "new".getBytes(StandardCharsets.UTF_8), (source, dest, options) -> {
            attempts.add(Arrays.asList(options));
            if (attempts.size() == 1) {
                throw new AtomicMoveNotSupportedException(source.toString(), dest.toString(), "no rename");
            }
            Files.move(source, dest, options);
        });

        assertThat(Files.readString(target)).isEqualTo("new");
        assertThat(attempts).hasSize(2);
        assertThat(attempts.get(0)).contains(StandardCopyOption.ATOMIC_MOVE);
        assertThat(attempts.get(1)).containsExactly(StandardCopyOption.REPLACE_EXISTING);
    }

    @Test
    void removesTempFileWhenMoveFails() throws IOException {
        Path target = dir.resolve("state/ETH.json");

        assertThatThrownBy(() -> AtomicFileWriter.write(target, new byte[]{1}, (source, dest, options) -> {
            throw new IOException("disk full");
        })).isInstanceOf(IOException.class);

        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files).isEmpty();
        }
    }
}
