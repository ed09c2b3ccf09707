package com.scheduler.lifecycle.logfiles;

import com.scheduler.lifecycle.maintenance.CancellationToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogFileReaper")
class LogFileReaperTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant CUTOFF = NOW.minus(Duration.ofDays(30));

    @TempDir
    Path dir;

    private LogFileReaper reaper;

    @BeforeEach
    void setUp() {
        reaper = new LogFileReaper();
    }

    private Path file(String name, int bytes, Instant lastModified) throws IOException {
        Path path = dir.resolve(name);
        Files.write(path, new byte[bytes]);
        Files.setLastModifiedTime(path, FileTime.from(lastModified));
        return path;
    }

    @Test
    @DisplayName("Should delete matching files older than the cutoff and report bytes freed")
    void deletesOldMatchingFiles() throws IOException {
        Path oldLog = file("app.log", 100, CUTOFF.minusSeconds(60));
        Path oldTxt = file("trace.txt", 50, CUTOFF.minus(Duration.ofDays(5)));
        Path recent = file("today.log", 10, NOW);

        LogReapResult result = reaper.reap(dir, CUTOFF);

        assertEquals(2, result.deletedCount());
        assertEquals(150, result.bytesFreed());
        assertFalse(Files.exists(oldLog));
        assertFalse(Files.exists(oldTxt));
        assertTrue(Files.exists(recent));
    }

    @Test
    @DisplayName("Should keep files that do not match the patterns")
    void keepsNonMatching() throws IOException {
        Path data = file("data.csv", 10, CUTOFF.minusSeconds(60));
        Path archive = file("app.log.gz", 10, CUTOFF.minusSeconds(60));

        LogReapResult result = reaper.reap(dir, CUTOFF);

        assertEquals(0, result.deletedCount());
        assertTrue(Files.exists(data));
        assertTrue(Files.exists(archive));
    }

    @Test
    @DisplayName("A file modified exactly at the cutoff should be kept")
    void strictCutoff() throws IOException {
        Path edge = file("edge.log", 10, CUTOFF);

        assertEquals(0, reaper.reap(dir, CUTOFF).deletedCount());
        assertTrue(Files.exists(edge));
    }

    @Test
    @DisplayName("Should not descend into subdirectories")
    void ignoresSubdirectories() throws IOException {
        Path sub = Files.createDirectory(dir.resolve("old.log"));
        Path nested = sub.resolve("nested.log");
        Files.write(nested, new byte[5]);
        Files.setLastModifiedTime(nested, FileTime.from(CUTOFF.minusSeconds(60)));

        assertEquals(0, reaper.reap(dir, CUTOFF).deletedCount());
        assertTrue(Files.exists(nested));
    }

    @Test
    @DisplayName("A missing directory should yield an empty result")
    void missingDirectory() {
        LogReapResult result = reaper.reap(dir.resolve("does-not-exist"), CUTOFF);

        assertEquals(LogReapResult.empty(), result);
    }

    @Test
    @DisplayName("Custom patterns should replace the defaults")
    void customPatterns() throws IOException {
        Path out = file("worker.out", 20, CUTOFF.minusSeconds(60));
        Path log = file("worker.log", 20, CUTOFF.minusSeconds(60));

        LogReapResult result = reaper.reap(dir, List.of("*.out"), CUTOFF, CancellationToken.NONE);

        assertEquals(1, result.deletedCount());
        assertFalse(Files.exists(out));
        assertTrue(Files.exists(log));
    }

    @Test
    @DisplayName("A cancelled token should stop before deleting anything")
    void cancelled() throws IOException {
        Path old = file("old.log", 10, CUTOFF.minusSeconds(60));
        CancellationToken token = CancellationToken.create();
        token.cancel();

        LogReapResult result = reaper.reap(dir, List.of("*.log"), CUTOFF, token);

        assertEquals(0, result.deletedCount());
        assertTrue(Files.exists(old));
    }

    @Test
    @DisplayName("LogReapResult should add up across directories")
    void resultsAddUp() {
        LogReapResult total = new LogReapResult(2, 100).plus(new LogReapResult(3, 50));

        assertEquals(new LogReapResult(5, 150), total);
    }
}
