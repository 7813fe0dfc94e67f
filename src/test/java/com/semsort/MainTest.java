package com.semsort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.semsort.persist.AtomicJsonFile;
import com.semsort.runtime.AppConfig;
import com.semsort.vector.LocalJsonVectorIndex;

import picocli.CommandLine;

class MainTest {

    @TempDir
    Path tempDir;

    private Path writeConfig() throws IOException {
        Path configPath = tempDir.resolve("semsort.yml");
        Files.writeString(configPath, """
                embedding:
                  model: hashing-test
                  dimensions: 64
                  chunkSize: 200
                  chunkOverlap: 20
                cache:
                  cleanupIntervalMs: 0
                queue:
                  directory: %1$s/queues
                  concurrency: 2
                  maxRetries: 0
                  retryBackoffMs: 0
                tracker:
                  persistencePath: %1$s/file-operations.json
                index:
                  path: %1$s/vector-index.json
                  metadataPath: %1$s/index-meta.json
                """.formatted(tempDir.toString().replace('\\', '/')));
        return configPath;
    }

    private int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Test
    void shouldRequireModeSpecificOptions() {
        assertEquals(2, run("--mode", "index"));
        assertEquals(2, run("--mode", "search"));
        assertEquals(2, run("--mode", "organize"));
        assertEquals(2, run("--mode", "suggest", "--file", "a.txt"));
    }

    @Test
    void shouldRejectUnknownMode() {
        assertEquals(2, run("--mode", "daemon"));
    }

    @Test
    void shouldIndexDirectoryThenSearchIt() throws Exception {
        Path config = writeConfig();
        Path docs = Files.createDirectories(tempDir.resolve("docs"));
        Files.writeString(docs.resolve("invoice.txt"), "Invoice for office rent, due end of month.");
        Files.writeString(docs.resolve("trip.md"), "# Trip\nHiking near the glacier lake.");
        Files.write(docs.resolve("photo.jpg"), new byte[] { 1, 2, 3 });

        assertEquals(0, run("--mode", "index", "--config", config.toString(), "--source-dir", docs.toString()));

        LocalJsonVectorIndex index = LocalJsonVectorIndex.load(tempDir.resolve("vector-index.json"), new AtomicJsonFile());
        assertEquals(2, index.stats().vectors());
        assertEquals(64, index.stats().dimensions());
        assertTrue(Files.exists(tempDir.resolve("index-meta.json")));

        assertEquals(0, run("--mode", "search", "--config", config.toString(), "--query", "office rent", "--top-k", "1"));
        assertEquals(0, run("--mode", "stats", "--config", config.toString()));
    }

    @Test
    void shouldOrganizeFilesFromPlan() throws Exception {
        Path config = writeConfig();
        Path inbox = Files.createDirectories(tempDir.resolve("inbox"));
        Path source = Files.writeString(inbox.resolve("receipt.txt"), "Pharmacy receipt");
        Path destination = tempDir.resolve("sorted/medical/receipt.txt");
        Path plan = tempDir.resolve("plan.json");
        Files.writeString(plan, """
                [{"source": "%s", "destination": "%s"}]
                """.formatted(source.toString().replace('\\', '/'), destination.toString().replace('\\', '/')));

        assertEquals(0, run("--mode", "organize", "--config", config.toString(), "--plan", plan.toString()));

        assertTrue(Files.exists(destination));
        assertFalse(Files.exists(source));
    }

    @Test
    void shouldFailOrganizeWhenDestinationExists() throws Exception {
        Path config = writeConfig();
        Path source = Files.writeString(tempDir.resolve("a.txt"), "a");
        Path destination = Files.writeString(tempDir.resolve("b.txt"), "b");
        Path plan = tempDir.resolve("plan.json");
        Files.writeString(plan, """
                [{"source": "%s", "destination": "%s"}]
                """.formatted(source.toString().replace('\\', '/'), destination.toString().replace('\\', '/')));

        assertEquals(1, run("--mode", "organize", "--config", config.toString(), "--plan", plan.toString()));
        assertEquals("a", Files.readString(source));
    }

    @Test
    void shouldReportMissingSuggestionWithoutGenerationEndpoint() throws Exception {
        Path config = writeConfig();
        Path file = Files.writeString(tempDir.resolve("note.txt"), "Flight to Lisbon");

        assertEquals(1, run("--mode", "suggest", "--config", config.toString(),
                "--file", file.toString(), "--folders", "Travel,Finance"));
    }

    @Test
    void shouldRetryDeadLettersWhenNothingFailed() throws Exception {
        Path config = writeConfig();

        assertEquals(0, run("--mode", "retry-dead-letters", "--config", config.toString()));
    }

    @Test
    void shouldSelectIndexableExtensions() {
        assertTrue(Main.isIndexable(Path.of("notes/README.MD")));
        assertTrue(Main.isIndexable(Path.of("data.csv")));
        assertFalse(Main.isIndexable(Path.of("photo.jpg")));
        assertFalse(Main.isIndexable(Path.of("Makefile")));
    }

    @Test
    void shouldFallBackToDefaultsWhenConfigIsMissing() throws Exception {
        AppConfig config = Main.loadConfig(tempDir.resolve("absent.yml"));

        assertEquals("nomic-embed-text", config.getEmbedding().getModel());
    }
}
