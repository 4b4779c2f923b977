package com.imageanalysis;

import com.fasterxml.jackson.databind.JsonNode;
import com.imageanalysis.shared.AppConfig;
import com.imageanalysis.shared.StoreFactory;
import com.imageanalysis.shared.json.Json;
import com.imageanalysis.shared.model.ResultStatus;
import com.imageanalysis.shared.model.ResultSummary;
import com.imageanalysis.shared.storage.LocalImageStorage;
import com.imageanalysis.shared.store.FileResultStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.Assert.*;

public class LocalAppTest {

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private Path dataDir;
    private ByteArrayOutputStream output;
    private LocalApp app;

    @Before
    public void setUp() throws Exception {
        dataDir = temp.newFolder("data").toPath();
        output = new ByteArrayOutputStream();
        app = new LocalApp(new AppConfig(Map.of(StoreFactory.LOCAL_DATA_DIR_KEY, dataDir.toString())),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testUploadCopiesUnderPrefix() throws Exception {
        Path source = temp.newFile("holiday.jpg").toPath();
        Files.write(source, new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x00});

        String id = app.upload(source);

        LocalImageStorage storage = new LocalImageStorage(dataDir.resolve("blobs"));
        Path stored = storage.getRoot().resolve("images/holiday.jpg");
        assertTrue(Files.exists(stored));
        assertEquals("Id matches what the orchestrator derives", storage.refFor(stored).getId(), id);
        assertTrue(printed().contains("Uploaded holiday.jpg (id: " + id + ")"));
    }

    @Test
    public void testUploadLeavesNoPartialFile() throws Exception {
        Path source = temp.newFile("scan.png").toPath();
        Files.write(source, new byte[]{(byte) 0x89, 'P', 'N', 'G'});

        app.upload(source);
        // Re-upload over an existing image goes through the same rename
        Files.write(source, new byte[]{(byte) 0x89, 'P', 'N', 'G', 0x0D});
        String id = app.upload(source);

        Path imagesDir = dataDir.resolve("blobs").resolve("images");
        try (Stream<Path> files = Files.list(imagesDir)) {
            assertEquals(List.of("scan.png"),
                    files.map(path -> path.getFileName().toString()).collect(Collectors.toList()));
        }
        Path stored = imagesDir.resolve("scan.png");
        assertEquals(5, Files.size(stored));
        assertEquals(new LocalImageStorage(dataDir.resolve("blobs")).refFor(stored).getId(), id);
    }

    @Test(expected = IOException.class)
    public void testUploadMissingFile() throws Exception {
        app.upload(temp.getRoot().toPath().resolve("nope.jpg"));
    }

    @Test
    public void testPrintResults() throws Exception {
        new FileResultStore(dataDir.resolve("results")).upsert(new ResultSummary("r1", "cat.jpg",
                "local/images/cat.jpg", Instant.parse("2024-05-01T10:00:00Z"), ResultStatus.COMPLETE,
                Map.of("format", "JPEG"), Map.of(), List.of()));

        app.printResults(10);

        JsonNode body = Json.mapper().readTree(printed());
        assertEquals(1, body.get("count").asInt());
        JsonNode first = body.get("results").get(0);
        assertEquals("r1", first.get("id").asText());
        assertEquals("cat.jpg", first.get("fileName").asText());
        assertEquals("COMPLETE", first.get("status").asText());
        assertEquals("JPEG", first.get("summary").get("format").asText());
        assertFalse("Listing shows the short form", first.has("analyses"));
        assertFalse(first.has("blobPath"));
    }

    @Test
    public void testPrintResultsEmpty() throws Exception {
        app.printResults(10);

        assertEquals(0, Json.mapper().readTree(printed()).get("count").asInt());
    }

    @Test
    public void testPrintMissingResult() {
        assertFalse(app.printResult("unknown-id"));
        assertTrue(printed().contains("Result not found: unknown-id"));
    }
}
