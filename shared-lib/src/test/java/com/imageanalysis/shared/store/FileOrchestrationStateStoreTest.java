package com.imageanalysis.shared.store;

import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.TaskStatus;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class FileOrchestrationStateStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final Duration LEASE = Duration.ofMinutes(5);

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private Path dir;
    private FileOrchestrationStateStore store;

    @Before
    public void setUp() {
        dir = temp.getRoot().toPath().resolve("orchestrations");
        store = new FileOrchestrationStateStore(dir, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private OrchestrationRecord newRecord(String key, String owner) {
        ImageRef image = ImageRef.of("local", key, "etag", 10, NOW);
        OrchestrationRecord record = OrchestrationRecord.create(image, Arrays.asList(AnalysisKind.values()), NOW);
        record.renewLease(owner, NOW.plus(LEASE));
        return record;
    }

    @Test
    public void testCreateIsConditional() {
        OrchestrationRecord record = newRecord("images/a.jpg", "node-a");

        assertTrue("First create should win", store.create(record));
        assertFalse("Second create should be refused", store.create(newRecord("images/a.jpg", "node-b")));
        assertEquals("node-a", store.load(record.getImageId()).get().getOwner());
    }

    @Test
    public void testSaveSurvivesRestart() {
        OrchestrationRecord record = newRecord("images/a.jpg", "node-a");
        store.create(record);

        record.getTask(AnalysisKind.TEXT).markRunning(1, NOW);
        record.getTask(AnalysisKind.TEXT).markSucceeded(Map.of("hasText", false), NOW);
        record.renewLease("node-a", NOW.plus(LEASE));
        store.save(record);

        // A new instance over the same directory plays the restarted process
        FileOrchestrationStateStore reopened = new FileOrchestrationStateStore(dir);
        OrchestrationRecord loaded = reopened.load(record.getImageId()).get();

        assertEquals(TaskStatus.SUCCEEDED, loaded.getTask(AnalysisKind.TEXT).getStatus());
        assertEquals(record.getVersion(), loaded.getVersion());
        assertEquals(1, reopened.listIncomplete().size());
    }

    @Test(expected = LeaseLostException.class)
    public void testSaveByOtherOwnerRejected() {
        store.create(newRecord("images/a.jpg", "node-a"));
        store.save(newRecord("images/a.jpg", "node-b"));
    }

    @Test
    public void testStaleOwnerCannotRecreateDeletedRecord() {
        OrchestrationRecord stale = newRecord("images/a.jpg", "node-a");
        store.create(stale);

        // node-b takes over the expired lease, finalizes and deletes the record
        FileOrchestrationStateStore later = new FileOrchestrationStateStore(dir,
                Clock.fixed(NOW.plus(LEASE).plusSeconds(1), ZoneOffset.UTC));
        assertTrue(later.claim(stale.getImageId(), "node-b", LEASE));
        later.delete(stale.getImageId());

        stale.getTask(AnalysisKind.TEXT).markRunning(1, NOW);
        try {
            store.save(stale);
            fail("Save of a deleted record should report the lost lease");
        } catch (LeaseLostException expected) {
            // expected
        }
        assertFalse("Deleted record must stay deleted", store.load(stale.getImageId()).isPresent());
    }

    @Test(expected = LeaseLostException.class)
    public void testSaveWithoutCreateRejected() {
        store.save(newRecord("images/never-created.jpg", "node-a"));
    }

    @Test
    public void testListIncompleteSkipsCompleted() throws Exception {
        OrchestrationRecord open = newRecord("images/open.jpg", "node-a");
        OrchestrationRecord done = OrchestrationRecord.create(
                ImageRef.of("local", "images/done.jpg", "etag", 10, NOW), Arrays.asList(AnalysisKind.TEXT), NOW);
        done.getTask(AnalysisKind.TEXT).markRunning(1, NOW);
        done.getTask(AnalysisKind.TEXT).markFailed("boom", NOW);
        done.stampCompletion(NOW);
        done.markCompleted();
        store.create(open);
        store.create(done);
        // Leftover temp file from an interrupted write is not a record
        Files.writeString(dir.resolve("garbage.json.123.tmp"), "{");

        List<OrchestrationRecord> incomplete = store.listIncomplete();

        assertEquals(1, incomplete.size());
        assertEquals(open.getImageId(), incomplete.get(0).getImageId());
    }

    @Test
    public void testClaimRespectsLiveLease() {
        OrchestrationRecord record = newRecord("images/a.jpg", "node-a");
        store.create(record);

        assertFalse("Lease of node-a is still live", store.claim(record.getImageId(), "node-b", LEASE));
        assertTrue("Owner may always re-claim", store.claim(record.getImageId(), "node-a", LEASE));
    }

    @Test
    public void testClaimTakesOverExpiredLease() {
        OrchestrationRecord record = newRecord("images/a.jpg", "node-a");
        store.create(record);

        FileOrchestrationStateStore later = new FileOrchestrationStateStore(dir,
                Clock.fixed(NOW.plus(LEASE).plusSeconds(1), ZoneOffset.UTC));

        assertTrue(later.claim(record.getImageId(), "node-b", LEASE));
        OrchestrationRecord claimed = later.load(record.getImageId()).get();
        assertEquals("node-b", claimed.getOwner());
        assertTrue("Claim should bump the version", claimed.getVersion() > record.getVersion());
    }

    @Test
    public void testDeleteAndMissing() {
        OrchestrationRecord record = newRecord("images/a.jpg", "node-a");
        store.create(record);
        store.delete(record.getImageId());
        store.delete(record.getImageId());

        assertFalse(store.load(record.getImageId()).isPresent());
        assertFalse(store.claim(record.getImageId(), "node-a", LEASE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPathLikeIdRejected() {
        store.load("../escape");
    }
}
