package com.imageanalysis.shared.model;

import com.imageanalysis.shared.json.Json;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class OrchestrationRecordTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final List<AnalysisKind> ROSTER = Arrays.asList(AnalysisKind.values());

    private final ImageRef image = ImageRef.of("photos", "images/test.jpg", "abc", 100, NOW);

    @Test
    public void testCreateHasOnePendingTaskPerKind() {
        OrchestrationRecord record = OrchestrationRecord.create(image, ROSTER, NOW);

        assertEquals(OrchestrationStatus.RUNNING, record.getStatus());
        assertEquals(4, record.getTasks().size());
        assertEquals(4, record.getOpenTasks().size());
        for (AnalysisTask task : record.getTasks().values()) {
            assertEquals(TaskStatus.PENDING, task.getStatus());
            assertEquals(0, task.getAttempts());
        }
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testTaskMembershipIsFixed() {
        OrchestrationRecord record = OrchestrationRecord.create(image, Arrays.asList(AnalysisKind.COLOR), NOW);
        record.getTasks().put(AnalysisKind.TEXT, new AnalysisTask(AnalysisKind.TEXT));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyRosterRejected() {
        OrchestrationRecord.create(image, List.of(), NOW);
    }

    @Test
    public void testTerminalTaskCannotChange() {
        AnalysisTask task = new AnalysisTask(AnalysisKind.TEXT);
        task.markRunning(1, NOW);
        task.markSucceeded(Map.of("hasText", false), NOW);

        try {
            task.markFailed("late", NOW);
            fail("A succeeded task should not be failed afterwards");
        } catch (IllegalStateException expected) {
            assertEquals(TaskStatus.SUCCEEDED, task.getStatus());
        }
    }

    @Test
    public void testTimedOutIsNotTerminal() {
        AnalysisTask task = new AnalysisTask(AnalysisKind.OBJECTS);
        task.markRunning(1, NOW);
        task.markTimedOut("slow", NOW);

        assertFalse(task.isTerminal());
        task.markRunning(2, NOW);
        assertEquals(2, task.getAttempts());
    }

    @Test
    public void testSuccessClearsEarlierError() {
        AnalysisTask task = new AnalysisTask(AnalysisKind.COLOR);
        task.markRunning(1, NOW);
        task.markRetryPending("decoder hiccup", NOW);
        task.markRunning(2, NOW);
        task.markSucceeded(Map.of("isGrayscale", true), NOW);

        assertNull(task.getLastError());
        assertEquals(Boolean.TRUE, task.getOutput().get("isGrayscale"));
    }

    @Test
    public void testCompletionNeedsAllTasksTerminal() {
        OrchestrationRecord record = OrchestrationRecord.create(image, Arrays.asList(AnalysisKind.TEXT), NOW);
        try {
            record.stampCompletion(NOW);
            fail("Finalize with open tasks should be refused");
        } catch (IllegalStateException expected) {
            assertNull(record.getCompletedAt());
        }

        record.getTask(AnalysisKind.TEXT).markRunning(1, NOW);
        record.getTask(AnalysisKind.TEXT).markFailed("boom", NOW);
        record.stampCompletion(NOW.plusSeconds(1));
        record.stampCompletion(NOW.plusSeconds(60));

        assertEquals("First completion stamp should win", NOW.plusSeconds(1), record.getCompletedAt());
        record.markCompleted();
        assertEquals(OrchestrationStatus.COMPLETED, record.getStatus());
    }

    @Test
    public void testLease() {
        OrchestrationRecord record = OrchestrationRecord.create(image, ROSTER, NOW);
        assertTrue("A fresh record has no lease", record.isLeaseExpired(NOW));

        record.renewLease("node-a", NOW.plusSeconds(300));
        assertFalse(record.isLeaseExpired(NOW.plusSeconds(299)));
        assertTrue(record.isLeaseExpired(NOW.plusSeconds(300)));
        assertEquals(1, record.getVersion());
    }

    @Test
    public void testPersistedFormKeepsProgress() {
        OrchestrationRecord record = OrchestrationRecord.create(image, ROSTER, NOW);
        record.getTask(AnalysisKind.COLOR).markRunning(1, NOW);
        record.getTask(AnalysisKind.COLOR).markSucceeded(Map.of("isGrayscale", false), NOW);
        record.renewLease("node-a", NOW.plusSeconds(300));

        OrchestrationRecord restored = Json.fromJson(Json.toJson(record), OrchestrationRecord.class);

        assertEquals(image, restored.getImageRef());
        assertEquals(TaskStatus.SUCCEEDED, restored.getTask(AnalysisKind.COLOR).getStatus());
        assertEquals(Boolean.FALSE, restored.getTask(AnalysisKind.COLOR).getOutput().get("isGrayscale"));
        assertEquals(3, restored.getOpenTasks().size());
        assertEquals("node-a", restored.getOwner());
        assertEquals(record.getVersion(), restored.getVersion());
    }

    @Test
    public void testSnapshotIsIndependent() {
        OrchestrationRecord record = OrchestrationRecord.create(image, ROSTER, NOW);
        OrchestrationRecord snapshot = record.snapshot();

        record.getTask(AnalysisKind.TEXT).markRunning(1, NOW);

        assertEquals(TaskStatus.PENDING, snapshot.getTask(AnalysisKind.TEXT).getStatus());
    }
}
