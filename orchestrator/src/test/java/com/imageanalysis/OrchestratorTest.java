package com.imageanalysis;

import com.imageanalysis.analyzer.AnalyzerRegistry;
import com.imageanalysis.analyzer.TextAnalyzer;
import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.OrchestrationStatus;
import com.imageanalysis.shared.model.ResultFilter;
import com.imageanalysis.shared.model.ResultStatus;
import com.imageanalysis.shared.model.ResultSummary;
import com.imageanalysis.shared.model.TaskStatus;
import com.imageanalysis.shared.storage.LocalImageStorage;
import com.imageanalysis.shared.store.FileOrchestrationStateStore;
import com.imageanalysis.shared.store.FileResultStore;
import com.imageanalysis.shared.store.LeaseLostException;
import com.imageanalysis.shared.store.OrchestrationStateStore;
import com.imageanalysis.shared.store.StoreException;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class OrchestratorTest {

    private static final Duration WAIT = Duration.ofSeconds(30);

    @Rule
    public TemporaryFolder temp = new TemporaryFolder();

    private LocalImageStorage storage;
    private FileOrchestrationStateStore stateStore;
    private FileResultStore resultStore;
    private Orchestrator orchestrator;
    private ImageRef testJpg;

    @Before
    public void setUp() throws Exception {
        Path root = temp.getRoot().toPath();
        storage = new LocalImageStorage(root.resolve("blobs"));
        stateStore = new FileOrchestrationStateStore(root.resolve("orchestrations"));
        resultStore = new FileResultStore(root.resolve("results"));

        Path file = TestImages.writeBlackAndRed(storage.getRoot(), "images/test.jpg", "jpg", 770, 400, 0.6);
        testJpg = storage.refFor(file);
    }

    @After
    public void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown(Duration.ofSeconds(5));
        }
    }

    private static OrchestratorSettings settings(Duration timeout) {
        return new OrchestratorSettings(Arrays.asList(AnalysisKind.values()), timeout, 2,
                Duration.ofMillis(10), Duration.ofMinutes(5), 2, 4, 3);
    }

    private Orchestrator orchestrator(AnalyzerRegistry registry, Duration timeout) {
        orchestrator = new Orchestrator(stateStore, resultStore, storage, registry, settings(timeout),
                "test-node", Clock.systemUTC());
        return orchestrator;
    }

    private OrchestrationRecord runToCompletion(ImageRef image) throws Exception {
        OrchestrationRecord started = orchestrator.startOrchestration(image);
        assertEquals(OrchestrationStatus.RUNNING, started.getStatus());
        return orchestrator.awaitCompletion(image.getId(), WAIT).get();
    }

    @Test
    public void testAllAnalyzersSucceed() throws Exception {
        orchestrator(AnalyzerRegistry.standard(storage), Duration.ofSeconds(20));

        OrchestrationRecord finished = runToCompletion(testJpg);

        assertEquals(OrchestrationStatus.COMPLETED, finished.getStatus());
        ResultSummary result = resultStore.get(testJpg.getId()).get();
        Map<String, Object> summary = result.getSummary();
        assertEquals("770x400", summary.get("imageSize"));
        assertEquals("JPEG", summary.get("format"));
        assertEquals("#000000", summary.get("dominantColor"));
        assertEquals(2, summary.get("objectsDetected"));
        assertEquals(false, summary.get("hasText"));
        assertEquals(false, summary.get("isGrayscale"));

        assertEquals(ResultStatus.COMPLETE, result.getStatus());
        assertTrue(result.getFailedAnalyzers().isEmpty());
        assertEquals("test.jpg", result.getFileName());
        assertEquals("local/images/test.jpg", result.getBlobPath());
        assertEquals(finished.getCompletedAt(), result.getAnalyzedAt());
        assertFalse("Record should be removed after finalize", stateStore.load(testJpg.getId()).isPresent());
    }

    @Test
    public void testObjectDetectionExhaustingRetriesGivesPartialResult() throws Exception {
        StubAnalyzer objects = StubAnalyzer.failing(AnalysisKind.OBJECTS);
        orchestrator(AnalyzerRegistry.standard(storage).register(objects), Duration.ofSeconds(20));

        OrchestrationRecord finished = runToCompletion(testJpg);

        assertEquals("Partial success still completes", OrchestrationStatus.COMPLETED, finished.getStatus());
        assertEquals(TaskStatus.FAILED, finished.getTask(AnalysisKind.OBJECTS).getStatus());
        assertEquals("1 attempt + 2 retries", 3, objects.getCalls());

        ResultSummary result = resultStore.get(testJpg.getId()).get();
        assertTrue(result.getSummary().containsKey("objectsDetected"));
        assertNull(result.getSummary().get("objectsDetected"));
        assertEquals("770x400", result.getSummary().get("imageSize"));
        assertEquals("#000000", result.getSummary().get("dominantColor"));
        assertEquals(ResultStatus.PARTIAL, result.getStatus());
        assertEquals(List.of(AnalysisKind.OBJECTS), result.getFailedAnalyzers());
        assertNull(result.getAnalyses().get("objects"));
    }

    @Test
    public void testTimeoutRetriedExactly() throws Exception {
        StubAnalyzer hanging = StubAnalyzer.hanging(AnalysisKind.OBJECTS);
        AnalyzerRegistry registry = new AnalyzerRegistry().register(hanging).register(new TextAnalyzer());
        orchestrator(registry, Duration.ofMillis(300));

        OrchestrationRecord finished = runToCompletion(testJpg);

        assertEquals(3, hanging.getCalls());
        assertEquals(TaskStatus.FAILED, finished.getTask(AnalysisKind.OBJECTS).getStatus());
        assertEquals(3, finished.getTask(AnalysisKind.OBJECTS).getAttempts());
        assertTrue(finished.getTask(AnalysisKind.OBJECTS).getLastError().startsWith("Timed out"));
        assertEquals(TaskStatus.SUCCEEDED, finished.getTask(AnalysisKind.TEXT).getStatus());

        ResultSummary result = resultStore.get(testJpg.getId()).get();
        assertNull(result.getSummary().get("objectsDetected"));
        assertEquals(false, result.getSummary().get("hasText"));
    }

    @Test
    public void testQueuedCallsDoNotSpendTheirTimeout() throws Exception {
        // One configured analyzer thread, but two tasks that each need most of the timeout
        StubAnalyzer text = StubAnalyzer.slow(AnalysisKind.TEXT, Map.of("hasText", false), 400);
        StubAnalyzer objects = StubAnalyzer.slow(AnalysisKind.OBJECTS, Map.of("objectCount", 1), 400);
        OrchestratorSettings narrow = new OrchestratorSettings(Arrays.asList(AnalysisKind.values()),
                Duration.ofMillis(700), 0, Duration.ofMillis(10), Duration.ofMinutes(5), 1, 1, 3);
        orchestrator = new Orchestrator(stateStore, resultStore, storage,
                new AnalyzerRegistry().register(text).register(objects), narrow, "test-node", Clock.systemUTC());

        OrchestrationRecord finished = runToCompletion(testJpg);

        assertEquals(TaskStatus.SUCCEEDED, finished.getTask(AnalysisKind.TEXT).getStatus());
        assertEquals(TaskStatus.SUCCEEDED, finished.getTask(AnalysisKind.OBJECTS).getStatus());
        assertEquals(1, text.getCalls());
        assertEquals(1, objects.getCalls());
        assertEquals(ResultStatus.COMPLETE, resultStore.get(testJpg.getId()).get().getStatus());
    }

    @Test
    public void testStaleOwnerDoesNotResurrectFinishedOrchestration() throws Exception {
        StubAnalyzer hanging = StubAnalyzer.hanging(AnalysisKind.OBJECTS);
        orchestrator(new AnalyzerRegistry().register(hanging).register(new TextAnalyzer()), Duration.ofMillis(300));

        orchestrator.startOrchestration(testJpg);
        // Meanwhile another node took the record over, committed its result and deleted the record
        ResultSummary committed = new ResultSummary(testJpg.getId(), "test.jpg", "local/images/test.jpg",
                Instant.parse("2024-05-01T10:00:00Z"), ResultStatus.COMPLETE, Map.of("hasText", true),
                Map.of(), List.of());
        resultStore.upsert(committed);
        stateStore.delete(testJpg.getId());

        try {
            orchestrator.awaitCompletion(testJpg.getId(), WAIT);
        } catch (LeaseLostException expected) {
            // the usual outcome; a very fast failure leaves nothing to await
        }
        long deadline = System.currentTimeMillis() + WAIT.toMillis();
        while (orchestrator.getTracker().hasActive() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        // Let the stranded timeout of the hanging call try its own write
        Thread.sleep(600);

        assertFalse("Orchestration should have stopped", orchestrator.getTracker().hasActive());
        assertEquals(0, orchestrator.getTracker().getCompletedCount());
        assertFalse("Deleted record must not come back", stateStore.load(testJpg.getId()).isPresent());
        assertEquals("Committed result must be left alone", committed, resultStore.get(testJpg.getId()).get());
    }

    @Test
    public void testRuntimeFaultBecomesTaskFailure() throws Exception {
        StubAnalyzer crashing = StubAnalyzer.crashing(AnalysisKind.TEXT);
        orchestrator(AnalyzerRegistry.standard(storage).register(crashing), Duration.ofSeconds(20));

        OrchestrationRecord finished = runToCompletion(testJpg);

        assertEquals(3, crashing.getCalls());
        assertTrue(finished.getTask(AnalysisKind.TEXT).getLastError().contains("bug in TEXT"));
        assertNull(resultStore.get(testJpg.getId()).get().getSummary().get("hasText"));
    }

    @Test
    public void testMalformedOutputCountsAsFailedAttempt() throws Exception {
        StubAnalyzer malformed = new StubAnalyzer(AnalysisKind.TEXT, StubAnalyzer.Mode.SUCCEED,
                Map.of("language", "unknown"), Set.of("hasText"));
        orchestrator(AnalyzerRegistry.standard(storage).register(malformed), Duration.ofSeconds(20));

        OrchestrationRecord finished = runToCompletion(testJpg);

        assertEquals(3, malformed.getCalls());
        assertEquals(TaskStatus.FAILED, finished.getTask(AnalysisKind.TEXT).getStatus());
        assertTrue(finished.getTask(AnalysisKind.TEXT).getLastError().contains("hasText"));
    }

    @Test
    public void testAllAnalyzersFailing() throws Exception {
        AnalyzerRegistry registry = new AnalyzerRegistry()
                .register(StubAnalyzer.failing(AnalysisKind.COLOR))
                .register(StubAnalyzer.failing(AnalysisKind.METADATA));
        orchestrator(registry, Duration.ofSeconds(5));

        OrchestrationRecord finished = runToCompletion(testJpg);

        assertEquals(OrchestrationStatus.COMPLETED, finished.getStatus());
        ResultSummary result = resultStore.get(testJpg.getId()).get();
        assertEquals(ResultStatus.FAILED, result.getStatus());
        assertEquals(List.of(AnalysisKind.COLOR, AnalysisKind.METADATA), result.getFailedAnalyzers());
        assertNull(result.getSummary().get("imageSize"));
    }

    @Test
    public void testDuplicateStartsYieldOneResult() throws Exception {
        StubAnalyzer text = StubAnalyzer.succeeding(AnalysisKind.TEXT, Map.of("hasText", false));
        orchestrator(AnalyzerRegistry.standard(storage).register(text), Duration.ofSeconds(20));

        int callers = 8;
        ExecutorService callersPool = Executors.newFixedThreadPool(callers);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<OrchestrationRecord>> starts = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                starts.add(callersPool.submit(() -> {
                    go.await();
                    return orchestrator.startOrchestration(testJpg);
                }));
            }
            go.countDown();
            for (Future<OrchestrationRecord> start : starts) {
                assertEquals(testJpg.getId(), start.get().getImageId());
            }
        } finally {
            callersPool.shutdownNow();
        }

        orchestrator.awaitCompletion(testJpg.getId(), WAIT);

        // Redelivery after completion is a no-op
        OrchestrationRecord again = orchestrator.startOrchestration(testJpg);
        assertEquals(OrchestrationStatus.COMPLETED, again.getStatus());

        assertEquals("Analyzer should run once", 1, text.getCalls());
        List<ResultSummary> all = resultStore.list(200, ResultFilter.none());
        assertEquals(1, all.size());
        assertEquals(testJpg.getId(), all.get(0).getId());
        assertEquals(1, orchestrator.getTracker().getCompletedCount());
    }

    @Test
    public void testMissingImageFails() throws Exception {
        orchestrator(AnalyzerRegistry.standard(storage), Duration.ofSeconds(5));
        ImageRef missing = ImageRef.of(LocalImageStorage.LOCAL_BUCKET, "images/nope.jpg", "x", 0, Instant.now());

        OrchestrationRecord record = orchestrator.startOrchestration(missing);

        assertEquals(OrchestrationStatus.FAILED, record.getStatus());
        assertTrue(record.getTasks().isEmpty());
        assertNotNull(record.getFailureReason());
        assertFalse(resultStore.get(missing.getId()).isPresent());
        assertFalse("Unreadable images are not persisted", stateStore.load(missing.getId()).isPresent());
        assertFalse(orchestrator.getTracker().hasActive());
    }

    @Test
    public void testStoreOutageIsPropagated() throws Exception {
        OrchestrationStateStore broken = mock(OrchestrationStateStore.class);
        when(broken.load(any())).thenReturn(Optional.empty());
        when(broken.create(any())).thenThrow(new StoreException("table unavailable"));
        orchestrator = new Orchestrator(broken, resultStore, storage, AnalyzerRegistry.standard(storage),
                settings(Duration.ofSeconds(5)), "test-node", Clock.systemUTC());

        try {
            orchestrator.startOrchestration(testJpg);
            fail("Store outage should reach the caller");
        } catch (StoreException expected) {
            assertFalse("Nothing stays registered, so a retry can start it", orchestrator.getTracker().hasActive());
            assertFalse(resultStore.get(testJpg.getId()).isPresent());
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testRejectsWorkAfterShutdown() {
        orchestrator(AnalyzerRegistry.standard(storage), Duration.ofSeconds(5));
        orchestrator.shutdown(Duration.ofSeconds(1));

        orchestrator.startOrchestration(testJpg);
    }
}
