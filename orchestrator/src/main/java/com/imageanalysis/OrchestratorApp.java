package com.imageanalysis;

import com.imageanalysis.analyzer.AnalyzerRegistry;
import com.imageanalysis.query.QueryApiServer;
import com.imageanalysis.query.QueryService;
import com.imageanalysis.shared.AppConfig;
import com.imageanalysis.shared.AwsClientFactory;
import com.imageanalysis.shared.StoreFactory;
import com.imageanalysis.shared.service.SqsService;
import com.imageanalysis.shared.storage.ImageStorage;
import com.imageanalysis.shared.storage.LocalImageStorage;
import com.imageanalysis.shared.store.OrchestrationStateStore;
import com.imageanalysis.shared.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Orchestrator main class.
 * Wires the stores, the analyzer roster, the event source and the query API,
 * resumes unfinished orchestrations and then runs until a shutdown signal.
 */
public class OrchestratorApp {

    private static final Logger logger = LoggerFactory.getLogger(OrchestratorApp.class);

    // Config Keys
    private static final String QUERY_PORT_KEY = "QUERY_PORT";
    private static final String LOCAL_POLL_KEY = "LOCAL_POLL_MILLIS";
    private static final String RECOVERY_INTERVAL_KEY = "RECOVERY_INTERVAL_SECONDS";

    private static final long MONITOR_INTERVAL_MILLIS = 10000;

    private final AtomicBoolean running;
    private final CountDownLatch stopped;

    private final Orchestrator orchestrator;
    private final Runnable eventSource;
    private final QueryApiServer queryServer;
    private final SqsService sqsService;
    private final Duration recoveryInterval;

    private ExecutorService executorService;
    private long lastRecoveryTime;

    public OrchestratorApp(AppConfig config) throws IOException {
        this.running = new AtomicBoolean(true);
        this.stopped = new CountDownLatch(1);

        OrchestratorSettings settings = OrchestratorSettings.fromConfig(config);
        StoreFactory storeFactory = new StoreFactory(config);
        this.recoveryInterval = config.getSecondsOptional(RECOVERY_INTERVAL_KEY, 60);

        // Initialize stores
        OrchestrationStateStore stateStore = storeFactory.createStateStore();
        ResultStore resultStore = storeFactory.createResultStore();
        ImageStorage imageStorage = storeFactory.createImageStorage();

        AnalyzerRegistry registry = AnalyzerRegistry.standard(imageStorage).retainOnly(settings.getRoster());
        this.orchestrator = new Orchestrator(stateStore, resultStore, imageStorage, registry, settings,
                NodeIdentity.resolve(config, storeFactory.localDataDir()), Clock.systemUTC());

        // Initialize event source
        if (storeFactory.isS3Storage()) {
            this.sqsService = new SqsService(AwsClientFactory.createSqsClient(storeFactory.awsRegion()));
            ImageEventListener listener = new ImageEventListener(config, storeFactory.imagePrefix(),
                    sqsService, orchestrator, running);
            listener.ensureQueueExists();
            this.eventSource = listener;
        } else {
            this.sqsService = null;
            this.eventSource = new LocalImageEventSource((LocalImageStorage) imageStorage,
                    storeFactory.imagePrefix(), orchestrator, running,
                    config.getMillisOptional(LOCAL_POLL_KEY, 2000).toMillis());
        }

        // Initialize query API
        int queryPort = config.getIntOptional(QUERY_PORT_KEY, 8080);
        this.queryServer = queryPort > 0 ? new QueryApiServer(new QueryService(resultStore), queryPort) : null;

        logger.info("Initialized (owner: {}, storage: {})", orchestrator.getOwnerId(),
                storeFactory.isS3Storage() ? "s3" : "local");
    }

    /**
     * Starts the orchestrator and blocks until shutdown.
     */
    public void start() {
        logger.info("=== Orchestrator Starting ===");

        setupShutdownHook();

        // Resume what a previous process left behind before taking new work
        orchestrator.recover();
        lastRecoveryTime = System.currentTimeMillis();

        executorService = Executors.newSingleThreadExecutor();
        executorService.submit(eventSource);

        if (queryServer != null) {
            queryServer.start();
        }

        logger.info("All threads started");

        monitor();

        shutdown();
    }

    /**
     * Main monitoring loop.
     * Logs status and periodically re-runs recovery to pick up records whose owner died.
     */
    private void monitor() {
        while (running.get()) {
            try {
                if (System.currentTimeMillis() - lastRecoveryTime >= recoveryInterval.toMillis()) {
                    orchestrator.recover();
                    lastRecoveryTime = System.currentTimeMillis();
                }

                logStatus();

                Thread.sleep(MONITOR_INTERVAL_MILLIS);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                logger.error("Error in monitor loop: {}", e.getMessage());
            }
        }
    }

    private void logStatus() {
        OrchestrationTracker tracker = orchestrator.getTracker();
        logger.info("orchestrations active={} completed={} failed={}",
                tracker.getActiveCount(), tracker.getCompletedCount(), tracker.getFailedCount());
    }

    /**
     * Graceful shutdown
     */
    private void shutdown() {
        logger.info("=== Orchestrator Shutting Down ===");

        running.set(false);

        if (queryServer != null) {
            queryServer.close();
        }

        if (executorService != null) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        orchestrator.close();

        if (sqsService != null) {
            try {
                sqsService.close();
            } catch (Exception e) {
                logger.error("Error closing SqsService: {}", e.getMessage());
            }
        }

        logger.info("=== Orchestrator Stopped ===");
        stopped.countDown();
    }

    /**
     * Sets up shutdown hook for graceful termination on SIGTERM/SIGINT
     */
    private void setupShutdownHook() {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            running.set(false);
            try {
                if (!stopped.await(90, TimeUnit.SECONDS)) {
                    logger.warn("Shutdown did not finish in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
    }

    /**
     * Main entry point
     */
    public static void main(String[] args) {
        try {
            new OrchestratorApp(new AppConfig()).start();
        } catch (Exception e) {
            logger.error("Orchestrator failed to start: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
