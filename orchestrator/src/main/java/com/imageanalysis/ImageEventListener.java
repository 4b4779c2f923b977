package com.imageanalysis;

import com.imageanalysis.model.S3EventNotification;
import com.imageanalysis.shared.AppConfig;
import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.OrchestrationStatus;
import com.imageanalysis.shared.service.SqsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.model.Message;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Thread that listens for S3 object-created notifications and starts an
 * orchestration for every new image under the configured prefix.
 * A message is only deleted once all of its images were taken care of,
 * otherwise SQS redelivers it after the visibility timeout.
 */
public class ImageEventListener implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(ImageEventListener.class);

    // Config Keys
    public static final String EVENT_QUEUE_KEY = "IMAGE_EVENT_QUEUE";
    public static final String WAIT_TIME_KEY = "WAIT_TIME_SECONDS";
    public static final String VISIBILITY_TIMEOUT_KEY = "VISIBILITY_TIMEOUT_SECONDS";
    public static final String MAX_RECEIVES_KEY = "MAX_EVENT_RECEIVES";

    private static final int BATCH_SIZE = 10;

    private final SqsService sqsService;
    private final Orchestrator orchestrator;
    private final AtomicBoolean running;

    // Config Values (Eagerly Loaded)
    private final String eventQueue;
    private final String imagePrefix;
    private final int waitTimeSeconds;
    private final int visibilityTimeout;
    private final int maxReceives;

    public ImageEventListener(AppConfig config,
            String imagePrefix,
            SqsService sqsService,
            Orchestrator orchestrator,
            AtomicBoolean running) {
        this.sqsService = sqsService;
        this.orchestrator = orchestrator;
        this.running = running;

        // Load Configuration (Fail Fast)
        this.eventQueue = config.getString(EVENT_QUEUE_KEY);
        this.imagePrefix = imagePrefix;
        this.waitTimeSeconds = config.getIntOptional(WAIT_TIME_KEY, 20);
        this.visibilityTimeout = config.getIntOptional(VISIBILITY_TIMEOUT_KEY, 180);
        this.maxReceives = config.getIntOptional(MAX_RECEIVES_KEY, 5);
    }

    public void ensureQueueExists() {
        sqsService.createQueueIfNotExists(eventQueue, visibilityTimeout, waitTimeSeconds);
    }

    @Override
    public void run() {
        logger.info("Started (queue: {}, prefix: '{}')", eventQueue, imagePrefix);

        while (running.get()) {
            try {
                List<Message> messages = sqsService.receiveMessages(eventQueue, BATCH_SIZE,
                        waitTimeSeconds, visibilityTimeout);

                for (Message message : messages) {
                    if (!running.get()) {
                        break;
                    }

                    processMessage(message);
                }

            } catch (Exception e) {
                logger.error("Error in ImageEventListener: {}", e.getMessage());
                sleep(5000);
            }
        }

        logger.info("Stopped");
    }

    /**
     * Handles one notification.
     *
     * @return true if the message was deleted
     */
    boolean processMessage(Message message) {
        int receives = SqsService.receiveCount(message);
        boolean finalReceive = receives >= maxReceives;

        S3EventNotification notification;
        try {
            notification = sqsService.parseMessage(message.body(), S3EventNotification.class);
        } catch (RuntimeException e) {
            logger.error("Unparseable notification {} (receive {}): {}", message.messageId(), receives, e.getMessage());
            if (finalReceive) {
                sqsService.deleteMessage(eventQueue, message);
                return true;
            }
            return false;
        }

        if (notification.isTestEvent()) {
            logger.info("Discarding S3 test event");
            sqsService.deleteMessage(eventQueue, message);
            return true;
        }

        boolean redeliver = false;
        for (S3EventNotification.EventRecord record : notification.getRecords()) {
            ImageRef image = toImageRef(record);
            if (image == null) {
                continue;
            }

            try {
                OrchestrationRecord started = orchestrator.startOrchestration(image);
                if (started.getStatus() == OrchestrationStatus.FAILED) {
                    if (finalReceive) {
                        logger.error("Giving up on {} after {} receives: {}",
                                image.getBlobPath(), receives, started.getFailureReason());
                    } else {
                        redeliver = true;
                    }
                }
            } catch (RuntimeException e) {
                logger.warn("Could not start orchestration for {}: {}", image.getBlobPath(), e.getMessage());
                redeliver = true;
            }
        }

        if (redeliver) {
            logger.info("Leaving message {} for redelivery (receive {})", message.messageId(), receives);
            return false;
        }
        sqsService.deleteMessage(eventQueue, message);
        return true;
    }

    /**
     * Image ref for a created object under the prefix, or null if the record is not one.
     */
    ImageRef toImageRef(S3EventNotification.EventRecord record) {
        if (!record.isObjectCreated()) {
            logger.debug("Ignoring {} event", record.getEventName());
            return null;
        }
        String key = record.getDecodedKey();
        if (key == null || record.getS3().getBucket() == null || key.endsWith("/")) {
            logger.warn("Notification record without bucket or object key");
            return null;
        }
        if (!imagePrefix.isEmpty() && !key.startsWith(imagePrefix + "/")) {
            logger.debug("Ignoring {} outside prefix '{}'", key, imagePrefix);
            return null;
        }

        S3EventNotification.ObjectEntity object = record.getS3().getObject();
        return ImageRef.of(record.getS3().getBucket().getName(), key, object.getETag(),
                object.getSize(), eventTime(record));
    }

    private static Instant eventTime(S3EventNotification.EventRecord record) {
        if (record.getEventTime() == null) {
            return Instant.now();
        }
        try {
            return Instant.parse(record.getEventTime());
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable event time '{}'", record.getEventTime());
            return Instant.now();
        }
    }

    /**
     * Sleep helper
     */
    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
