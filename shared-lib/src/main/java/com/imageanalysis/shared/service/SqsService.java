package com.imageanalysis.shared.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imageanalysis.shared.json.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sqs.SqsClient;
import software.amazon.awssdk.services.sqs.model.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SQS operations used by the event listener.
 */
public class SqsService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SqsService.class);

    private static final String RECEIVE_COUNT_ATTRIBUTE = "ApproximateReceiveCount";

    private final SqsClient sqsClient;
    private final ObjectMapper objectMapper;
    private final Map<String, String> queueUrlCache;

    public SqsService(SqsClient sqsClient) {
        this.sqsClient = sqsClient;
        this.objectMapper = Json.mapper();
        this.queueUrlCache = new ConcurrentHashMap<>();
    }

    /**
     * Gets the queue URL, caching it for future use.
     */
    public String getQueueUrl(String queueName) {
        return queueUrlCache.computeIfAbsent(queueName, name -> {
            try {
                GetQueueUrlRequest request = GetQueueUrlRequest.builder()
                        .queueName(name)
                        .build();

                GetQueueUrlResponse response = sqsClient.getQueueUrl(request);
                logger.debug("Resolved queue URL for {}: {}", name, response.queueUrl());
                return response.queueUrl();
            } catch (QueueDoesNotExistException e) {
                logger.error("Queue does not exist: {}", name);
                throw new RuntimeException("Queue not found: " + name, e);
            }
        });
    }

    /**
     * Creates a queue if it doesn't exist.
     */
    public String createQueueIfNotExists(String queueName, int visibilityTimeout, int waitTimeSeconds) {
        try {
            GetQueueUrlRequest getRequest = GetQueueUrlRequest.builder()
                    .queueName(queueName)
                    .build();

            String queueUrl = sqsClient.getQueueUrl(getRequest).queueUrl();
            logger.info("Queue '{}' exists", queueName);
            queueUrlCache.put(queueName, queueUrl);
            return queueUrl;

        } catch (QueueDoesNotExistException e) {
            logger.info("Creating queue '{}'...", queueName);

            CreateQueueRequest createRequest = CreateQueueRequest.builder()
                    .queueName(queueName)
                    .attributes(Map.of(
                            QueueAttributeName.VISIBILITY_TIMEOUT, String.valueOf(visibilityTimeout),
                            QueueAttributeName.RECEIVE_MESSAGE_WAIT_TIME_SECONDS, String.valueOf(waitTimeSeconds)))
                    .build();

            String queueUrl = sqsClient.createQueue(createRequest).queueUrl();
            logger.info("Queue '{}' created", queueName);
            queueUrlCache.put(queueName, queueUrl);
            return queueUrl;
        }
    }

    /**
     * Receives messages from a queue, including their receive count.
     */
    public List<Message> receiveMessages(String queueName, int maxMessages, int waitTimeSeconds,
            int visibilityTimeout) {
        String queueUrl = getQueueUrl(queueName);

        ReceiveMessageRequest request = ReceiveMessageRequest.builder()
                .queueUrl(queueUrl)
                .maxNumberOfMessages(maxMessages)
                .waitTimeSeconds(waitTimeSeconds)
                .visibilityTimeout(visibilityTimeout)
                .attributeNamesWithStrings(RECEIVE_COUNT_ATTRIBUTE)
                .build();

        return sqsClient.receiveMessage(request).messages();
    }

    /**
     * How many times SQS has handed out this message, 1 if unknown.
     */
    public static int receiveCount(Message message) {
        String count = message.attributesAsStrings().get(RECEIVE_COUNT_ATTRIBUTE);
        if (count == null) {
            return 1;
        }
        try {
            return Integer.parseInt(count);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    public void deleteMessage(String queueName, Message message) {
        String queueUrl = getQueueUrl(queueName);

        DeleteMessageRequest request = DeleteMessageRequest.builder()
                .queueUrl(queueUrl)
                .receiptHandle(message.receiptHandle())
                .build();

        sqsClient.deleteMessage(request);
        logger.debug("Deleted message {} from queue {}", message.messageId(), queueName);
    }

    /**
     * Parses a message body into the specified type.
     */
    public <T> T parseMessage(String messageBody, Class<T> clazz) {
        try {
            return objectMapper.readValue(messageBody, clazz);
        } catch (Exception e) {
            throw new RuntimeException("Failed to parse message", e);
        }
    }

    @Override
    public void close() {
        // Client lifecycle managed externally
        logger.debug("SqsService close called (client lifecycle managed externally)");
    }
}
