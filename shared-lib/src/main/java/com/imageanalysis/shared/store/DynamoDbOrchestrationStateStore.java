package com.imageanalysis.shared.store;

import com.imageanalysis.shared.json.Json;
import com.imageanalysis.shared.model.OrchestrationRecord;
import com.imageanalysis.shared.model.OrchestrationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.GetItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.PutItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Orchestration state in a DynamoDB table keyed by image id.
 * Creation, saves and claims are conditional writes, which is what keeps two
 * processes from driving the same orchestration.
 */
public class DynamoDbOrchestrationStateStore implements OrchestrationStateStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbOrchestrationStateStore.class);

    private final DynamoDbTable<OrchestrationStateItem> table;
    private final Clock clock;

    public DynamoDbOrchestrationStateStore(DynamoDbTable<OrchestrationStateItem> table, Clock clock) {
        this.table = table;
        this.clock = clock;
    }

    public static DynamoDbOrchestrationStateStore create(DynamoDbEnhancedClient client, String tableName) {
        return new DynamoDbOrchestrationStateStore(
                client.table(tableName, TableSchema.fromBean(OrchestrationStateItem.class)),
                Clock.systemUTC());
    }

    /**
     * Creates the table if necessary.
     */
    public void ensureTableExists() {
        try {
            table.createTable();
            logger.info("Created table {}", table.tableName());
        } catch (ResourceInUseException e) {
            logger.info("Table exists: {}", table.tableName());
        }
    }

    @Override
    public boolean create(OrchestrationRecord record) {
        Expression notExists = Expression.builder()
                .expression("attribute_not_exists(imageId)")
                .build();
        try {
            put(toItem(record), notExists);
            return true;
        } catch (ConditionalCheckFailedException e) {
            logger.debug("Orchestration {} already exists", record.getImageId());
            return false;
        }
    }

    @Override
    public void save(OrchestrationRecord record) {
        Expression ownedByCaller = Expression.builder()
                .expression("attribute_exists(imageId) AND #owner = :owner")
                .putExpressionName("#owner", "owner")
                .putExpressionValue(":owner", AttributeValue.builder().s(record.getOwner()).build())
                .build();
        try {
            put(toItem(record), ownedByCaller);
        } catch (ConditionalCheckFailedException e) {
            throw new LeaseLostException(record.getImageId(), record.getOwner());
        }
    }

    @Override
    public Optional<OrchestrationRecord> load(String imageId) {
        return loadItem(imageId).map(DynamoDbOrchestrationStateStore::fromItem);
    }

    @Override
    public List<OrchestrationRecord> listIncomplete() {
        Expression notCompleted = Expression.builder()
                .expression("#status <> :completed")
                .putExpressionName("#status", "status")
                .putExpressionValue(":completed",
                        AttributeValue.builder().s(OrchestrationStatus.COMPLETED.name()).build())
                .build();
        try {
            return table.scan(ScanEnhancedRequest.builder()
                            .filterExpression(notCompleted)
                            .consistentRead(true)
                            .build())
                    .items()
                    .stream()
                    .map(DynamoDbOrchestrationStateStore::fromItem)
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            throw new StoreException("Failed to scan " + table.tableName(), e);
        }
    }

    @Override
    public boolean claim(String imageId, String owner, Duration lease) {
        Optional<OrchestrationStateItem> stored = loadItem(imageId);
        if (stored.isEmpty() || !OrchestrationStatus.RUNNING.name().equals(stored.get().getStatus())) {
            return false;
        }
        OrchestrationRecord record = fromItem(stored.get());
        Instant now = clock.instant();
        if (!owner.equals(record.getOwner()) && !record.isLeaseExpired(now)) {
            logger.debug("Orchestration {} is leased by {} until {}",
                    imageId, record.getOwner(), record.getLeaseExpiresAt());
            return false;
        }

        long expectedVersion = stored.get().getVersion() != null ? stored.get().getVersion() : 0L;
        record.renewLease(owner, now.plus(lease));
        Expression unchanged = Expression.builder()
                .expression("#version = :expected")
                .putExpressionName("#version", "version")
                .putExpressionValue(":expected", AttributeValue.builder().n(Long.toString(expectedVersion)).build())
                .build();
        try {
            put(toItem(record), unchanged);
            return true;
        } catch (ConditionalCheckFailedException e) {
            logger.debug("Lost claim race for orchestration {}", imageId);
            return false;
        }
    }

    @Override
    public void delete(String imageId) {
        try {
            table.deleteItem(Key.builder().partitionValue(imageId).build());
        } catch (SdkException e) {
            throw new StoreException("Failed to delete orchestration " + imageId, e);
        }
    }

    private void put(OrchestrationStateItem item, Expression condition) {
        try {
            table.putItem(PutItemEnhancedRequest.builder(OrchestrationStateItem.class)
                    .item(item)
                    .conditionExpression(condition)
                    .build());
        } catch (ConditionalCheckFailedException e) {
            throw e;
        } catch (SdkException e) {
            throw new StoreException("Failed to write orchestration " + item.getImageId(), e);
        }
    }

    private Optional<OrchestrationStateItem> loadItem(String imageId) {
        try {
            return Optional.ofNullable(table.getItem(GetItemEnhancedRequest.builder()
                    .key(Key.builder().partitionValue(imageId).build())
                    .consistentRead(true)
                    .build()));
        } catch (SdkException e) {
            throw new StoreException("Failed to load orchestration " + imageId, e);
        }
    }

    static OrchestrationStateItem toItem(OrchestrationRecord record) {
        OrchestrationStateItem item = new OrchestrationStateItem();
        item.setImageId(record.getImageId());
        item.setStatus(record.getStatus().name());
        item.setOwner(record.getOwner());
        item.setLeaseExpiresAt(record.getLeaseExpiresAt() != null ? record.getLeaseExpiresAt().toEpochMilli() : null);
        item.setVersion(record.getVersion());
        item.setPayload(Json.toJson(record));
        return item;
    }

    static OrchestrationRecord fromItem(OrchestrationStateItem item) {
        return Json.fromJson(item.getPayload(), OrchestrationRecord.class);
    }
}
