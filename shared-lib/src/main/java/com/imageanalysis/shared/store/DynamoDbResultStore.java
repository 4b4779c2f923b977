package com.imageanalysis.shared.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.imageanalysis.shared.json.Json;
import com.imageanalysis.shared.model.AnalysisKind;
import com.imageanalysis.shared.model.ResultFilter;
import com.imageanalysis.shared.model.ResultStatus;
import com.imageanalysis.shared.model.ResultSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Results in a DynamoDB table: one partition, image id as the sort key.
 */
public class DynamoDbResultStore implements ResultStore {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbResultStore.class);

    private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Map<String, Object>>> ANALYSES = new TypeReference<>() {
    };
    private static final TypeReference<List<AnalysisKind>> KINDS = new TypeReference<>() {
    };

    private final DynamoDbTable<ResultSummaryItem> table;

    public DynamoDbResultStore(DynamoDbTable<ResultSummaryItem> table) {
        this.table = table;
    }

    public static DynamoDbResultStore create(DynamoDbEnhancedClient client, String tableName) {
        return new DynamoDbResultStore(client.table(tableName, TableSchema.fromBean(ResultSummaryItem.class)));
    }

    public void ensureTableExists() {
        try {
            table.createTable();
            logger.info("Created table {}", table.tableName());
        } catch (ResourceInUseException e) {
            logger.info("Table exists: {}", table.tableName());
        }
    }

    @Override
    public void upsert(ResultSummary summary) {
        try {
            table.putItem(toItem(summary));
            logger.debug("Stored result {}", summary.getId());
        } catch (SdkException e) {
            throw new StoreException("Failed to store result " + summary.getId(), e);
        }
    }

    @Override
    public Optional<ResultSummary> get(String id) {
        try {
            ResultSummaryItem item = table.getItem(Key.builder()
                    .partitionValue(ResultSummaryItem.PARTITION)
                    .sortValue(id)
                    .build());
            return Optional.ofNullable(item).map(DynamoDbResultStore::fromItem);
        } catch (SdkException e) {
            throw new StoreException("Failed to load result " + id, e);
        }
    }

    @Override
    public List<ResultSummary> list(int limit, ResultFilter filter) {
        QueryEnhancedRequest request = QueryEnhancedRequest.builder()
                .queryConditional(QueryConditional.keyEqualTo(Key.builder()
                        .partitionValue(ResultSummaryItem.PARTITION)
                        .build()))
                .build();
        try {
            return table.query(request)
                    .items()
                    .stream()
                    .map(DynamoDbResultStore::fromItem)
                    .filter(filter::matches)
                    .sorted(NEWEST_FIRST)
                    .limit(ResultStore.clampLimit(limit))
                    .collect(Collectors.toList());
        } catch (SdkException e) {
            throw new StoreException("Failed to query " + table.tableName(), e);
        }
    }

    static ResultSummaryItem toItem(ResultSummary summary) {
        ResultSummaryItem item = new ResultSummaryItem();
        item.setPartitionKey(ResultSummaryItem.PARTITION);
        item.setId(summary.getId());
        item.setFileName(summary.getFileName());
        item.setBlobPath(summary.getBlobPath());
        item.setAnalyzedAt(summary.getAnalyzedAt() != null ? summary.getAnalyzedAt().toString() : null);
        item.setStatus(summary.getStatus() != null ? summary.getStatus().name() : null);
        item.setSummary(Json.toJson(summary.getSummary()));
        item.setAnalyses(Json.toJson(summary.getAnalyses()));
        item.setFailedAnalyzers(Json.toJson(summary.getFailedAnalyzers()));
        return item;
    }

    static ResultSummary fromItem(ResultSummaryItem item) {
        return new ResultSummary(
                item.getId(),
                item.getFileName(),
                item.getBlobPath(),
                item.getAnalyzedAt() != null ? Instant.parse(item.getAnalyzedAt()) : null,
                item.getStatus() != null ? ResultStatus.valueOf(item.getStatus()) : null,
                item.getSummary() != null ? Json.fromJson(item.getSummary(), FIELDS) : null,
                item.getAnalyses() != null ? Json.fromJson(item.getAnalyses(), ANALYSES) : null,
                item.getFailedAnalyzers() != null ? Json.fromJson(item.getFailedAnalyzers(), KINDS) : null);
    }
}
