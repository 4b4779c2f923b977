package com.imageanalysis.shared.store;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSortKey;

/**
 * DynamoDB row for a committed result. All results share one partition and
 * are keyed by image id within it.
 */
@DynamoDbBean
public class ResultSummaryItem {

    public static final String PARTITION = "ImageAnalysis";

    private String partitionKey;
    private String id;
    private String fileName;
    private String blobPath;

    /** ISO-8601 instant. */
    private String analyzedAt;

    private String status;

    /** JSON object of merged summary fields. */
    private String summary;

    /** JSON object of per-analyzer output. */
    private String analyses;

    /** JSON array of failed analyzer kinds. */
    private String failedAnalyzers;

    public ResultSummaryItem() {
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute("PartitionKey")
    public String getPartitionKey() {
        return partitionKey;
    }

    public void setPartitionKey(String partitionKey) {
        this.partitionKey = partitionKey;
    }

    @DynamoDbSortKey
    @DynamoDbAttribute("RowKey")
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @DynamoDbAttribute("FileName")
    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    @DynamoDbAttribute("BlobPath")
    public String getBlobPath() {
        return blobPath;
    }

    public void setBlobPath(String blobPath) {
        this.blobPath = blobPath;
    }

    @DynamoDbAttribute("AnalyzedAt")
    public String getAnalyzedAt() {
        return analyzedAt;
    }

    public void setAnalyzedAt(String analyzedAt) {
        this.analyzedAt = analyzedAt;
    }

    @DynamoDbAttribute("Status")
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @DynamoDbAttribute("Summary")
    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    @DynamoDbAttribute("Analyses")
    public String getAnalyses() {
        return analyses;
    }

    public void setAnalyses(String analyses) {
        this.analyses = analyses;
    }

    @DynamoDbAttribute("FailedAnalyzers")
    public String getFailedAnalyzers() {
        return failedAnalyzers;
    }

    public void setFailedAnalyzers(String failedAnalyzers) {
        this.failedAnalyzers = failedAnalyzers;
    }
}
