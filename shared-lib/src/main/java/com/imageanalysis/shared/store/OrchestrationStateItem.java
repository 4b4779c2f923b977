package com.imageanalysis.shared.store;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * DynamoDB row for one orchestration. Lease and status are top-level attributes
 * so conditions and scans can use them; the full record travels as JSON.
 */
@DynamoDbBean
public class OrchestrationStateItem {

    /** Partition key: image id. */
    private String imageId;

    /** RUNNING | COMPLETED | FAILED. */
    private String status;

    private String owner;

    /** Epoch millis. */
    private Long leaseExpiresAt;

    private Long version;

    /** Serialized OrchestrationRecord. */
    private String payload;

    public OrchestrationStateItem() {
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute("imageId")
    public String getImageId() {
        return imageId;
    }

    public void setImageId(String imageId) {
        this.imageId = imageId;
    }

    @DynamoDbAttribute("status")
    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @DynamoDbAttribute("owner")
    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    @DynamoDbAttribute("leaseExpiresAt")
    public Long getLeaseExpiresAt() {
        return leaseExpiresAt;
    }

    public void setLeaseExpiresAt(Long leaseExpiresAt) {
        this.leaseExpiresAt = leaseExpiresAt;
    }

    @DynamoDbAttribute("version")
    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    @DynamoDbAttribute("payload")
    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }
}
