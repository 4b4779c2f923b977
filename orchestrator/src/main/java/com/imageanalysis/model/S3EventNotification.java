package com.imageanalysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of an S3 event notification delivered through SQS.
 * Only the fields needed to locate the new object are mapped.
 */
public class S3EventNotification {

    public static final String TEST_EVENT = "s3:TestEvent";

    @JsonProperty("Records")
    private List<EventRecord> records;

    @JsonProperty("Event")
    private String event;

    public S3EventNotification() {
    }

    public S3EventNotification(List<EventRecord> records) {
        this.records = records;
    }

    public List<EventRecord> getRecords() {
        return records != null ? records : new ArrayList<>();
    }

    public void setRecords(List<EventRecord> records) {
        this.records = records;
    }

    public String getEvent() {
        return event;
    }

    public void setEvent(String event) {
        this.event = event;
    }

    /**
     * S3 sends this once when the notification is configured.
     */
    @JsonIgnore
    public boolean isTestEvent() {
        return TEST_EVENT.equals(event);
    }

    public static class EventRecord {
        @JsonProperty("eventName")
        private String eventName;

        @JsonProperty("eventTime")
        private String eventTime;

        @JsonProperty("s3")
        private S3Entity s3;

        public EventRecord() {
        }

        public EventRecord(String eventName, String eventTime, S3Entity s3) {
            this.eventName = eventName;
            this.eventTime = eventTime;
            this.s3 = s3;
        }

        public String getEventName() {
            return eventName;
        }

        public void setEventName(String eventName) {
            this.eventName = eventName;
        }

        public String getEventTime() {
            return eventTime;
        }

        public void setEventTime(String eventTime) {
            this.eventTime = eventTime;
        }

        public S3Entity getS3() {
            return s3;
        }

        public void setS3(S3Entity s3) {
            this.s3 = s3;
        }

        @JsonIgnore
        public boolean isObjectCreated() {
            return eventName != null && eventName.startsWith("ObjectCreated");
        }

        /**
         * Object key as uploaded. S3 URL-encodes keys in notifications, spaces as '+'.
         */
        @JsonIgnore
        public String getDecodedKey() {
            if (s3 == null || s3.getObject() == null || s3.getObject().getKey() == null) {
                return null;
            }
            return URLDecoder.decode(s3.getObject().getKey(), StandardCharsets.UTF_8);
        }
    }

    public static class S3Entity {
        @JsonProperty("bucket")
        private BucketEntity bucket;

        @JsonProperty("object")
        private ObjectEntity object;

        public S3Entity() {
        }

        public S3Entity(BucketEntity bucket, ObjectEntity object) {
            this.bucket = bucket;
            this.object = object;
        }

        public BucketEntity getBucket() {
            return bucket;
        }

        public void setBucket(BucketEntity bucket) {
            this.bucket = bucket;
        }

        public ObjectEntity getObject() {
            return object;
        }

        public void setObject(ObjectEntity object) {
            this.object = object;
        }
    }

    public static class BucketEntity {
        @JsonProperty("name")
        private String name;

        public BucketEntity() {
        }

        public BucketEntity(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }

    public static class ObjectEntity {
        @JsonProperty("key")
        private String key;

        @JsonProperty("size")
        private long size;

        @JsonProperty("eTag")
        private String eTag;

        public ObjectEntity() {
        }

        public ObjectEntity(String key, long size, String eTag) {
            this.key = key;
            this.size = size;
            this.eTag = eTag;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public long getSize() {
            return size;
        }

        public void setSize(long size) {
            this.size = size;
        }

        @JsonProperty("eTag")
        public String getETag() {
            return eTag;
        }

        @JsonProperty("eTag")
        public void setETag(String eTag) {
            this.eTag = eTag;
        }
    }
}
