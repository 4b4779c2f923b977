package com.imageanalysis.shared.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.*;

import java.nio.file.Path;

/**
 * S3 operations against a single bucket.
 */
public class S3Service implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(S3Service.class);

    private final S3Client s3Client;
    private final String bucketName;

    public S3Service(S3Client s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
    }

    /**
     * Uploads a local file to S3.
     */
    public String uploadFile(Path localPath, String key, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .contentType(contentType)
                .build();

        s3Client.putObject(request, RequestBody.fromFile(localPath));
        logger.info("Uploaded {} to s3://{}/{}", localPath, bucketName, key);
        return key;
    }

    /**
     * Metadata probe; does not transfer the object body.
     * Throws NoSuchKeyException (or S3Exception with 404) when the object is missing.
     */
    public HeadObjectResponse headObject(String key) {
        HeadObjectRequest request = HeadObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();
        return s3Client.headObject(request);
    }

    /**
     * Downloads an object into memory.
     */
    public byte[] downloadBytes(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucketName)
                .key(key)
                .build();

        ResponseBytes<GetObjectResponse> response = s3Client.getObjectAsBytes(request);
        byte[] bytes = response.asByteArray();
        logger.debug("Downloaded s3://{}/{} ({} bytes)", bucketName, key, bytes.length);
        return bytes;
    }

    /**
     * Ensures the S3 bucket exists, creating it if necessary.
     */
    public void ensureBucketExists() {
        try {
            HeadBucketRequest request = HeadBucketRequest.builder()
                    .bucket(bucketName)
                    .build();

            s3Client.headBucket(request);
            logger.info("Bucket exists: {}", bucketName);

        } catch (NoSuchBucketException e) {
            logger.info("Creating bucket: {}", bucketName);

            CreateBucketRequest createRequest = CreateBucketRequest.builder()
                    .bucket(bucketName)
                    .build();

            s3Client.createBucket(createRequest);
            logger.info("Bucket created: {}", bucketName);
        }
    }

    public String getBucketName() {
        return bucketName;
    }

    @Override
    public void close() {
        // Client lifecycle managed by whoever created it
        logger.debug("S3Service close called (client lifecycle managed externally)");
    }
}
