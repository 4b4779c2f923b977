package com.imageanalysis.shared.storage;

import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.service.S3Service;
import com.imageanalysis.shared.store.StoreException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;

public class S3ImageStorage implements ImageStorage {

    private final S3Service s3Service;

    public S3ImageStorage(S3Service s3Service) {
        this.s3Service = s3Service;
    }

    @Override
    public ObjectInfo probe(ImageRef image) throws ImageUnreadableException {
        requireBucket(image);
        try {
            HeadObjectResponse head = s3Service.headObject(image.getKey());
            long size = head.contentLength() != null ? head.contentLength() : image.getSizeBytes();
            return new ObjectInfo(size, head.eTag(), head.contentType());
        } catch (NoSuchKeyException e) {
            throw new ImageUnreadableException("Image not found: " + image.getBlobPath(), e);
        } catch (S3Exception e) {
            // 403/404 mean the object is not readable for us; anything else is infrastructure
            if (e.statusCode() == 404 || e.statusCode() == 403) {
                throw new ImageUnreadableException(
                        "Image not readable (" + e.statusCode() + "): " + image.getBlobPath(), e);
            }
            throw new StoreException("S3 probe failed for " + image.getBlobPath(), e);
        } catch (SdkException e) {
            throw new StoreException("S3 probe failed for " + image.getBlobPath(), e);
        }
    }

    @Override
    public byte[] read(ImageRef image) throws IOException {
        try {
            return s3Service.downloadBytes(image.getKey());
        } catch (SdkException e) {
            throw new IOException("Failed to download " + image.getBlobPath() + ": " + e.getMessage(), e);
        }
    }

    private void requireBucket(ImageRef image) throws ImageUnreadableException {
        if (!s3Service.getBucketName().equals(image.getBucket())) {
            throw new ImageUnreadableException("Image " + image.getBlobPath()
                    + " is outside the configured bucket " + s3Service.getBucketName());
        }
    }
}
