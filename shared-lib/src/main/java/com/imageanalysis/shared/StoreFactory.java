package com.imageanalysis.shared;

import com.imageanalysis.shared.service.S3Service;
import com.imageanalysis.shared.storage.ImageStorage;
import com.imageanalysis.shared.storage.LocalImageStorage;
import com.imageanalysis.shared.storage.S3ImageStorage;
import com.imageanalysis.shared.store.DynamoDbOrchestrationStateStore;
import com.imageanalysis.shared.store.DynamoDbResultStore;
import com.imageanalysis.shared.store.FileOrchestrationStateStore;
import com.imageanalysis.shared.store.FileResultStore;
import com.imageanalysis.shared.store.OrchestrationStateStore;
import com.imageanalysis.shared.store.ResultStore;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Builds the stores and image storage selected by configuration.
 * Clients are created lazily so the local backends never touch AWS.
 */
public class StoreFactory {

    // Config Keys
    public static final String STORE_BACKEND_KEY = "STORE_BACKEND";
    public static final String STORAGE_BACKEND_KEY = "STORAGE_BACKEND";
    public static final String AWS_REGION_KEY = "AWS_REGION";
    public static final String IMAGE_BUCKET_KEY = "IMAGE_BUCKET";
    public static final String IMAGE_PREFIX_KEY = "IMAGE_PREFIX";
    public static final String STATE_TABLE_KEY = "STATE_TABLE";
    public static final String RESULT_TABLE_KEY = "RESULT_TABLE";
    public static final String LOCAL_DATA_DIR_KEY = "LOCAL_DATA_DIR";

    private final AppConfig config;
    private final boolean awsStores;
    private final boolean s3Storage;
    private final Path localDataDir;

    private DynamoDbEnhancedClient enhancedClient;
    private S3Service s3Service;

    public StoreFactory(AppConfig config) {
        this.config = config;
        this.awsStores = isBackend(config.getOptional(STORE_BACKEND_KEY, "local"), "dynamodb");
        this.s3Storage = isBackend(config.getOptional(STORAGE_BACKEND_KEY, "local"), "s3");
        this.localDataDir = Paths.get(config.getOptional(LOCAL_DATA_DIR_KEY, "data"));
    }

    private static boolean isBackend(String value, String awsName) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals(awsName)) {
            return true;
        }
        if (normalized.equals("local")) {
            return false;
        }
        throw new RuntimeException("Unknown backend '" + value + "', expected '" + awsName + "' or 'local'");
    }

    public OrchestrationStateStore createStateStore() {
        if (awsStores) {
            DynamoDbOrchestrationStateStore store = DynamoDbOrchestrationStateStore.create(
                    enhancedClient(), config.getOptional(STATE_TABLE_KEY, "ImageOrchestrations"));
            store.ensureTableExists();
            return store;
        }
        return new FileOrchestrationStateStore(localDataDir.resolve("orchestrations"));
    }

    public ResultStore createResultStore() {
        if (awsStores) {
            DynamoDbResultStore store = DynamoDbResultStore.create(
                    enhancedClient(), config.getOptional(RESULT_TABLE_KEY, "ImageAnalysisResults"));
            store.ensureTableExists();
            return store;
        }
        return new FileResultStore(localDataDir.resolve("results"));
    }

    public ImageStorage createImageStorage() {
        if (s3Storage) {
            return new S3ImageStorage(s3Service());
        }
        return new LocalImageStorage(localImageRoot());
    }

    public S3Service s3Service() {
        if (s3Service == null) {
            s3Service = new S3Service(AwsClientFactory.createS3Client(awsRegion()),
                    config.getString(IMAGE_BUCKET_KEY));
        }
        return s3Service;
    }

    /**
     * Directory for everything this process keeps on local disk.
     */
    public Path localDataDir() {
        return localDataDir;
    }

    /**
     * Root of local image storage; keys are relative to it (e.g. images/cat.jpg).
     */
    public Path localImageRoot() {
        return localDataDir.resolve("blobs");
    }

    /**
     * Key prefix under which new images are picked up, without slashes at either end.
     */
    public String imagePrefix() {
        String prefix = config.getOptional(IMAGE_PREFIX_KEY, "images").trim();
        while (prefix.startsWith("/")) {
            prefix = prefix.substring(1);
        }
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
        return prefix;
    }

    public String awsRegion() {
        return config.getString(AWS_REGION_KEY);
    }

    public boolean isS3Storage() {
        return s3Storage;
    }

    private DynamoDbEnhancedClient enhancedClient() {
        if (enhancedClient == null) {
            enhancedClient = AwsClientFactory.createEnhancedClient(
                    AwsClientFactory.createDynamoDbClient(awsRegion()));
        }
        return enhancedClient;
    }
}
