package com.imageanalysis;

import com.imageanalysis.shared.AppConfig;
import com.imageanalysis.shared.StoreFactory;
import com.imageanalysis.shared.json.Json;
import com.imageanalysis.shared.model.ImageRef;
import com.imageanalysis.shared.model.ResultFilter;
import com.imageanalysis.shared.model.ResultListResponse;
import com.imageanalysis.shared.model.ResultSummary;
import com.imageanalysis.shared.service.S3Service;
import com.imageanalysis.shared.storage.LocalImageStorage;
import com.imageanalysis.shared.store.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

/**
 * Local Application main class
 *
 * Usage:
 * <pre>
 *   java -jar local-app.jar upload &lt;imageFile&gt;
 *   java -jar local-app.jar results [limit]
 *   java -jar local-app.jar result &lt;id&gt;
 * </pre>
 */
public class LocalApp {

    private static final Logger logger = LoggerFactory.getLogger(LocalApp.class);

    private static final int DEFAULT_LIMIT = 10;

    private final StoreFactory storeFactory;
    private final PrintStream out;

    private ResultStore resultStore;

    public LocalApp(AppConfig config, PrintStream out) {
        this.storeFactory = new StoreFactory(config);
        this.out = out;
    }

    /**
     * Puts an image where the orchestrator picks it up.
     *
     * @return the id its result will be stored under
     */
    public String upload(Path imageFile) throws IOException {
        if (!Files.isRegularFile(imageFile)) {
            throw new IOException("Image file not found: " + imageFile);
        }
        String fileName = imageFile.getFileName().toString();
        String prefix = storeFactory.imagePrefix();
        String key = prefix.isEmpty() ? fileName : prefix + "/" + fileName;

        String id;
        if (storeFactory.isS3Storage()) {
            S3Service s3Service = storeFactory.s3Service();
            s3Service.ensureBucketExists();
            String contentType = Files.probeContentType(imageFile);
            s3Service.uploadFile(imageFile, key, contentType != null ? contentType : "application/octet-stream");
            HeadObjectResponse head = s3Service.headObject(key);
            id = ImageRef.idFor(s3Service.getBucketName(), key, head.eTag());
        } else {
            LocalImageStorage storage = new LocalImageStorage(storeFactory.localImageRoot());
            Path target = storage.getRoot().resolve(key);
            Files.createDirectories(target.getParent());
            // The poller skips dot files, so it never sees a half-written image
            Path partial = target.resolveSibling("." + fileName + ".uploading");
            try {
                Files.copy(imageFile, partial, StandardCopyOption.REPLACE_EXISTING);
                Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(partial);
            }
            id = storage.refFor(target).getId();
        }

        logger.info("Uploaded {} as {}", imageFile, key);
        out.println("Uploaded " + fileName + " (id: " + id + ")");
        return id;
    }

    public void printResults(int limit) {
        List<ResultSummary> results = resultStore().list(limit, ResultFilter.none());
        out.println(Json.toPrettyJson(ResultListResponse.of(results)));
    }

    /**
     * @return false if no result exists for the id
     */
    public boolean printResult(String id) {
        Optional<ResultSummary> result = resultStore().get(id);
        if (result.isEmpty()) {
            out.println("Result not found: " + id);
            return false;
        }
        out.println(Json.toPrettyJson(result.get()));
        return true;
    }

    private ResultStore resultStore() {
        if (resultStore == null) {
            resultStore = storeFactory.createResultStore();
        }
        return resultStore;
    }

    private static void printUsage() {
        System.err.println("Usage:");
        System.err.println("  java -jar local-app.jar upload <imageFile>");
        System.err.println("  java -jar local-app.jar results [limit]");
        System.err.println("  java -jar local-app.jar result <id>");
    }

    /**
     * Main entry point
     */
    public static void main(String[] args) {
        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }

        try {
            LocalApp app = new LocalApp(new AppConfig(), System.out);
            String command = args[0];

            if (command.equals("upload") && args.length == 2) {
                app.upload(Paths.get(args[1]));
            } else if (command.equals("results") && args.length <= 2) {
                int limit = args.length == 2 ? Integer.parseInt(args[1]) : DEFAULT_LIMIT;
                app.printResults(limit);
            } else if (command.equals("result") && args.length == 2) {
                if (!app.printResult(args[1])) {
                    System.exit(2);
                }
            } else {
                printUsage();
                System.exit(1);
            }

        } catch (NumberFormatException e) {
            System.err.println("Invalid limit: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            logger.error("Local application failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }
}
