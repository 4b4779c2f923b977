package com.imageanalysis;

import com.imageanalysis.shared.AppConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

/**
 * Lease owner id of this node. It must survive restarts, otherwise a restarted
 * node waits for its own leases to expire before it can resume them.
 */
public final class NodeIdentity {

    private static final Logger logger = LoggerFactory.getLogger(NodeIdentity.class);

    // Config Keys
    public static final String NODE_ID_KEY = "NODE_ID";

    static final String NODE_ID_FILE = "node-id";

    private NodeIdentity() {
    }

    /**
     * NODE_ID if configured, else the id stored under the data directory,
     * generated and stored on first use.
     */
    public static String resolve(AppConfig config, Path dataDir) throws IOException {
        String configured = config.getOptional(NODE_ID_KEY, "").trim();
        if (!configured.isEmpty()) {
            return configured;
        }

        Path file = dataDir.resolve(NODE_ID_FILE);
        if (Files.exists(file)) {
            String stored = Files.readString(file, StandardCharsets.UTF_8).trim();
            if (!stored.isEmpty()) {
                return stored;
            }
        }

        String generated = hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        Files.createDirectories(dataDir);
        Files.writeString(file, generated, StandardCharsets.UTF_8);
        logger.info("Generated node id {} at {}", generated, file.toAbsolutePath());
        return generated;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown-host";
        }
    }
}
