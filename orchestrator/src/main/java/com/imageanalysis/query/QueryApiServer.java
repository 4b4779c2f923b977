package com.imageanalysis.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ApplicationContextInitializer;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Embedded web server for the query API. Lives inside the orchestrator process
 * and shares its result store.
 */
public class QueryApiServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryApiServer.class);

    private final QueryService queryService;
    private final int port;

    private ConfigurableApplicationContext context;

    /**
     * @param port listening port, 0 for any free port
     */
    public QueryApiServer(QueryService queryService, int port) {
        this.queryService = queryService;
        this.port = port;
    }

    public void start() {
        ApplicationContextInitializer<ConfigurableApplicationContext> registerQueryService =
                ctx -> ctx.getBeanFactory().registerSingleton("queryService", queryService);

        context = new SpringApplicationBuilder(QueryApiApplication.class)
                .web(WebApplicationType.SERVLET)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .registerShutdownHook(false)
                .initializers(registerQueryService)
                .properties("server.port=" + port)
                .run();

        logger.info("Query API listening on port {}", getPort());
    }

    public int getPort() {
        if (context == null) {
            throw new IllegalStateException("Query API not started");
        }
        return ((WebServerApplicationContext) context).getWebServer().getPort();
    }

    @Override
    public void close() {
        if (context != null) {
            context.close();
            context = null;
            logger.info("Query API stopped");
        }
    }
}
