package com.imageanalysis.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.imageanalysis.shared.json.Json;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot configuration of the query API. The {@link QueryService} bean is
 * registered by {@link QueryApiServer} before the context refreshes.
 */
@SpringBootApplication
public class QueryApiApplication {

    /**
     * Same mapper as the stores, so HTTP bodies match what is persisted.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return Json.mapper();
    }
}
