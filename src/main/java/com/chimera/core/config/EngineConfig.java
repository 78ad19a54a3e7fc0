package com.chimera.core.config;

import com.chimera.core.catalog.AbilityCatalog;
import com.chimera.core.catalog.CatalogLoader;
import com.chimera.core.executor.ExecutorRegistry;
import com.chimera.core.executor.OutputInterpreter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the engine's shared, read-only collaborators.
 */
@Configuration
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AbilityCatalog abilityCatalog(ChimeraProperties properties, ObjectMapper objectMapper,
                                         ExecutorRegistry executors, OutputInterpreter interpreter) {
        return new CatalogLoader(objectMapper, executors, interpreter)
                .load(Path.of(properties.getCatalogPath()));
    }
}
