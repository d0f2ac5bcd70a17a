package com.tracelake.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracelake.storage.manifest.DatasetHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binds the configured dataset root to the handle shared by the services
 */
@Configuration
public class DatasetConfig {
    private static final Logger logger = LoggerFactory.getLogger(DatasetConfig.class);

    @Bean
    public DatasetHandle datasetHandle(TraceLakeSettings settings, ObjectMapper objectMapper) {
        DatasetHandle handle = new DatasetHandle(settings.getDatasetRoot(), objectMapper);
        logger.info("Dataset root: {}", handle.getLayout().root());
        return handle;
    }
}
