package com.architecture.design.nodeforge.config;

import com.architecture.design.nodeforge.dto.style.StyleMappingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default style mapping switches, read from {@code nodeforge.style.*} in application.yml.
 * A request carrying its own {@code styleConfig} overrides these for that run.
 */
@Configuration
@Slf4j
public class StyleMappingConfiguration {

    @Value("${nodeforge.style.use-variables:true}")
    private boolean useVariables;

    @Value("${nodeforge.style.fallback-to-direct-values:true}")
    private boolean fallbackToDirectValues;

    @Value("${nodeforge.style.collection-prefix:Default}")
    private String collectionPrefix;

    @Value("${nodeforge.style.prefer-multi-mode:false}")
    private boolean preferMultiMode;

    @Bean
    public StyleMappingConfig styleMappingConfig() {
        log.info("[Style Config] useVariables={}, fallbackToDirectValues={}, collectionPrefix={}, preferMultiMode={}",
                useVariables, fallbackToDirectValues, collectionPrefix, preferMultiMode);

        return StyleMappingConfig.builder()
                .useVariables(useVariables)
                .fallbackToDirectValues(fallbackToDirectValues)
                .collectionPrefix(collectionPrefix)
                .preferMultiMode(preferMultiMode)
                .build();
    }
}
