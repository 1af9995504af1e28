package io.github.hunghhdev.fetchcache.spring;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hunghhdev.fetchcache.core.CacheEventListener;
import io.github.hunghhdev.fetchcache.fetch.EntitySources;
import io.github.hunghhdev.fetchcache.fetch.FetchOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the fetch cache.
 * Creates a {@link FetchOrchestrator} when the application defines an {@link EntitySources} bean.
 */
@AutoConfiguration
@ConditionalOnClass(FetchOrchestrator.class)
@ConditionalOnProperty(prefix = "fetchcache", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FetchCacheProperties.class)
public class FetchCacheAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(FetchCacheAutoConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    @ConditionalOnBean(EntitySources.class)
    public FetchOrchestrator fetchOrchestrator(EntitySources entitySources,
                                               FetchCacheProperties properties,
                                               ObjectProvider<CacheEventListener> eventListeners,
                                               ObjectProvider<ObjectMapper> objectMapper) {
        logger.info("Auto-configuring FetchOrchestrator with default TTL: {}, max entries: {}, sources: {}",
                properties.getDefaultTtl(), properties.getMaxCacheEntries(), entitySources.registeredTypes());

        FetchOrchestrator.Builder builder = properties.applyTo(FetchOrchestrator.builder())
                .sources(entitySources);
        eventListeners.orderedStream().forEach(builder::eventListener);
        ObjectMapper mapper = objectMapper.getIfAvailable();
        if (mapper != null) {
            builder.objectMapper(mapper);
        }
        return builder.build();
    }
}
