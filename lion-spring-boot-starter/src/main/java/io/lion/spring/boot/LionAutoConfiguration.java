package io.lion.spring.boot;

import io.lion.integration.EventMapper;
import io.lion.registry.MapperRegistry;
import io.lion.spring.BeanFactoryMapperRegistry;

import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

/**
 * Auto-configuration for Lion event mappers.
 *
 * <p>Registers every {@link EventMapper} and {@link io.lion.integration.FlexibleEventMapper}
 * found in the application's packages as prototype beans, and exposes them through a
 * {@link MapperRegistry}. Disable with {@code lion.mappers.enabled=false}.
 *
 * @see LionProperties
 * @see EventMapperScanningPostProcessor
 */
@AutoConfiguration
@ConditionalOnClass(EventMapper.class)
@ConditionalOnProperty(prefix = "lion.mappers", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LionProperties.class)
public class LionAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public static EventMapperScanningPostProcessor eventMapperScanningPostProcessor(Environment environment) {
        return new EventMapperScanningPostProcessor(environment);
    }

    @Bean
    @ConditionalOnMissingBean
    public MapperRegistry mapperRegistry(ConfigurableListableBeanFactory beanFactory) {
        return new BeanFactoryMapperRegistry(beanFactory);
    }
}
