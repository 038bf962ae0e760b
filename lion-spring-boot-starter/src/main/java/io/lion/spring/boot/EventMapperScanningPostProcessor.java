package io.lion.spring.boot;

import io.lion.registry.MapperConfigurationException;
import io.lion.spring.EventMapperBeanRegistrar;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.BeanDefinitionRegistryPostProcessor;
import org.springframework.boot.autoconfigure.AutoConfigurationPackages;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.core.env.Environment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scans the configured packages for event mappers before any bean is instantiated.
 *
 * <p>Packages come from {@code lion.mappers.base-packages}; when that is empty the
 * application's {@link AutoConfigurationPackages} are used. Properties are bound from the
 * {@link Environment} directly because this post-processor runs before
 * {@code @ConfigurationProperties} beans exist.
 */
public class EventMapperScanningPostProcessor implements BeanDefinitionRegistryPostProcessor {

    private final Environment environment;

    public EventMapperScanningPostProcessor(Environment environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public void postProcessBeanDefinitionRegistry(BeanDefinitionRegistry registry) throws BeansException {
        List<String> packages = resolvePackages(registry);
        if (packages.isEmpty()) {
            throw new MapperConfigurationException(
                    "No packages to scan for event mappers: set lion.mappers.base-packages "
                            + "or annotate the application with @SpringBootApplication");
        }
        EventMapperBeanRegistrar.addEventMappers(registry, packages.toArray(new String[0]));
    }

    private List<String> resolvePackages(BeanDefinitionRegistry registry) {
        LionProperties properties = Binder.get(environment)
                .bind("lion", LionProperties.class)
                .orElseGet(LionProperties::new);
        List<String> packages = new ArrayList<>(properties.getMappers().getBasePackages());
        if (packages.isEmpty() && registry instanceof BeanFactory beanFactory
                && AutoConfigurationPackages.has(beanFactory)) {
            packages.addAll(AutoConfigurationPackages.get(beanFactory));
        }
        return packages;
    }
}
