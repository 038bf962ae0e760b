package io.lion.spring;

import io.lion.integration.EventMapper;
import io.lion.integration.FlexibleEventMapper;
import io.lion.registry.MapperKey;
import io.lion.registry.MapperRegistration;
import io.lion.registry.MapperRegistry;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.beans.factory.support.AbstractBeanDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link MapperRegistry} view over the mapper bean definitions of a Spring bean factory.
 *
 * <p>Lookups go through the bean name derived from the capability, so each resolution
 * returns a new prototype instance with its dependencies injected by Spring.
 *
 * @see EventMapperBeanRegistrar
 */
public final class BeanFactoryMapperRegistry implements MapperRegistry {

    private final ConfigurableListableBeanFactory beanFactory;

    public BeanFactoryMapperRegistry(ConfigurableListableBeanFactory beanFactory) {
        this.beanFactory = Objects.requireNonNull(beanFactory, "beanFactory");
    }

    @Override
    @SuppressWarnings("unchecked")
    public <N> Optional<EventMapper<N>> eventMapperFor(Class<N> notificationType) {
        return resolve(MapperKey.typed(notificationType)).map(mapper -> (EventMapper<N>) mapper);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <N> Optional<FlexibleEventMapper<N>> flexibleEventMapperFor(Class<N> notificationType) {
        return resolve(MapperKey.flexible(notificationType)).map(mapper -> (FlexibleEventMapper<N>) mapper);
    }

    @Override
    public List<MapperRegistration> registrations() {
        List<MapperRegistration> result = new ArrayList<>();
        for (String name : beanFactory.getBeanDefinitionNames()) {
            BeanDefinition definition = beanFactory.getBeanDefinition(name);
            if (definition.getAttribute(EventMapperBeanRegistrar.MAPPER_KEY_ATTRIBUTE) instanceof MapperKey key
                    && definition instanceof AbstractBeanDefinition abd
                    && abd.hasBeanClass()) {
                result.add(new MapperRegistration(key, abd.getBeanClass()));
            }
        }
        return List.copyOf(result);
    }

    private Optional<Object> resolve(MapperKey key) {
        String beanName = EventMapperBeanRegistrar.beanName(key);
        if (!beanFactory.containsBeanDefinition(beanName)) {
            return Optional.empty();
        }
        return Optional.of(beanFactory.getBean(beanName, key.kind().capability()));
    }
}
