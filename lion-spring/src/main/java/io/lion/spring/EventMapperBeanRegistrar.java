package io.lion.spring;

import io.lion.integration.EventMapper;
import io.lion.integration.FlexibleEventMapper;
import io.lion.registry.MapperConfigurationException;
import io.lion.registry.MapperKey;
import io.lion.registry.MapperRegistration;
import io.lion.registry.MapperTypeScanner;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.support.AbstractBeanDefinition;
import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.beans.factory.support.RootBeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.ResolvableType;
import org.springframework.core.env.EnvironmentCapable;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Scans packages for {@link EventMapper} and {@link FlexibleEventMapper} implementations and
 * registers them as prototype beans in a {@link BeanDefinitionRegistry}.
 *
 * <p>One bean definition is registered per capability instantiation, named after it
 * (e.g. {@code EventMapper<com.acme.UserCreatedNotification>}) and typed with the
 * generic capability, so mappers resolve by type:
 * <pre>{@code
 * ObjectProvider<EventMapper<UserCreatedNotification>> provider = beanFactory.getBeanProvider(
 *     ResolvableType.forClassWithGenerics(EventMapper.class, UserCreatedNotification.class));
 * }</pre>
 *
 * <p>Constructor arguments of a mapper are autowired.
 *
 * <p>A class implementing both capabilities yields two bean definitions. Registering a
 * capability that already has a definition replaces it (last write wins), including
 * when two overlapping scans find the same class.
 *
 * <h2>Entry points</h2>
 * <ul>
 *   <li>{@link #addEventMappers(BeanDefinitionRegistry, String...)} - explicit packages</li>
 *   <li>{@link #addEventMappers(BeanDefinitionRegistry)} - the calling class's package</li>
 *   <li>{@link #addEventMappersFromPackageOf(BeanDefinitionRegistry, Class)} - a marker class's package</li>
 *   <li>{@link EnableEventMappers} - annotation on a configuration class</li>
 * </ul>
 */
public final class EventMapperBeanRegistrar {

    /** Bean definition attribute holding the {@link MapperKey} of a registered mapper. */
    public static final String MAPPER_KEY_ATTRIBUTE = EventMapperBeanRegistrar.class.getName() + ".mapperKey";

    private static final Logger logger = Logger.getLogger(EventMapperBeanRegistrar.class.getName());

    private EventMapperBeanRegistrar() {
    }

    /**
     * Registers every mapper found in the given packages and their sub-packages.
     *
     * @param registry the registry to add bean definitions to
     * @param basePackages the packages to scan
     * @return {@code registry} for chaining
     * @throws MapperConfigurationException if no package is given
     */
    public static BeanDefinitionRegistry addEventMappers(BeanDefinitionRegistry registry, String... basePackages) {
        Objects.requireNonNull(registry, "registry");
        Set<String> packages = new LinkedHashSet<>();
        if (basePackages != null) {
            for (String basePackage : basePackages) {
                if (StringUtils.hasText(basePackage)) {
                    packages.add(basePackage.trim());
                }
            }
        }
        if (packages.isEmpty()) {
            throw new MapperConfigurationException("At least one base package must be provided");
        }

        List<Class<?>> candidates = findCandidates(registry, packages);
        List<MapperRegistration> registrations = MapperTypeScanner.scan(candidates);
        for (MapperRegistration registration : registrations) {
            register(registry, registration);
        }
        logger.info("Registered " + registrations.size() + " event mapper bean(s) from " + packages);
        return registry;
    }

    /**
     * Registers every mapper found in the package of the calling class.
     *
     * @param registry the registry to add bean definitions to
     * @return {@code registry} for chaining
     */
    public static BeanDefinitionRegistry addEventMappers(BeanDefinitionRegistry registry) {
        Class<?> caller = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE).getCallerClass();
        return addEventMappers(registry, ClassUtils.getPackageName(caller));
    }

    /**
     * Registers every mapper found in the package of a marker class.
     *
     * @param registry the registry to add bean definitions to
     * @param markerClass any class of the package to scan
     * @return {@code registry} for chaining
     */
    public static BeanDefinitionRegistry addEventMappersFromPackageOf(
            BeanDefinitionRegistry registry, Class<?> markerClass) {
        Objects.requireNonNull(markerClass, "markerClass");
        return addEventMappers(registry, ClassUtils.getPackageName(markerClass));
    }

    /**
     * Registers a single mapper as a prototype bean definition.
     *
     * @param registry the registry to add the bean definition to
     * @param registration the capability and implementing class
     * @return the bean name used
     */
    public static String register(BeanDefinitionRegistry registry, MapperRegistration registration) {
        MapperKey key = registration.key();
        String beanName = beanName(key);

        RootBeanDefinition definition = new RootBeanDefinition(registration.implementation());
        definition.setScope(BeanDefinition.SCOPE_PROTOTYPE);
        definition.setAutowireMode(AbstractBeanDefinition.AUTOWIRE_CONSTRUCTOR);
        definition.setTargetType(ResolvableType.forClassWithGenerics(key.kind().capability(), key.notificationType()));
        definition.setAttribute(MAPPER_KEY_ATTRIBUTE, key);

        if (registry.containsBeanDefinition(beanName)) {
            registry.removeBeanDefinition(beanName);
            logger.fine("Replacing bean definition " + beanName);
        }
        registry.registerBeanDefinition(beanName, definition);
        logger.fine("Registered " + registration);
        return beanName;
    }

    /**
     * Returns the bean name used for a capability instantiation.
     */
    public static String beanName(MapperKey key) {
        return key.toString();
    }

    private static List<Class<?>> findCandidates(BeanDefinitionRegistry registry, Set<String> packages) {
        ClassPathScanningCandidateComponentProvider provider = new ClassPathScanningCandidateComponentProvider(
                false,
                registry instanceof EnvironmentCapable ec ? ec.getEnvironment() : new StandardEnvironment());
        provider.addIncludeFilter(new AssignableTypeFilter(EventMapper.class));
        provider.addIncludeFilter(new AssignableTypeFilter(FlexibleEventMapper.class));
        if (registry instanceof ResourceLoader resourceLoader) {
            provider.setResourceLoader(resourceLoader);
        }
        ClassLoader classLoader = provider.getResourceLoader().getClassLoader();

        List<Class<?>> candidates = new ArrayList<>();
        for (String basePackage : packages) {
            for (BeanDefinition component : provider.findCandidateComponents(basePackage)) {
                String className = component.getBeanClassName();
                try {
                    candidates.add(ClassUtils.forName(className, classLoader));
                } catch (ClassNotFoundException | LinkageError e) {
                    throw new MapperConfigurationException("Failed to load event mapper class " + className, e);
                }
            }
        }
        return candidates;
    }
}
