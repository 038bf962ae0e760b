package io.lion.spring;

import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.AliasFor;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers every {@link io.lion.integration.EventMapper} and
 * {@link io.lion.integration.FlexibleEventMapper} found in the given packages as prototype beans.
 *
 * <h2>Scan the annotated class's package</h2>
 * <pre>{@code
 * @Configuration
 * @EnableEventMappers
 * public class MappingConfiguration { }
 * }</pre>
 *
 * <h2>Explicit packages</h2>
 * <pre>{@code
 * @Configuration
 * @EnableEventMappers(basePackageClasses = UserCreatedEventMapper.class, basePackages = "com.acme.orders")
 * public class MappingConfiguration { }
 * }</pre>
 *
 * <p>Package resolution rules:
 * <ul>
 *   <li>{@code basePackages} and {@code basePackageClasses} are combined</li>
 *   <li>If both are empty, the package of the annotated class is scanned</li>
 * </ul>
 *
 * @see EventMapperBeanRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(EventMappersImportRegistrar.class)
public @interface EnableEventMappers {

    /**
     * Alias for {@link #basePackages()}.
     */
    @AliasFor("basePackages")
    String[] value() default {};

    /**
     * Packages to scan, including sub-packages.
     */
    @AliasFor("value")
    String[] basePackages() default {};

    /**
     * Classes whose packages are scanned.
     */
    Class<?>[] basePackageClasses() default {};
}
