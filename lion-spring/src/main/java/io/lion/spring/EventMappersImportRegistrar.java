package io.lion.spring;

import org.springframework.beans.factory.support.BeanDefinitionRegistry;
import org.springframework.context.annotation.ImportBeanDefinitionRegistrar;
import org.springframework.core.annotation.AnnotationAttributes;
import org.springframework.core.type.AnnotationMetadata;
import org.springframework.util.ClassUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Resolves the packages of {@link EnableEventMappers} and hands them to
 * {@link EventMapperBeanRegistrar}.
 */
class EventMappersImportRegistrar implements ImportBeanDefinitionRegistrar {

    @Override
    public void registerBeanDefinitions(AnnotationMetadata metadata, BeanDefinitionRegistry registry) {
        AnnotationAttributes attributes = AnnotationAttributes.fromMap(
                metadata.getAnnotationAttributes(EnableEventMappers.class.getName()));
        if (attributes == null) {
            return;
        }

        Set<String> packages = new LinkedHashSet<>();
        for (String basePackage : attributes.getStringArray("basePackages")) {
            packages.add(basePackage);
        }
        for (Class<?> markerClass : attributes.getClassArray("basePackageClasses")) {
            packages.add(ClassUtils.getPackageName(markerClass));
        }
        if (packages.isEmpty()) {
            packages.add(ClassUtils.getPackageName(metadata.getClassName()));
        }

        EventMapperBeanRegistrar.addEventMappers(registry, packages.toArray(new String[0]));
    }
}
