/**
 * Spring integration for event mappers.
 *
 * <p>{@link io.lion.spring.EventMapperBeanRegistrar} scans packages and registers each
 * discovered mapper as a prototype bean keyed by its capability instantiation.
 * {@link io.lion.spring.EnableEventMappers} triggers the scan from a configuration class, and
 * {@link io.lion.spring.BeanFactoryMapperRegistry} exposes the result through the
 * {@link io.lion.registry.MapperRegistry} API.
 *
 * @see io.lion.spring.EventMapperBeanRegistrar
 */
package io.lion.spring;
