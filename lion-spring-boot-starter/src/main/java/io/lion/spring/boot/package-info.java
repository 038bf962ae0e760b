/**
 * Spring Boot auto-configuration for Lion.
 *
 * <p>{@link io.lion.spring.boot.LionAutoConfiguration} scans for event mappers using
 * {@link io.lion.spring.boot.LionProperties} and exposes a
 * {@link io.lion.registry.MapperRegistry} bean.
 */
package io.lion.spring.boot;
