/**
 * Mapper discovery and resolution keyed by capability instantiation.
 *
 * <p>{@link io.lion.registry.MapperTypeScanner} turns candidate classes into
 * {@link io.lion.registry.MapperRegistration}s; {@link io.lion.registry.DefaultMapperRegistry}
 * stores them and creates a fresh mapper on every lookup. The Spring adapter feeds the same
 * registrations into a {@code BeanDefinitionRegistry} instead.
 *
 * @see io.lion.registry.MapperRegistry
 * @see io.lion.registry.DefaultMapperRegistry
 */
package io.lion.registry;
