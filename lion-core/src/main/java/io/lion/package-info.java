/**
 * Root API for Lion, a small toolkit of Domain-Driven-Design building blocks.
 *
 * <h2>Core Design</h2>
 * <p>Domain objects implement capability interfaces instead of extending base classes.
 * {@linkplain io.lion.domain.Entity Entities} compare by identity and
 * {@linkplain io.lion.domain.ValueObject value objects} compare by an ordered list of
 * components; both delegate {@code equals}/{@code hashCode} to the static helpers in
 * {@link io.lion.domain.Entities} and {@link io.lion.domain.ValueObjects}.
 *
 * <p>Domain events travel inside a {@linkplain io.lion.domain.event.DomainEventNotification
 * notification} that carries extra context. {@linkplain io.lion.integration.EventMapper Mappers}
 * turn a notification into zero or more outbound events, and the
 * {@linkplain io.lion.registry.DefaultMapperRegistry registry} discovers and resolves mappers
 * by notification type.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>lion-core</b>: capability interfaces, equality helpers, mapper registry (zero external deps)</li>
 *   <li><b>lion-spring</b>: package scanning into a Spring {@code BeanDefinitionRegistry}</li>
 *   <li><b>lion-spring-boot-starter</b>: auto-configuration for Spring Boot applications</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var registry = new DefaultMapperRegistry()
 *     .addEventMappers(UserCreatedEventMapper.class, UserCreatedFlexibleEventMapper.class);
 *
 * EventMapper<UserCreatedNotification> mapper =
 *     registry.eventMapperFor(UserCreatedNotification.class).orElseThrow();
 * List<IntegrationEvent> events = mapper.createEvents(notification).join();
 * }</pre>
 *
 * @see io.lion.domain.Entity
 * @see io.lion.domain.ValueObject
 * @see io.lion.integration.EventMapper
 * @see io.lion.registry.DefaultMapperRegistry
 */
package io.lion;
