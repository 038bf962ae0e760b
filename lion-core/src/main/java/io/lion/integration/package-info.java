/**
 * Integration events and the mappers that produce them from domain notifications.
 *
 * <p>{@link io.lion.integration.EventMapper} returns strongly typed
 * {@link io.lion.integration.IntegrationEvent}s; {@link io.lion.integration.FlexibleEventMapper}
 * returns untyped objects. Both complete asynchronously through a
 * {@link java.util.concurrent.CompletableFuture}.
 *
 * @see io.lion.registry.DefaultMapperRegistry
 */
package io.lion.integration;
