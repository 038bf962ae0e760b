package io.lion.integration;

import io.lion.Event;

/**
 * An event published to other services as part of an external contract.
 *
 * @see EventMapper
 */
public interface IntegrationEvent extends Event {
}
