/**
 * Domain events and the notifications that carry them to mappers.
 *
 * @see io.lion.domain.event.DomainEventNotification
 */
package io.lion.domain.event;
