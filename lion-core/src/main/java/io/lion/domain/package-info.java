/**
 * Domain building blocks: entities, aggregate roots and value objects.
 *
 * <p>{@link io.lion.domain.Entities} implements identity equality and
 * {@link io.lion.domain.ValueObjects} implements component equality. Both are static
 * helpers so that classes and records can share them without a common base class.
 *
 * @see io.lion.domain.Entity
 * @see io.lion.domain.ValueObject
 */
package io.lion.domain;
