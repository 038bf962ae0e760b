package io.lion.domain;

/**
 * Thrown when a domain object violates one of its invariants.
 *
 * <p>The predicate and the message are defined by the domain object. Validation
 * failures are never retried.
 *
 * @see ValueObject#validate()
 */
public class DomainValidationException extends RuntimeException {

    public DomainValidationException(String message) {
        super(message);
    }

    public DomainValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
