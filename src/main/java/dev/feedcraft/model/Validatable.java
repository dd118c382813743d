package dev.feedcraft.model;

import dev.feedcraft.exception.FeedValidationException;

import java.util.Optional;

/**
 * Model element that can check its own invariants.
 *
 * <p>
 * {@link #violation()} reports without throwing so that extraction code can degrade an optional
 * structure to absence with a plain branch; {@link #validate()} is the throwing form used by the
 * validation pass.
 */
public interface Validatable {

    /**
     * @return description of the first violated invariant, or empty when the element is valid
     */
    Optional<String> violation();

    default void validate() {
        Optional<String> violation = violation();
        if (violation.isPresent()) {
            throw new FeedValidationException(violation.get());
        }
    }
}
