package io.github.jsummarise.exception;

import javax.annotation.Nonnull;

/**
 * Malformed aggregation request, bad rename label, invalid function combination or an empty request batch.
 */
public class InvalidArgumentException extends IllegalArgumentException {
    public InvalidArgumentException(@Nonnull String message) {
        super(message);
    }
}
