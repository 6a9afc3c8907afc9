package io.github.jsummarise.exception;

import javax.annotation.Nonnull;

/**
 * A named aggregation function the aggregation primitive does not know, with no callable fallback available.
 */
public class UnsupportedFunctionException extends RuntimeException {
    public UnsupportedFunctionException(@Nonnull String message) {
        super(message);
    }
}
