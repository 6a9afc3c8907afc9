package io.github.jsummarise.exception;

import javax.annotation.Nonnull;

public class ColumnNotFoundException extends RuntimeException {
    public ColumnNotFoundException(@Nonnull String message) {
        super(message);
    }
}
