package io.github.jsummarise.summarise;

import java.util.Locale;

import static java.lang.String.format;

/**
 * What a plain result name does when its request produces more than one column.
 */
public enum RenamePolicy {
    // keep the generated labels, log a warning
    IGNORE,
    // fail with InvalidArgumentException
    FAIL;

    public static RenamePolicy of(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(format("unknown rename policy '%s', expected ignore or fail", value), e);
        }
    }
}
