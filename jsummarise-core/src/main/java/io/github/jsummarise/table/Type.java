package io.github.jsummarise.table;

import io.github.jsummarise.exception.UnknownTypeException;

import java.math.BigDecimal;

public enum Type {
    STRING,
    INT,
    BIGINT,
    DOUBLE,
    BIGDECIMAL,
    BOOLEAN,
    // only for result columns mixing values of several types, never detected from a value
    OBJECT;

    public static Type getType(Object object) {
        if (null == object) {
            throw new NullPointerException();
        }

        Class clazz = object.getClass();
        if (clazz == Integer.class) {
            return INT;
        }
        if (clazz == Long.class) {
            return BIGINT;
        }
        if (clazz == Double.class) {
            return DOUBLE;
        }
        if (clazz == String.class) {
            return STRING;
        }
        if (clazz == BigDecimal.class) {
            return BIGDECIMAL;
        }
        if (clazz == Boolean.class) {
            return BOOLEAN;
        }

        throw new UnknownTypeException(object.getClass().getName());
    }

    public boolean isNumeric() {
        switch (this) {
            case INT:
            case BIGINT:
            case DOUBLE:
            case BIGDECIMAL:
                return true;
            default:
                return false;
        }
    }

    public boolean isIntegral() {
        return this == INT || this == BIGINT;
    }
}
