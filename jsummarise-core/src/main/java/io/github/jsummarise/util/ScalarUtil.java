package io.github.jsummarise.util;

import io.github.jsummarise.exception.InconsistentColumnTypeException;

import java.math.BigDecimal;

import static java.lang.String.format;

public class ScalarUtil {
    public static Integer toInteger(Object object) {
        return null == object ? null : (Integer) object;
    }

    public static Long toLong(Object object) {
        return null == object ? null : (Long) object;
    }

    public static Double toDouble(Object object) {
        return null == object ? null : (Double) object;
    }

    public static String toStr(Object object) {
        return null == object ? null : object.toString();
    }

    public static BigDecimal toBigDecimal(Object object) {
        return null == object ? null : (BigDecimal) object;
    }

    public static Boolean toBoolean(Object object) {
        return null == object ? null : (Boolean) object;
    }

    /**
     * numeric value of a cell for arithmetic aggregation, unlike toDouble any Number is accepted
     * @param object    non null cell value
     * @return          the value widened to double
     */
    public static double toDoubleValue(Object object) {
        if (object instanceof Number) {
            return ((Number) object).doubleValue();
        }
        throw new InconsistentColumnTypeException(format("%s is not numeric", object.getClass().getName()));
    }

    public static boolean isIntegral(Object object) {
        return object instanceof Integer || object instanceof Long;
    }

    /**
     * total order over heterogeneous cells: nulls last, numbers by value, same classes by compareTo,
     * otherwise by class name
     */
    @SuppressWarnings("unchecked")
    public static int compare(Comparable a, Comparable b) {
        if (a == b) {
            return 0;
        }
        if (null == a) {
            return 1;
        }
        if (null == b) {
            return -1;
        }
        if (a instanceof Number && b instanceof Number && a.getClass() != b.getClass()) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a.getClass() == b.getClass()) {
            return a.compareTo(b);
        }
        return a.getClass().getName().compareTo(b.getClass().getName());
    }
}
