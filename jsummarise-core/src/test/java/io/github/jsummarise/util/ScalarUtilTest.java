package io.github.jsummarise.util;

import io.github.jsummarise.exception.InconsistentColumnTypeException;
import org.junit.Test;

import java.math.BigDecimal;

public class ScalarUtilTest {
    @Test
    public void compare() {
        assert ScalarUtil.compare(1, 2L) < 0;
        assert ScalarUtil.compare(2.5, 2) > 0;
        assert ScalarUtil.compare("finals", "heats") < 0;
        assert ScalarUtil.compare(null, "heats") > 0;
        assert ScalarUtil.compare("heats", null) < 0;
        assert ScalarUtil.compare(null, null) == 0;
    }

    @Test
    public void toDoubleValue() {
        assert ScalarUtil.toDoubleValue(3) == 3.0;
        assert ScalarUtil.toDoubleValue(new BigDecimal("1.25")) == 1.25;
    }

    @Test(expected = InconsistentColumnTypeException.class)
    public void toDoubleValueOfString() {
        ScalarUtil.toDoubleValue("heats");
    }
}
