package org.airspace.dss.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "DSS_ENV_TEST_SETTING";

    @AfterEach
    void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    void unsetFallsBackToDefault() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        assertEquals(7, Env.getInt(KEY, 7));
    }

    @Test
    void blankCountsAsUnset() {
        System.setProperty(KEY, "   ");
        assertEquals("fallback", Env.get(KEY, "fallback"));
    }

    @Test
    void numbersAreTrimmedBeforeParsing() {
        System.setProperty(KEY, " 42 ");
        assertEquals(42, Env.getInt(KEY, 7));
        assertEquals(42.0, Env.getDouble(KEY, 1.5));
    }

    @Test
    void unparseableNumberFallsBackToDefault() {
        System.setProperty(KEY, "4.5");
        assertEquals(7, Env.getInt(KEY, 7), "Not an int");
        assertEquals(4.5, Env.getDouble(KEY, 1.5));

        System.setProperty(KEY, "lots");
        assertEquals(1.5, Env.getDouble(KEY, 1.5));
    }
}
