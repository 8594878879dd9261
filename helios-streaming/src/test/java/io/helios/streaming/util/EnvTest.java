package io.helios.streaming.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvTest {

    private static final String KEY = "HELIOS_ENV_TEST_VALUE";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void testDefaultWhenUnset() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        assertEquals(5, Env.getInt(KEY, 5));
        assertEquals(7L, Env.getLong(KEY, 7L));
        assertTrue(Env.getBool(KEY, true));
    }

    @Test
    void testSystemPropertyIsTrimmed() {
        System.setProperty(KEY, "  value  ");
        assertEquals("value", Env.get(KEY, "fallback"));
    }

    @Test
    void testNumericParsing() {
        System.setProperty(KEY, "42");
        assertEquals(42, Env.getInt(KEY, 0));
        assertEquals(42L, Env.getLong(KEY, 0L));

        System.setProperty(KEY, "4x2");
        assertEquals(9, Env.getInt(KEY, 9));
        assertEquals(9L, Env.getLong(KEY, 9L));
    }

    @Test
    void testBooleanParsing() {
        System.setProperty(KEY, "TRUE");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "1");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "no");
        assertFalse(Env.getBool(KEY, true));
    }
}
