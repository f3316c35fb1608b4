package dev.evalkit.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class BaseConfigTest {

    @Test
    void testGetConfigHierarchy() {
        // NOTE: surefire exports EVALKIT_TEST_VAR1 and EVALKIT_TEST_VAR2 into this test env
        TestConfig config = new TestConfig(Map.of("EVALKIT_TEST_VAR1", "override"));

        // overrides take precedence
        assertEquals("override", config.getConfig("EVALKIT_TEST_VAR1", "default"));
        // then envars
        assertEquals("fromenv2", config.getConfig("EVALKIT_TEST_VAR2", "default"));
        // finally, defaults
        assertEquals("default", config.getConfig("NON_EXISTENT_VAR", "default"));
    }

    @Test
    void testGetConfigWithNullDefault() {
        TestConfig config = new TestConfig(Map.of());
        String result = config.getConfig("NON_EXISTENT_VAR", null, String.class);
        assertNull(result);
    }

    @Test
    void testValuesAreTrimmed() {
        TestConfig config = new TestConfig(Map.of("PADDED_VAR", "  7 "));
        assertEquals(7, config.getConfig("PADDED_VAR", 0));
    }

    @Test
    void testGetRequiredConfigFailure() {
        TestConfig config = new TestConfig(Map.of());

        var e =
                assertThrows(
                        RuntimeException.class,
                        () -> config.getRequiredConfig("NON_EXISTENT_VAR", String.class));
        assertEquals("NON_EXISTENT_VAR is required", e.getMessage());
    }

    @Test
    void testCastDuration() {
        TestConfig config = new TestConfig(Map.of());

        assertEquals(Duration.ofSeconds(45), config.cast("45", Duration.class));
        assertEquals(Duration.ofMinutes(2), config.cast("PT2M", Duration.class));
    }

    @Test
    void testCastUnsupportedType() {
        TestConfig config = new TestConfig(Map.of());

        assertThrows(RuntimeException.class, () -> config.cast("test", Object.class));
    }

    @Test
    void testNullSentinelHandling() {
        TestConfig config = new TestConfig(Map.of("EVALKIT_TEST_VAR2", BaseConfig.NULL_OVERRIDE));

        // the sentinel hides the real environment value
        assertNull(config.getEnvValue("EVALKIT_TEST_VAR2"));
        assertEquals("default", config.getConfig("EVALKIT_TEST_VAR2", "default"));
    }

    @Test
    void testOverrideMapRejectsDanglingKey() {
        var e =
                assertThrows(
                        RuntimeException.class,
                        () -> BaseConfig.toOverrideMap("KEY_A", "a", "KEY_B"));
        assertTrue(e.getMessage().contains("KEY_B"));
    }

    @Test
    void testIntegrationWithAllTypes() {
        Map<String, String> overrides =
                Map.of(
                        "STRING_VAR", "hello",
                        "BOOL_VAR", "true",
                        "INT_VAR", "42",
                        "LONG_VAR", "123456789",
                        "DOUBLE_VAR", "2.71828",
                        "DURATION_VAR", "30");

        TestConfig config = new TestConfig(overrides);

        assertEquals("hello", config.getConfig("STRING_VAR", "default"));
        assertEquals(true, config.getConfig("BOOL_VAR", false));
        assertEquals(42, config.getConfig("INT_VAR", 0));
        assertEquals(123456789L, config.getConfig("LONG_VAR", 0L));
        assertEquals(2.71828, config.getConfig("DOUBLE_VAR", 0.0), 0.00001);
        assertEquals(
                Duration.ofSeconds(30),
                config.getConfig("DURATION_VAR", Duration.ZERO, Duration.class));
    }

    static class TestConfig extends BaseConfig {
        TestConfig(Map<String, String> envOverrides) {
            super(envOverrides);
        }

        @Override
        public <T> T getConfig(String settingName, T defaultValue) {
            return super.getConfig(settingName, defaultValue);
        }

        @Override
        public <T> T getConfig(String settingName, T defaultValue, Class<T> settingClass) {
            return super.getConfig(settingName, defaultValue, settingClass);
        }

        @Override
        public <T> T getRequiredConfig(String settingName, Class<T> settingClass) {
            return super.getRequiredConfig(settingName, settingClass);
        }
    }
}
