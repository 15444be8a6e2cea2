package org.muma.mini.kv.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MiniKvConfigTest {

    private MiniKvConfig config;

    @BeforeEach
    void setUp() {
        config = new MiniKvConfig();
    }

    @Test
    void testDefaults() {
        assertEquals("0.0.0.0", config.getBind());
        assertEquals(6379, config.getPort());
        assertEquals(64, config.getLockStripes());
        assertFalse(config.isActiveExpireEnabled());
        assertNull(config.getSlaveOfHost());
    }

    @Test
    void testLoadFromClasspath() {
        config.loadConfig("mini-kv-test.properties");

        assertEquals("127.0.0.1", config.getBind());
        assertEquals(7001, config.getPort());
        assertEquals(16, config.getLockStripes());
        assertTrue(config.isActiveExpireEnabled());
        assertEquals(5, config.getActiveExpireSampleSize());
        assertEquals("10.0.0.5", config.getSlaveOfHost());
        assertEquals(6380, config.getSlaveOfPort());

        // 非法值保留默认
        assertEquals(512 * 1024 * 1024, config.getMaxBulkLength());
    }

    @Test
    void testNonPositiveValuesFallBackToDefaults() {
        config.loadConfig("mini-kv-nonpositive.properties");

        assertTrue(config.isActiveExpireEnabled());
        assertEquals(100, config.getActiveExpireIntervalMs());
        assertEquals(20, config.getActiveExpireSampleSize());
        assertEquals(512 * 1024 * 1024, config.getMaxBulkLength());
    }

    @Test
    void testMissingFileKeepsDefaults() {
        config.loadConfig("does-not-exist.properties");
        assertEquals(6379, config.getPort());
    }

    @Test
    void testEnvOverridesFile() {
        config.loadConfig("mini-kv-test.properties");
        config.applyEnvOverrides(Map.of("MINIKV_PORT", "7100", "MINIKV_BIND", "10.0.0.1"));

        assertEquals(7100, config.getPort());
        assertEquals("10.0.0.1", config.getBind());

        // 非法的环境变量不生效
        config.applyEnvOverrides(Map.of("MINIKV_PORT", "abc"));
        assertEquals(7100, config.getPort());
    }

    @Test
    void testArgsOverrideEverything() {
        config.loadConfig("mini-kv-test.properties");
        config.parseArgs(new String[]{"--port", "7200", "--bind", "localhost", "--slaveof", "master.local", "6000"});

        assertEquals(7200, config.getPort());
        assertEquals("localhost", config.getBind());
        assertEquals("master.local", config.getSlaveOfHost());
        assertEquals(6000, config.getSlaveOfPort());
    }

    @Test
    void testInvalidSlaveOfIgnored() {
        config.parseArgs(new String[]{"--slaveof", "master.local", "notaport"});
        assertNull(config.getSlaveOfHost());
        assertEquals(-1, config.getSlaveOfPort());
    }

    @Test
    void testActiveExpireFlag() {
        config.parseArgs(new String[]{"--active-expire"});
        assertTrue(config.isActiveExpireEnabled());
    }
}
