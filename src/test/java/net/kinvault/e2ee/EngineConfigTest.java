package net.kinvault.e2ee;

import org.junit.Test;

import java.time.Duration;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class EngineConfigTest {

    @Test
    public void testBundledDefaultsMatchBuilder() throws Exception {
        EngineConfig bundled = EngineConfig.fromResource(EngineConfig.DEFAULTS_RESOURCE);
        EngineConfig defaults = EngineConfig.defaults();

        assertEquals(defaults.getMaxSkip(), bundled.getMaxSkip());
        assertEquals(defaults.getMaxStoredMessageKeys(), bundled.getMaxStoredMessageKeys());
        assertEquals(defaults.getMessageKeyLifetime(), bundled.getMessageKeyLifetime());
        assertEquals(defaults.getSessionLifetime(), bundled.getSessionLifetime());
        assertEquals(defaults.getSessionCacheCapacity(), bundled.getSessionCacheCapacity());
        assertEquals(defaults.getSessionCacheTtl(), bundled.getSessionCacheTtl());
        assertEquals(defaults.getMaintenanceInterval(), bundled.getMaintenanceInterval());
        assertEquals(defaults.getRotationInterval(), bundled.getRotationInterval());
        assertEquals(defaults.getMaxActiveKeys(), bundled.getMaxActiveKeys());
        assertEquals(defaults.getPreRotationWarning(), bundled.getPreRotationWarning());
        assertEquals(defaults.getOneTimePreKeyBatchSize(), bundled.getOneTimePreKeyBatchSize());
        assertEquals(defaults.getMinOneTimePreKeys(), bundled.getMinOneTimePreKeys());
    }

    @Test
    public void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(1000, config.getMaxSkip());
        assertEquals(Duration.ofDays(30), config.getRotationInterval());
        assertEquals(3, config.getMaxActiveKeys());
        assertEquals(Duration.ofDays(7), config.getSessionLifetime());
    }

    @Test
    public void testResourceOverridesDefaults() throws Exception {
        EngineConfig config = EngineConfig.fromResource("/e2ee-test.properties");

        assertEquals(25, config.getMaxSkip());
        assertEquals(Duration.ofDays(2), config.getSessionLifetime());
        assertEquals(Duration.ofDays(10), config.getRotationInterval());
        assertEquals(2, config.getMaxActiveKeys());
        assertEquals(8, config.getOneTimePreKeyBatchSize());
        assertEquals(2000, config.getMaxStoredMessageKeys());
    }

    @Test
    public void testInvalidValuesRejected() {
        Properties properties = new Properties();
        properties.setProperty("e2ee.rotation.interval", "thirty days");
        try {
            EngineConfig.fromProperties(properties);
            fail("unparseable duration accepted");
        } catch (IllegalArgumentException e) {
            // expected
        }

        properties = new Properties();
        properties.setProperty("e2ee.ratchet.max-skip", "0");
        try {
            EngineConfig.fromProperties(properties);
            fail("non-positive max skip accepted");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test(expected = java.io.IOException.class)
    public void testMissingResource() throws Exception {
        EngineConfig.fromResource("/no-such-config.properties");
    }
}
