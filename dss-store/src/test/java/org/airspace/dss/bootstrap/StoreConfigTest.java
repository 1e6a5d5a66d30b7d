package org.airspace.dss.bootstrap;

import org.airspace.dss.domain.geo.CoveringPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StoreConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("DSS_DB_DIALECT");
        System.clearProperty("DSS_COVERING_LEVEL");
        System.clearProperty("DSS_DB_POOL_SIZE");
    }

    @Test
    void systemPropertiesOverrideDefaults() {
        System.setProperty("DSS_DB_DIALECT", "h2");
        System.setProperty("DSS_COVERING_LEVEL", "12");
        System.setProperty("DSS_DB_POOL_SIZE", "not-a-number");

        StoreConfig config = StoreConfig.fromEnv();

        assertEquals("h2", config.dialect());
        assertEquals(12, config.covering().level());
        assertEquals(10, config.poolSize(), "Unparseable values fall back to the default");
        assertEquals(CoveringPolicy.DEFAULT_MAX_CELLS, config.covering().maxCells());
    }

    @Test
    void passwordIsNotPrinted() {
        StoreConfig config = new StoreConfig("jdbc:h2:mem:x", "sa", "secret", 2, "h2", null);
        assertFalse(config.toString().contains("secret"));
        assertEquals(CoveringPolicy.defaults(), config.covering());
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new StoreConfig(" ", "sa", "", 2, "h2", null));
        assertThrows(IllegalArgumentException.class, () -> new StoreConfig("jdbc:h2:mem:x", "sa", "", 0, "h2", null));
    }
}
