package com.atcascade.core.engine;

import com.atcascade.core.ConfigurationException;
import com.atcascade.core.config.CascadeConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FitEngineFactoryTest {

    private static CascadeConfig.EngineConfig config(String type) {
        CascadeConfig.EngineConfig config = new CascadeConfig.EngineConfig();
        config.type = type;
        config.fitCommand = List.of("dismod_at", "{database}", "fit", "{mode}");
        return config;
    }

    @Test
    public void testFactoryCreation() {
        assertTrue(FitEngineFactory.create(config("process")) instanceof ProcessFitEngine);
        assertTrue(FitEngineFactory.create(config(null)) instanceof ProcessFitEngine, "Should default to process");
        assertTrue(FitEngineFactory.create(config(" ")) instanceof ProcessFitEngine);
        assertTrue(FitEngineFactory.create(config("dry_run")) instanceof DryRunFitEngine);
    }

    @Test
    public void testUnknownTypeRejected() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> FitEngineFactory.create(config("dryrun")));
        assertTrue(e.getMessage().contains("dryrun"));
    }

    @Test
    public void testProcessNeedsCommand() {
        CascadeConfig.EngineConfig config = config("process");
        config.fitCommand = List.of();
        assertThrows(ConfigurationException.class, () -> FitEngineFactory.create(config));
        assertThrows(ConfigurationException.class, () -> FitEngineFactory.create(null));

        CascadeConfig.EngineConfig noTimeout = config("process");
        noTimeout.timeoutSeconds = 0;
        assertThrows(ConfigurationException.class, () -> FitEngineFactory.create(noTimeout));
    }

    @Test
    public void testFitModeLabels() {
        assertEquals(FitMode.BOTH, FitMode.fromLabel("both"));
        assertEquals(FitMode.FIXED, FitMode.fromLabel(" Fixed"));
        assertThrows(ConfigurationException.class, () -> FitMode.fromLabel("random"));
    }
}
