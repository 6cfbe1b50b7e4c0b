package com.tlsearch.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;

import org.junit.jupiter.api.Test;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToLibraryRefreshSettings() {
        AppConfig config = new AppConfig();

        assertEquals(24, config.getCache().getFreshnessHours());
        assertEquals(25, config.getBuild().getCheckpointInterval());
        assertEquals(200, config.getBuild().getBaseDelayMs());
        assertEquals(5, config.getProvider().getMaxAttempts());
        assertEquals(1000, config.getProvider().getBaseDelayMs());
        assertEquals(30000, config.getProvider().getMaxDelayMs());
        assertEquals(3001, config.getServer().getPort());
        assertEquals(6, config.getServer().getTopK());
        assertTrue(config.getRefresh().isEnabled());
        assertEquals(ZoneId.systemDefault(), config.getRefresh().zoneId());
    }

    @Test
    void shouldDerivePartialPathFromSnapshotFile() {
        AppConfig.CacheConfig cache = new AppConfig.CacheConfig();
        cache.setDirectory("data");

        assertEquals(Path.of("data", "embedded-resources.json"), cache.snapshotPath());
        assertEquals(Path.of("data", "cache-metadata.json"), cache.metadataPath());
        assertEquals(Path.of("data", "embedded-resources.json.partial"), cache.partialPath());
    }

    @Test
    void shouldReplaceNullSectionsWithDefaults() {
        AppConfig config = new AppConfig();
        config.setBuild(null);

        assertEquals(25, config.getBuild().getCheckpointInterval());
    }

    @Test
    void shouldRejectInvalidSettings() {
        AppConfig badZone = new AppConfig();
        badZone.getRefresh().setZone("Mars/Olympus_Mons");
        AppConfig badInterval = new AppConfig();
        badInterval.getBuild().setCheckpointInterval(0);
        AppConfig badAttempts = new AppConfig();
        badAttempts.getProvider().setMaxAttempts(0);

        assertThrows(ConfigurationException.class, badZone::validate);
        assertThrows(ConfigurationException.class, badInterval::validate);
        assertThrows(ConfigurationException.class, badAttempts::validate);
    }

    @Test
    void shouldRequireApiKeyFromEnvironment() {
        AppConfig config = new AppConfig();

        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> config.resolveApiKey(Map.of("OPENAI_API_KEY", " ")));

        assertEquals("OPENAI_API_KEY environment variable is required", ex.getMessage());
        assertEquals("sk-test", config.resolveApiKey(Map.of("OPENAI_API_KEY", "sk-test")));
    }
}
