package org.onionscout;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.onionscout.config.ConfigurationException;
import org.onionscout.config.ScoutConfig;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoutConfigTest {

    private static ObjectNode noOverrides() {
        return JsonNodeFactory.instance.objectNode();
    }

    private Path example() throws URISyntaxException {
        return Path.of(getClass().getResource("config/example.yaml").toURI());
    }

    @Test
    void testDefaults() throws ConfigurationException {
        ScoutConfig config = OnionScout.loadConfig(null, noOverrides(), List.of());

        assertEquals(List.of(), config.seeds());
        assertEquals(8, config.crawl().workers());
        assertEquals(Duration.ofSeconds(90), config.crawl().timeout());
        assertEquals(Duration.ofSeconds(2), config.crawl().courtesyInterval());
        assertEquals(Duration.ofMillis(250), config.crawl().idlePoll());
        assertEquals(2, config.crawl().retryLimit());
        assertNull(config.crawl().pageBudget());
        assertEquals(List.of(".onion"), config.crawl().networkSuffixes());
        assertTrue(config.crawl().ignoredExtensions().contains(".png"));

        assertEquals("127.0.0.1", config.proxy().host());
        assertEquals(9050, config.proxy().port());
        assertEquals(9150, config.proxy().fallbackPort());
        assertTrue(config.proxy().verify());
        assertEquals(10L * 1024 * 1024, config.proxy().maxBodySize());
        assertEquals(3, config.proxy().userAgents().size());

        assertEquals(Path.of("onionscout.db"), config.storage().database());
        assertNull(config.storage().export());
        assertFalse(config.storage().reset());
        assertEquals(8080, config.web().port());
        assertEquals(Duration.ofDays(7), config.trust().halfLife());
        assertEquals(Duration.ofMinutes(10), config.trust().refreshInterval());
        assertEquals(2L * 1024 * 1024, config.analysis().maxAnalyzedBytes());
        assertEquals(1000, config.analysis().matchStepsPerChar());
    }

    @Test
    void testConfigFileIsMergedOverDefaults() throws Exception {
        ScoutConfig config = OnionScout.loadConfig(example(), noOverrides(), List.of());

        assertEquals(List.of("http://darkexample.onion/", "forum.onion/index.php"), config.seeds());
        assertEquals(4, config.crawl().workers());
        assertEquals(Duration.ofMillis(500), config.crawl().courtesyInterval());
        assertEquals(1000L, config.crawl().pageBudget());
        assertEquals(List.of(".pdf"), config.crawl().ignoredExtensions(), "lists replace rather than merge");
        assertEquals(Duration.ofSeconds(90), config.crawl().timeout());

        assertEquals(9150, config.proxy().port());
        assertFalse(config.proxy().verify());
        assertEquals("127.0.0.1", config.proxy().host());

        assertEquals(Path.of("/var/lib/onionscout/export.json"), config.storage().export());
    }

    @Test
    void testCommandLineOverridesAndSeeds() throws Exception {
        ObjectNode overrides = noOverrides();
        overrides.putObject("crawl").put("workers", 16).put("timeout", "30s");
        overrides.putObject("web").put("enabled", false);

        ScoutConfig config = OnionScout.loadConfig(example(), overrides, List.of("http://extra.onion/"));

        assertEquals(16, config.crawl().workers());
        assertEquals(Duration.ofSeconds(30), config.crawl().timeout());
        assertEquals(Duration.ofMillis(500), config.crawl().courtesyInterval());
        assertFalse(config.web().enabled());
        assertEquals(List.of("http://darkexample.onion/", "forum.onion/index.php", "http://extra.onion/"),
                config.seeds());
    }

    @Test
    void testInvalidValues() {
        ObjectNode zeroWorkers = noOverrides();
        zeroWorkers.putObject("crawl").put("workers", 0);
        assertThrows(ConfigurationException.class, () -> OnionScout.loadConfig(null, zeroWorkers, List.of()));

        ObjectNode badDuration = noOverrides();
        badDuration.putObject("crawl").put("timeout", "soon");
        assertThrows(ConfigurationException.class, () -> OnionScout.loadConfig(null, badDuration, List.of()));

        ObjectNode unknown = noOverrides();
        unknown.putObject("crawl").put("threads", 3);
        assertThrows(ConfigurationException.class, () -> OnionScout.loadConfig(null, unknown, List.of()));
    }

    @Test
    void testBadConfigFiles(@TempDir Path tempDir) throws Exception {
        assertThrows(ConfigurationException.class,
                () -> OnionScout.loadConfig(tempDir.resolve("missing.yaml"), noOverrides(), List.of()));

        Path list = tempDir.resolve("list.yaml");
        Files.writeString(list, "- just\n- a list\n");
        var e = assertThrows(ConfigurationException.class,
                () -> OnionScout.loadConfig(list, noOverrides(), List.of()));
        assertTrue(e.getMessage().contains("not a YAML mapping"));

        Path empty = tempDir.resolve("empty.yaml");
        Files.writeString(empty, "");
        assertEquals(8, OnionScout.loadConfig(empty, noOverrides(), List.of()).crawl().workers());
    }
}
