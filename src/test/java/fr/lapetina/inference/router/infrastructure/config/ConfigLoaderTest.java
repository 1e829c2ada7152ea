package fr.lapetina.inference.router.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static RouterConfig parse(String yaml) {
        try (ConfigLoader loader = new ConfigLoader("unused.yaml")) {
            return loader.loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        }
    }

    @Test
    @DisplayName("should load a configuration from the classpath")
    void shouldLoadFromClasspath() {
        try (ConfigLoader loader = new ConfigLoader("test-router.yaml")) {
            RouterConfig config = loader.load();

            assertThat(config.getServer().getPort()).isEqualTo(9000);
            assertThat(config.getRing().getVirtualNodesPerPhysical()).isEqualTo(50);
            assertThat(config.getDisruptor().getWaitStrategy()).isEqualTo("yielding");
            assertThat(config.getRetry().isEnabled()).isTrue();
            assertThat(config.getStats().getMaxLoadBalanceCv()).isEqualTo(0.25);
            assertThat(config.getWorkers()).extracting(RouterConfig.WorkerConfig::effectiveId)
                    .containsExactly("alpha", "http://localhost:9102");
            // Untouched sections keep their defaults
            assertThat(config.getBatch().getResultTimeoutMs()).isEqualTo(10000);
            assertThat(loader.getCurrentConfig()).isSameAs(config);
        }
    }

    @Test
    @DisplayName("should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        RouterConfig config = parse("");

        assertThat(config.getRing().getVirtualNodesPerPhysical()).isEqualTo(150);
        assertThat(config.getRetry().isEnabled()).isFalse();
        assertThat(config.getWorkers()).isEmpty();
    }

    @Test
    @DisplayName("should reject out-of-range values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> parse("disruptor:\n  ringBufferSize: 1000\n"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("power of two");
        assertThatThrownBy(() -> parse("batch:\n  maxBatchSize: 0\n"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
        assertThatThrownBy(() -> parse("compute:\n  failureRate: 1.5\n"))
                .isInstanceOf(ConfigLoader.ConfigurationException.class);
    }

    @Test
    @DisplayName("should reject duplicate worker ids")
    void shouldRejectDuplicateWorkers() {
        String yaml = "workers:\n"
                + "  - id: a\n    url: http://localhost:1\n"
                + "  - id: a\n    url: http://localhost:2\n";

        assertThatThrownBy(() -> parse(yaml))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Duplicate worker id");
    }

    @Test
    @DisplayName("should report a missing file")
    void shouldFailOnMissingFile() {
        try (ConfigLoader loader = new ConfigLoader("does-not-exist.yaml")) {
            assertThatThrownBy(loader::load)
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Test
    @DisplayName("should notify listeners and keep the current config on an invalid reload")
    void shouldReloadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("router.yaml");
        Files.writeString(file, "ring:\n  virtualNodesPerPhysical: 20\n");
        List<Integer> seen = new ArrayList<>();

        try (ConfigLoader loader = new ConfigLoader(file.toString())) {
            loader.addListener((oldConfig, newConfig) ->
                    seen.add(newConfig.getRing().getVirtualNodesPerPhysical()));
            loader.load();

            Files.writeString(file, "ring:\n  virtualNodesPerPhysical: 30\n");
            assertThat(loader.reload().getRing().getVirtualNodesPerPhysical()).isEqualTo(30);

            Files.writeString(file, "ring:\n  virtualNodesPerPhysical: 0\n");
            assertThat(loader.reload().getRing().getVirtualNodesPerPhysical()).isEqualTo(30);
        }

        assertThat(seen).containsExactly(20, 30);
    }
}
