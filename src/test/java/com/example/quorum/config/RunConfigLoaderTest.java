package com.example.quorum.config;

import com.example.quorum.agent.AgentSelection;
import com.example.quorum.consensus.ConsensusPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RunConfigLoader functionality.
 */
class RunConfigLoaderTest {

    @Nested
    @DisplayName("JSON documents")
    class JsonDocuments {

        @Test
        @DisplayName("Should read every option")
        void shouldReadAllOptions() {
            String json = "{"
                + "\"concurrency\": 8,"
                + "\"defaultFaultTolerance\": \"none\","
                + "\"perTaskConsensusOverride\": {\"vote\": 2, \"quick\": \"none\"},"
                + "\"maxRetries\": 5,"
                + "\"retryBackoff\": {\"base\": 100, \"multiplier\": 3, \"max\": \"PT5S\"},"
                + "\"consensusTimeout\": \"PT30S\","
                + "\"agentTimeout\": 45000,"
                + "\"similarityThreshold\": 0.9,"
                + "\"agentSelection\": \"reuse\""
                + "}";

            RunConfig config = RunConfigLoader.fromJson(json);

            assertEquals(8, config.getConcurrency());
            assertEquals(ConsensusPolicy.SINGLE_AGENT, config.getDefaultFaultTolerance());
            assertEquals(Map.of("vote", 2, "quick", ConsensusPolicy.SINGLE_AGENT),
                         config.getPerTaskConsensusOverride());
            assertEquals(5, config.getMaxRetries());
            assertEquals(new RetryBackoff(Duration.ofMillis(100), 3.0, Duration.ofSeconds(5)),
                         config.getRetryBackoff());
            assertEquals(Duration.ofSeconds(30), config.getConsensusTimeout());
            assertEquals(Duration.ofSeconds(45), config.getAgentTimeout());
            assertEquals(0.9, config.getSimilarityThreshold());
            assertEquals(AgentSelection.REUSE, config.getAgentSelection());
        }

        @Test
        @DisplayName("Should keep defaults for absent options and ignore unknown ones")
        void shouldApplyDefaults() {
            RunConfig config = RunConfigLoader.fromJson("{\"concurrency\": 2, \"colour\": \"blue\"}");

            assertEquals(2, config.getConcurrency());
            assertEquals(RunConfig.defaults().toBuilder().concurrency(2).build(), config);
        }

        @Test
        @DisplayName("Should reject malformed documents and invalid values")
        void shouldRejectInvalidInput() {
            assertThrows(IllegalArgumentException.class, () -> RunConfigLoader.fromJson("{not json"));
            assertThrows(IllegalArgumentException.class, () -> RunConfigLoader.fromJson("[1, 2]"));
            assertThrows(IllegalArgumentException.class, () -> RunConfigLoader.fromJson("{\"concurrency\": 0}"));
            assertThrows(IllegalArgumentException.class,
                () -> RunConfigLoader.fromJson("{\"defaultFaultTolerance\": \"many\"}"));
            assertThrows(IllegalArgumentException.class,
                () -> RunConfigLoader.fromJson("{\"perTaskConsensusOverride\": [1]}"));
            assertThrows(IllegalArgumentException.class,
                () -> RunConfigLoader.fromJson("{\"agentSelection\": \"random\"}"));
            assertThrows(IllegalArgumentException.class,
                () -> RunConfigLoader.fromJson("{\"consensusTimeout\": \"soon\"}"));
        }

        @Test
        @DisplayName("Should read a configuration file")
        void shouldReadFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("run.json");
            Files.writeString(file, "{\"maxRetries\": 1}");

            assertEquals(1, RunConfigLoader.fromJson(file).getMaxRetries());
        }
    }

    @Nested
    @DisplayName("Properties")
    class PropertiesSource {

        @AfterEach
        void clearSystemProperties() {
            System.clearProperty("quorum.concurrency");
        }

        @Test
        @DisplayName("Should read prefixed keys including per-task overrides")
        void shouldReadProperties() {
            Properties properties = new Properties();
            properties.setProperty("quorum.concurrency", "3");
            properties.setProperty("quorum.defaultFaultTolerance", "2");
            properties.setProperty("quorum.consensus.summary", "none");
            properties.setProperty("quorum.retryBackoff.base", "PT0.5S");
            properties.setProperty("quorum.retryBackoff.max", "2000");
            properties.setProperty("quorum.agentSelection", "ROTATE");
            properties.setProperty("unrelated.key", "ignored");

            RunConfig config = RunConfigLoader.fromProperties(properties);

            assertEquals(3, config.getConcurrency());
            assertEquals(2, config.getDefaultFaultTolerance());
            assertFalse(config.getConsensusPolicy().requiresConsensus("summary"));
            assertEquals(Duration.ofMillis(500), config.getRetryBackoff().getBase());
            assertEquals(Duration.ofSeconds(2), config.getRetryBackoff().getMax());
            assertEquals(RetryBackoff.DEFAULT_MULTIPLIER, config.getRetryBackoff().getMultiplier());
        }

        @Test
        @DisplayName("Should let system properties override file values")
        void shouldPreferSystemProperties(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("quorum.properties");
            Files.writeString(file, "quorum.concurrency=3\nquorum.maxRetries=4\n");
            System.setProperty("quorum.concurrency", "7");

            RunConfig config = RunConfigLoader.fromProperties(file);

            assertEquals(7, config.getConcurrency());
            assertEquals(4, config.getMaxRetries());
        }

        @Test
        @DisplayName("Should name the offending key")
        void shouldRejectInvalidValues() {
            Properties properties = new Properties();
            properties.setProperty("quorum.maxRetries", "lots");

            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                () -> RunConfigLoader.fromProperties(properties));
            assertTrue(exception.getMessage().contains("quorum.maxRetries"));
        }
    }

    @Test
    void testParseDuration() {
        assertEquals(Duration.ofMillis(250), RunConfigLoader.parseDuration("x", " 250 "));
        assertEquals(Duration.ofMinutes(2), RunConfigLoader.parseDuration("x", "PT2M"));
        assertThrows(IllegalArgumentException.class, () -> RunConfigLoader.parseDuration("x", ""));
    }
}
