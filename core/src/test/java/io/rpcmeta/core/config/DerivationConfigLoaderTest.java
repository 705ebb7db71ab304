package io.rpcmeta.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DerivationConfigLoader")
class DerivationConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    @TempDir
    Path dir;

    private Path yaml(String content) throws IOException {
        Path file = dir.resolve("rpc-metadata.yaml");
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        void fullFileOverridesEveryDefault() throws IOException {
            Path file = yaml(
                    """
                    matching:
                      consumption-policy: first-match
                      require-all-members-matched: true
                    model:
                      include-default-methods: true
                    cache:
                      enabled: false
                    """);

            DerivationConfig config = DerivationConfigLoader.load(file, NO_ENV);

            assertThat(config.consumptionPolicy()).isEqualTo(ConsumptionPolicy.FIRST_MATCH);
            assertThat(config.requireAllMembersMatched()).isTrue();
            assertThat(config.includeDefaultMethods()).isTrue();
            assertThat(config.cacheEnabled()).isFalse();
        }

        @Test
        void emptyFileGivesDefaults() throws IOException {
            assertThat(DerivationConfigLoader.load(yaml(""), NO_ENV)).isEqualTo(DerivationConfig.DEFAULT);
        }

        @Test
        void missingFileIsRejected() {
            assertThatThrownBy(() -> DerivationConfigLoader.load(dir.resolve("absent.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        void unknownKeyIsRejected() throws IOException {
            Path file = yaml("matching:\n  consumption-polcy: exclusive\n");

            assertThatThrownBy(() -> DerivationConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'matching.consumption-polcy'");
        }

        @Test
        void nonBooleanIsRejected() throws IOException {
            Path file = yaml("cache:\n  enabled: sometimes\n");

            assertThatThrownBy(() -> DerivationConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'enabled' must be a boolean");
        }

        @Test
        void unknownPolicyIsRejected() throws IOException {
            Path file = yaml("matching:\n  consumption-policy: greedy\n");

            assertThatThrownBy(() -> DerivationConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("'greedy'");
        }

        @Test
        void malformedYamlIsRejected() throws IOException {
            Path file = yaml("matching: [unclosed\n");

            assertThatThrownBy(() -> DerivationConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse");
        }
    }

    @Nested
    @DisplayName("environment overlay")
    class Environment {

        @Test
        void envVarsTakePrecedenceOverYaml() throws IOException {
            Path file = yaml("matching:\n  consumption-policy: exclusive\ncache:\n  enabled: true\n");
            Map<String, String> env = Map.of(
                    "RPCMETA_CONSUMPTION_POLICY", "FIRST_MATCH",
                    "RPCMETA_CACHE_ENABLED", "false");

            DerivationConfig config = DerivationConfigLoader.load(file, env::get);

            assertThat(config.consumptionPolicy()).isEqualTo(ConsumptionPolicy.FIRST_MATCH);
            assertThat(config.cacheEnabled()).isFalse();
        }

        @Test
        void blankEnvVarIsIgnored() throws IOException {
            Map<String, String> env = Map.of("RPCMETA_INCLUDE_DEFAULT_METHODS", "  ");

            DerivationConfig config =
                    DerivationConfigLoader.load(yaml("model:\n  include-default-methods: true\n"), env::get);

            assertThat(config.includeDefaultMethods()).isTrue();
        }

        @Test
        void defaultsWithoutClasspathResource() {
            DerivationConfig config = DerivationConfigLoader.loadDefault(
                    name -> name.equals("RPCMETA_REQUIRE_ALL_MEMBERS_MATCHED") ? "true" : null);

            assertThat(config.requireAllMembersMatched()).isTrue();
            assertThat(config.consumptionPolicy()).isEqualTo(ConsumptionPolicy.EXCLUSIVE);
        }
    }

    @Test
    void builderRoundTripsThroughToBuilder() {
        DerivationConfig config = DerivationConfig.builder()
                .consumptionPolicy(ConsumptionPolicy.FIRST_MATCH)
                .cacheEnabled(false)
                .build();

        assertThat(config.toBuilder().build()).isEqualTo(config);
    }
}
