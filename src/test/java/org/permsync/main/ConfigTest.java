package org.permsync.main;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.permsync.api.AccessLevel;

import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Config Tests")
class ConfigTest {

    private Properties properties;

    @BeforeEach
    void setUp() throws Exception {
        properties = new Properties();

        try (InputStream is = getClass().getResourceAsStream("/permsync-test.properties")) {
            properties.load(is);
        }
    }

    @Test
    @DisplayName("reads grouped properties")
    void readsGroupedProperties() {
        Config config = new Config(properties, Collections.emptyMap());
        Config.Group gitlab = config.readGroup("gitlab");

        assertThat(gitlab.getString("entitlement_group")).isEqualTo("AFKL-MCP");
        assertThat(gitlab.getLong("max_retries", 3)).isEqualTo(3);
        assertThat(config.getBoolean("sync.dry_run", false)).isTrue();
    }

    @Test
    @DisplayName("falls back to environment variables")
    void fallsBackToEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("OKTA_TOKEN", "from-env");
        env.put("GITLAB_TOKEN", "ignored");

        Config config = new Config(properties, env);

        assertThat(config.readGroup("okta").getString("token")).isEqualTo("from-env");
        assertThat(config.readGroup("gitlab").getString("token")).isEqualTo("glpat-test");
    }

    @Test
    @DisplayName("complains about missing required properties")
    void missingProperty() {
        Config config = new Config(properties, Collections.emptyMap());

        assertThatThrownBy(() -> config.getString("okta.token"))
            .hasMessageContaining("Missing property: okta.token");
    }

    @Test
    @DisplayName("collects explicit group mappings")
    void collectsMappings() {
        Config config = new Config(properties, Collections.emptyMap());

        assertThat(config.mappingOverrides()).containsExactly(Map.entry("dev_platform", "platform-engineering"));
    }

    @Test
    @DisplayName("builds sync settings")
    void buildsSettings() {
        SyncSettings settings = SyncSettings.fromConfig(new Config(properties, Collections.emptyMap()));

        assertThat(settings.getGroupPrefix()).isEqualTo("dev_");
        assertThat(settings.getGrantLevel()).isEqualTo(AccessLevel.DEVELOPER);
        assertThat(settings.getPrivilegeCeiling()).isEqualTo(AccessLevel.OWNER);
        assertThat(settings.isDryRun()).isTrue();
    }

    @Test
    @DisplayName("rejects a grant level at or above the ceiling")
    void rejectsGrantAboveCeiling() {
        assertThatThrownBy(() -> new SyncSettings("dev_", "AFKL-MCP", AccessLevel.OWNER, AccessLevel.OWNER, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("maps property names to environment variable names")
    void environmentKeys() {
        assertThat(Config.environmentKey("gitlab.max-retries")).isEqualTo("GITLAB_MAX_RETRIES");
    }
}
