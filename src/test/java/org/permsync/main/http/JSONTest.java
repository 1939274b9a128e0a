package org.permsync.main.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JSON Tests")
class JSONTest {

    private final JSON user = JSON.parse(
        "{\"id\": 42, \"status\": \"ACTIVE\", \"profile\": {\"login\": \"jdoe@example.com\"}, "
        + "\"groups\": [{\"name\": \"dev_payments\"}], \"group_saml_identity\": null}");

    @Test
    @DisplayName("follows nested paths and array indexes")
    void followsPaths() {
        assertThat(user.path("profile > login").asStringOrDie()).isEqualTo("jdoe@example.com");
        assertThat(user.path("groups > [0] > name").asStringOrDie()).isEqualTo("dev_payments");
    }

    @Test
    @DisplayName("renders numeric identifiers as strings")
    void numericIdsAsStrings() {
        assertThat(user.path("id").asStringOrDie()).isEqualTo("42");
        assertThat(user.path("id").asLongOrDie()).isEqualTo(42L);
    }

    @Test
    @DisplayName("missing and null values fall back to defaults")
    void missingValuesUseDefaults() {
        assertThat(user.path("profile > email").isMissing()).isTrue();
        assertThat(user.path("profile > email").asString("none")).isEqualTo("none");
        assertThat(user.path("group_saml_identity > extern_uid").asString(null)).isNull();
        assertThat(user.path("groups > [3] > name").asString("none")).isEqualTo("none");
    }

    @Test
    @DisplayName("fails loudly when a required value is missing")
    void requiredValueMissing() {
        assertThatThrownBy(() -> user.path("profile > email").asStringOrDie())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("profile > email");
    }

    @Test
    @DisplayName("rejects unparseable documents")
    void rejectsGarbage() {
        assertThatThrownBy(() -> JSON.parse("{not json")).isInstanceOf(IllegalArgumentException.class);
    }
}
