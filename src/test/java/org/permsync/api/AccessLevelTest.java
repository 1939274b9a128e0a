package org.permsync.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AccessLevel Tests")
class AccessLevelTest {

    @Test
    @DisplayName("parses names and numeric values")
    void parsesNamesAndValues() {
        assertThat(AccessLevel.fromName("developer")).isEqualTo(AccessLevel.DEVELOPER);
        assertThat(AccessLevel.fromName(" Minimal-Access ")).isEqualTo(AccessLevel.MINIMAL_ACCESS);
        assertThat(AccessLevel.fromName("40")).isEqualTo(AccessLevel.MAINTAINER);
    }

    @Test
    @DisplayName("maps unknown values to the level beneath them")
    void mapsUnknownValuesDown() {
        assertThat(AccessLevel.fromValue(35)).isEqualTo(AccessLevel.DEVELOPER);
        assertThat(AccessLevel.fromValue(60)).isEqualTo(AccessLevel.OWNER);
        assertThat(AccessLevel.fromValue(-1)).isEqualTo(AccessLevel.NO_ACCESS);
    }

    @Test
    @DisplayName("rejects unknown names")
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> AccessLevel.fromName("admin"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("admin");
    }

    @Test
    @DisplayName("compares by privilege")
    void comparesByPrivilege() {
        assertThat(AccessLevel.DEVELOPER.isBelow(AccessLevel.OWNER)).isTrue();
        assertThat(AccessLevel.OWNER.isBelow(AccessLevel.OWNER)).isFalse();
    }
}
