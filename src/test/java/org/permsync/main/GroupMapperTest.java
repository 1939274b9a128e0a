package org.permsync.main;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.permsync.api.GroupMapping;
import org.permsync.api.UpstreamGroup;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GroupMapper Tests")
class GroupMapperTest {

    @Test
    @DisplayName("strips the naming prefix by default")
    void stripsPrefix() {
        GroupMapper mapper = new GroupMapper("dev_", Collections.emptyMap());

        assertThat(mapper.accessGroupNameFor("dev_payments")).isEqualTo("payments");
        assertThat(mapper.accessGroupNameFor("payments")).isEqualTo("payments");
    }

    @Test
    @DisplayName("explicit overrides take precedence")
    void overridesWin() {
        GroupMapper mapper = new GroupMapper("dev_", Collections.singletonMap("dev_platform", "platform-engineering"));

        assertThat(mapper.accessGroupNameFor("dev_platform")).isEqualTo("platform-engineering");
    }

    @Test
    @DisplayName("skips groups with nothing left after the prefix")
    void skipsEmptyNames() {
        GroupMapper mapper = new GroupMapper("dev_", Collections.emptyMap());

        List<GroupMapping> mappings = mapper.map(Arrays.asList(
            new UpstreamGroup("1", "dev_"),
            new UpstreamGroup("2", "dev_search")));

        assertThat(mappings).extracting(GroupMapping::getAccessGroupName).containsExactly("search");
    }
}
