package org.permsync.main.gitlab;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.permsync.api.AccessGroup;
import org.permsync.api.AccessLevel;
import org.permsync.api.DownstreamAccount;
import org.permsync.api.GatewayException;
import org.permsync.api.MutationResult;
import org.permsync.main.RateLimiter;
import org.permsync.main.http.ApiResponse;
import org.permsync.main.http.JSON;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GitLabAccessGateway Tests")
class GitLabAccessGatewayTest {

    @Mock
    private GitLabClient gitlab;

    @Mock
    private RateLimiter rateLimiter;

    private static JSON group(long id, String name, String fullPath) {
        return JSON.parse(String.format("{\"id\": %d, \"name\": \"%s\", \"path\": \"%s\", \"full_path\": \"%s\"}",
                                        id, name, fullPath.substring(fullPath.lastIndexOf('/') + 1), fullPath));
    }

    private static JSON member(long id, int accessLevel, String externUid) {
        String identity = (externUid == null) ? "null" : String.format("{\"extern_uid\": \"%s\", \"provider\": \"group_saml\"}", externUid);
        return JSON.parse(String.format("{\"id\": %d, \"username\": \"user%d\", \"access_level\": %d, \"group_saml_identity\": %s}",
                                        id, id, accessLevel, identity));
    }

    @Test
    @DisplayName("keeps members below the privilege ceiling")
    void filtersByCeiling() throws Exception {
        when(gitlab.searchGroups("payments")).thenReturn(Arrays.asList(group(200, "payments", "org/payments")));
        when(gitlab.listAllGroupMembers("200")).thenReturn(Arrays.asList(
            member(1, 30, "00u1"),
            member(2, 50, "00u2"),
            member(3, 10, null)));

        AccessGroup group = new GitLabAccessGateway(gitlab, rateLimiter).fetchGroupMembers("payments", AccessLevel.OWNER);

        assertThat(group.getId()).isEqualTo("200");
        assertThat(group.getName()).isEqualTo("org/payments");
        assertThat(group.getMembers()).containsExactly(
            new DownstreamAccount("1", "00u1", AccessLevel.DEVELOPER),
            new DownstreamAccount("3", null, AccessLevel.GUEST));
    }

    @Test
    @DisplayName("prefers an exact match over the first search hit")
    void prefersExactMatch() throws Exception {
        when(gitlab.searchGroups("payments")).thenReturn(Arrays.asList(
            group(201, "payments-legacy", "org/payments-legacy"),
            group(200, "Payments", "org/payments")));

        assertThat(new GitLabAccessGateway(gitlab, rateLimiter).findGroup("payments").path("id").asStringOrDie())
            .isEqualTo("200");
    }

    @Test
    @DisplayName("refuses to sync into a group that only resembles the name")
    void noExactMatch() throws Exception {
        when(gitlab.searchGroups("pay")).thenReturn(Arrays.asList(group(900, "payroll-admins", "org/payroll-admins")));

        assertThatThrownBy(() -> new GitLabAccessGateway(gitlab, rateLimiter).fetchGroupMembers("pay", AccessLevel.OWNER))
            .isInstanceOf(GatewayException.class)
            .hasMessageContaining("No exact GitLab match for group pay")
            .hasMessageContaining("org/payroll-admins");
        verify(gitlab, never()).listAllGroupMembers(anyString());
    }

    @Test
    @DisplayName("fails when no group matches")
    void missingGroup() throws Exception {
        when(gitlab.searchGroups("ghost")).thenReturn(Collections.emptyList());

        assertThatThrownBy(() -> new GitLabAccessGateway(gitlab, rateLimiter).fetchGroupMembers("ghost", AccessLevel.OWNER))
            .isInstanceOf(GatewayException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    @DisplayName("adds members at the requested level through the rate limiter")
    void addsMembers() throws Exception {
        when(gitlab.addGroupMember("200", "1", 30)).thenReturn(new ApiResponse("POST", 201, "{}", null));

        MutationResult result = new GitLabAccessGateway(gitlab, rateLimiter).addMember("200", "1", AccessLevel.DEVELOPER);

        assertThat(result.isSuccess()).isTrue();
        verify(rateLimiter).wantQueries(1);
    }

    @Test
    @DisplayName("reports failed removals with the response")
    void reportsFailedRemovals() throws Exception {
        when(gitlab.removeGroupMember("200", "1")).thenReturn(new ApiResponse("DELETE", 429, "Retry later", null));

        MutationResult result = new GitLabAccessGateway(gitlab, rateLimiter).removeMember("200", "1");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).contains("429");
        verify(rateLimiter).rateLimitHit("GitLab");
    }

    @Test
    @DisplayName("reports transport failures as failed mutations")
    void transportFailures() throws Exception {
        when(gitlab.removeGroupMember("200", "1")).thenThrow(new GatewayException("GitLab request DELETE failed"));

        MutationResult result = new GitLabAccessGateway(gitlab, rateLimiter).removeMember("200", "1");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).contains("DELETE failed");
    }

    @Test
    @DisplayName("treats removing a member who isn't a direct member as done")
    void removalOfAbsentMember() throws Exception {
        when(gitlab.removeGroupMember("200", "2")).thenReturn(new ApiResponse("DELETE", 404, "{\"message\":\"404 Not found\"}", null));

        MutationResult result = new GitLabAccessGateway(gitlab, rateLimiter).removeMember("200", "2");

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("treats adding an existing member as done")
    void addOfExistingMember() throws Exception {
        when(gitlab.addGroupMember("200", "1", 30)).thenReturn(new ApiResponse("POST", 409, "{\"message\":\"Member already exists\"}", null));

        MutationResult result = new GitLabAccessGateway(gitlab, rateLimiter).addMember("200", "1", AccessLevel.DEVELOPER);

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("still reports other failed additions")
    void otherAddFailures() throws Exception {
        when(gitlab.addGroupMember("200", "1", 30)).thenReturn(new ApiResponse("POST", 403, "Forbidden", null));

        MutationResult result = new GitLabAccessGateway(gitlab, rateLimiter).addMember("200", "1", AccessLevel.DEVELOPER);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFailureReason()).contains("403");
    }
}
