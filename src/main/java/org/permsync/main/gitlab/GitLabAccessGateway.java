package org.permsync.main.gitlab;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import org.permsync.api.AccessGateway;
import org.permsync.api.AccessGroup;
import org.permsync.api.AccessLevel;
import org.permsync.api.DownstreamAccount;
import org.permsync.api.GatewayException;
import org.permsync.api.MutationResult;
import org.permsync.main.RateLimiter;
import org.permsync.main.http.ApiResponse;
import org.permsync.main.http.JSON;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and changes GitLab group membership.  A member's federated
 * identifier is the `extern_uid` of their group SAML identity, which GitLab
 * only reports on the group that owns the SAML link.
 */
public class GitLabAccessGateway implements AccessGateway {

    private static final Logger LOG = LoggerFactory.getLogger(GitLabAccessGateway.class);

    private GitLabClient gitlab;
    private RateLimiter rateLimiter;

    public GitLabAccessGateway(GitLabClient gitlab, RateLimiter rateLimiter) {
        this.gitlab = gitlab;
        this.rateLimiter = rateLimiter;
    }

    public String getId() {
        return "gitlab";
    }

    public AccessGroup fetchGroupMembers(String name, AccessLevel ceiling) throws GatewayException {
        try {
            JSON group = findGroup(name);
            String groupId = group.path("id").asStringOrDie();

            List<DownstreamAccount> members = new ArrayList<>();

            for (JSON member : gitlab.listAllGroupMembers(groupId)) {
                DownstreamAccount account = toAccount(member);

                if (account.getAccessLevel().isBelow(ceiling)) {
                    members.add(account);
                }
            }

            return new AccessGroup(groupId, group.path("full_path").asString(name), members);
        } catch (IllegalStateException e) {
            throw new GatewayException(String.format("Unexpected response from GitLab for group %s: %s", name, e.getMessage()), e);
        }
    }

    // Search is fuzzy.  Only an exact match is accepted: a look-alike group
    // belongs to some other team.
    JSON findGroup(String name) throws GatewayException {
        List<JSON> candidates = gitlab.searchGroups(name);

        if (candidates.isEmpty()) {
            throw new GatewayException("GitLab group not found: " + name);
        }

        for (String field : new String[] { "full_path", "path", "name" }) {
            for (JSON candidate : candidates) {
                if (name.toLowerCase(Locale.ROOT).equals(candidate.path(field).asString("").toLowerCase(Locale.ROOT))) {
                    return candidate;
                }
            }
        }

        throw new GatewayException(String.format("No exact GitLab match for group %s (search found: %s)",
                                                 name,
                                                 candidates.stream()
                                                     .map(c -> c.path("full_path").asString("?"))
                                                     .collect(Collectors.joining(", "))));
    }

    static DownstreamAccount toAccount(JSON member) {
        return new DownstreamAccount(member.path("id").asStringOrDie(),
                                     member.path("group_saml_identity > extern_uid").asString(null),
                                     AccessLevel.fromValue(member.path("access_level").asLong(0L).intValue()));
    }

    public MutationResult addMember(String groupId, String accountId, AccessLevel level) {
        // A 409 means the member is already there, e.g. from an earlier attempt that timed out.
        return mutate(String.format("add %s to group %s", accountId, groupId),
                      409,
                      () -> gitlab.addGroupMember(groupId, accountId, level.getValue()));
    }

    public MutationResult removeMember(String groupId, String accountId) {
        // A 404 means they aren't a direct member: either already gone, or
        // their access is inherited from a parent group and can't be removed here.
        return mutate(String.format("remove %s from group %s", accountId, groupId),
                      404,
                      () -> gitlab.removeGroupMember(groupId, accountId));
    }

    private interface Mutation {
        ApiResponse call() throws GatewayException;
    }

    private MutationResult mutate(String description, int alreadyDoneStatus, Mutation mutation) {
        rateLimiter.wantQueries(1);

        try {
            ApiResponse response = mutation.call();

            if (response.isSuccess()) {
                return MutationResult.ok();
            }

            if (response.getStatusCode() == alreadyDoneStatus) {
                LOG.info("Nothing to {}: {}", description, response.failureDescription());
                return MutationResult.ok();
            }

            if (response.getStatusCode() == 429) {
                rateLimiter.rateLimitHit("GitLab");
            }

            LOG.warn("Couldn't {}: {}", description, response.failureDescription());
            return MutationResult.failed(response.failureDescription());
        } catch (GatewayException e) {
            LOG.warn("Couldn't {}: {}", description, e.getMessage());
            return MutationResult.failed(e.getMessage());
        }
    }
}
