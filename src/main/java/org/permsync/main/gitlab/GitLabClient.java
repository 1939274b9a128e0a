package org.permsync.main.gitlab;

import java.util.ArrayList;
import java.util.List;

import org.permsync.api.GatewayException;
import org.permsync.main.Config;
import org.permsync.main.http.ApiClient;
import org.permsync.main.http.ApiResponse;
import org.permsync.main.http.JSON;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class GitLabClient {

    private static final Logger LOG = LoggerFactory.getLogger(GitLabClient.class);

    private static final String PAGE_SIZE = "100";

    private ApiClient api;

    public GitLabClient(Config.Group config) {
        this(new ApiClient("GitLab",
                           config.getString("base_url", "https://gitlab.com").replaceAll("/+$", "") + "/api/v4",
                           "PRIVATE-TOKEN",
                           config.getString("token"),
                           (int) config.getLong("request_timeout_ms", 60000),
                           (int) config.getLong("max_retries", 3)));
    }

    GitLabClient(ApiClient api) {
        this.api = api;
    }

    public List<JSON> searchGroups(String name) throws GatewayException {
        return api.get("/groups", "search", name, "per_page", PAGE_SIZE).json().asJSONList();
    }

    // Includes members inherited from parent groups.
    public List<JSON> listAllGroupMembers(String groupId) throws GatewayException {
        List<JSON> result = new ArrayList<>();
        String page = "1";

        while (page != null) {
            ApiResponse response = api.get(String.format("/groups/%s/members/all", groupId),
                                           "per_page", PAGE_SIZE,
                                           "page", page);

            result.addAll(response.json().asJSONList());

            String next = response.header("X-Next-Page");
            page = (next == null || next.trim().isEmpty()) ? null : next.trim();
        }

        LOG.debug("GitLab group {} has {} members", groupId, result.size());

        return result;
    }

    public ApiResponse addGroupMember(String groupId, String userId, int accessLevel) throws GatewayException {
        return api.postForm(String.format("/groups/%s/members", groupId),
                            "user_id", userId,
                            "access_level", String.valueOf(accessLevel));
    }

    public ApiResponse removeGroupMember(String groupId, String userId) throws GatewayException {
        return api.delete(String.format("/groups/%s/members/%s", groupId, userId));
    }
}
