package org.permsync.main.okta;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.permsync.api.GatewayException;
import org.permsync.main.Config;
import org.permsync.main.http.ApiClient;
import org.permsync.main.http.ApiResponse;
import org.permsync.main.http.JSON;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class OktaClient {

    private static final Logger LOG = LoggerFactory.getLogger(OktaClient.class);

    private static final String PAGE_SIZE = "200";

    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");

    private ApiClient api;

    public OktaClient(Config.Group config) {
        this(new ApiClient("Okta",
                           config.getString("org_url"),
                           "Authorization",
                           String.format("SSWS %s", config.getString("token")),
                           (int) config.getLong("request_timeout_ms", 45000),
                           (int) config.getLong("max_retries", 3)));
    }

    OktaClient(ApiClient api) {
        this.api = api;
    }

    public List<JSON> listGroups(String query) throws GatewayException {
        LOG.debug("Listing Okta groups matching '{}'", query);
        return fetchAllPages(api.get("/api/v1/groups", "q", query, "limit", PAGE_SIZE));
    }

    public List<JSON> listGroupUsers(String groupId) throws GatewayException {
        LOG.debug("Listing members of Okta group {}", groupId);
        return fetchAllPages(api.get(String.format("/api/v1/groups/%s/users", groupId), "limit", PAGE_SIZE));
    }

    private List<JSON> fetchAllPages(ApiResponse firstPage) throws GatewayException {
        List<JSON> result = new ArrayList<>();
        ApiResponse page = firstPage;

        for (;;) {
            result.addAll(page.json().asJSONList());

            String next = nextLink(page.header("Link"));
            if (next == null) {
                break;
            }

            page = api.getUrl(next);
        }

        return result;
    }

    static String nextLink(String linkHeader) {
        if (linkHeader == null) {
            return null;
        }

        Matcher m = NEXT_LINK.matcher(linkHeader);

        return m.find() ? m.group(1) : null;
    }
}
