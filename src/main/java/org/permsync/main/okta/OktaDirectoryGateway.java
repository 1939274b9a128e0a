package org.permsync.main.okta;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.permsync.api.DirectoryGateway;
import org.permsync.api.GatewayException;
import org.permsync.api.UpstreamGroup;
import org.permsync.main.http.JSON;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads directory groups and their members from Okta.  Members whose Okta
 * status is SUSPENDED or DEPROVISIONED are reported as deprovisioned; every
 * other status counts as active.
 */
public class OktaDirectoryGateway implements DirectoryGateway {

    private static final Logger LOG = LoggerFactory.getLogger(OktaDirectoryGateway.class);

    private static final Set<String> DEPROVISIONED_STATUSES = new HashSet<>(Arrays.asList("SUSPENDED", "DEPROVISIONED"));

    // The user attribute that the access system's SAML identities carry.
    public enum IdentityAttribute {
        ID("id"),
        LOGIN("profile > login"),
        EMAIL("profile > email");

        private final String path;

        IdentityAttribute(String path) {
            this.path = path;
        }

        public String read(JSON user) {
            return user.path(path).asString(null);
        }

        public static IdentityAttribute fromName(String name) {
            try {
                return IdentityAttribute.valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown identity attribute: " + name, e);
            }
        }
    }

    private OktaClient okta;
    private IdentityAttribute identityAttribute;

    public OktaDirectoryGateway(OktaClient okta, IdentityAttribute identityAttribute) {
        this.okta = okta;
        this.identityAttribute = identityAttribute;
    }

    public String getId() {
        return "okta";
    }

    public List<UpstreamGroup> fetchGroupsByPrefix(String prefix) throws GatewayException {
        List<UpstreamGroup> result = new ArrayList<>();

        try {
            for (JSON group : okta.listGroups(prefix)) {
                String groupId = group.path("id").asStringOrDie();
                String name = group.path("profile > name").asString("");

                // Okta's `q` also matches on other words in the name.
                if (!name.startsWith(prefix)) {
                    LOG.debug("Ignoring Okta group '{}' which doesn't start with '{}'", name, prefix);
                    continue;
                }

                result.add(readMembers(new UpstreamGroup(groupId, name)));
            }
        } catch (IllegalStateException e) {
            throw new GatewayException("Unexpected response from Okta: " + e.getMessage(), e);
        }

        return result;
    }

    private UpstreamGroup readMembers(UpstreamGroup group) throws GatewayException {
        for (JSON user : okta.listGroupUsers(group.getId())) {
            String identifier = identityAttribute.read(user);

            if (identifier == null || identifier.trim().isEmpty()) {
                LOG.warn("Skipped user in group {} with no {}: {}", group.getName(), identityAttribute, user.path("id").asString("?"));
                continue;
            }

            String status = user.path("status").asString("").toUpperCase(Locale.ROOT);

            if (DEPROVISIONED_STATUSES.contains(status)) {
                group.addDeprovisionedMember(identifier);
            } else {
                group.addActiveMember(identifier);
            }
        }

        LOG.debug("Read {}", group);

        return group;
    }
}
