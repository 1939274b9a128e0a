package org.permsync.main;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.permsync.api.GroupMapping;
import org.permsync.api.UpstreamGroup;

/**
 * Pairs each directory group with the access group it controls.  By default
 * the access group is named after the directory group with the naming prefix
 * stripped (`dev_payments` controls `payments`).  Explicit overrides win.
 */
public class GroupMapper {
    private static Logger logger = LoggerFactory.getLogger(GroupMapper.class);

    private String prefix;
    private Map<String, String> overrides;

    public GroupMapper(String prefix, Map<String, String> overrides) {
        this.prefix = (prefix == null) ? "" : prefix;
        this.overrides = (overrides == null) ? new HashMap<>() : new HashMap<>(overrides);
    }

    public List<GroupMapping> map(Collection<UpstreamGroup> upstreamGroups) {
        List<GroupMapping> result = new ArrayList<>();

        for (UpstreamGroup group : upstreamGroups) {
            String accessGroupName = accessGroupNameFor(group.getName());

            if (accessGroupName.isEmpty()) {
                logger.warn("Skipping directory group '{}': no access group name could be derived", group.getName());
                continue;
            }

            result.add(new GroupMapping(group, accessGroupName));
        }

        return result;
    }

    public String accessGroupNameFor(String upstreamName) {
        String override = overrides.get(upstreamName);

        if (override != null) {
            return override.trim();
        }

        if (!prefix.isEmpty() && upstreamName.startsWith(prefix)) {
            return upstreamName.substring(prefix.length()).trim();
        }

        return upstreamName.trim();
    }
}
