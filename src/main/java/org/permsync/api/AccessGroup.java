package org.permsync.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group in the access system together with the members that were visible
 * beneath the privilege ceiling used to fetch it.
 */
public class AccessGroup {
    private final String id;
    private final String name;
    private final List<DownstreamAccount> members;

    public AccessGroup(String id, String name, List<DownstreamAccount> members) {
        this.id = id;
        this.name = name;
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<DownstreamAccount> getMembers() {
        return members;
    }

    public String toString() {
        return String.format("#<AccessGroup '%s' [%s] (%d members)>", name, id, members.size());
    }
}
