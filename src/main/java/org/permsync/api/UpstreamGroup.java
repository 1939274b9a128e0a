package org.permsync.api;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public class UpstreamGroup {
    private final String id;
    private final String name;

    private final Set<String> activeMembers = new LinkedHashSet<>();
    private final Set<String> deprovisionedMembers = new LinkedHashSet<>();

    public UpstreamGroup(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public void addActiveMember(String memberId) {
        if (!deprovisionedMembers.contains(memberId)) {
            activeMembers.add(memberId);
        }
    }

    // A deprovisioned status always wins over an active one, so the two sets stay disjoint.
    public void addDeprovisionedMember(String memberId) {
        activeMembers.remove(memberId);
        deprovisionedMembers.add(memberId);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getActiveMembers() {
        return Collections.unmodifiableSet(activeMembers);
    }

    public Set<String> getDeprovisionedMembers() {
        return Collections.unmodifiableSet(deprovisionedMembers);
    }

    public String toString() {
        return String.format("#<UpstreamGroup '%s' (%d active, %d deprovisioned)>",
                name,
                activeMembers.size(),
                deprovisionedMembers.size());
    }
}
