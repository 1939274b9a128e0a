package org.permsync.api;

public class GroupMapping {
    private final UpstreamGroup upstreamGroup;
    private final String accessGroupName;

    public GroupMapping(UpstreamGroup upstreamGroup, String accessGroupName) {
        if (upstreamGroup == null || accessGroupName == null) {
            throw new IllegalArgumentException("Both sides of a group mapping must be set");
        }

        this.upstreamGroup = upstreamGroup;
        this.accessGroupName = accessGroupName;
    }

    public UpstreamGroup getUpstreamGroup() {
        return upstreamGroup;
    }

    public String getAccessGroupName() {
        return accessGroupName;
    }

    public String toString() {
        return String.format("%s -> %s", upstreamGroup.getName(), accessGroupName);
    }
}
