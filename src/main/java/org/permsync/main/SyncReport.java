package org.permsync.main;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public class SyncReport {

    private final List<GroupResult> groupResults = new ArrayList<>();
    private String passFailure;
    private boolean dryRun;

    public SyncReport(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public static class GroupResult {
        public final String upstreamGroup;
        public final String accessGroup;

        public int plannedAdds = 0;
        public int plannedRemoves = 0;
        public int appliedAdds = 0;
        public int appliedRemoves = 0;

        public String failureReason;

        public GroupResult(String upstreamGroup, String accessGroup) {
            this.upstreamGroup = upstreamGroup;
            this.accessGroup = accessGroup;
        }

        public boolean isSuccessful() {
            return failureReason == null;
        }

        public String toString() {
            return String.format("#<GroupResult %s -> %s: added %d/%d, removed %d/%d%s>",
                                 upstreamGroup,
                                 accessGroup,
                                 appliedAdds, plannedAdds,
                                 appliedRemoves, plannedRemoves,
                                 (failureReason == null) ? "" : " FAILED: " + failureReason);
        }
    }

    void addGroupResult(GroupResult result) {
        groupResults.add(result);
    }

    void failPass(String reason) {
        this.passFailure = reason;
    }

    public List<GroupResult> getGroupResults() {
        return Collections.unmodifiableList(groupResults);
    }

    public String getPassFailure() {
        return passFailure;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public boolean isSuccessful() {
        return passFailure == null && failedGroups().isEmpty();
    }

    public List<GroupResult> failedGroups() {
        return groupResults.stream().filter(r -> !r.isSuccessful()).collect(Collectors.toList());
    }

    public int totalAdded() {
        return groupResults.stream().mapToInt(r -> r.appliedAdds).sum();
    }

    public int totalRemoved() {
        return groupResults.stream().mapToInt(r -> r.appliedRemoves).sum();
    }

    public int totalPlannedAdds() {
        return groupResults.stream().mapToInt(r -> r.plannedAdds).sum();
    }

    public int totalPlannedRemoves() {
        return groupResults.stream().mapToInt(r -> r.plannedRemoves).sum();
    }

    public String summary() {
        if (passFailure != null) {
            return String.format("Pass failed: %s", passFailure);
        }

        return String.format("%d groups (%d failed): %d/%d added, %d/%d removed%s",
                             groupResults.size(),
                             failedGroups().size(),
                             totalAdded(), totalPlannedAdds(),
                             totalRemoved(), totalPlannedRemoves(),
                             dryRun ? " (dry run)" : "");
    }
}
