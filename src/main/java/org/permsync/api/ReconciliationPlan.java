package org.permsync.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The membership changes that bring one access group in line with its
 * upstream group.  Accounts in the add plan are granted the plan's grant
 * level; accounts in the remove plan lose their membership.
 */
public class ReconciliationPlan {
    private final List<DownstreamAccount> toAdd;
    private final List<DownstreamAccount> toRemove;
    private final AccessLevel grantLevel;

    public ReconciliationPlan(List<DownstreamAccount> toAdd, List<DownstreamAccount> toRemove, AccessLevel grantLevel) {
        this.toAdd = Collections.unmodifiableList(new ArrayList<>(toAdd));
        this.toRemove = Collections.unmodifiableList(new ArrayList<>(toRemove));
        this.grantLevel = grantLevel;
    }

    public List<DownstreamAccount> getToAdd() {
        return toAdd;
    }

    public List<DownstreamAccount> getToRemove() {
        return toRemove;
    }

    public AccessLevel getGrantLevel() {
        return grantLevel;
    }

    public boolean isEmpty() {
        return toAdd.isEmpty() && toRemove.isEmpty();
    }

    public String toString() {
        return String.format("#<ReconciliationPlan add: %s[%s] remove: %s>", toAdd, grantLevel, toRemove);
    }
}
