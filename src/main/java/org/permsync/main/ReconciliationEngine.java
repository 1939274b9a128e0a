package org.permsync.main;

import org.permsync.api.AccessLevel;
import org.permsync.api.DownstreamAccount;
import org.permsync.api.ReconciliationPlan;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Works out which accounts to add to and remove from an access group.
 *
 * An identity is added when it is active in the directory group, holds an
 * account in the entitlement population and isn't in the access group yet.
 * An identity is removed when the directory reports it as deprovisioned or
 * suspended and it still holds access.  Everything else is left alone, so
 * running the engine again after applying its plan yields an empty plan.
 *
 * If the directory lists an identity as both active and deprovisioned, the
 * deprovisioned status wins.
 *
 * Stateless and safe to share between threads.
 */
public class ReconciliationEngine {

    private final IdentityCorrelator correlator;
    private final AccessLevel grantLevel;

    public ReconciliationEngine(IdentityCorrelator correlator, AccessLevel grantLevel) {
        this.correlator = correlator;
        this.grantLevel = grantLevel;
    }

    public AccessLevel getGrantLevel() {
        return grantLevel;
    }

    public ReconciliationPlan reconcile(Collection<String> upstreamEligible,
                                        Collection<String> upstreamDeprovisioned,
                                        Collection<DownstreamAccount> entitlementSet,
                                        Collection<DownstreamAccount> accessGroupMembers) {
        Set<String> activeIds = correlator.difference(upstreamEligible, upstreamDeprovisioned);
        Set<String> eligibleFederatedIds = correlator.intersect(activeIds, correlator.federatedIdsOf(entitlementSet));
        Set<String> currentAccessFederatedIds = correlator.federatedIdsOf(accessGroupMembers);

        // Accounts to add come from the entitlement population, since that's
        // where the real access system account lives.
        Set<String> addIds = correlator.difference(eligibleFederatedIds, currentAccessFederatedIds);
        List<DownstreamAccount> toAdd = correlator.matchAccounts(addIds, entitlementSet);

        // Removal doesn't look at the entitlement population at all.
        Set<String> removeIds = correlator.intersect(upstreamDeprovisioned, currentAccessFederatedIds);
        List<DownstreamAccount> toRemove = correlator.matchAccounts(removeIds, accessGroupMembers);

        return new ReconciliationPlan(toAdd, toRemove, grantLevel);
    }
}
