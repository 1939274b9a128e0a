package org.permsync.main;

import org.permsync.api.AccessGateway;
import org.permsync.api.AccessGroup;
import org.permsync.api.DirectoryGateway;
import org.permsync.api.DownstreamAccount;
import org.permsync.api.GatewayException;
import org.permsync.api.GroupMapping;
import org.permsync.api.MutationResult;
import org.permsync.api.ReconciliationPlan;
import org.permsync.api.UpstreamGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs a full reconciliation pass over every mapped directory/access group
 * pair.  Pairs are processed one at a time.  A failure while fetching or
 * mutating one pair stops work on that pair only and the pass moves on.
 */
public class SyncOrchestrator {
    private static Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private DirectoryGateway directory;
    private AccessGateway access;
    private ReconciliationEngine engine;
    private IdentityCorrelator correlator;
    private GroupMapper mapper;
    private SyncSettings settings;

    public SyncOrchestrator(DirectoryGateway directory,
                            AccessGateway access,
                            IdentityCorrelator correlator,
                            GroupMapper mapper,
                            SyncSettings settings) {
        this.directory = directory;
        this.access = access;
        this.correlator = correlator;
        this.engine = new ReconciliationEngine(correlator, settings.getGrantLevel());
        this.mapper = mapper;
        this.settings = settings;
    }

    public SyncReport runPass() {
        SyncReport report = new SyncReport(settings.isDryRun());

        logger.info("Starting sync pass from '{}' to '{}'{}",
                    directory.getId(), access.getId(), settings.isDryRun() ? " (dry run)" : "");

        List<UpstreamGroup> upstreamGroups;
        AccessGroup entitlementGroup;

        try {
            upstreamGroups = directory.fetchGroupsByPrefix(settings.getGroupPrefix());
            logger.info("Found {} directory groups with prefix '{}'", upstreamGroups.size(), settings.getGroupPrefix());

            entitlementGroup = access.fetchGroupMembers(settings.getEntitlementGroupName(), settings.getPrivilegeCeiling());
            logger.info("Entitlement group {} has {} members below {}",
                        entitlementGroup.getName(), entitlementGroup.getMembers().size(), settings.getPrivilegeCeiling());
        } catch (GatewayException e) {
            logger.error("Sync pass aborted: {}", e.getMessage(), e);
            report.failPass(e.getMessage());
            return report;
        }

        for (GroupMapping mapping : mapper.map(upstreamGroups)) {
            report.addGroupResult(syncGroup(mapping, entitlementGroup.getMembers()));
        }

        logger.info("Sync pass finished: {}", report.summary());

        return report;
    }

    SyncReport.GroupResult syncGroup(GroupMapping mapping, List<DownstreamAccount> entitlementSet) {
        UpstreamGroup upstream = mapping.getUpstreamGroup();
        SyncReport.GroupResult result = new SyncReport.GroupResult(upstream.getName(), mapping.getAccessGroupName());

        try {
            AccessGroup accessGroup = access.fetchGroupMembers(mapping.getAccessGroupName(), settings.getPrivilegeCeiling());

            List<DownstreamAccount> accessMembers = correlator.resolveFederatedIds(accessGroup.getMembers(), entitlementSet);

            ReconciliationPlan plan = engine.reconcile(upstream.getActiveMembers(),
                                                       upstream.getDeprovisionedMembers(),
                                                       entitlementSet,
                                                       accessMembers);

            result.plannedAdds = plan.getToAdd().size();
            result.plannedRemoves = plan.getToRemove().size();

            if (plan.isEmpty()) {
                logger.info("{} is in sync", mapping);
                return result;
            }

            logger.info("{}: {} to add, {} to remove", mapping, result.plannedAdds, result.plannedRemoves);
            logger.debug("Calculated plan for {}: {}", mapping, plan);

            if (settings.isDryRun()) {
                return result;
            }

            applyPlan(accessGroup, plan, result);
        } catch (GatewayException e) {
            logger.error("Skipping {}: {}", mapping, e.getMessage(), e);
            result.failureReason = e.getMessage();
        } catch (RuntimeException e) {
            logger.error("Unexpected error while syncing {}: {}", mapping, e.getMessage(), e);
            Monitoring.recordException(e);
            result.failureReason = String.valueOf(e.getMessage());
        }

        return result;
    }

    // Removals go first so revoked access doesn't linger behind a failing add.
    // The first failed mutation stops the rest of the plan.
    private void applyPlan(AccessGroup accessGroup, ReconciliationPlan plan, SyncReport.GroupResult result) {
        for (DownstreamAccount account : plan.getToRemove()) {
            MutationResult outcome = access.removeMember(accessGroup.getId(), account.getAccountId());

            if (!outcome.isSuccess()) {
                result.failureReason = String.format("Failed to remove %s from %s: %s",
                                                     account.getAccountId(), accessGroup.getName(), outcome.getFailureReason());
                logger.error(result.failureReason);
                return;
            }

            logger.info("Removed {} from {}", account, accessGroup.getName());
            result.appliedRemoves++;
        }

        for (DownstreamAccount account : plan.getToAdd()) {
            MutationResult outcome = access.addMember(accessGroup.getId(), account.getAccountId(), plan.getGrantLevel());

            if (!outcome.isSuccess()) {
                result.failureReason = String.format("Failed to add %s to %s: %s",
                                                     account.getAccountId(), accessGroup.getName(), outcome.getFailureReason());
                logger.error(result.failureReason);
                return;
            }

            logger.info("Added {} to {} as {}", account, accessGroup.getName(), plan.getGrantLevel());
            result.appliedAdds++;
        }
    }
}
