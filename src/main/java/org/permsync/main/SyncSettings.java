package org.permsync.main;

import org.permsync.api.AccessLevel;

/**
 * Everything a sync pass needs to know besides the gateways themselves.
 */
public class SyncSettings {
    private final String groupPrefix;
    private final String entitlementGroupName;
    private final AccessLevel grantLevel;
    private final AccessLevel privilegeCeiling;
    private final boolean dryRun;

    public SyncSettings(String groupPrefix,
                        String entitlementGroupName,
                        AccessLevel grantLevel,
                        AccessLevel privilegeCeiling,
                        boolean dryRun) {
        if (!grantLevel.isBelow(privilegeCeiling)) {
            throw new IllegalArgumentException(String.format("Grant level %s must be below the privilege ceiling %s",
                                                             grantLevel, privilegeCeiling));
        }

        this.groupPrefix = groupPrefix;
        this.entitlementGroupName = entitlementGroupName;
        this.grantLevel = grantLevel;
        this.privilegeCeiling = privilegeCeiling;
        this.dryRun = dryRun;
    }

    public static SyncSettings fromConfig(Config config) {
        Config.Group okta = config.readGroup("okta");
        Config.Group gitlab = config.readGroup("gitlab");
        Config.Group sync = config.readGroup("sync");

        return new SyncSettings(okta.getString("group_prefix", "dev_"),
                                gitlab.getString("entitlement_group"),
                                AccessLevel.fromName(gitlab.getString("grant_level", "developer")),
                                AccessLevel.fromName(gitlab.getString("max_access_level", "owner")),
                                sync.getBoolean("dry_run", false));
    }

    public String getGroupPrefix() {
        return groupPrefix;
    }

    public String getEntitlementGroupName() {
        return entitlementGroupName;
    }

    public AccessLevel getGrantLevel() {
        return grantLevel;
    }

    public AccessLevel getPrivilegeCeiling() {
        return privilegeCeiling;
    }

    public boolean isDryRun() {
        return dryRun;
    }
}
