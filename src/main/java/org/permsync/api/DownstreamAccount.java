package org.permsync.api;

import java.util.Objects;

/**
 * An account in the access system.  The federated identifier is only
 * present for accounts that were provisioned through the identity
 * federation, and only those accounts can be correlated with the directory.
 */
public class DownstreamAccount {
    private final String accountId;
    private final String federatedId;
    private final AccessLevel accessLevel;

    public DownstreamAccount(String accountId, String federatedId, AccessLevel accessLevel) {
        if (accountId == null) {
            throw new IllegalArgumentException("accountId wasn't set!");
        }

        this.accountId = accountId;
        this.federatedId = federatedId;
        this.accessLevel = (accessLevel == null) ? AccessLevel.NO_ACCESS : accessLevel;
    }

    public String getAccountId() {
        return accountId;
    }

    public String getFederatedId() {
        return federatedId;
    }

    public AccessLevel getAccessLevel() {
        return accessLevel;
    }

    public boolean hasFederatedId() {
        return federatedId != null && !federatedId.trim().isEmpty();
    }

    public DownstreamAccount withFederatedId(String newFederatedId) {
        return new DownstreamAccount(accountId, newFederatedId, accessLevel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DownstreamAccount)) {
            return false;
        }

        DownstreamAccount other = (DownstreamAccount) o;
        return accountId.equals(other.accountId)
            && Objects.equals(federatedId, other.federatedId)
            && accessLevel == other.accessLevel;
    }

    @Override
    public int hashCode() {
        return Objects.hash(accountId, federatedId, accessLevel);
    }

    public String toString() {
        return String.format("%s <%s, %s>", accountId, federatedId, accessLevel);
    }
}
