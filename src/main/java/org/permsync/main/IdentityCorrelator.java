package org.permsync.main;

import org.permsync.api.DownstreamAccount;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Set operations over federated identifiers.
 *
 * Raw account identifiers from the directory and the access system are never
 * compared with each other.  Accounts without a federated identifier can't be
 * matched and are dropped before any comparison happens.
 *
 * Every result preserves the iteration order of its first argument.
 */
public class IdentityCorrelator {

    // Elements of `a` that are also in `b`.
    public Set<String> intersect(Collection<String> a, Collection<String> b) {
        Set<String> index = presenceIndex(b);
        Set<String> result = new LinkedHashSet<>();

        for (String item : a) {
            if (isUsable(item) && index.contains(item)) {
                result.add(item);
            }
        }

        return result;
    }

    // Elements of `a` that aren't in `b`.
    public Set<String> difference(Collection<String> a, Collection<String> b) {
        Set<String> index = presenceIndex(b);
        Set<String> result = new LinkedHashSet<>();

        for (String item : a) {
            if (isUsable(item) && !index.contains(item)) {
                result.add(item);
            }
        }

        return result;
    }

    public Set<String> federatedIdsOf(Collection<DownstreamAccount> accounts) {
        Set<String> result = new LinkedHashSet<>();

        for (DownstreamAccount account : accounts) {
            if (account.hasFederatedId()) {
                result.add(account.getFederatedId());
            }
        }

        return result;
    }

    /**
     * Index accounts by federated identifier.  When several accounts share an
     * identifier the first one seen is kept.
     */
    public Map<String, DownstreamAccount> indexByFederatedId(Collection<DownstreamAccount> accounts) {
        Map<String, DownstreamAccount> result = new LinkedHashMap<>();

        for (DownstreamAccount account : accounts) {
            if (account.hasFederatedId()) {
                result.putIfAbsent(account.getFederatedId(), account);
            }
        }

        return result;
    }

    // The accounts from `accounts` whose federated identifier is in `federatedIds`.
    public List<DownstreamAccount> matchAccounts(Collection<String> federatedIds, Collection<DownstreamAccount> accounts) {
        Map<String, DownstreamAccount> index = indexByFederatedId(accounts);
        List<DownstreamAccount> result = new ArrayList<>();

        for (String federatedId : federatedIds) {
            DownstreamAccount account = index.get(federatedId);

            if (account != null) {
                result.add(account);
            }
        }

        return result;
    }

    /**
     * Fill in missing federated identifiers on `accounts` using the account
     * with the same account identifier in `reference`.  Both collections must
     * come from the same access system, otherwise their account identifiers
     * aren't comparable.
     */
    public List<DownstreamAccount> resolveFederatedIds(Collection<DownstreamAccount> accounts,
                                                       Collection<DownstreamAccount> reference) {
        Map<String, String> federatedIdByAccountId = new HashMap<>();

        for (DownstreamAccount account : reference) {
            if (account.hasFederatedId()) {
                federatedIdByAccountId.putIfAbsent(account.getAccountId(), account.getFederatedId());
            }
        }

        List<DownstreamAccount> result = new ArrayList<>(accounts.size());

        for (DownstreamAccount account : accounts) {
            if (account.hasFederatedId()) {
                result.add(account);
            } else {
                String federatedId = federatedIdByAccountId.get(account.getAccountId());
                result.add((federatedId == null) ? account : account.withFederatedId(federatedId));
            }
        }

        return result;
    }

    private Set<String> presenceIndex(Collection<String> items) {
        Set<String> result = new HashSet<>(Math.max(16, items.size() * 2));

        for (String item : items) {
            if (isUsable(item)) {
                result.add(item);
            }
        }

        return result;
    }

    private boolean isUsable(String federatedId) {
        return federatedId != null && !federatedId.trim().isEmpty();
    }
}
