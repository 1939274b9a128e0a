package org.permsync.api;

public interface AccessGateway {
    public String getId();

    // Only members strictly below `ceiling` are returned.
    public AccessGroup fetchGroupMembers(String name, AccessLevel ceiling) throws GatewayException;

    public MutationResult addMember(String groupId, String accountId, AccessLevel level);

    public MutationResult removeMember(String groupId, String accountId);
}
