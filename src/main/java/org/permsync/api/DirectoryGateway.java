package org.permsync.api;

import java.util.List;

public interface DirectoryGateway {
    public String getId();

    public List<UpstreamGroup> fetchGroupsByPrefix(String prefix) throws GatewayException;
}
