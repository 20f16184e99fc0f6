package io.ration.client;

import io.ration.error.ClientRegistryUnavailableException;

/** External account service. */
@FunctionalInterface
public interface ClientRegistry {
    ClientInfo getClientInfo(String clientId) throws ClientRegistryUnavailableException;

    /** Registry for deployments without an account service: every client gets the defaults. */
    static ClientRegistry defaults() { return ClientInfo::defaults; }
}
