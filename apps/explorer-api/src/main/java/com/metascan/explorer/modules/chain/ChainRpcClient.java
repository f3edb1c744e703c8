package com.metascan.explorer.modules.chain;

import java.util.Optional;

public interface ChainRpcClient {

    /**
     * Balance of the account with the given hex id, or empty when lookups are disabled or the
     * node does not know the account.
     */
    Optional<ChainAccountBalance> fetchAccountBalance(String accountId) throws UpstreamUnavailableException;
}
