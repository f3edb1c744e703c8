package com.metascan.explorer.modules.chain;

import java.util.Optional;

/**
 * Used when no node is configured: account details carry stored balances only.
 */
public class DisabledChainRpcClient implements ChainRpcClient {

    @Override
    public Optional<ChainAccountBalance> fetchAccountBalance(String accountId) {
        return Optional.empty();
    }
}
