package com.metascan.explorer.modules.chain;

import org.web3j.protocol.core.Response;

import java.util.Map;

/**
 * JSON-RPC response carrying {@code {nonce, data: {free, reserved, miscFrozen, feeFrozen}}}.
 */
public class AccountInfoResponse extends Response<Map<String, Object>> {
}
