package com.metascan.explorer.modules.chain;

import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads account balances from a node over JSON-RPC. The method name is configurable because
 * nodes expose the account info call under different names.
 */
@Slf4j
public class Web3jChainRpcClient implements ChainRpcClient {

    private final Web3jService service;
    private final String balanceMethod;

    public Web3jChainRpcClient(Web3jService service, String balanceMethod) {
        this.service = service;
        this.balanceMethod = balanceMethod;
    }

    @Override
    public Optional<ChainAccountBalance> fetchAccountBalance(String accountId) throws UpstreamUnavailableException {
        String param = accountId.startsWith("0x") ? accountId : "0x" + accountId;
        AccountInfoResponse response;
        try {
            response = new Request<>(balanceMethod, List.of(param), service, AccountInfoResponse.class).send();
        } catch (IOException e) {
            throw new UpstreamUnavailableException(balanceMethod + " failed", e);
        }
        if (response.hasError()) {
            throw new UpstreamUnavailableException(balanceMethod + " returned error "
                    + response.getError().getCode() + ": " + response.getError().getMessage());
        }
        Map<String, Object> result = response.getResult();
        if (result == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(toBalance(result));
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException(balanceMethod + " returned an unexpected result", e);
        }
    }

    @SuppressWarnings("unchecked")
    private static ChainAccountBalance toBalance(Map<String, Object> result) {
        Object data = result.get("data");
        Map<String, Object> balances = data instanceof Map ? (Map<String, Object>) data : result;
        BigDecimal nonce = amount(result.get("nonce"));
        return ChainAccountBalance.builder()
                .free(amount(balances.get("free")))
                .reserved(amount(balances.get("reserved")))
                .miscFrozen(amount(balances.get("miscFrozen")))
                .feeFrozen(amount(balances.get("feeFrozen")))
                .nonce(nonce == null ? null : nonce.longValueExact())
                .build();
    }

    static BigDecimal amount(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }
        String text = value.toString();
        if (text.startsWith("0x")) {
            return new BigDecimal(Numeric.toBigInt(text));
        }
        return new BigDecimal(text);
    }
}
