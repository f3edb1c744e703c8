package com.metascan.explorer.modules.chain;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Web3jChainRpcClientTest {

    private final Web3jService service = mock(Web3jService.class);
    private final Web3jChainRpcClient client = new Web3jChainRpcClient(service, "did_accountInfo");

    @Test
    @SuppressWarnings({"unchecked", "rawtypes"})
    void parsesBalancesAndPrefixesAccountId() throws Exception {
        AccountInfoResponse response = new AccountInfoResponse();
        response.setResult(Map.of(
                "nonce", 7,
                "data", Map.of("free", "0x0f4240", "reserved", 25, "miscFrozen", "0", "feeFrozen", "0")));
        when(service.send(any(Request.class), eq(AccountInfoResponse.class))).thenReturn(response);

        Optional<ChainAccountBalance> balance = client.fetchAccountBalance("abcd");

        assertEquals(new BigDecimal("1000000"), balance.orElseThrow().getFree());
        assertEquals(new BigDecimal("25"), balance.get().getReserved());
        assertEquals(7L, balance.get().getNonce());
        ArgumentCaptor<Request> request = ArgumentCaptor.forClass(Request.class);
        verify(service).send(request.capture(), eq(AccountInfoResponse.class));
        assertEquals("did_accountInfo", request.getValue().getMethod());
        assertEquals(List.of("0xabcd"), request.getValue().getParams());
    }

    @Test
    @SuppressWarnings("unchecked")
    void rpcErrorIsUpstreamUnavailable() throws Exception {
        AccountInfoResponse response = new AccountInfoResponse();
        response.setError(new Response.Error(-32601, "Method not found"));
        when(service.send(any(Request.class), eq(AccountInfoResponse.class))).thenReturn(response);

        assertThrows(UpstreamUnavailableException.class, () -> client.fetchAccountBalance("0xabcd"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void transportFailureIsUpstreamUnavailable() throws Exception {
        when(service.send(any(Request.class), eq(AccountInfoResponse.class))).thenThrow(new IOException("refused"));

        assertThrows(UpstreamUnavailableException.class, () -> client.fetchAccountBalance("0xabcd"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void unknownAccountIsEmpty() throws Exception {
        when(service.send(any(Request.class), eq(AccountInfoResponse.class))).thenReturn(new AccountInfoResponse());

        assertEquals(Optional.empty(), client.fetchAccountBalance("0xabcd"));
    }
}
