package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.Account;
import com.metascan.explorer.entity.AccountInfoSnapshot;
import com.metascan.explorer.modules.chain.ChainAccountBalance;
import com.metascan.explorer.modules.chain.ChainRpcClient;
import com.metascan.explorer.modules.chain.UpstreamUnavailableException;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.search.SearchIndexResolver;
import com.metascan.explorer.repository.AccountIndexRepository;
import com.metascan.explorer.repository.AccountInfoSnapshotRepository;
import com.metascan.explorer.repository.AccountRepository;
import com.metascan.explorer.repository.ExtrinsicRepository;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AccountServiceTest {

    private static final String ACCOUNT_ID = "6469643a737369643a616c696365";
    private static final String ADDRESS = "did:ssid:alice";

    private final AccountRepository accountRepository = mock(AccountRepository.class);
    private final AccountInfoSnapshotRepository snapshotRepository = mock(AccountInfoSnapshotRepository.class);
    private final ChainRpcClient chainRpcClient = mock(ChainRpcClient.class);
    private final ExplorerProperties properties = ExplorerProperties.defaults();

    private final AccountService service = new AccountService(
            accountRepository,
            mock(AccountIndexRepository.class),
            snapshotRepository,
            mock(ExtrinsicRepository.class),
            chainRpcClient,
            new QueryResolver(mock(SearchIndexResolver.class), OpenTelemetry.noop().getTracer("test")),
            new JsonApiSerializer(new ObjectMapper().findAndRegisterModules()),
            properties);

    @BeforeEach
    void storedAccount() {
        Account account = new Account();
        account.setId(ACCOUNT_ID);
        account.setAddress(ADDRESS);
        account.setBalanceFree(new BigDecimal("100"));
        account.setBalanceReserved(new BigDecimal("7"));
        account.setNonce(3L);
        when(accountRepository.findFirstByAddressOrIndexAddress(ADDRESS, ADDRESS)).thenReturn(Optional.of(account));
        when(snapshotRepository.findTop1000ByAccountIdOrderByBlockIdDesc(ACCOUNT_ID)).thenReturn(List.of(
                snapshot(20L, "3000000"), snapshot(10L, "1000000")));
    }

    @Test
    void unavailableNodeLeavesStoredBalances() throws Exception {
        when(chainRpcClient.fetchAccountBalance(ACCOUNT_ID))
                .thenThrow(new UpstreamUnavailableException("did_accountInfo failed"));

        JsonNode attributes = detailAttributes();

        assertFalse(attributes.has("misc_frozen_balance"));
        assertFalse(attributes.has("fee_frozen_balance"));
        assertEquals(new BigDecimal("100"), attributes.get("balance_free").decimalValue());
        assertEquals(new BigDecimal("7"), attributes.get("balance_reserved").decimalValue());
        assertEquals(3L, attributes.get("nonce").asLong());
        assertBalanceHistory(attributes);
    }

    @Test
    void liveBalanceReplacesStoredFigures() throws Exception {
        when(chainRpcClient.fetchAccountBalance(ACCOUNT_ID)).thenReturn(Optional.of(ChainAccountBalance.builder()
                .free(new BigDecimal("5000"))
                .reserved(new BigDecimal("40"))
                .miscFrozen(new BigDecimal("11"))
                .feeFrozen(new BigDecimal("12"))
                .nonce(9L)
                .build()));

        JsonNode attributes = detailAttributes();

        assertEquals(new BigDecimal("5000"), attributes.get("balance_free").decimalValue());
        assertEquals(new BigDecimal("40"), attributes.get("balance_reserved").decimalValue());
        assertEquals(new BigDecimal("11"), attributes.get("misc_frozen_balance").decimalValue());
        assertEquals(new BigDecimal("12"), attributes.get("fee_frozen_balance").decimalValue());
        assertEquals(9L, attributes.get("nonce").asLong());
        assertBalanceHistory(attributes);
    }

    @Test
    void unknownAccountIsEmpty() {
        assertTrue(service.getAccount("did:ssid:nobody", request()).isEmpty());
    }

    private JsonNode detailAttributes() {
        Optional<ObjectNode> document = service.getAccount(ADDRESS, request());
        assertTrue(document.isPresent());
        assertEquals("account", document.get().path("data").path("type").asText());
        return document.get().path("data").path("attributes");
    }

    private static void assertBalanceHistory(JsonNode attributes) {
        JsonNode points = attributes.path("balance_history").path(0).path("data");
        assertEquals(2, points.size());
        assertEquals(10L, points.get(0).get(0).asLong());
        assertEquals(1.0, points.get(0).get(1).asDouble());
        assertEquals(20L, points.get(1).get(0).asLong());
        assertEquals(3.0, points.get(1).get(1).asDouble());
    }

    private ResourceRequest request() {
        return ResourceRequest.of(new LinkedMultiValueMap<>(), properties.getPaging());
    }

    private static AccountInfoSnapshot snapshot(Long blockId, String balanceTotal) {
        AccountInfoSnapshot snapshot = new AccountInfoSnapshot();
        snapshot.setBlockId(blockId);
        snapshot.setAccountId(ACCOUNT_ID);
        snapshot.setBalanceTotal(new BigDecimal(balanceTotal));
        return snapshot;
    }
}
