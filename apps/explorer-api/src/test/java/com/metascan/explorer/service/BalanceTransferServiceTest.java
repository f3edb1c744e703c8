package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.Block;
import com.metascan.explorer.entity.Event;
import com.metascan.explorer.entity.EventAttribute;
import com.metascan.explorer.exception.ParameterRequiredException;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.privacy.PrivacyMask;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.search.SearchIndexResolver;
import com.metascan.explorer.modules.transfer.TransferNormalizer;
import com.metascan.explorer.repository.AccountInfoSnapshotRepository;
import com.metascan.explorer.repository.BlockRepository;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.repository.TopHolderRow;
import com.metascan.explorer.util.DidCodec;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BalanceTransferServiceTest {

    private static final String ALICE = "did:ssid:alice";
    private static final String BOB = "did:ssid:bob";

    private final EventRepository eventRepository = mock(EventRepository.class);
    private final BlockRepository blockRepository = mock(BlockRepository.class);
    private final AccountInfoSnapshotRepository snapshotRepository = mock(AccountInfoSnapshotRepository.class);
    private final ExplorerProperties properties = ExplorerProperties.defaults();
    private final PrivacyMask privacyMask = new PrivacyMask(properties);

    private final BalanceTransferService service = new BalanceTransferService(
            eventRepository,
            blockRepository,
            snapshotRepository,
            new TransferNormalizer(privacyMask),
            new QueryResolver(mock(SearchIndexResolver.class), OpenTelemetry.noop().getTracer("test")),
            new JsonApiSerializer(new ObjectMapper().findAndRegisterModules()),
            mock(EventService.class),
            properties);

    @Test
    void topHoldersAreScaledWithPercentageOfSupply() {
        when(snapshotRepository.findTopHolders(DidCodec.toHexPrefix("did:ssid:"), 100)).thenReturn(List.of(
                holder(DidCodec.toPaddedHex(ALICE).substring(2), "250000000000000", "249999999500000", "500000")));

        JsonNode holder = service.topHolders().get("data").get(0);

        assertEquals(77, holder.get("block_id").asLong());
        assertEquals(ALICE, holder.get("did").asText());
        assertEquals("250000000.000000", holder.get("balance_total").asText());
        assertEquals("249999999.500000", holder.get("balance_free").asText());
        assertEquals("0.500000", holder.get("balance_reserved").asText());
        assertEquals("25.00", holder.get("percentage").asText());
    }

    @Test
    void emptyBalanceIsZero() {
        JsonNode holder = service.renderHolder(holder("00", "0", null, "0"));

        assertEquals("0", holder.get("balance_total").asText());
        assertEquals("0", holder.get("percentage").asText());
    }

    @Test
    void historyRequiresDid() {
        assertThrows(ParameterRequiredException.class, () -> service.historyByDid(" ", Identity.anonymous()));
    }

    @Test
    void historyByDidMasksPerRecordAndAddsBlockTime() {
        Event transfer = new Event();
        transfer.setBlockId(12L);
        transfer.setEventIdx(3);
        transfer.setModuleId("balances");
        transfer.setEventId("Transfer");
        transfer.setAttributes(List.of(
                new EventAttribute(EventAttribute.TYPE_DID, DidCodec.toPaddedHex(ALICE)),
                new EventAttribute(EventAttribute.TYPE_DID, DidCodec.toPaddedHex(BOB)),
                new EventAttribute("Balance", 10)));
        Block block = new Block();
        block.setId(12L);
        block.setDatetime(LocalDateTime.of(2024, 1, 2, 3, 4, 5));
        when(eventRepository.findAllTransfersMentioning(DidCodec.toPaddedHex(ALICE))).thenReturn(List.of(transfer));
        when(blockRepository.findAllById(any())).thenReturn(List.of(block));

        JsonNode own = service.historyByDid(ALICE, Identity.authenticated(ALICE)).get("data").get(0);
        JsonNode foreign = service.historyByDid(ALICE, Identity.authenticated("did:ssid:mallory")).get("data").get(0);

        assertEquals("balancetransfer", own.get("type").asText());
        assertEquals("12-3", own.get("id").asText());
        assertEquals("2024-01-02T03:04:05+00:00", own.get("attributes").get("datetime").asText());
        assertEquals(BOB, own.get("attributes").get("destination").get("attributes").get("address").asText());
        assertEquals(privacyMask.mask(BOB),
                foreign.get("attributes").get("destination").get("attributes").get("address").asText());
    }

    @Test
    void plainDidIsConvertedToStoredForm() {
        assertEquals(DidCodec.toPaddedHex(ALICE), BalanceTransferService.storedDid(ALICE));
        assertEquals("0x00ff", BalanceTransferService.storedDid("0x00ff"));
    }

    private static TopHolderRow holder(String accountId, String total, String free, String reserved) {
        return new TopHolderRow() {
            @Override
            public Long getBlockId() {
                return 77L;
            }

            @Override
            public String getAccountId() {
                return accountId;
            }

            @Override
            public BigDecimal getBalanceTotal() {
                return new BigDecimal(total);
            }

            @Override
            public BigDecimal getBalanceFree() {
                return free == null ? null : new BigDecimal(free);
            }

            @Override
            public BigDecimal getBalanceReserved() {
                return new BigDecimal(reserved);
            }
        };
    }
}
