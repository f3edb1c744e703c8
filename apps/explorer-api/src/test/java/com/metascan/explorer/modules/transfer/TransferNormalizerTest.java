package com.metascan.explorer.modules.transfer;

import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.Event;
import com.metascan.explorer.entity.EventAttribute;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.privacy.PrivacyMask;
import com.metascan.explorer.util.DidCodec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransferNormalizerTest {

    private static final String ALICE = "did:ssid:alice";
    private static final String BOB = "did:ssid:bob";

    private final PrivacyMask privacyMask = new PrivacyMask(ExplorerProperties.defaults());
    private final TransferNormalizer normalizer = new TransferNormalizer(privacyMask);

    @Test
    void transferWithFeeKeepsFourthAttribute() {
        Event event = event("balances", "Transfer",
                did(ALICE), did(BOB), balance(500), balance(7));

        CanonicalTransfer transfer = normalizer.normalize(event, Identity.authenticated(ALICE));

        assertEquals(TransferKind.TRANSFER, transfer.getKind());
        assertEquals("100-3", transfer.getId());
        assertEquals(500, transfer.getValue());
        assertEquals(7, transfer.getFee());
        assertEquals(ALICE, address(transfer.getSender()));
        assertEquals(BOB, address(transfer.getDestination()));
        assertEquals(DidCodec.toPaddedHex(ALICE).substring(2), transfer.getSender().get("id"));
        assertEquals("account", transfer.getSender().get("type"));
    }

    @Test
    void transferWithoutFeeDefaultsToZero() {
        Event event = event("balances", "Transfer", did(ALICE), did(BOB), balance(500));

        CanonicalTransfer transfer = normalizer.normalize(event, Identity.authenticated(BOB));

        assertEquals(0, transfer.getFee());
        assertEquals(500, transfer.getValue());
    }

    @Test
    void outsiderSeesBothPartiesMasked() {
        Event event = event("balances", "Transfer", did(ALICE), did(BOB), balance(1));

        CanonicalTransfer transfer = normalizer.normalize(event, Identity.anonymous());

        assertEquals(privacyMask.mask(ALICE), address(transfer.getSender()));
        assertEquals(privacyMask.mask(BOB), address(transfer.getDestination()));
    }

    @Test
    void claimNamesEthereumAddress() {
        Event event = event("claims", "Claimed",
                did(ALICE), new EventAttribute("EthereumAddress", "0xabc"), balance(42));

        CanonicalTransfer transfer = normalizer.normalize(event, Identity.anonymous());

        assertEquals(TransferKind.CLAIMED, transfer.getKind());
        assertEquals(Map.of("name", "Claim", "eth_address", "0xabc"), transfer.getSender());
        assertTrue(transfer.getDestination().isEmpty());
        assertEquals(42, transfer.getValue());
    }

    @Test
    void depositAndRewardUseSecondAttribute() {
        CanonicalTransfer deposit = normalizer.normalize(
                event("balances", "Deposit", did(ALICE), balance(9)), Identity.anonymous());
        CanonicalTransfer reward = normalizer.normalize(
                event("staking", "Reward", did(ALICE), balance(11)), Identity.anonymous());

        assertEquals(Map.of("name", "Deposit"), deposit.getSender());
        assertEquals(9, deposit.getValue());
        assertEquals(Map.of("name", "Staking reward"), reward.getSender());
        assertEquals(11, reward.getValue());
    }

    @Test
    void unrecognisedOrShortEventsFallBackToUnknown() {
        CanonicalTransfer other = normalizer.normalize(
                event("system", "Remarked", did(ALICE)), Identity.anonymous());
        CanonicalTransfer truncated = normalizer.normalize(
                event("balances", "Transfer", did(ALICE)), Identity.anonymous());

        assertEquals(TransferKind.UNKNOWN, other.getKind());
        assertEquals(TransferKind.UNKNOWN, truncated.getKind());
        assertTrue(truncated.getSender().isEmpty());
        assertNull(truncated.getValue());
    }

    @Test
    void summaryMasksMemoTogetherWithParties() {
        Event event = event("balances", "Transfer", did(ALICE), did(BOB), balance(5));

        TransferEventParams hidden = normalizer.summarize(event, "did:ssid:carol", Identity.anonymous());
        TransferEventParams shown = normalizer.summarize(event, "did:ssid:carol", Identity.authenticated(BOB));

        assertEquals(privacyMask.mask("did:ssid:carol"), hidden.getMemo());
        assertEquals(privacyMask.mask(ALICE), hidden.getSender());
        assertEquals("did:ssid:carol", shown.getMemo());
        assertEquals(ALICE, shown.getSender());
        assertEquals(5, shown.getAmount());
    }

    @SuppressWarnings("unchecked")
    private static String address(Map<String, Object> account) {
        return (String) ((Map<String, Object>) account.get("attributes")).get("address");
    }

    private static Event event(String moduleId, String eventId, EventAttribute... attributes) {
        Event event = new Event();
        event.setBlockId(100L);
        event.setEventIdx(3);
        event.setModuleId(moduleId);
        event.setEventId(eventId);
        event.setAttributes(List.of(attributes));
        return event;
    }

    private static EventAttribute did(String did) {
        return new EventAttribute(EventAttribute.TYPE_DID, DidCodec.toPaddedHex(did));
    }

    private static EventAttribute balance(int amount) {
        return new EventAttribute("Balance", amount);
    }
}
