package com.metascan.explorer.modules.transfer;

import com.metascan.explorer.entity.Event;
import com.metascan.explorer.entity.EventAttribute;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.privacy.DidField;
import com.metascan.explorer.modules.privacy.PrivacyMask;
import com.metascan.explorer.util.DidCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps transfer-like events to {@link CanonicalTransfer}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TransferNormalizer {

    static final String ROLE_SENDER = "sender";
    static final String ROLE_RECEIVER = "receiver";
    static final String ROLE_MEMO = "memo";

    private final PrivacyMask privacyMask;

    public CanonicalTransfer normalize(Event event, Identity viewer) {
        TransferKind kind = TransferKind.classify(event.getModuleId(), event.getEventId());
        List<EventAttribute> attributes = event.getAttributes() == null ? List.of() : event.getAttributes();
        CanonicalTransfer.CanonicalTransferBuilder builder = CanonicalTransfer.builder()
                .kind(kind)
                .blockId(event.getBlockId())
                .eventIdx(event.getEventIdx())
                .eventId(event.getEventId())
                .fee(0);

        return switch (kind) {
            case TRANSFER -> attributes.size() < 3 ? unknown(event, builder) : transfer(attributes, viewer, builder);
            case CLAIMED -> attributes.size() < 3 ? unknown(event, builder) : builder
                    .sender(descriptor("name", "Claim", "eth_address", attributes.get(1).getValue()))
                    .destination(Map.of())
                    .value(attributes.get(2).getValue())
                    .build();
            case DEPOSIT -> attributes.size() < 2 ? unknown(event, builder) : builder
                    .sender(descriptor("name", "Deposit"))
                    .destination(Map.of())
                    .value(attributes.get(1).getValue())
                    .build();
            case REWARD -> attributes.size() < 2 ? unknown(event, builder) : builder
                    .sender(descriptor("name", "Staking reward"))
                    .destination(Map.of())
                    .value(attributes.get(1).getValue())
                    .build();
            case UNKNOWN -> unknown(event, builder);
        };
    }

    /**
     * Sender, receiver and amount of a {@code balances.Transfer} event plus the memo passed to the
     * call, masked together.
     */
    public TransferEventParams summarize(Event transferEvent, String memo, Identity viewer) {
        String sender = "";
        String receiver = "";
        Object amount = "";
        List<EventAttribute> attributes = transferEvent.getAttributes() == null
                ? List.of() : transferEvent.getAttributes();
        for (int i = 0; i < attributes.size(); i++) {
            EventAttribute attribute = attributes.get(i);
            if (attribute.isDid() && i == 0) {
                sender = DidCodec.decodeOrRaw(attribute.valueAsText());
            } else if (attribute.isDid() && i == 1) {
                receiver = DidCodec.decodeOrRaw(attribute.valueAsText());
            } else if ("Balance".equals(attribute.getType())) {
                amount = attribute.getValue();
            }
        }

        List<DidField> fields = new ArrayList<>(3);
        fields.add(DidField.participant(ROLE_SENDER, sender));
        fields.add(DidField.participant(ROLE_RECEIVER, receiver));
        if (memo != null) {
            fields.add(DidField.companion(ROLE_MEMO, memo));
        }
        List<DidField> visible = privacyMask.apply(fields, viewer);
        return TransferEventParams.builder()
                .sender(visible.get(0).getValue())
                .receiver(visible.get(1).getValue())
                .amount(amount)
                .memo(memo == null ? "" : visible.get(2).getValue())
                .build();
    }

    private CanonicalTransfer transfer(List<EventAttribute> attributes,
                                       Identity viewer,
                                       CanonicalTransfer.CanonicalTransferBuilder builder) {
        String senderHex = attributes.get(0).valueAsText();
        String receiverHex = attributes.get(1).valueAsText();
        List<DidField> visible = privacyMask.apply(List.of(
                DidField.participant(ROLE_SENDER, DidCodec.decodeOrRaw(senderHex)),
                DidField.participant(ROLE_RECEIVER, DidCodec.decodeOrRaw(receiverHex))), viewer);

        // networks without transaction fees emit the event without the fourth attribute
        Object fee = attributes.size() == 4 ? attributes.get(3).getValue() : 0;
        return builder
                .sender(account(senderHex, visible.get(0).getValue()))
                .destination(account(receiverHex, visible.get(1).getValue()))
                .value(attributes.get(2).getValue())
                .fee(fee)
                .build();
    }

    private CanonicalTransfer unknown(Event event, CanonicalTransfer.CanonicalTransferBuilder builder) {
        log.debug("No transfer shape for {}.{} at {}-{}",
                event.getModuleId(), event.getEventId(), event.getBlockId(), event.getEventIdx());
        return builder
                .kind(TransferKind.UNKNOWN)
                .sender(Map.of())
                .destination(Map.of())
                .value(null)
                .build();
    }

    static Map<String, Object> account(String hex, String address) {
        String id = hex == null ? null : hex.replace("0x", "");
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("id", id);
        attributes.put("address", address);
        Map<String, Object> account = new LinkedHashMap<>();
        account.put("type", "account");
        account.put("id", id);
        account.put("attributes", attributes);
        return account;
    }

    private static Map<String, Object> descriptor(Object... keysAndValues) {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            descriptor.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return descriptor;
    }
}
