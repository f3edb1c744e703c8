package com.metascan.explorer.modules.transfer;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One value movement, whatever event produced it.
 *
 * <p>{@code sender} and {@code destination} are either account descriptors
 * ({@code {type, id, attributes: {id, address}}}) or free-form descriptors such as
 * {@code {name: "Deposit"}}; an absent party is an empty map.</p>
 */
@Value
@Builder(toBuilder = true)
public class CanonicalTransfer {
    TransferKind kind;
    Long blockId;
    Integer eventIdx;
    String eventId;
    Map<String, Object> sender;
    Map<String, Object> destination;
    Object value;
    Object fee;
    LocalDateTime datetime;

    public String getId() {
        return blockId + "-" + eventIdx;
    }
}
