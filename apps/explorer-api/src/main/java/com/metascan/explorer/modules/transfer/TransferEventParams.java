package com.metascan.explorer.modules.transfer;

import lombok.Builder;
import lombok.Value;

/**
 * Human-readable summary of a transfer shown on the extrinsic that made it.
 */
@Value
@Builder
public class TransferEventParams {
    String sender;
    String receiver;
    Object amount;
    String memo;
}
