package com.metascan.explorer.modules.chain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Current balance of an account as reported by a live node, in base units.
 */
@Value
@Builder
public class ChainAccountBalance {
    BigDecimal free;
    BigDecimal reserved;
    BigDecimal miscFrozen;
    BigDecimal feeFrozen;
    Long nonce;
}
