package com.metascan.explorer.modules.search;

import lombok.Value;

/**
 * Key of a block sub-record: a block and the extrinsic, event or log position within it.
 */
@Value
public class BlockPosition {
    Long blockId;
    Integer idx;
}
