package com.metascan.explorer.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key of records that live inside a block: {@code (block_id, idx)}.
 * The second component is named after the owning entity's index column.
 */
public final class BlockEntityId {

    private BlockEntityId() {
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Extrinsic implements Serializable {
        private Long blockId;
        private Integer extrinsicIdx;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Event implements Serializable {
        private Long blockId;
        private Integer eventIdx;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Log implements Serializable {
        private Long blockId;
        private Integer logIdx;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Snapshot implements Serializable {
        private Long blockId;
        private String accountId;
    }
}
