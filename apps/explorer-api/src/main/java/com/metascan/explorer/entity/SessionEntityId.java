package com.metascan.explorer.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

public final class SessionEntityId {

    private SessionEntityId() {
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Validator implements Serializable {
        private Long sessionId;
        private Integer rankValidator;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Nominator implements Serializable {
        private Long sessionId;
        private Integer rankValidator;
        private Integer rankNominator;
    }
}
