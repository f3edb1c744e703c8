package com.metascan.explorer.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * One decoded call argument of an extrinsic, as stored by the indexer.
 * {@code value} is free-form JSON: a scalar, a list of nested params, or a nested call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CallParam implements Serializable {
    private String name;
    private String type;
    private Object value;
    @JsonProperty("valueRaw")
    private String valueRaw;
}
