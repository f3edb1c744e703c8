package com.metascan.explorer.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * One positional event argument as stored by the indexer: {@code {type, value}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventAttribute implements Serializable {

    public static final String TYPE_DID = "Did";

    private String type;
    private Object value;

    @JsonIgnore
    public boolean isDid() {
        return TYPE_DID.equals(type);
    }

    public String valueAsText() {
        return value == null ? null : String.valueOf(value);
    }
}
