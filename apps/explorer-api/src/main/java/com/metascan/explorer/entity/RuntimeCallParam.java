package com.metascan.explorer.entity;

import com.metascan.explorer.modules.jsonapi.JsonApiRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;

@Data
@Entity
@Immutable
@Table(name = "runtime_call_param")
public class RuntimeCallParam implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "runtime_call_id")
    private Long runtimeCallId;

    private String name;

    private String type;

    @Override
    public String resourceType() {
        return "runtimecallparam";
    }

    @Override
    public String resourceId() {
        return String.valueOf(id);
    }
}
