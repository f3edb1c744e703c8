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
@Table(name = "runtime_type")
public class RuntimeType implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "spec_version")
    private Integer specVersion;

    @Column(name = "type_string")
    private String typeString;

    @Column(name = "decoder_class")
    private String decoderClass;

    @Column(name = "is_primitive_runtime")
    private Boolean isPrimitiveRuntime;

    @Column(name = "is_primitive_core")
    private Boolean isPrimitiveCore;

    @Override
    public String resourceType() {
        return "runtimetype";
    }

    @Override
    public String resourceId() {
        return String.valueOf(id);
    }
}
