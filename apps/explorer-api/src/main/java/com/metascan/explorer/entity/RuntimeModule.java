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
@Table(name = "runtime_module")
public class RuntimeModule implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "spec_version")
    private Integer specVersion;

    @Column(name = "module_id")
    private String moduleId;

    private String prefix;

    private String name;

    private String lookup;

    @Column(name = "count_call_functions")
    private Integer countCallFunctions;

    @Column(name = "count_storage_functions")
    private Integer countStorageFunctions;

    @Column(name = "count_events")
    private Integer countEvents;

    @Column(name = "count_constants")
    private Integer countConstants;

    @Column(name = "count_errors")
    private Integer countErrors;

    @Override
    public String resourceType() {
        return "runtimemodule";
    }

    @Override
    public String resourceId() {
        return specVersion + "-" + moduleId;
    }
}
