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
@Table(name = "runtime")
public class RuntimeVersion implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "impl_name")
    private String implName;

    @Column(name = "impl_version")
    private Integer implVersion;

    @Column(name = "spec_version")
    private Integer specVersion;

    @Column(name = "spec_name")
    private String specName;

    @Column(name = "authoring_version")
    private Integer authoringVersion;

    @Column(name = "count_modules")
    private Integer countModules;

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
        return "runtime";
    }

    @Override
    public String resourceId() {
        return String.valueOf(specVersion);
    }
}
