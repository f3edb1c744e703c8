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
@Table(name = "runtime_storage")
public class RuntimeStorage implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "spec_version")
    private Integer specVersion;

    @Column(name = "module_id")
    private String moduleId;

    @Column(name = "`index`")
    private Integer index;

    private String name;

    private String lookup;

    @Column(name = "`default`")
    private String defaultValue;

    private String modifier;

    @Column(name = "type_hasher")
    private String typeHasher;

    @Column(name = "storage_key")
    private String storageKey;

    @Column(name = "type_key1")
    private String typeKey1;

    @Column(name = "type_key2")
    private String typeKey2;

    @Column(name = "type_value")
    private String typeValue;

    @Column(columnDefinition = "TEXT")
    private String documentation;

    @Override
    public String resourceType() {
        return "runtimestorage";
    }

    @Override
    public String resourceId() {
        return specVersion + "-" + moduleId + "-" + name;
    }
}
