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
@Table(name = "runtime_error_message")
public class RuntimeErrorMessage implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "spec_version")
    private Integer specVersion;

    @Column(name = "module_id")
    private String moduleId;

    @Column(name = "module_index")
    private Integer moduleIndex;

    @Column(name = "`index`")
    private Integer index;

    private String name;

    @Column(columnDefinition = "TEXT")
    private String documentation;

    @Override
    public String resourceType() {
        return "runtimeerrormessage";
    }

    @Override
    public String resourceId() {
        return specVersion + "-" + moduleId + "-" + index;
    }
}
