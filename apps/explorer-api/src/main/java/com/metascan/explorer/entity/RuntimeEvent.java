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
@Table(name = "runtime_event")
public class RuntimeEvent implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "spec_version")
    private Integer specVersion;

    @Column(name = "module_id")
    private String moduleId;

    @Column(name = "event_id")
    private String eventId;

    @Column(name = "`index`")
    private Integer index;

    private String prefix;

    private String code;

    private String name;

    private String lookup;

    @Column(columnDefinition = "TEXT")
    private String documentation;

    @Column(name = "count_attributes")
    private Integer countAttributes;

    @Override
    public String resourceType() {
        return "runtimeevent";
    }

    @Override
    public String resourceId() {
        return specVersion + "-" + moduleId + "-" + eventId;
    }
}
