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
@Table(name = "runtime_event_attribute")
public class RuntimeEventAttribute implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "runtime_event_id")
    private Long runtimeEventId;

    @Column(name = "`index`")
    private Integer index;

    private String type;

    @Override
    public String resourceType() {
        return "runtimeeventattribute";
    }

    @Override
    public String resourceId() {
        return String.valueOf(id);
    }
}
