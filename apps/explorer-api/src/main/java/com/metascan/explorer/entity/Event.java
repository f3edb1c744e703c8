package com.metascan.explorer.entity;

import com.metascan.explorer.modules.jsonapi.JsonApiRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.util.List;

@Data
@Entity
@Immutable
@IdClass(BlockEntityId.Event.class)
@Table(name = "data_event")
public class Event implements JsonApiRecord {

    @Id
    @Column(name = "block_id")
    private Long blockId;

    @Id
    @Column(name = "event_idx")
    private Integer eventIdx;

    private String phase;

    @Column(name = "extrinsic_idx")
    private Integer extrinsicIdx;

    private String type;

    @Column(name = "spec_version_id")
    private Integer specVersionId;

    @Column(name = "module_id")
    private String moduleId;

    @Column(name = "event_id")
    private String eventId;

    private Integer system;

    private Integer module;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<EventAttribute> attributes;

    @Column(name = "codec_error")
    private Boolean codecError;

    @Override
    public String resourceType() {
        return "event";
    }

    @Override
    public String resourceId() {
        return blockId + "-" + eventIdx;
    }
}
