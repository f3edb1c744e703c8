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

import java.util.Map;

@Data
@Entity
@Immutable
@IdClass(BlockEntityId.Log.class)
@Table(name = "data_log")
public class Log implements JsonApiRecord {

    @Id
    @Column(name = "block_id")
    private Long blockId;

    @Id
    @Column(name = "log_idx")
    private Integer logIdx;

    @Column(name = "type_id")
    private Integer typeId;

    private String type;

    @JdbcTypeCode(SqlTypes.JSON)
    private Map<String, Object> data;

    @Override
    public String resourceType() {
        return "log";
    }

    @Override
    public String resourceId() {
        return blockId + "-" + logIdx;
    }
}
