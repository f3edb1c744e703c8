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
@Table(name = "data_session")
public class Session implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "start_at_block")
    private Long startAtBlock;

    private Long era;

    @Column(name = "era_idx")
    private Integer eraIdx;

    @Column(name = "created_at_block")
    private Long createdAtBlock;

    @Column(name = "created_at_extrinsic")
    private Integer createdAtExtrinsic;

    @Column(name = "created_at_event")
    private Integer createdAtEvent;

    @Column(name = "count_validators")
    private Integer countValidators;

    @Column(name = "count_nominators")
    private Integer countNominators;

    @Override
    public String resourceType() {
        return "session";
    }

    @Override
    public String resourceId() {
        return String.valueOf(id);
    }
}
