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
@Table(name = "data_account_index")
public class AccountIndex implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "short_address")
    private String shortAddress;

    @Column(name = "account_id")
    private String accountId;

    @Column(name = "is_reclaimable")
    private Boolean isReclaimable;

    @Column(name = "is_reclaimed")
    private Boolean isReclaimed;

    @Column(name = "created_at_block")
    private Long createdAtBlock;

    @Column(name = "updated_at_block")
    private Long updatedAtBlock;

    @Override
    public String resourceType() {
        return "indices";
    }

    @Override
    public String resourceId() {
        return shortAddress;
    }
}
