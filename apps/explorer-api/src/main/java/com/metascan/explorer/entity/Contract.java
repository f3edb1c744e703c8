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
@Table(name = "data_contract")
public class Contract implements JsonApiRecord {

    @Id
    @Column(name = "code_hash")
    private String codeHash;

    @Column(columnDefinition = "LONGTEXT")
    private String bytecode;

    @Column(columnDefinition = "LONGTEXT")
    private String source;

    @Column(columnDefinition = "LONGTEXT")
    private String abi;

    private String compiler;

    @Column(name = "created_at_block")
    private Long createdAtBlock;

    @Column(name = "created_at_extrinsic")
    private Integer createdAtExtrinsic;

    @Column(name = "created_at_event")
    private Integer createdAtEvent;

    @Override
    public String resourceType() {
        return "contract";
    }

    @Override
    public String resourceId() {
        return codeHash;
    }
}
