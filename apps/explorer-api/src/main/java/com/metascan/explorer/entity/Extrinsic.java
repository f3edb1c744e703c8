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
@IdClass(BlockEntityId.Extrinsic.class)
@Table(name = "data_extrinsic")
public class Extrinsic implements JsonApiRecord {

    @Id
    @Column(name = "block_id")
    private Long blockId;

    @Id
    @Column(name = "extrinsic_idx")
    private Integer extrinsicIdx;

    @Column(name = "extrinsic_length")
    private String extrinsicLength;

    @Column(name = "extrinsic_version")
    private String extrinsicVersion;

    private Integer signed;

    private Integer unsigned;

    @Column(name = "signedby_address")
    private Integer signedbyAddress;

    @Column(name = "signedby_index")
    private Integer signedbyIndex;

    /**
     * DID of the signer.
     */
    private String address;

    @Column(name = "account_index")
    private String accountIndex;

    private String signature;

    private Long nonce;

    private String era;

    private String call;

    @Column(name = "module_id")
    private String moduleId;

    @Column(name = "call_id")
    private String callId;

    @JdbcTypeCode(SqlTypes.JSON)
    private List<CallParam> params;

    private Integer success;

    private Integer error;

    @Column(name = "spec_version_id")
    private Integer specVersionId;

    @Column(name = "codec_error")
    private Boolean codecError;

    @Column(name = "extrinsic_hash")
    private String extrinsicHash;

    @Override
    public String resourceType() {
        return "extrinsic";
    }

    @Override
    public String resourceId() {
        return blockId + "-" + extrinsicIdx;
    }
}
