package com.metascan.explorer.entity;

import com.metascan.explorer.modules.jsonapi.JsonApiRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

@Data
@Entity
@Immutable
@Table(name = "data_account")
public class Account implements JsonApiRecord {

    /**
     * Hex-encoded, right-padded DID.
     */
    @Id
    private String id;

    private String address;

    @Column(name = "index_address")
    private String indexAddress;

    @Column(name = "is_reaped")
    private Boolean isReaped;

    @Column(name = "is_validator")
    private Boolean isValidator;

    @Column(name = "was_validator")
    private Boolean wasValidator;

    @Column(name = "is_nominator")
    private Boolean isNominator;

    @Column(name = "was_nominator")
    private Boolean wasNominator;

    @Column(name = "is_council_member")
    private Boolean isCouncilMember;

    @Column(name = "was_council_member")
    private Boolean wasCouncilMember;

    @Column(name = "is_tech_comm_member")
    private Boolean isTechCommMember;

    @Column(name = "was_tech_comm_member")
    private Boolean wasTechCommMember;

    @Column(name = "is_registrar")
    private Boolean isRegistrar;

    @Column(name = "was_registrar")
    private Boolean wasRegistrar;

    @Column(name = "is_sudo")
    private Boolean isSudo;

    @Column(name = "was_sudo")
    private Boolean wasSudo;

    @Column(name = "is_treasury")
    private Boolean isTreasury;

    @Column(name = "is_contract")
    private Boolean isContract;

    @Column(name = "balance_total")
    private BigDecimal balanceTotal;

    @Column(name = "balance_free")
    private BigDecimal balanceFree;

    @Column(name = "balance_reserved")
    private BigDecimal balanceReserved;

    private Long nonce;

    @Column(name = "has_identity")
    private Boolean hasIdentity;

    @Column(name = "has_subidentity")
    private Boolean hasSubidentity;

    @Column(name = "identity_display")
    private String identityDisplay;

    @Column(name = "identity_web")
    private String identityWeb;

    @Column(name = "identity_email")
    private String identityEmail;

    @Column(name = "identity_judgement_good")
    private Integer identityJudgementGood;

    @Column(name = "identity_judgement_bad")
    private Integer identityJudgementBad;

    @Column(name = "created_at_block")
    private Long createdAtBlock;

    @Column(name = "updated_at_block")
    private Long updatedAtBlock;

    @Override
    public String resourceType() {
        return "account";
    }

    @Override
    public String resourceId() {
        return id;
    }
}
