package com.metascan.explorer.entity;

import com.metascan.explorer.modules.jsonapi.JsonApiRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

@Data
@Entity
@Immutable
@IdClass(SessionEntityId.Validator.class)
@Table(name = "data_session_validator")
public class SessionValidator implements JsonApiRecord {

    @Id
    @Column(name = "session_id")
    private Long sessionId;

    @Id
    @Column(name = "rank_validator")
    private Integer rankValidator;

    @Column(name = "validator_stash")
    private String validatorStash;

    @Column(name = "validator_controller")
    private String validatorController;

    @Column(name = "validator_session")
    private String validatorSession;

    @Column(name = "bonded_total")
    private BigDecimal bondedTotal;

    @Column(name = "bonded_active")
    private BigDecimal bondedActive;

    @Column(name = "bonded_nominators")
    private BigDecimal bondedNominators;

    @Column(name = "bonded_own")
    private BigDecimal bondedOwn;

    @Column(name = "count_nominators")
    private Integer countNominators;

    private String commission;

    @Override
    public String resourceType() {
        return "validator";
    }

    @Override
    public String resourceId() {
        return sessionId + "-" + rankValidator;
    }
}
