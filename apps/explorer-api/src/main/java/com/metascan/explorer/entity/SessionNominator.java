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
@IdClass(SessionEntityId.Nominator.class)
@Table(name = "data_session_nominator")
public class SessionNominator implements JsonApiRecord {

    @Id
    @Column(name = "session_id")
    private Long sessionId;

    @Id
    @Column(name = "rank_validator")
    private Integer rankValidator;

    @Id
    @Column(name = "rank_nominator")
    private Integer rankNominator;

    @Column(name = "nominator_stash")
    private String nominatorStash;

    @Column(name = "nominator_controller")
    private String nominatorController;

    private BigDecimal bonded;

    @Override
    public String resourceType() {
        return "nominator";
    }

    @Override
    public String resourceId() {
        return sessionId + "-" + rankValidator + "-" + rankNominator;
    }
}
