package com.metascan.explorer.entity;

import com.metascan.explorer.modules.jsonapi.JsonApiRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

@Data
@Entity
@Immutable
@Table(name = "data_block")
public class Block implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "parent_id")
    private Long parentId;

    @Column(nullable = false)
    private String hash;

    @Column(name = "parent_hash")
    private String parentHash;

    @Column(name = "state_root")
    private String stateRoot;

    @Column(name = "extrinsics_root")
    private String extrinsicsRoot;

    @Column(name = "count_extrinsics")
    private Integer countExtrinsics;

    @Column(name = "count_extrinsics_signed")
    private Integer countExtrinsicsSigned;

    @Column(name = "count_extrinsics_unsigned")
    private Integer countExtrinsicsUnsigned;

    @Column(name = "count_extrinsics_error")
    private Integer countExtrinsicsError;

    @Column(name = "count_extrinsics_success")
    private Integer countExtrinsicsSuccess;

    @Column(name = "count_events")
    private Integer countEvents;

    @Column(name = "count_events_system")
    private Integer countEventsSystem;

    @Column(name = "count_events_module")
    private Integer countEventsModule;

    @Column(name = "count_events_extrinsic")
    private Integer countEventsExtrinsic;

    @Column(name = "count_accounts_new")
    private Integer countAccountsNew;

    @Column(name = "count_accounts_reaped")
    private Integer countAccountsReaped;

    @Column(name = "count_sessions_new")
    private Integer countSessionsNew;

    @Column(name = "count_contracts_new")
    private Integer countContractsNew;

    @Column(name = "count_log")
    private Integer countLog;

    @Column(name = "session_id")
    private Long sessionId;

    @Column(name = "slot_number")
    private String slotNumber;

    @Column(name = "authority_index")
    private Integer authorityIndex;

    private LocalDateTime datetime;

    @Column(name = "spec_version_id")
    private Integer specVersionId;

    @Override
    public String resourceType() {
        return "block";
    }

    @Override
    public String resourceId() {
        return String.valueOf(id);
    }
}
