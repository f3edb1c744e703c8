package com.metascan.explorer.entity;

import com.metascan.explorer.modules.jsonapi.JsonApiRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Entity
@Immutable
@Table(name = "data_block_total")
public class BlockTotal implements JsonApiRecord {

    @Id
    private Long id;

    @Column(name = "session_id")
    private Long sessionId;

    @Column(name = "parent_datetime")
    private LocalDateTime parentDatetime;

    private BigDecimal blocktime;

    /**
     * DID of the block author.
     */
    private String author;

    @Column(name = "total_extrinsics")
    private Long totalExtrinsics;

    @Column(name = "total_extrinsics_success")
    private Long totalExtrinsicsSuccess;

    @Column(name = "total_extrinsics_error")
    private Long totalExtrinsicsError;

    @Column(name = "total_extrinsics_signed")
    private Long totalExtrinsicsSigned;

    @Column(name = "total_extrinsics_unsigned")
    private Long totalExtrinsicsUnsigned;

    @Column(name = "total_events")
    private Long totalEvents;

    @Column(name = "total_events_module")
    private Long totalEventsModule;

    @Column(name = "total_blocktime")
    private Long totalBlocktime;

    @Column(name = "total_accounts")
    private Long totalAccounts;

    @Column(name = "total_accounts_new")
    private Long totalAccountsNew;

    @Column(name = "total_accounts_reaped")
    private Long totalAccountsReaped;

    @Column(name = "total_sessions_new")
    private Long totalSessionsNew;

    @Column(name = "total_contracts_new")
    private Long totalContractsNew;

    @Column(name = "total_log")
    private Long totalLog;

    @Override
    public String resourceType() {
        return "blocktotal";
    }

    @Override
    public String resourceId() {
        return String.valueOf(id);
    }
}
