package com.metascan.explorer.entity;

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
@IdClass(BlockEntityId.Snapshot.class)
@Table(name = "data_account_info_snapshot")
public class AccountInfoSnapshot {

    @Id
    @Column(name = "block_id")
    private Long blockId;

    @Id
    @Column(name = "account_id")
    private String accountId;

    @Column(name = "balance_total")
    private BigDecimal balanceTotal;

    @Column(name = "balance_free")
    private BigDecimal balanceFree;

    @Column(name = "balance_reserved")
    private BigDecimal balanceReserved;

    private Long nonce;
}
