package com.metascan.explorer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

/**
 * Account-keyed projection written by the indexer. One row points at either an extrinsic
 * or an event of the block; rows for one {@code (index_type_id, account_id)} are ordered
 * by {@code sorting_value}.
 */
@Data
@Entity
@Immutable
@Table(name = "analytics_search_index")
public class SearchIndex {

    @Id
    private Long id;

    @Column(name = "index_type_id")
    private Integer indexTypeId;

    @Column(name = "block_id")
    private Long blockId;

    @Column(name = "extrinsic_idx")
    private Integer extrinsicIdx;

    @Column(name = "event_idx")
    private Integer eventIdx;

    @Column(name = "account_id")
    private String accountId;

    @Column(name = "sorting_value")
    private BigDecimal sortingValue;
}
