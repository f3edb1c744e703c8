package com.metascan.explorer.entity;

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
@Table(name = "data_stats")
public class Stats {

    /**
     * Currency identifier, e.g. {@code metamui}.
     */
    @Id
    private String id;

    @Column(name = "token_name")
    private String tokenName;

    private String symbol;

    private String site;

    private Integer decimals;

    @Column(name = "current_circulation")
    private BigDecimal currentCirculation;

    @Column(name = "total_supply")
    private BigDecimal totalSupply;
}
