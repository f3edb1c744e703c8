package com.metascan.explorer.repository;


import java.math.BigDecimal;

/**
 * Row of the top holder report: the latest balance snapshot of one account.
 */
public interface TopHolderRow {

    Long getBlockId();

    String getAccountId();

    BigDecimal getBalanceTotal();

    BigDecimal getBalanceFree();

    BigDecimal getBalanceReserved();
}
