package com.metascan.explorer.repository;

import com.metascan.explorer.entity.AccountInfoSnapshot;
import com.metascan.explorer.entity.BlockEntityId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AccountInfoSnapshotRepository extends JpaRepository<AccountInfoSnapshot, BlockEntityId.Snapshot> {

    List<AccountInfoSnapshot> findTop1000ByAccountIdOrderByBlockIdDesc(String accountId);

    /**
     * Report query: latest snapshot per account whose hex id starts with {@code accountPrefix},
     * richest first.
     */
    @Query(value = """
            SELECT tt.block_id AS blockId, tt.account_id AS accountId, tt.balance_total AS balanceTotal,
                   tt.balance_free AS balanceFree, tt.balance_reserved AS balanceReserved
            FROM data_account_info_snapshot tt
            INNER JOIN (SELECT account_id, MAX(block_id) AS max_block_id
                        FROM data_account_info_snapshot
                        GROUP BY account_id) latest
                ON tt.account_id = latest.account_id AND tt.block_id = latest.max_block_id
            WHERE tt.account_id LIKE CONCAT(:accountPrefix, '%')
            ORDER BY tt.balance_total DESC
            LIMIT :limit
            """, nativeQuery = true)
    List<TopHolderRow> findTopHolders(@Param("accountPrefix") String accountPrefix, @Param("limit") int limit);
}
