package com.metascan.explorer.repository;

import com.metascan.explorer.entity.BlockTotal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface BlockTotalRepository extends JpaRepository<BlockTotal, Long>, JpaSpecificationExecutor<BlockTotal> {
}
