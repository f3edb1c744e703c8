package com.metascan.explorer.repository;

import com.metascan.explorer.entity.Block;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BlockRepository extends JpaRepository<Block, Long>, JpaSpecificationExecutor<Block> {

    Optional<Block> findFirstByHash(String hash);

    List<Block> findBySessionIdOrderByIdDesc(Long sessionId);
}
