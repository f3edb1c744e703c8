package com.metascan.explorer.repository;

import com.metascan.explorer.entity.BlockEntityId;
import com.metascan.explorer.entity.Log;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LogRepository extends JpaRepository<Log, BlockEntityId.Log>, JpaSpecificationExecutor<Log> {

    List<Log> findByBlockIdOrderByLogIdx(Long blockId);
}
