package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeCallParam;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RuntimeCallParamRepository extends JpaRepository<RuntimeCallParam, Long>, JpaSpecificationExecutor<RuntimeCallParam> {

    List<RuntimeCallParam> findByRuntimeCallIdOrderById(Long runtimeCallId);
}
