package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeEventAttribute;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RuntimeEventAttributeRepository extends JpaRepository<RuntimeEventAttribute, Long>, JpaSpecificationExecutor<RuntimeEventAttribute> {

    List<RuntimeEventAttribute> findByRuntimeEventIdOrderById(Long runtimeEventId);
}
