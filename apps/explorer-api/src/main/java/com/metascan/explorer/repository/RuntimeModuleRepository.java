package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeModule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RuntimeModuleRepository extends JpaRepository<RuntimeModule, Long>, JpaSpecificationExecutor<RuntimeModule> {

    Optional<RuntimeModule> findFirstBySpecVersionAndModuleId(Integer specVersion, String moduleId);

    List<RuntimeModule> findBySpecVersionOrderByLookupAscIdAsc(Integer specVersion);
}
