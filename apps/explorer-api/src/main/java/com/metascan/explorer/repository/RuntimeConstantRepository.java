package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeConstant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RuntimeConstantRepository extends JpaRepository<RuntimeConstant, Long>, JpaSpecificationExecutor<RuntimeConstant> {

    Optional<RuntimeConstant> findFirstBySpecVersionAndModuleIdAndName(Integer specVersion, String moduleId, String name);

    List<RuntimeConstant> findBySpecVersionAndModuleIdOrderByName(Integer specVersion, String moduleId);
}
