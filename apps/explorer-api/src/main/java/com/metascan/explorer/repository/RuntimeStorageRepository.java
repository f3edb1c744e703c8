package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeStorage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RuntimeStorageRepository extends JpaRepository<RuntimeStorage, Long>, JpaSpecificationExecutor<RuntimeStorage> {

    Optional<RuntimeStorage> findFirstBySpecVersionAndModuleIdAndName(Integer specVersion, String moduleId, String name);

    List<RuntimeStorage> findBySpecVersionAndModuleIdOrderByName(Integer specVersion, String moduleId);
}
