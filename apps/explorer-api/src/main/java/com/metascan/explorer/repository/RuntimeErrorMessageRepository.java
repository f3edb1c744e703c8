package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeErrorMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RuntimeErrorMessageRepository extends JpaRepository<RuntimeErrorMessage, Long>, JpaSpecificationExecutor<RuntimeErrorMessage> {

    Optional<RuntimeErrorMessage> findFirstByModuleIndexAndIndexAndSpecVersion(Integer moduleIndex, Integer index, Integer specVersion);

    List<RuntimeErrorMessage> findBySpecVersionAndModuleIdOrderByNameAscIndexAsc(Integer specVersion, String moduleId);
}
