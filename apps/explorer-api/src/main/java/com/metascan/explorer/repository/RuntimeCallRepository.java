package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeCall;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RuntimeCallRepository extends JpaRepository<RuntimeCall, Long>, JpaSpecificationExecutor<RuntimeCall> {

    Optional<RuntimeCall> findFirstBySpecVersionAndModuleIdAndCallId(Integer specVersion, String moduleId, String callId);

    List<RuntimeCall> findBySpecVersionAndModuleIdOrderByLookupAscIdAsc(Integer specVersion, String moduleId);
}
