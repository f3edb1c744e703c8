package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeVersion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RuntimeVersionRepository extends JpaRepository<RuntimeVersion, Long>, JpaSpecificationExecutor<RuntimeVersion> {

    Optional<RuntimeVersion> findFirstBySpecVersion(Integer specVersion);

    Optional<RuntimeVersion> findFirstByOrderBySpecVersionDesc();
}
