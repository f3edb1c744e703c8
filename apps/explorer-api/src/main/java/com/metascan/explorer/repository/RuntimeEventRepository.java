package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface RuntimeEventRepository extends JpaRepository<RuntimeEvent, Long>, JpaSpecificationExecutor<RuntimeEvent> {

    Optional<RuntimeEvent> findFirstBySpecVersionAndModuleIdAndEventId(Integer specVersion, String moduleId, String eventId);

    List<RuntimeEvent> findBySpecVersionAndModuleIdOrderByLookupAscIdAsc(Integer specVersion, String moduleId);
}
