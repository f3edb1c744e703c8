package com.metascan.explorer.repository;

import com.metascan.explorer.entity.SessionEntityId;
import com.metascan.explorer.entity.SessionValidator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionValidatorRepository extends JpaRepository<SessionValidator, SessionEntityId.Validator>, JpaSpecificationExecutor<SessionValidator> {

    List<SessionValidator> findBySessionIdOrderByRankValidator(Long sessionId);
}
