package com.metascan.explorer.repository;

import com.metascan.explorer.entity.SessionEntityId;
import com.metascan.explorer.entity.SessionNominator;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionNominatorRepository extends JpaRepository<SessionNominator, SessionEntityId.Nominator>, JpaSpecificationExecutor<SessionNominator> {

    List<SessionNominator> findBySessionIdAndRankValidatorOrderByRankNominator(Long sessionId, Integer rankValidator);
}
