package com.metascan.explorer.repository;

import com.metascan.explorer.entity.AccountIndex;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccountIndexRepository extends JpaRepository<AccountIndex, Long>, JpaSpecificationExecutor<AccountIndex> {

    Optional<AccountIndex> findFirstByShortAddress(String shortAddress);

    List<AccountIndex> findByAccountIdOrderByUpdatedAtBlockDesc(String accountId);
}
