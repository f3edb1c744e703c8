package com.metascan.explorer.repository;

import com.metascan.explorer.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AccountRepository extends JpaRepository<Account, String>, JpaSpecificationExecutor<Account> {

    Optional<Account> findFirstByAddressOrIndexAddress(String address, String indexAddress);

    List<Account> findByAddressIn(Collection<String> addresses);
}
