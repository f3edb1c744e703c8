package com.metascan.explorer.repository;

import com.metascan.explorer.entity.RuntimeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RuntimeTypeRepository extends JpaRepository<RuntimeType, Long>, JpaSpecificationExecutor<RuntimeType> {

    List<RuntimeType> findBySpecVersionOrderByTypeString(Integer specVersion);
}
