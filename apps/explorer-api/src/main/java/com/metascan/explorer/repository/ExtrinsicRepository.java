package com.metascan.explorer.repository;

import com.metascan.explorer.entity.BlockEntityId;
import com.metascan.explorer.entity.Extrinsic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ExtrinsicRepository extends JpaRepository<Extrinsic, BlockEntityId.Extrinsic>, JpaSpecificationExecutor<Extrinsic> {

    Optional<Extrinsic> findFirstByExtrinsicHash(String extrinsicHash);

    List<Extrinsic> findByBlockIdOrderByExtrinsicIdx(Long blockId);

    List<Extrinsic> findByBlockIdAndSignedOrderByExtrinsicIdx(Long blockId, Integer signed);

    List<Extrinsic> findTop10ByAddressOrderByBlockIdDesc(String address);

    List<Extrinsic> findTop10ByModuleIdAndCallIdOrderByBlockIdDesc(String moduleId, String callId);
}
