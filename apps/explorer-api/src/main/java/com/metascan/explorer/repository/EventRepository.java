package com.metascan.explorer.repository;

import com.metascan.explorer.entity.BlockEntityId;
import com.metascan.explorer.entity.Event;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EventRepository extends JpaRepository<Event, BlockEntityId.Event>, JpaSpecificationExecutor<Event> {

    String TRANSFERS_MENTIONING = "FROM data_event e WHERE e.module_id = 'balances' AND e.event_id = 'Transfer' "
            + "AND JSON_CONTAINS(e.attributes, JSON_OBJECT('value', :accountHex))";

    List<Event> findByBlockIdOrderByEventIdx(Long blockId);

    List<Event> findByBlockIdAndExtrinsicIdxOrderByEventIdx(Long blockId, Integer extrinsicIdx);

    Optional<Event> findFirstByBlockIdAndExtrinsicIdxAndEventId(Long blockId, Integer extrinsicIdx, String eventId);

    List<Event> findTop10ByModuleIdAndEventIdOrderByBlockIdDesc(String moduleId, String eventId);

    /**
     * Report query: balance transfers where any attribute value equals the padded hex DID.
     */
    @Query(value = "SELECT e.* " + TRANSFERS_MENTIONING + " ORDER BY e.block_id DESC, e.event_idx DESC",
            countQuery = "SELECT COUNT(*) " + TRANSFERS_MENTIONING,
            nativeQuery = true)
    Page<Event> findTransfersMentioning(@Param("accountHex") String accountHex, Pageable pageable);

    @Query(value = "SELECT e.* " + TRANSFERS_MENTIONING + " ORDER BY e.block_id DESC, e.event_idx DESC",
            nativeQuery = true)
    List<Event> findAllTransfersMentioning(@Param("accountHex") String accountHex);
}
