package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.Block;
import com.metascan.explorer.entity.Event;
import com.metascan.explorer.exception.ParameterRequiredException;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.FilterParams;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.PageParams;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResolvedPage;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.query.SearchIndexBinding;
import com.metascan.explorer.modules.query.Specs;
import com.metascan.explorer.modules.search.IndexTarget;
import com.metascan.explorer.modules.transfer.CanonicalTransfer;
import com.metascan.explorer.modules.transfer.TransferKind;
import com.metascan.explorer.modules.transfer.TransferNormalizer;
import com.metascan.explorer.repository.AccountInfoSnapshotRepository;
import com.metascan.explorer.repository.BlockRepository;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.repository.TopHolderRow;
import com.metascan.explorer.util.DidCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Balance transfers, transfer history by DID and the top holder report.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class BalanceTransferService {

    static final String RESOURCE_TYPE = "balancetransfer";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final EventRepository eventRepository;
    private final BlockRepository blockRepository;
    private final AccountInfoSnapshotRepository snapshotRepository;
    private final TransferNormalizer transferNormalizer;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;
    private final EventService eventService;
    private final ExplorerProperties.Currency currency;
    private final List<Integer> transferCategories;

    public BalanceTransferService(EventRepository eventRepository,
                                  BlockRepository blockRepository,
                                  AccountInfoSnapshotRepository snapshotRepository,
                                  TransferNormalizer transferNormalizer,
                                  QueryResolver queryResolver,
                                  JsonApiSerializer serializer,
                                  EventService eventService,
                                  ExplorerProperties properties) {
        this.eventRepository = eventRepository;
        this.blockRepository = blockRepository;
        this.snapshotRepository = snapshotRepository;
        this.transferNormalizer = transferNormalizer;
        this.queryResolver = queryResolver;
        this.serializer = serializer;
        this.eventService = eventService;
        this.currency = properties.getCurrency();
        this.transferCategories = properties.getSearchIndex().transferCategories();
    }

    /**
     * Transfers, newest first. With {@code filter[address]} the account's transfers, claims,
     * deposits and rewards come from the search index.
     */
    public ObjectNode listTransfers(ResourceRequest request) {
        ListQuery<Event> query = ListQuery.<Event>builder()
                .resource(RESOURCE_TYPE)
                .executor(eventRepository)
                .sort(Sort.by(Sort.Direction.DESC, "blockId", "eventIdx"))
                .filters(filters -> transferEvents())
                .searchIndex(SearchIndexBinding.<Event>builder()
                        .target(IndexTarget.EVENT)
                        .categories(filters -> filters.has(FilterParams.ADDRESS) ? transferCategories : List.of())
                        .loader(eventService::loadEvents)
                        .positionOf(EventService::positionOf)
                        .build())
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request),
                event -> render(transferNormalizer.normalize(event, Identity.anonymous())));
    }

    public Optional<ObjectNode> getTransfer(String id, Identity viewer) {
        return queryResolver.getItem(RESOURCE_TYPE, id, () -> eventService.findEvent(id))
                .map(event -> serializer.document(render(transferNormalizer.normalize(event, viewer))));
    }

    /**
     * Transfers naming the DID in {@code filter[address]} in any attribute.
     */
    public ObjectNode listHistory(ResourceRequest request) {
        Optional<String> address = request.getFilters().get(FilterParams.ADDRESS);
        if (address.isEmpty()) {
            ListQuery<Event> query = ListQuery.<Event>builder()
                    .resource(RESOURCE_TYPE)
                    .executor(eventRepository)
                    .sort(Sort.by(Sort.Direction.DESC, "blockId", "eventIdx"))
                    .filters(filters -> transferEvents())
                    .build();
            return serializer.listDocument(queryResolver.resolve(query, request),
                    event -> render(transferNormalizer.normalize(event, Identity.anonymous())));
        }

        PageParams page = request.getPage();
        Page<Event> events = eventRepository.findTransfersMentioning(
                storedDid(address.get()), PageRequest.of(page.getNumber() - 1, page.getSize()));
        ResolvedPage<Event> resolved = new ResolvedPage<>(events.getContent(), events.getTotalElements(),
                page.getNumber(), page.getSize(), false);
        return serializer.listDocument(resolved,
                event -> render(transferNormalizer.normalize(event, Identity.anonymous())));
    }

    /**
     * Every transfer naming {@code did}, with block time, masked per record for the viewer.
     */
    public ObjectNode historyByDid(String did, Identity viewer) {
        if (did == null || did.isBlank()) {
            throw new ParameterRequiredException("did");
        }
        List<Event> events = eventRepository.findAllTransfersMentioning(storedDid(did));
        Map<Long, LocalDateTime> blockTimes = blockRepository
                .findAllById(events.stream().map(Event::getBlockId).collect(Collectors.toSet()))
                .stream()
                .filter(block -> block.getDatetime() != null)
                .collect(Collectors.toMap(Block::getId, Block::getDatetime));
        log.debug("Transfer history has {} records", events.size());

        return serializer.listDocument(events.stream()
                .map(event -> transferNormalizer.normalize(event, viewer).toBuilder()
                        .datetime(blockTimes.get(event.getBlockId()))
                        .build())
                .map(this::render)
                .toList());
    }

    /**
     * Latest balance of the richest holder accounts, in whole tokens and percent of total supply.
     */
    public ObjectNode topHolders() {
        List<TopHolderRow> rows = snapshotRepository.findTopHolders(
                DidCodec.toHexPrefix(currency.getHolderDidPrefix()), currency.getTopHoldersLimit());
        return serializer.listDocument(rows.stream().map(this::renderHolder).toList());
    }

    ObjectNode renderHolder(TopHolderRow row) {
        BigDecimal total = scaled(row.getBalanceTotal());
        ObjectNode holder = serializer.objectNode();
        holder.put("block_id", row.getBlockId());
        holder.put("did", DidCodec.decodeOrRaw(row.getAccountId()));
        holder.put("balance_total", total.toPlainString());
        holder.put("balance_free", scaled(row.getBalanceFree()).toPlainString());
        holder.put("balance_reserved", scaled(row.getBalanceReserved()).toPlainString());
        holder.put("percentage", percentage(total).toPlainString());
        return holder;
    }

    private BigDecimal scaled(BigDecimal balance) {
        if (balance == null || balance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return balance.movePointLeft(currency.getDisplayDecimals())
                .setScale(currency.getDisplayDecimals(), RoundingMode.HALF_EVEN);
    }

    private BigDecimal percentage(BigDecimal scaledBalance) {
        if (scaledBalance.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return HUNDRED.multiply(scaledBalance)
                .divide(currency.getTotalSupply(), 2, RoundingMode.HALF_EVEN);
    }

    ObjectNode render(CanonicalTransfer transfer) {
        ObjectNode attributes = serializer.objectNode();
        attributes.put("block_id", transfer.getBlockId());
        attributes.put("event_id", transfer.getEventId());
        attributes.put("event_idx", transfer.getId());
        if (transfer.getDatetime() != null) {
            attributes.put("datetime", JsonApiSerializer.isoUtc(transfer.getDatetime()));
        }
        attributes.set("sender", serializer.tree(transfer.getSender()));
        attributes.set("destination", serializer.tree(transfer.getDestination()));
        attributes.set("value", serializer.tree(transfer.getValue()));
        attributes.set("fee", serializer.tree(transfer.getFee()));
        return serializer.resource(RESOURCE_TYPE, transfer.getId(), attributes);
    }

    /**
     * A {@code 0x} value is taken as the stored form already; anything else is a plain DID.
     */
    static String storedDid(String did) {
        return did.startsWith("0x") ? did : DidCodec.toPaddedHex(did);
    }

    private static Specification<Event> transferEvents() {
        return Specs.<Event>equal("moduleId", TransferKind.TRANSFER.getModuleId())
                .and(Specs.equal("eventId", TransferKind.TRANSFER.getEventId()));
    }
}
