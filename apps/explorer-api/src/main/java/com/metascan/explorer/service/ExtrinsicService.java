package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.entity.Account;
import com.metascan.explorer.entity.Block;
import com.metascan.explorer.entity.BlockEntityId;
import com.metascan.explorer.entity.CallParam;
import com.metascan.explorer.entity.Event;
import com.metascan.explorer.entity.EventAttribute;
import com.metascan.explorer.entity.Extrinsic;
import com.metascan.explorer.entity.RuntimeCall;
import com.metascan.explorer.entity.RuntimeErrorMessage;
import com.metascan.explorer.exception.InvalidFilterValueException;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.jsonapi.CallParamInspector;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.FilterParams;
import com.metascan.explorer.modules.query.ItemKey;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResolvedPage;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.query.SearchIndexBinding;
import com.metascan.explorer.modules.query.Specs;
import com.metascan.explorer.modules.search.BlockPosition;
import com.metascan.explorer.modules.search.IndexTarget;
import com.metascan.explorer.modules.transfer.TransferNormalizer;
import com.metascan.explorer.repository.BlockRepository;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.repository.ExtrinsicRepository;
import com.metascan.explorer.repository.RuntimeCallRepository;
import com.metascan.explorer.repository.RuntimeErrorMessageRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ExtrinsicService {

    static final String TRANSFER_EVENT = "Transfer";
    static final String FAILED_EVENT = "ExtrinsicFailed";

    private static final List<String> PARAMS = List.of("params");

    private final ExtrinsicRepository extrinsicRepository;
    private final EventRepository eventRepository;
    private final BlockRepository blockRepository;
    private final RuntimeCallRepository runtimeCallRepository;
    private final RuntimeErrorMessageRepository runtimeErrorMessageRepository;
    private final AccountService accountService;
    private final TransferNormalizer transferNormalizer;
    private final CallParamInspector callParamInspector;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;

    /**
     * Extrinsics, newest first. Params are left out unless the list comes from the search index.
     */
    public ObjectNode listExtrinsics(ResourceRequest request) {
        ListQuery<Extrinsic> query = ListQuery.<Extrinsic>builder()
                .resource("extrinsic")
                .executor(extrinsicRepository)
                .sort(Sort.by(Sort.Direction.DESC, "blockId", "extrinsicIdx"))
                .filters(ExtrinsicService::extrinsicFilters)
                .searchIndex(SearchIndexBinding.<Extrinsic>builder()
                        .target(IndexTarget.EXTRINSIC)
                        .categories(SearchIndexBinding.requestedCategories())
                        .loader(positions -> extrinsicRepository.findAllById(positions.stream()
                                .map(p -> new BlockEntityId.Extrinsic(p.getBlockId(), p.getIdx()))
                                .toList()))
                        .positionOf(e -> new BlockPosition(e.getBlockId(), e.getExtrinsicIdx()))
                        .build())
                .build();

        ResolvedPage<Extrinsic> page = queryResolver.resolve(query, request);
        Map<String, Account> accounts = accountService.findByAddresses(page.getItems().stream()
                .map(Extrinsic::getAddress)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet()));
        List<String> excluded = page.isSearchIndexUsed() ? List.of() : PARAMS;
        return serializer.listDocument(page, extrinsic -> {
            ObjectNode resource = serializer.resource(extrinsic, excluded);
            Account account = extrinsic.getAddress() == null ? null : accounts.get(extrinsic.getAddress());
            if (account != null) {
                attributes(resource).set("account", serializer.resource(account));
            }
            return resource;
        });
    }

    public Optional<ObjectNode> getExtrinsic(String id, ResourceRequest request, Identity viewer) {
        return queryResolver.getItem("extrinsic", id, () -> findExtrinsic(id))
                .map(extrinsic -> serializer.document(renderDetail(extrinsic, request, viewer)));
    }

    private Optional<Extrinsic> findExtrinsic(String id) {
        if (ItemKey.isHash(id)) {
            return extrinsicRepository.findFirstByExtrinsicHash(id.substring(2));
        }
        return ItemKey.blockPosition(id)
                .flatMap(p -> extrinsicRepository.findById(new BlockEntityId.Extrinsic(p.getBlockId(), p.getIdx())));
    }

    private ObjectNode renderDetail(Extrinsic extrinsic, ResourceRequest request, Identity viewer) {
        ObjectNode resource = serializer.resource(extrinsic);
        ObjectNode attributes = attributes(resource);

        attributes.put("documentation", runtimeCallRepository
                .findFirstBySpecVersionAndModuleIdAndCallId(
                        extrinsic.getSpecVersionId(), extrinsic.getModuleId(), extrinsic.getCallId())
                .map(RuntimeCall::getDocumentation)
                .orElse(null));
        attributes.put("datetime", blockRepository.findById(extrinsic.getBlockId())
                .map(Block::getDatetime)
                .map(JsonApiSerializer::isoUtc)
                .orElse(null));
        accountService.findByAddress(extrinsic.getAddress())
                .ifPresent(account -> attributes.set("account", serializer.resource(account)));

        callParamInspector.inspect(attributes.get("params"), extrinsic.resourceId());

        if ("balances".equals(extrinsic.getModuleId())) {
            Optional<String> memo = Optional.empty();
            boolean transferCall = "transfer".equals(extrinsic.getCallId());
            if ("transfer_with_memo".equals(extrinsic.getCallId()) && paramCount(extrinsic) >= 3) {
                transferCall = true;
                memo = Optional.ofNullable(extrinsic.getParams().get(2).getValue()).map(String::valueOf);
            }
            if (transferCall) {
                String memoValue = memo.orElse(null);
                eventRepository.findFirstByBlockIdAndExtrinsicIdxAndEventId(
                                extrinsic.getBlockId(), extrinsic.getExtrinsicIdx(), TRANSFER_EVENT)
                        .ifPresent(event -> attributes.set("event_params",
                                serializer.tree(transferNormalizer.summarize(event, memoValue, viewer))));
            }
        }

        if (extrinsic.getError() != null && extrinsic.getError() != 0) {
            errorMessage(extrinsic).ifPresent(message -> attributes.put("error_message", message));
        }

        if (request.includes("events")) {
            serializer.withRelatedRecords(resource, "events", eventRepository
                    .findByBlockIdAndExtrinsicIdxOrderByEventIdx(extrinsic.getBlockId(), extrinsic.getExtrinsicIdx()));
        }
        return resource;
    }

    /**
     * Reason of a failed call from its {@code ExtrinsicFailed} event.
     */
    Optional<String> errorMessage(Extrinsic extrinsic) {
        Optional<Event> failed = eventRepository.findFirstByBlockIdAndExtrinsicIdxAndEventId(
                extrinsic.getBlockId(), extrinsic.getExtrinsicIdx(), FAILED_EVENT);
        if (failed.isEmpty() || failed.get().getAttributes() == null || failed.get().getAttributes().isEmpty()) {
            return Optional.empty();
        }
        EventAttribute dispatchError = failed.get().getAttributes().get(0);
        Object value = dispatchError.getValue();
        if (value instanceof Map) {
            Map<?, ?> error = (Map<?, ?>) value;
            if (error.get("Module") instanceof Map) {
                Map<?, ?> module = (Map<?, ?>) error.get("Module");
                Optional<Integer> moduleIndex = ItemKey.asInt(String.valueOf(module.get("index")));
                Optional<Integer> errorIndex = ItemKey.asInt(String.valueOf(module.get("error")));
                if (moduleIndex.isEmpty() || errorIndex.isEmpty()) {
                    return Optional.empty();
                }
                return runtimeErrorMessageRepository
                        .findFirstByModuleIndexAndIndexAndSpecVersion(
                                moduleIndex.get(), errorIndex.get(), extrinsic.getSpecVersionId())
                        .map(RuntimeErrorMessage::getDocumentation);
            }
            return originError(error.keySet().toString());
        }
        if (value != null) {
            return originError(value.toString());
        }
        return Optional.empty();
    }

    private static Optional<String> originError(String dispatchError) {
        if (dispatchError.contains("BadOrigin")) {
            return Optional.of("Bad origin");
        }
        if (dispatchError.contains("CannotLookup")) {
            return Optional.of("Cannot lookup");
        }
        return Optional.empty();
    }

    private static int paramCount(Extrinsic extrinsic) {
        List<CallParam> params = extrinsic.getParams();
        return params == null ? 0 : params.size();
    }

    private static Specification<Extrinsic> extrinsicFilters(FilterParams filters) {
        Specification<Extrinsic> spec = Specs.all();
        Optional<String> signed = filters.get("signed");
        if (signed.isPresent()) {
            Integer value = ItemKey.asInt(signed.get())
                    .orElseThrow(() -> new InvalidFilterValueException("signed", "Not an integer: " + signed.get()));
            spec = spec.and(Specs.equal("signed", value));
        }
        Optional<String> moduleId = filters.get("module_id");
        if (moduleId.isPresent()) {
            spec = spec.and(Specs.equal("moduleId", moduleId.get()));
        }
        Optional<String> callId = filters.get("call_id");
        if (callId.isPresent()) {
            spec = spec.and(Specs.equal("callId", callId.get()));
        }
        Optional<String> address = filters.getDecodedDid(FilterParams.ADDRESS);
        if (address.isPresent()) {
            spec = spec.and(Specs.equal("address", address.get()));
        }
        return spec;
    }

    private static ObjectNode attributes(ObjectNode resource) {
        return (ObjectNode) resource.get("attributes");
    }
}
