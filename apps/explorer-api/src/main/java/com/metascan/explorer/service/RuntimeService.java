package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.entity.RuntimeCall;
import com.metascan.explorer.entity.RuntimeConstant;
import com.metascan.explorer.entity.RuntimeEvent;
import com.metascan.explorer.entity.RuntimeModule;
import com.metascan.explorer.entity.RuntimeType;
import com.metascan.explorer.entity.RuntimeVersion;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.FilterParams;
import com.metascan.explorer.modules.query.ItemKey;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.query.Specs;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.repository.ExtrinsicRepository;
import com.metascan.explorer.repository.RuntimeCallParamRepository;
import com.metascan.explorer.repository.RuntimeCallRepository;
import com.metascan.explorer.repository.RuntimeConstantRepository;
import com.metascan.explorer.repository.RuntimeErrorMessageRepository;
import com.metascan.explorer.repository.RuntimeEventAttributeRepository;
import com.metascan.explorer.repository.RuntimeEventRepository;
import com.metascan.explorer.repository.RuntimeModuleRepository;
import com.metascan.explorer.repository.RuntimeStorageRepository;
import com.metascan.explorer.repository.RuntimeTypeRepository;
import com.metascan.explorer.repository.RuntimeVersionRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Runtime metadata: versions, modules and the calls, events, storage functions, constants and
 * errors they declare.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RuntimeService {

    static final String LATEST_RUNTIME = "latestRuntime";

    private final RuntimeVersionRepository versionRepository;
    private final RuntimeModuleRepository moduleRepository;
    private final RuntimeCallRepository callRepository;
    private final RuntimeCallParamRepository callParamRepository;
    private final RuntimeEventRepository eventRepository;
    private final RuntimeEventAttributeRepository eventAttributeRepository;
    private final RuntimeTypeRepository typeRepository;
    private final RuntimeStorageRepository storageRepository;
    private final RuntimeConstantRepository constantRepository;
    private final RuntimeErrorMessageRepository errorMessageRepository;
    private final ExtrinsicRepository extrinsicRepository;
    private final EventRepository chainEventRepository;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;

    public ObjectNode listRuntimes(ResourceRequest request) {
        ListQuery<RuntimeVersion> query = ListQuery.<RuntimeVersion>builder()
                .resource("runtime")
                .executor(versionRepository)
                .sort(Sort.by(Sort.Direction.DESC, "id"))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getRuntime(String specVersion, ResourceRequest request) {
        return queryResolver.getItem("runtime", specVersion,
                        () -> ItemKey.asInt(specVersion).flatMap(versionRepository::findFirstBySpecVersion))
                .map(runtime -> {
                    ObjectNode resource = serializer.resource(runtime);
                    if (request.includes("modules")) {
                        serializer.withRelatedRecords(resource, "modules",
                                moduleRepository.findBySpecVersionOrderByLookupAscIdAsc(runtime.getSpecVersion()));
                    }
                    if (request.includes("types")) {
                        serializer.withRelatedRecords(resource, "types",
                                typeRepository.findBySpecVersionOrderByTypeString(runtime.getSpecVersion()));
                    }
                    return serializer.document(resource);
                });
    }

    public ObjectNode listCalls(ResourceRequest request) {
        ListQuery<RuntimeCall> query = ListQuery.<RuntimeCall>builder()
                .resource("runtime-call")
                .executor(callRepository)
                .sort(Sort.by("specVersion", "moduleId", "callId"))
                .filters(filters -> this.<RuntimeCall>latestRuntime(filters).and(moduleId(filters)))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getCall(String id, ResourceRequest request) {
        return queryResolver.getItem("runtime-call", id, () -> ModuleItemKey.parse(id)
                        .flatMap(key -> callRepository.findFirstBySpecVersionAndModuleIdAndCallId(
                                key.getSpecVersion(), key.getModuleId(), key.getName())))
                .map(call -> {
                    ObjectNode resource = serializer.resource(call);
                    if (request.includes("params")) {
                        serializer.withRelatedRecords(resource, "params",
                                callParamRepository.findByRuntimeCallIdOrderById(call.getId()));
                    }
                    if (request.includes("recent_extrinsics")) {
                        serializer.withRelatedRecords(resource, "recent_extrinsics",
                                extrinsicRepository.findTop10ByModuleIdAndCallIdOrderByBlockIdDesc(
                                        call.getModuleId(), call.getCallId()));
                    }
                    return serializer.document(resource);
                });
    }

    public ObjectNode listEvents(ResourceRequest request) {
        ListQuery<RuntimeEvent> query = ListQuery.<RuntimeEvent>builder()
                .resource("runtime-event")
                .executor(eventRepository)
                .sort(Sort.by("specVersion", "moduleId", "eventId"))
                .filters(filters -> this.<RuntimeEvent>latestRuntime(filters).and(moduleId(filters)))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getEvent(String id, ResourceRequest request) {
        return queryResolver.getItem("runtime-event", id, () -> ModuleItemKey.parse(id)
                        .flatMap(key -> eventRepository.findFirstBySpecVersionAndModuleIdAndEventId(
                                key.getSpecVersion(), key.getModuleId(), key.getName())))
                .map(event -> {
                    ObjectNode resource = serializer.resource(event);
                    if (request.includes("attributes")) {
                        serializer.withRelatedRecords(resource, "attributes",
                                eventAttributeRepository.findByRuntimeEventIdOrderById(event.getId()));
                    }
                    if (request.includes("recent_events")) {
                        serializer.withRelatedRecords(resource, "recent_events",
                                chainEventRepository.findTop10ByModuleIdAndEventIdOrderByBlockIdDesc(
                                        event.getModuleId(), event.getEventId()));
                    }
                    return serializer.document(resource);
                });
    }

    public ObjectNode listTypes(ResourceRequest request) {
        ListQuery<RuntimeType> query = ListQuery.<RuntimeType>builder()
                .resource("runtime-type")
                .executor(typeRepository)
                .sort(Sort.by("specVersion", "typeString"))
                .filters(this::latestRuntime)
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public ObjectNode listModules(ResourceRequest request) {
        ListQuery<RuntimeModule> query = ListQuery.<RuntimeModule>builder()
                .resource("runtime-module")
                .executor(moduleRepository)
                .sort(Sort.by("specVersion", "name"))
                .filters(this::latestRuntime)
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getModule(String id, ResourceRequest request) {
        return queryResolver.getItem("runtime-module", id, () -> ItemKey.split(id, 2)
                        .flatMap(parts -> ItemKey.asInt(parts.get(0))
                                .flatMap(spec -> moduleRepository.findFirstBySpecVersionAndModuleId(spec, parts.get(1)))))
                .map(module -> {
                    ObjectNode resource = serializer.resource(module);
                    Integer spec = module.getSpecVersion();
                    String moduleId = module.getModuleId();
                    if (request.includes("calls")) {
                        serializer.withRelatedRecords(resource, "calls",
                                callRepository.findBySpecVersionAndModuleIdOrderByLookupAscIdAsc(spec, moduleId));
                    }
                    if (request.includes("events")) {
                        serializer.withRelatedRecords(resource, "events",
                                eventRepository.findBySpecVersionAndModuleIdOrderByLookupAscIdAsc(spec, moduleId));
                    }
                    if (request.includes("storage")) {
                        serializer.withRelatedRecords(resource, "storage",
                                storageRepository.findBySpecVersionAndModuleIdOrderByName(spec, moduleId));
                    }
                    if (request.includes("constants")) {
                        serializer.withRelatedRecords(resource, "constants",
                                constantRepository.findBySpecVersionAndModuleIdOrderByName(spec, moduleId));
                    }
                    if (request.includes("errors")) {
                        serializer.withRelatedRecords(resource, "errors",
                                errorMessageRepository.findBySpecVersionAndModuleIdOrderByNameAscIndexAsc(spec, moduleId));
                    }
                    return serializer.document(resource);
                });
    }

    public Optional<ObjectNode> getStorage(String id) {
        return queryResolver.getItem("runtime-storage", id, () -> ModuleItemKey.parse(id)
                        .flatMap(key -> storageRepository.findFirstBySpecVersionAndModuleIdAndName(
                                key.getSpecVersion(), key.getModuleId(), key.getName())))
                .map(storage -> serializer.document(serializer.resource(storage)));
    }

    public ObjectNode listConstants(ResourceRequest request) {
        ListQuery<RuntimeConstant> query = ListQuery.<RuntimeConstant>builder()
                .resource("runtime-constant")
                .executor(constantRepository)
                .sort(Sort.by(Sort.Order.desc("specVersion"), Sort.Order.asc("moduleId"), Sort.Order.asc("name")))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getConstant(String id) {
        return queryResolver.getItem("runtime-constant", id, () -> ModuleItemKey.parse(id)
                        .flatMap(key -> constantRepository.findFirstBySpecVersionAndModuleIdAndName(
                                key.getSpecVersion(), key.getModuleId(), key.getName())))
                .map(constant -> serializer.document(serializer.resource(constant)));
    }

    private <T> Specification<T> latestRuntime(FilterParams filters) {
        if (!filters.has(LATEST_RUNTIME)) {
            return Specs.all();
        }
        return versionRepository.findFirstByOrderBySpecVersionDesc()
                .<Specification<T>>map(runtime -> Specs.equal("specVersion", runtime.getSpecVersion()))
                .orElseGet(Specs::none);
    }

    private static <T> Specification<T> moduleId(FilterParams filters) {
        return filters.get("module_id")
                .<Specification<T>>map(moduleId -> Specs.equal("moduleId", moduleId))
                .orElseGet(Specs::all);
    }

    /**
     * {@code <spec_version>-<module_id>-<name>} key of a module-scoped metadata item.
     */
    @Value
    static class ModuleItemKey {
        Integer specVersion;
        String moduleId;
        String name;

        static Optional<ModuleItemKey> parse(String id) {
            return ItemKey.split(id, 3).flatMap(parts -> ItemKey.asInt(parts.get(0))
                    .map(spec -> new ModuleItemKey(spec, parts.get(1), parts.get(2))));
        }
    }
}
