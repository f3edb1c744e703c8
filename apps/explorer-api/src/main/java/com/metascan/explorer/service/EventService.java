package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.metascan.explorer.entity.BlockEntityId;
import com.metascan.explorer.entity.Event;
import com.metascan.explorer.entity.EventAttribute;
import com.metascan.explorer.entity.Log;
import com.metascan.explorer.entity.RuntimeEvent;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.privacy.DidField;
import com.metascan.explorer.modules.privacy.PrivacyMask;
import com.metascan.explorer.modules.query.FilterParams;
import com.metascan.explorer.modules.query.ItemKey;
import com.metascan.explorer.modules.query.ListQuery;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.query.SearchIndexBinding;
import com.metascan.explorer.modules.query.Specs;
import com.metascan.explorer.modules.search.BlockPosition;
import com.metascan.explorer.modules.search.IndexTarget;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.repository.LogRepository;
import com.metascan.explorer.repository.RuntimeEventRepository;
import com.metascan.explorer.util.DidCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Events and logs.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EventService {

    static final List<String> EXTRINSIC_OUTCOME_EVENTS = List.of("ExtrinsicSuccess", "ExtrinsicFailed");

    private final EventRepository eventRepository;
    private final LogRepository logRepository;
    private final RuntimeEventRepository runtimeEventRepository;
    private final PrivacyMask privacyMask;
    private final QueryResolver queryResolver;
    private final JsonApiSerializer serializer;

    public ObjectNode listEvents(ResourceRequest request) {
        ListQuery<Event> query = ListQuery.<Event>builder()
                .resource("event")
                .executor(eventRepository)
                .sort(Sort.by(Sort.Direction.DESC, "blockId", "eventIdx"))
                .filters(EventService::eventFilters)
                .searchIndex(SearchIndexBinding.<Event>builder()
                        .target(IndexTarget.EVENT)
                        .categories(SearchIndexBinding.requestedCategories())
                        .loader(this::loadEvents)
                        .positionOf(EventService::positionOf)
                        .build())
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    /**
     * Event with its DID attributes decoded, and masked unless the viewer is one of them.
     */
    public Optional<ObjectNode> getEvent(String id, Identity viewer) {
        return queryResolver.getItem("event", id, () -> findEvent(id))
                .map(event -> serializer.document(renderDetail(event, viewer)));
    }

    public ObjectNode listLogs(ResourceRequest request) {
        ListQuery<Log> query = ListQuery.<Log>builder()
                .resource("log")
                .executor(logRepository)
                .sort(Sort.by(Sort.Direction.DESC, "blockId", "logIdx"))
                .build();
        return serializer.listDocument(queryResolver.resolve(query, request), serializer::resource);
    }

    public Optional<ObjectNode> getLog(String id) {
        return queryResolver.getItem("log", id, () -> ItemKey.blockPosition(id)
                        .flatMap(p -> logRepository.findById(new BlockEntityId.Log(p.getBlockId(), p.getIdx()))))
                .map(entry -> serializer.document(serializer.resource(entry)));
    }

    List<Event> loadEvents(List<BlockPosition> positions) {
        return eventRepository.findAllById(positions.stream()
                .map(p -> new BlockEntityId.Event(p.getBlockId(), p.getIdx()))
                .toList());
    }

    static BlockPosition positionOf(Event event) {
        return new BlockPosition(event.getBlockId(), event.getEventIdx());
    }

    Optional<Event> findEvent(String id) {
        return ItemKey.blockPosition(id)
                .flatMap(p -> eventRepository.findById(new BlockEntityId.Event(p.getBlockId(), p.getIdx())));
    }

    private ObjectNode renderDetail(Event event, Identity viewer) {
        ObjectNode resource = serializer.resource(event);
        ObjectNode attributes = (ObjectNode) resource.get("attributes");

        List<EventAttribute> eventAttributes = event.getAttributes() == null ? List.of() : event.getAttributes();
        List<Integer> didPositions = new ArrayList<>();
        List<DidField> dids = new ArrayList<>();
        for (int i = 0; i < eventAttributes.size(); i++) {
            EventAttribute attribute = eventAttributes.get(i);
            if (attribute.isDid()) {
                didPositions.add(i);
                dids.add(DidField.participant(attribute.getType(), DidCodec.decodeOrRaw(attribute.valueAsText())));
            }
        }
        if (!dids.isEmpty() && attributes.get("attributes") instanceof ArrayNode) {
            ArrayNode rendered = (ArrayNode) attributes.get("attributes");
            List<DidField> visible = privacyMask.apply(dids, viewer);
            for (int i = 0; i < didPositions.size(); i++) {
                ((ObjectNode) rendered.get(didPositions.get(i))).put("value", visible.get(i).getValue());
            }
        }

        attributes.put("documentation", runtimeEventRepository
                .findFirstBySpecVersionAndModuleIdAndEventId(
                        event.getSpecVersionId(), event.getModuleId(), event.getEventId())
                .map(RuntimeEvent::getDocumentation)
                .orElse(null));
        return resource;
    }

    private static Specification<Event> eventFilters(FilterParams filters) {
        Specification<Event> spec = Specs.all();
        Optional<String> moduleId = filters.get("module_id");
        if (moduleId.isPresent()) {
            spec = spec.and(Specs.equal("moduleId", moduleId.get()));
        }
        Optional<String> eventId = filters.get("event_id");
        if (eventId.isPresent()) {
            spec = spec.and(Specs.equal("eventId", eventId.get()));
        } else {
            spec = spec.and(Specs.notIn("eventId", EXTRINSIC_OUTCOME_EVENTS));
        }
        return spec;
    }
}
