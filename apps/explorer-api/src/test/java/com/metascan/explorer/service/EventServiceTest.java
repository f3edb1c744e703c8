package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.BlockEntityId;
import com.metascan.explorer.entity.Event;
import com.metascan.explorer.entity.EventAttribute;
import com.metascan.explorer.entity.RuntimeEvent;
import com.metascan.explorer.modules.identity.Identity;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.privacy.PrivacyMask;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.search.SearchIndexResolver;
import com.metascan.explorer.repository.EventRepository;
import com.metascan.explorer.repository.LogRepository;
import com.metascan.explorer.repository.RuntimeEventRepository;
import com.metascan.explorer.util.DidCodec;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventServiceTest {

    private static final String ALICE = "did:ssid:alice";
    private static final String BOB = "did:ssid:bob";

    private final EventRepository eventRepository = mock(EventRepository.class);
    private final RuntimeEventRepository runtimeEventRepository = mock(RuntimeEventRepository.class);
    private final PrivacyMask privacyMask = new PrivacyMask(ExplorerProperties.defaults());

    private final EventService service = new EventService(
            eventRepository,
            mock(LogRepository.class),
            runtimeEventRepository,
            privacyMask,
            new QueryResolver(mock(SearchIndexResolver.class), OpenTelemetry.noop().getTracer("test")),
            new JsonApiSerializer(new ObjectMapper()));

    @BeforeEach
    void setUp() {
        Event event = new Event();
        event.setBlockId(50L);
        event.setEventIdx(2);
        event.setSpecVersionId(9100);
        event.setModuleId("did");
        event.setEventId("DidRotated");
        event.setAttributes(List.of(
                new EventAttribute(EventAttribute.TYPE_DID, DidCodec.toPaddedHex(ALICE)),
                new EventAttribute("u32", 3),
                new EventAttribute(EventAttribute.TYPE_DID, DidCodec.toPaddedHex(BOB))));
        when(eventRepository.findById(new BlockEntityId.Event(50L, 2))).thenReturn(Optional.of(event));
        RuntimeEvent runtimeEvent = new RuntimeEvent();
        runtimeEvent.setDocumentation("A DID key was rotated");
        when(runtimeEventRepository.findFirstBySpecVersionAndModuleIdAndEventId(9100, "did", "DidRotated"))
                .thenReturn(Optional.of(runtimeEvent));
    }

    @Test
    void participantSeesDecodedDids() {
        JsonNode attributes = detail(Identity.authenticated(BOB));

        assertEquals(ALICE, attributes.get("attributes").get(0).get("value").asText());
        assertEquals(3, attributes.get("attributes").get(1).get("value").asInt());
        assertEquals(BOB, attributes.get("attributes").get(2).get("value").asText());
        assertEquals("A DID key was rotated", attributes.get("documentation").asText());
    }

    @Test
    void outsiderSeesAllDidsMasked() {
        JsonNode attributes = detail(Identity.anonymous());

        assertEquals(privacyMask.mask(ALICE), attributes.get("attributes").get(0).get("value").asText());
        assertEquals(privacyMask.mask(BOB), attributes.get("attributes").get(2).get("value").asText());
    }

    @Test
    void malformedIdIsAbsent() {
        assertTrue(service.getEvent("abc", Identity.anonymous()).isEmpty());
    }

    private JsonNode detail(Identity viewer) {
        return service.getEvent("50-2", viewer).orElseThrow().get("data").get("attributes");
    }
}
