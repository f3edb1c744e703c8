package com.metascan.explorer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metascan.explorer.config.ExplorerProperties;
import com.metascan.explorer.entity.RuntimeCall;
import com.metascan.explorer.entity.RuntimeCallParam;
import com.metascan.explorer.modules.jsonapi.JsonApiSerializer;
import com.metascan.explorer.modules.query.QueryResolver;
import com.metascan.explorer.modules.query.ResourceRequest;
import com.metascan.explorer.modules.search.SearchIndexResolver;
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
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.Test;
import org.springframework.util.LinkedMultiValueMap;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RuntimeServiceTest {

    private final RuntimeCallRepository callRepository = mock(RuntimeCallRepository.class);
    private final RuntimeCallParamRepository callParamRepository = mock(RuntimeCallParamRepository.class);

    private final RuntimeService service = new RuntimeService(
            mock(RuntimeVersionRepository.class),
            mock(RuntimeModuleRepository.class),
            callRepository,
            callParamRepository,
            mock(RuntimeEventRepository.class),
            mock(RuntimeEventAttributeRepository.class),
            mock(RuntimeTypeRepository.class),
            mock(RuntimeStorageRepository.class),
            mock(RuntimeConstantRepository.class),
            mock(RuntimeErrorMessageRepository.class),
            mock(ExtrinsicRepository.class),
            mock(EventRepository.class),
            new QueryResolver(mock(SearchIndexResolver.class), OpenTelemetry.noop().getTracer("test")),
            new JsonApiSerializer(new ObjectMapper()));

    @Test
    void moduleItemKeyKeepsDashesInName() {
        RuntimeService.ModuleItemKey key = RuntimeService.ModuleItemKey.parse("9100-system-remark-with-event").orElseThrow();

        assertEquals(9100, key.getSpecVersion());
        assertEquals("system", key.getModuleId());
        assertEquals("remark-with-event", key.getName());
        assertFalse(RuntimeService.ModuleItemKey.parse("latest-system-remark").isPresent());
    }

    @Test
    void callDetailIncludesParams() {
        RuntimeCall call = new RuntimeCall();
        call.setId(11L);
        call.setSpecVersion(9100);
        call.setModuleId("balances");
        call.setCallId("transfer");
        RuntimeCallParam dest = new RuntimeCallParam();
        dest.setId(1L);
        dest.setRuntimeCallId(11L);
        dest.setName("dest");
        when(callRepository.findFirstBySpecVersionAndModuleIdAndCallId(9100, "balances", "transfer"))
                .thenReturn(Optional.of(call));
        when(callParamRepository.findByRuntimeCallIdOrderById(11L)).thenReturn(List.of(dest));

        LinkedMultiValueMap<String, String> params = new LinkedMultiValueMap<>();
        params.add("include", "params");
        JsonNode data = service.getCall("9100-balances-transfer",
                ResourceRequest.of(params, ExplorerProperties.defaults().getPaging())).orElseThrow().get("data");

        assertEquals("runtimecall", data.get("type").asText());
        assertEquals("9100-balances-transfer", data.get("id").asText());
        assertEquals("dest", data.get("relationships").get("params").get("data").get(0).get("attributes").get("name").asText());
        assertFalse(data.get("relationships").has("recent_extrinsics"));
    }

    @Test
    void unknownCallIsAbsent() {
        assertTrue(service.getCall("9100-balances", ResourceRequest.of(null, ExplorerProperties.defaults().getPaging()))
                .isEmpty());
    }
}
